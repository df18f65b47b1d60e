package org.example.simplifier.epub;

import net.lingala.zip4j.io.outputstream.ZipOutputStream;
import net.lingala.zip4j.model.ZipParameters;
import net.lingala.zip4j.model.enums.CompressionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Serializes an {@link EpubDocument} back to a zip. The {@code mimetype} entry is written first and
 * uncompressed; every other entry keeps its original order and bytes.
 */
@Component
public class EpubWriter {

    private static final Logger log = LoggerFactory.getLogger(EpubWriter.class);
    static final String MIMETYPE = "mimetype";

    public byte[] write(EpubDocument document) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            writeTo(document, buffer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize EPUB", e);
        }
        return buffer.toByteArray();
    }

    public Path write(EpubDocument document, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(target)) {
            writeTo(document, out);
        }
        log.info("Wrote EPUB '{}' to {}", document.metadata().title(), target);
        return target;
    }

    private void writeTo(EpubDocument document, OutputStream out) throws IOException {
        Map<String, byte[]> entries = document.rawEntries();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            byte[] mimetype = entries.get(MIMETYPE);
            if (mimetype != null) {
                putEntry(zip, MIMETYPE, mimetype, CompressionMethod.STORE);
            }
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                if (!MIMETYPE.equals(entry.getKey())) {
                    putEntry(zip, entry.getKey(), entry.getValue(), CompressionMethod.DEFLATE);
                }
            }
        }
    }

    private void putEntry(ZipOutputStream zip, String name, byte[] bytes, CompressionMethod method)
            throws IOException {
        ZipParameters parameters = new ZipParameters();
        parameters.setFileNameInZip(name);
        parameters.setCompressionMethod(method);
        parameters.setEntrySize(bytes.length);
        zip.putNextEntry(parameters);
        zip.write(bytes);
        zip.closeEntry();
    }
}
