package org.example.simplifier.epub;

import net.lingala.zip4j.io.inputstream.ZipInputStream;
import net.lingala.zip4j.model.LocalFileHeader;
import org.example.simplifier.model.Chapter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads an EPUB zip into an {@link EpubDocument}: package metadata, spine order and one {@link Chapter}
 * of normalized text per XHTML content document.
 * <p>
 * Chapter text is the body's block-level prose joined by blank lines. Headings are left out: they become
 * the chapter title and are never rewritten.
 */
@Component
public class EpubReader {

    private static final Logger log = LoggerFactory.getLogger(EpubReader.class);

    static final String CONTAINER_PATH = "META-INF/container.xml";
    static final String TEXT_BLOCKS = "p, li, blockquote, pre, dt, dd, td, th, figcaption";

    private static final Set<String> CONTENT_MEDIA_TYPES = Set.of("application/xhtml+xml", "text/html");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SPACES = Pattern.compile("[ \\t\\x0B\\f\\r\\u00A0]+");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+", Pattern.UNICODE_CHARACTER_CLASS);

    public EpubDocument read(byte[] epubBytes) {
        if (epubBytes == null || epubBytes.length == 0) {
            throw new DocumentFormatException("EPUB is empty");
        }
        return fromEntries(digest(epubBytes), unzip(epubBytes));
    }

    /**
     * Builds a document from already extracted entries, keeping their order.
     */
    public EpubDocument fromEntries(String sourceDigest, Map<String, byte[]> entries) {
        String packagePath = findPackagePath(entries);
        byte[] packageBytes = entries.get(packagePath);
        if (packageBytes == null) {
            throw new DocumentFormatException("Package document not found: " + packagePath);
        }

        Document opf = parseXml(packageBytes);
        EpubMetadata metadata = new EpubMetadata(
                metadataValue(opf, "title"),
                metadataValue(opf, "language"),
                metadataValue(opf, "creator")
        );
        List<StructuralUnit> units = resolveUnits(opf, packagePath, entries);

        List<Chapter> chapters = new ArrayList<>();
        for (StructuralUnit unit : units) {
            chapters.add(toChapter(unit, entries.get(unit.path())));
        }
        log.debug("Read EPUB '{}' with {} content documents", metadata.title(), units.size());
        return new EpubDocument(sourceDigest, entries, packagePath, metadata, units, chapters);
    }

    private Map<String, byte[]> unzip(byte[] epubBytes) {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(epubBytes))) {
            LocalFileHeader header;
            byte[] buffer = new byte[8192];
            while ((header = zip.getNextEntry()) != null) {
                if (header.isDirectory()) {
                    continue;
                }
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                int read;
                while ((read = zip.read(buffer)) != -1) {
                    out.write(buffer, 0, read);
                }
                entries.put(header.getFileName(), out.toByteArray());
            }
        } catch (IOException e) {
            throw new DocumentFormatException("Unreadable EPUB archive", e);
        }
        if (entries.isEmpty()) {
            throw new DocumentFormatException("EPUB archive has no entries");
        }
        return entries;
    }

    private String findPackagePath(Map<String, byte[]> entries) {
        byte[] container = entries.get(CONTAINER_PATH);
        if (container != null) {
            Element rootfile = parseXml(container).selectFirst("rootfile");
            if (rootfile != null && !rootfile.attr("full-path").isBlank()) {
                return rootfile.attr("full-path");
            }
        }
        return entries.keySet().stream()
                .filter(name -> name.toLowerCase().endsWith(".opf"))
                .findFirst()
                .orElseThrow(() -> new DocumentFormatException("No package document in EPUB"));
    }

    private List<StructuralUnit> resolveUnits(Document opf, String packagePath, Map<String, byte[]> entries) {
        String baseDir = packagePath.contains("/") ? packagePath.substring(0, packagePath.lastIndexOf('/') + 1) : "";

        Map<String, StructuralUnit> contentItems = new LinkedHashMap<>();
        for (Element item : opf.select("manifest > item")) {
            String mediaType = item.attr("media-type").trim().toLowerCase();
            String properties = item.attr("properties");
            if (!CONTENT_MEDIA_TYPES.contains(mediaType) || properties.contains("nav")) {
                continue;
            }
            String path = resolveHref(baseDir, item.attr("href"));
            if (!entries.containsKey(path)) {
                log.warn("Manifest item {} points to missing entry {}", item.attr("id"), path);
                continue;
            }
            contentItems.put(item.attr("id"), new StructuralUnit(item.attr("id"), path, mediaType));
        }

        Set<String> ordered = new LinkedHashSet<>();
        for (Element itemref : opf.select("spine > itemref")) {
            String idref = itemref.attr("idref");
            if (contentItems.containsKey(idref)) {
                ordered.add(idref);
            }
        }
        ordered.addAll(contentItems.keySet());

        List<StructuralUnit> units = new ArrayList<>();
        for (String id : ordered) {
            units.add(contentItems.get(id));
        }
        return units;
    }

    static String resolveHref(String baseDir, String href) {
        String withoutFragment = href.contains("#") ? href.substring(0, href.indexOf('#')) : href;
        try {
            String resolved = URI.create(baseDir.replace(" ", "%20"))
                    .resolve(withoutFragment.replace(" ", "%20"))
                    .normalize()
                    .getPath();
            return resolved.startsWith("/") ? resolved.substring(1) : resolved;
        } catch (IllegalArgumentException e) {
            return baseDir + withoutFragment;
        }
    }

    private Chapter toChapter(StructuralUnit unit, byte[] bytes) {
        Document doc = Jsoup.parse(new String(bytes, StandardCharsets.UTF_8), "", Parser.xmlParser());
        Element body = doc.selectFirst("body");
        Element root = body != null ? body : doc;
        return new Chapter(unit.id(), titleOf(doc, unit), extractText(root));
    }

    static String extractText(Element root) {
        List<String> blocks = textBlocks(root).stream().map(EpubReader::blockText).toList();
        String raw = blocks.isEmpty() ? root.wholeText() : String.join("\n\n", blocks);
        return normalize(raw);
    }

    /**
     * Leaf prose blocks under {@code root} in document order, skipping blocks without visible text.
     * Block k holds paragraph k of the chapter text, both when reading and when writing text back.
     */
    public static List<Element> textBlocks(Element root) {
        List<Element> blocks = new ArrayList<>();
        for (Element block : root.select(TEXT_BLOCKS)) {
            // select() matches the block itself, so more than one hit means a nested block
            if (block.select(TEXT_BLOCKS).size() > 1) {
                continue;
            }
            if (!blockText(block).isEmpty()) {
                blocks.add(block);
            }
        }
        return blocks;
    }

    /**
     * Text of one block on a single line, so a block never splits into several paragraphs.
     */
    public static String blockText(Element block) {
        return WHITESPACE.matcher(block.text()).replaceAll(" ").strip();
    }

    static String normalize(String text) {
        String collapsed = BLANK_LINES.matcher(text).replaceAll("\n\n");
        collapsed = SPACES.matcher(collapsed).replaceAll(" ");
        return collapsed.strip();
    }

    private String titleOf(Document doc, StructuralUnit unit) {
        Element heading = doc.selectFirst("h1, h2, h3");
        if (heading != null && !heading.text().isBlank()) {
            return heading.text().trim();
        }
        Element title = doc.selectFirst("head > title");
        if (title != null && !title.text().isBlank()) {
            return title.text().trim();
        }
        String path = unit.path();
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private String metadataValue(Document opf, String name) {
        for (Element element : opf.select("metadata *")) {
            String tag = element.normalName();
            if (tag.equals("dc:" + name) || tag.equals(name)) {
                String value = element.text().trim();
                if (!value.isEmpty()) {
                    return value;
                }
            }
        }
        return "";
    }

    static Document parseXml(byte[] bytes) {
        return Jsoup.parse(new String(bytes, StandardCharsets.UTF_8), "", Parser.xmlParser());
    }

    public static String digest(byte[] bytes) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
