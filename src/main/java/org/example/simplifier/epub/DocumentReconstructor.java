package org.example.simplifier.epub;

import org.example.simplifier.model.Chapter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.jsoup.select.NodeTraversor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Puts rewritten chapter text back into the original container.
 * <p>
 * Only the text of prose blocks changes. Blocks are picked exactly as {@link EpubReader#textBlocks} picks them,
 * so paragraph k of the rewritten chapter lands in block k. Extra paragraphs become new {@code <p>} nodes right
 * after the last block, and unused blocks are emptied but kept. Headings, images and any other markup stay
 * where they were. Units without rewritten text keep their original bytes.
 */
@Component
public class DocumentReconstructor {

    private static final Logger log = LoggerFactory.getLogger(DocumentReconstructor.class);
    private static final String MEDIA = "img, image, svg, video, audio, object, math, iframe, picture";

    private final EpubReader epubReader;

    public DocumentReconstructor(EpubReader epubReader) {
        this.epubReader = epubReader;
    }

    public record Result(EpubDocument document, Map<String, UnitOutcome> outcomes) {
        public long count(UnitOutcome outcome) {
            return outcomes.values().stream().filter(value -> value == outcome).count();
        }
    }

    public Result reconstruct(EpubDocument original, List<Chapter> rewritten, String titleSuffix) {
        Map<String, String> rewrittenById = new HashMap<>();
        for (Chapter chapter : rewritten) {
            if (chapter != null && chapter.id() != null) {
                rewrittenById.put(chapter.id(), chapter.content());
            }
        }

        Map<String, byte[]> replacements = new HashMap<>();
        Map<String, UnitOutcome> outcomes = new LinkedHashMap<>();
        for (StructuralUnit unit : original.units()) {
            String text = rewrittenById.get(unit.id());
            if (text == null || text.isBlank()) {
                outcomes.put(unit.id(), UnitOutcome.UNCHANGED);
                continue;
            }
            byte[] originalBytes = original.entry(unit.path()).orElse(null);
            if (originalBytes == null) {
                outcomes.put(unit.id(), UnitOutcome.FAILED);
                continue;
            }
            try {
                replacements.put(unit.path(), rewriteUnit(originalBytes, splitParagraphs(text)));
                outcomes.put(unit.id(), UnitOutcome.REWRITTEN);
            } catch (RuntimeException e) {
                log.warn("Leaving unit {} ({}) unchanged: {}", unit.id(), unit.path(), e.getMessage());
                outcomes.put(unit.id(), UnitOutcome.FAILED);
            }
        }

        if (titleSuffix != null && !titleSuffix.isEmpty()) {
            retitle(original, titleSuffix, replacements);
        }

        EpubDocument document = epubReader.fromEntries(original.sourceDigest(), original.entriesWith(replacements));
        Result result = new Result(document, outcomes);
        log.info("Reconstructed '{}': {} rewritten, {} unchanged, {} failed",
                document.metadata().title(),
                result.count(UnitOutcome.REWRITTEN),
                result.count(UnitOutcome.UNCHANGED),
                result.count(UnitOutcome.FAILED));
        return result;
    }

    byte[] rewriteUnit(byte[] originalBytes, List<String> paragraphs) {
        Document doc = Jsoup.parse(new String(originalBytes, StandardCharsets.UTF_8), "", Parser.xmlParser());
        configureOutput(doc);
        Element body = doc.selectFirst("body");
        Element container = body != null ? body : doc;

        List<Element> blocks = EpubReader.textBlocks(container);
        int next = 0;
        for (Element block : blocks) {
            replaceText(block, next < paragraphs.size() ? paragraphs.get(next) : "");
            next++;
        }

        Element anchor = blocks.isEmpty() ? null : topLevel(blocks.get(blocks.size() - 1), container);
        while (next < paragraphs.size()) {
            Element paragraph;
            if (anchor == null) {
                paragraph = container.appendElement("p");
            } else {
                paragraph = new Element("p");
                anchor.after(paragraph);
            }
            paragraph.text(paragraphs.get(next));
            anchor = paragraph;
            next++;
        }
        return doc.outerHtml().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Sets the text of a block. Blocks holding media keep their child elements and only their text changes.
     */
    static void replaceText(Element block, String text) {
        if (block.select(MEDIA).isEmpty()) {
            block.text(text);
            return;
        }
        List<TextNode> textNodes = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                textNodes.add(textNode);
            }
        }, block);

        boolean placed = false;
        for (TextNode textNode : textNodes) {
            if (!placed && !textNode.isBlank()) {
                textNode.text(text);
                placed = true;
            } else if (!textNode.isBlank()) {
                textNode.text("");
            }
        }
        if (!placed) {
            block.appendText(text);
        }
    }

    private static Element topLevel(Element element, Element container) {
        Element current = element;
        while (current.parent() != null && current.parent() != container) {
            current = current.parent();
        }
        return current;
    }

    static List<String> splitParagraphs(String text) {
        List<String> paragraphs = Arrays.stream(text.split("\\n\\s*\\n"))
                .map(String::strip)
                .filter(p -> !p.isEmpty())
                .toList();
        return paragraphs.isEmpty() ? List.of(text.strip()) : paragraphs;
    }

    private void retitle(EpubDocument original, String titleSuffix, Map<String, byte[]> replacements) {
        try {
            byte[] opfBytes = original.entry(original.packagePath()).orElseThrow();
            Document opf = EpubReader.parseXml(opfBytes);
            configureOutput(opf);
            Element title = opf.select("metadata *").stream()
                    .filter(el -> el.normalName().equals("dc:title") || el.normalName().equals("title"))
                    .findFirst()
                    .orElse(null);
            if (title == null || title.text().isBlank()) {
                return;
            }
            title.text(title.text().trim() + titleSuffix);
            replacements.put(original.packagePath(), opf.outerHtml().getBytes(StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            log.warn("Could not update package title: {}", e.getMessage());
        }
    }

    private static void configureOutput(Document doc) {
        doc.outputSettings()
                .prettyPrint(false)
                .syntax(Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .charset(StandardCharsets.UTF_8);
    }
}
