package org.example.simplifier.epub;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds small EPUBs in memory: a cover page with only an image, a navigation document and two chapters.
 * The second chapter has three paragraphs with an image between the first and second. The mixed variant adds
 * a third chapter whose prose sits in lists, quotes, tables and a captioned image.
 */
public final class EpubFixtures {

    public static final String CHAPTER_ONE_TEXT = "It was a bright cold day in April, and the clocks were striking "
            + "thirteen. Winston hurried home through the gritty dust.";

    public static final String MIXED_CHAPTER_TEXT = String.join("\n\n",
            "Alpha opens the chapter.",
            "Bravo is the first item.",
            "Charlie is the second item.",
            "Delta is quoted here.",
            "Echo sits in a cell.",
            "Foxtrot captions the figure.",
            "Golf closes the chapter.");

    private EpubFixtures() {
    }

    public static Map<String, byte[]> entries() {
        return entries(false);
    }

    public static Map<String, byte[]> mixedEntries() {
        return entries(true);
    }

    private static Map<String, byte[]> entries(boolean mixed) {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("mimetype", utf8("application/epub+zip"));
        entries.put("META-INF/container.xml", utf8("""
                <?xml version="1.0" encoding="UTF-8"?>
                <container version="1.0" xmlns="urn:oasis:names:tc:opendocument:xmlns:container">
                  <rootfiles>
                    <rootfile full-path="OEBPS/content.opf" media-type="application/oebps-package+xml"/>
                  </rootfiles>
                </container>
                """));
        entries.put("OEBPS/content.opf", utf8(String.format("""
                <?xml version="1.0" encoding="UTF-8"?>
                <package xmlns="http://www.idpf.org/2007/opf" version="3.0" unique-identifier="bookid">
                  <metadata xmlns:dc="http://purl.org/dc/elements/1.1/">
                    <dc:identifier id="bookid">urn:uuid:fixture</dc:identifier>
                    <dc:title>The Fixture Book</dc:title>
                    <dc:language>en</dc:language>
                    <dc:creator>Test Author</dc:creator>
                  </metadata>
                  <manifest>
                    <item id="nav" href="nav.xhtml" media-type="application/xhtml+xml" properties="nav"/>
                    <item id="ch2" href="text/ch2.xhtml" media-type="application/xhtml+xml"/>
                    <item id="cover" href="text/cover.xhtml" media-type="application/xhtml+xml"/>
                    <item id="ch1" href="text/ch1.xhtml" media-type="application/xhtml+xml"/>
                    <item id="pic" href="images/pic.png" media-type="image/png"/>%s
                  </manifest>
                  <spine>
                    <itemref idref="cover"/>
                    <itemref idref="ch1"/>
                    <itemref idref="ch2"/>%s
                  </spine>
                </package>
                """,
                mixed ? "\n    <item id=\"ch3\" href=\"text/ch3.xhtml\" media-type=\"application/xhtml+xml\"/>" : "",
                mixed ? "\n    <itemref idref=\"ch3\"/>" : "")));
        entries.put("OEBPS/nav.xhtml", utf8(xhtml("Contents",
                "<nav><ol><li><a href=\"text/ch1.xhtml\">One</a></li><li><a href=\"text/ch2.xhtml\">Two</a></li></ol></nav>")));
        entries.put("OEBPS/text/cover.xhtml", utf8(xhtml("Cover",
                "<div><img src=\"../images/pic.png\" alt=\"cover\"/></div>")));
        entries.put("OEBPS/text/ch1.xhtml", utf8(xhtml("Chapter One",
                "<h1>Chapter One</h1><p>" + CHAPTER_ONE_TEXT + "</p>")));
        entries.put("OEBPS/text/ch2.xhtml", utf8(xhtml("Chapter Two",
                "<h1>Chapter Two</h1>"
                        + "<p>The first paragraph of the second chapter.</p>"
                        + "<div class=\"figure\"><img src=\"../images/pic.png\" alt=\"figure\"/></div>"
                        + "<p>The second paragraph   follows the figure.</p>"
                        + "<p>The third paragraph closes the chapter.</p>")));
        if (mixed) {
            entries.put("OEBPS/text/ch3.xhtml", utf8(xhtml("Chapter Three",
                    "<h1>Chapter Three</h1>"
                            + "<p>Alpha opens the chapter.</p>"
                            + "<ul><li>Bravo is the first item.</li><li>Charlie is the second item.</li></ul>"
                            + "<blockquote><p>Delta is quoted here.</p></blockquote>"
                            + "<table><tr><td>Echo sits in a cell.</td></tr></table>"
                            + "<p><img src=\"../images/pic.png\" alt=\"figure\"/> Foxtrot captions the figure.</p>"
                            + "<div class=\"notes\"><p>Golf closes&#160;the chapter.</p></div>")));
        }
        entries.put("OEBPS/images/pic.png", new byte[]{(byte) 0x89, 'P', 'N', 'G', 0, 1, 2, 3});
        return entries;
    }

    public static EpubDocument document() {
        return new EpubReader().fromEntries("fixture", entries());
    }

    public static EpubDocument mixedDocument() {
        return new EpubReader().fromEntries("mixed", mixedEntries());
    }

    public static byte[] bytes() {
        return new EpubWriter().write(document());
    }

    static String xhtml(String title, String body) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<html xmlns=\"http://www.w3.org/1999/xhtml\">"
                + "<head><title>" + title + "</title></head>"
                + "<body>" + body + "</body></html>";
    }

    static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
