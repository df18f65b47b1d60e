package org.example.simplifier.epub;

/**
 * An XHTML content document of the container, in reading order.
 *
 * @param id        manifest item id
 * @param path      full path of the entry inside the zip
 * @param mediaType manifest media type
 */
public record StructuralUnit(String id, String path, String mediaType) {
}
