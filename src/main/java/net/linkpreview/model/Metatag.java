package net.linkpreview.model;

/**
 * A single {@code <meta>} tag as it appeared in the source document.
 *
 * @param name the tag's name (or property/http-equiv/itemprop) attribute
 * @param content the tag's content attribute
 */
public record Metatag(String name, String content) {
}
