package net.linkpreview.parser;

import net.linkpreview.exception.MetadataParseException;

/**
 * Turns fetched page text into a document that metadata can be read from.
 */
public interface MetadataParser {

    /**
     * @param text page text, possibly truncated mid-document; never {@code null}
     * @return the parsed document
     * @throws MetadataParseException if an implementation cannot interpret the text at all
     *         (the jsoup parser is lenient and never does)
     */
    ParsedDocument parse(String text);
}
