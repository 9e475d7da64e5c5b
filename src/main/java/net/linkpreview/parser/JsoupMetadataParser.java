package net.linkpreview.parser;

import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

/**
 * {@link MetadataParser} using jsoup's lenient HTML parser.
 *
 * <p>jsoup repairs unclosed tags, so a body cut off at the byte budget still yields
 * whatever metadata appeared before the cut. It never rejects input.</p>
 */
@Component
public class JsoupMetadataParser implements MetadataParser {

    @Override
    public ParsedDocument parse(String text) {
        return new ParsedDocument(Jsoup.parse(text));
    }
}
