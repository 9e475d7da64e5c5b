/**
 * Metadata extraction over a parsed HTML document
 *
 * Features:
 * - Each field reads a prioritized list of sources; the first non-blank value wins
 * - Values are trimmed and returned as written (relative URLs are not resolved)
 * - Meta tags are collected in document order with duplicates preserved
 */
package net.linkpreview.parser;

import net.linkpreview.model.MetaData;
import net.linkpreview.model.Metatag;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class ParsedDocument {

    private static final String[] METATAG_NAME_ATTRIBUTES = {"name", "property", "http-equiv", "itemprop"};

    private final Document document;

    ParsedDocument(Document document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    /**
     * @return metadata built once from this document
     */
    public MetaData metadata() {
        return new MetaData(
            title(),
            description(),
            canonical(),
            language(),
            rss(),
            image(),
            amp(),
            author(),
            date(),
            metatags()
        );
    }

    private String title() {
        Element title = document.selectFirst("title");
        String text = title != null ? clean(title.text()) : null;
        if (text != null) {
            return text;
        }
        return firstMetaContent("meta[property=og:title]", "meta[name=og:title]", "meta[name=twitter:title]");
    }

    private String description() {
        return firstMetaContent(
            "meta[name=description]",
            "meta[property=og:description]",
            "meta[name=twitter:description]"
        );
    }

    private String canonical() {
        String href = firstAttribute("href", "link[rel=canonical]");
        return href != null ? href : firstMetaContent("meta[property=og:url]");
    }

    private String language() {
        String lang = firstAttribute("lang", "html[lang]");
        if (lang != null) {
            return lang;
        }
        return firstMetaContent("meta[http-equiv=content-language]", "meta[property=og:locale]");
    }

    private String rss() {
        return firstAttribute("href",
            "link[type=\"application/rss+xml\"]",
            "link[type=\"application/atom+xml\"]");
    }

    private String image() {
        String image = firstMetaContent(
            "meta[property=og:image]",
            "meta[property=og:image:url]",
            "meta[name=twitter:image]",
            "meta[name=twitter:image:src]"
        );
        return image != null ? image : firstAttribute("href", "link[rel=image_src]");
    }

    private String amp() {
        return firstAttribute("href", "link[rel=amphtml]");
    }

    private String author() {
        String author = firstMetaContent("meta[name=author]", "meta[property=article:author]");
        return author != null ? author : firstAttribute("href", "link[rel=author]");
    }

    private String date() {
        String date = firstMetaContent(
            "meta[property=article:published_time]",
            "meta[name=date]",
            "meta[itemprop=datePublished]",
            "meta[property=og:updated_time]"
        );
        return date != null ? date : firstAttribute("datetime", "time[datetime]");
    }

    private List<Metatag> metatags() {
        List<Metatag> tags = new ArrayList<>();
        for (Element meta : document.select("meta[content]")) {
            String name = metatagName(meta);
            if (name != null) {
                tags.add(new Metatag(name, meta.attr("content").trim()));
            }
        }
        return tags.isEmpty() ? null : tags;
    }

    private static String metatagName(Element meta) {
        for (String attribute : METATAG_NAME_ATTRIBUTES) {
            String value = clean(meta.attr(attribute));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private String firstMetaContent(String... selectors) {
        return firstAttribute("content", selectors);
    }

    private String firstAttribute(String attribute, String... selectors) {
        for (String selector : selectors) {
            for (Element element : document.select(selector)) {
                String value = clean(element.attr(attribute));
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    private static String clean(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
