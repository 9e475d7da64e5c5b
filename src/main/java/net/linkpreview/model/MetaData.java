/**
 * Page metadata returned by the link preview endpoint
 *
 * Features:
 * - Built once per successful extraction and never mutated afterwards
 * - Every text field is optional and serializes as {@code null} when absent
 * - Metatags keep document order and are not deduplicated
 */
package net.linkpreview.model;

import java.util.List;

/**
 * Immutable snapshot of the metadata extracted from one page.
 *
 * @param title document title
 * @param description short page summary
 * @param canonical canonical URL declared by the page
 * @param language declared document language
 * @param rss RSS/Atom feed URL
 * @param image preview image URL
 * @param amp AMP variant URL
 * @param author declared author
 * @param date publication date as written in the page
 * @param metatags every name/content meta pair in document order, or {@code null} when the page has none
 */
public record MetaData(
    String title,
    String description,
    String canonical,
    String language,
    String rss,
    String image,
    String amp,
    String author,
    String date,
    List<Metatag> metatags
) {

    public MetaData {
        metatags = metatags == null ? null : List.copyOf(metatags);
    }

    /**
     * @return metadata with every field absent
     */
    public static MetaData empty() {
        return new MetaData(null, null, null, null, null, null, null, null, null, null);
    }
}
