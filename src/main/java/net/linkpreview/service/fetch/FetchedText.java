package net.linkpreview.service.fetch;

/**
 * Text read from a page body under the byte budget.
 *
 * @param text boundary-safe UTF-8 text, never longer than the budget in bytes
 * @param bytesRead encoded length of {@code text}
 * @param truncated whether the body was cut short because the budget ran out
 */
public record FetchedText(String text, int bytesRead, boolean truncated) {
}
