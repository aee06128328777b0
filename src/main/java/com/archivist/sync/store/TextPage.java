package com.archivist.sync.store;

/**
 * One page of a free-text record.
 *
 * @param title page title, may be empty
 * @param text  raw page text (HTML or markdown)
 * @param image optional page image URL
 */
public record TextPage(String title, String text, String image) {

    public TextPage {
        title = title != null ? title : "";
        text = text != null ? text : "";
    }

    public static TextPage text(String text) {
        return new TextPage("", text, null);
    }

    public boolean hasText() {
        return !text.isBlank();
    }
}
