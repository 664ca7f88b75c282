package com.williamcallahan.lawlens.domain.document;

/**
 * Visual decorations a rendered fragment can combine.
 */
public enum TextDecoration {
    BOLD("font-bold"),
    ITALIC("italic"),
    MUTED("text-muted"),
    STRIKETHROUGH("line-through"),
    MUTED_BACKGROUND("bg-muted");

    private final String cssClass;

    TextDecoration(String cssClass) {
        this.cssClass = cssClass;
    }

    public String cssClass() {
        return cssClass;
    }
}
