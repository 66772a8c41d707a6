package org.epubmeta.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.Set;

@UtilityClass
public class HtmlElements {

    // Formatting that survives markup preserving extraction, all other tags are dropped.
    private static final Set<String> KEPT_MARKUP_TAGS = Set.of(
            "br", "p", "h1", "h2", "h3", "h4", "h5", "span", "div", "i", "strong", "b", "table", "td", "th", "tr"
    );

    private static final Set<String> BLOCK_LEVEL_TAGS = Set.of(
            "address", "article", "aside", "blockquote", "canvas", "dd", "div", "dl", "dt", "fieldset",
            "figcaption", "figure", "footer", "form", "h1", "h2", "h3", "h4", "h5", "h6", "header", "hgroup",
            "hr", "li", "main", "nav", "noscript", "ol", "output", "p", "pre", "section", "table", "tfoot",
            "ul", "video"
    );

    public static boolean isKeptMarkup(String tag) {
        return tag != null && KEPT_MARKUP_TAGS.contains(tag.toLowerCase(Locale.ROOT));
    }

    public static boolean isBlockLevel(String tag) {
        return tag != null && BLOCK_LEVEL_TAGS.contains(tag.toLowerCase(Locale.ROOT));
    }
}
