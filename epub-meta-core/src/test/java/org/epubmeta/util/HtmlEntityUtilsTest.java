package org.epubmeta.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlEntityUtilsTest {

    @Test
    void namedEntitiesBecomeCharacterReferences() {
        assertThat(HtmlEntityUtils.convertNamedToNumeric("a&nbsp;b&rsquo;c")).isEqualTo("a&#160;b&#8217;c");
    }

    @Test
    void xmlEntitiesAndUnknownNamesAreKept() {
        assertThat(HtmlEntityUtils.convertNamedToNumeric("&amp;&lt;&gt;&quot;&apos;"))
                .isEqualTo("&amp;&lt;&gt;&quot;&apos;");
        assertThat(HtmlEntityUtils.convertNamedToNumeric("&notAnEntityName;")).isEqualTo("&notAnEntityName;");
        assertThat(HtmlEntityUtils.convertNamedToNumeric("&#160; & plain")).isEqualTo("&#160; & plain");
    }

    @Test
    void nullAndTextWithoutEntitiesPassThrough() {
        assertThat(HtmlEntityUtils.convertNamedToNumeric(null)).isNull();
        assertThat(HtmlEntityUtils.convertNamedToNumeric("no entities")).isEqualTo("no entities");
    }

    @Test
    void htmlElementLists() {
        assertThat(HtmlElements.isKeptMarkup("P")).isTrue();
        assertThat(HtmlElements.isKeptMarkup("a")).isFalse();
        assertThat(HtmlElements.isBlockLevel("blockquote")).isTrue();
        assertThat(HtmlElements.isBlockLevel("span")).isFalse();
        assertThat(HtmlElements.isBlockLevel(null)).isFalse();
    }
}
