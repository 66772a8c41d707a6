package org.epubmeta.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HrefUtilsTest {

    @Test
    void wellFormedEscapesAreDecoded() {
        assertThat(HrefUtils.decode("a%20b.xhtml")).isEqualTo("a b.xhtml");
        assertThat(HrefUtils.decode("%E2%80%99s.xhtml")).isEqualTo("\u2019s.xhtml");
    }

    @Test
    void strayPercentAndPlusAreLiteral() {
        assertThat(HrefUtils.decode("100%.jpg")).isEqualTo("100%.jpg");
        assertThat(HrefUtils.decode("%")).isEqualTo("%");
        assertThat(HrefUtils.decode("a%2")).isEqualTo("a%2");
        assertThat(HrefUtils.decode("c++%20x")).isEqualTo("c++ x");
    }

    @Test
    void nullAndPlainHrefsPassThrough() {
        assertThat(HrefUtils.decode(null)).isNull();
        assertThat(HrefUtils.decode("text/one.xhtml")).isEqualTo("text/one.xhtml");
    }
}
