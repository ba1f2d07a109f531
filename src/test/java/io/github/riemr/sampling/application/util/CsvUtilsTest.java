package io.github.riemr.sampling.application.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CsvUtilsTest {

    @Test
    void splitLine_handlesQuotesAndEscapedQuotes() {
        assertThat(CsvUtils.splitLine("a, \"b, c\" ,\"say \"\"hi\"\"\",")).containsExactly("a", "b, c", "say \"hi\"", "");
    }

    @Test
    void stripBom_removesLeadingMarkOnly() {
        assertThat(CsvUtils.stripBom("\uFEFFname")).isEqualTo("name");
        assertThat(CsvUtils.stripBom("name")).isEqualTo("name");
    }

    @Test
    void escape_quotesWhenNeeded() {
        assertThat(CsvUtils.escape("plain")).isEqualTo("plain");
        assertThat(CsvUtils.escape("a,b")).isEqualTo("\"a,b\"");
        assertThat(CsvUtils.escape("a\"b")).isEqualTo("\"a\"\"b\"");
        assertThat(CsvUtils.escape(null)).isEmpty();
    }
}
