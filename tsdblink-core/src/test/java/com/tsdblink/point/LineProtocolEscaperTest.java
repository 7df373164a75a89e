package com.tsdblink.point;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class LineProtocolEscaperTest {

    private static final char[] RESERVED = {',', '"', ' ', '='};

    @Test
    void escapesEveryReservedCharacter() {
        assertThat(LineProtocolEscaper.escape("a,b\"c d=e")).isEqualTo("a\\,b\\\"c\\ d\\=e");
    }

    @Test
    void plainStringsAreReturnedAsIs() {
        String plain = "cpu_load";
        assertThat(LineProtocolEscaper.escape(plain)).isSameAs(plain);
        assertThat(LineProtocolEscaper.unescape(plain)).isSameAs(plain);
    }

    @Test
    void unescapeReversesEscapeOverReservedAlphabet() {
        Random random = new Random(42);
        for (int run = 0; run < 500; run++) {
            StringBuilder sb = new StringBuilder();
            int len = random.nextInt(12);
            for (int i = 0; i < len; i++) sb.append(RESERVED[random.nextInt(RESERVED.length)]);
            String s = sb.toString();
            assertThat(LineProtocolEscaper.unescape(LineProtocolEscaper.escape(s))).isEqualTo(s);
        }
    }

    @Test
    void backslashesThatDoNotEscapeAReservedCharacterSurvive() {
        for (String s : List.of("\\", "a\\b", "\\,", "x\\\\y", "tail\\")) {
            assertThat(LineProtocolEscaper.unescape(LineProtocolEscaper.escape(s))).isEqualTo(s);
        }
    }

    @Test
    void stringValuesEscapeQuotesAndBackslashes() {
        assertThat(LineProtocolEscaper.escapeStringValue("say \"hi\" \\o/")).isEqualTo("say \\\"hi\\\" \\\\o/");
    }
}
