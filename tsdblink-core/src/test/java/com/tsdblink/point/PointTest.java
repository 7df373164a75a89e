package com.tsdblink.point;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PointTest {

    private static final Instant TS = Instant.parse("2024-01-01T00:00:00.123456789Z");

    @Test
    void rendersSortedTagsAndTypedFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("value", 1.5d);
        fields.put("count", 3);
        fields.put("ok", true);
        fields.put("note", "all good");

        Point p = Point.of("cpu", Map.of("region", "eu", "host", "a"), fields, TS);

        assertThat(p.precisionString(Precision.MILLISECONDS))
                .isEqualTo("cpu,host=a,region=eu count=3i,note=\"all good\",ok=true,value=1.5 1704067200123");
    }

    @Test
    void timestampFollowsPrecision() {
        Point p = Point.builder("m").field("v", 1L).time(TS).build();

        assertThat(p.precisionString(Precision.SECONDS)).endsWith(" 1704067200");
        assertThat(p.precisionString(Precision.MICROSECONDS)).endsWith(" 1704067200123456");
        assertThat(p.toString()).endsWith(" 1704067200123456789");
    }

    @Test
    void pointWithoutTimeHasNoTimestampSuffix() {
        Point p = Point.builder("m").field("v", 2L).build();

        assertThat(p.hasTime()).isFalse();
        assertThat(p.precisionString(Precision.MILLISECONDS)).isEqualTo("m v=2i");
    }

    @Test
    void escapesNamesTagsAndFieldKeys() {
        Point p = Point.builder("disk usage")
                .tag("mount point", "/var,log")
                .field("free=bytes", 10L)
                .field("label", "a \"quoted\" word")
                .build();

        assertThat(p.toString())
                .isEqualTo("disk\\ usage,mount\\ point=/var\\,log free\\=bytes=10i,label=\"a \\\"quoted\\\" word\"");
    }

    @Test
    void normalizesNumericFieldsAndKeepsUnsigned() {
        Point p = Point.builder("m")
                .field("b", (byte) 1)
                .field("f", 2.5f)
                .field("u", new BigInteger("18446744073709551615"))
                .build();

        assertThat(p.fields()).containsEntry("b", 1L).containsEntry("f", 2.5d);
        assertThat(p.toString()).isEqualTo("m b=1i,f=2.5,u=18446744073709551615u");
    }

    @Test
    void floatsUsePlainDecimalForm() {
        assertThat(Point.formatFloat(1.0)).isEqualTo("1");
        assertThat(Point.formatFloat(1e-7)).isEqualTo("0.0000001");
        assertThat(Point.formatFloat(12345678.5)).isEqualTo("12345678.5");
    }

    @Test
    void rejectsMissingNameOrFields() {
        assertThatThrownBy(() -> Point.builder("").field("v", 1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Point.builder("m").build()).isInstanceOf(IllegalArgumentException.class);

        Map<String, Object> onlyNull = new LinkedHashMap<>();
        onlyNull.put("v", null);
        assertThatThrownBy(() -> Point.of("m", Map.of(), onlyNull, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no fields");
    }

    @Test
    void rejectsNonFiniteAndUnsupportedValues() {
        assertThatThrownBy(() -> Point.builder("m").field("v", Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Point.builder("m").field("v", new Object()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unsupported type");
    }

    @Test
    void dropsTagsWithEmptyValues() {
        Point p = Point.builder("m").tag("host", "").tag("dc", "x").field("v", 1).build();

        assertThat(p.tags()).containsOnlyKeys("dc");
    }
}
