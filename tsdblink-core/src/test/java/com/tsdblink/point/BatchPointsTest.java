package com.tsdblink.point;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class BatchPointsTest {

    @Test
    void defaultsToMilliseconds() {
        BatchPoints batch = BatchPoints.builder().database("iot").build();

        assertThat(batch.precision()).isEqualTo(Precision.MILLISECONDS);
        assertThat(batch.database()).isEqualTo("iot");
    }

    @Test
    void builderRejectsInvalidPrecision() {
        assertThatThrownBy(() -> BatchPoints.builder().precision("minutes"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minutes");
    }

    @Test
    void invalidPrecisionLeavesPreviousValue() {
        BatchPoints batch = BatchPoints.builder().precision("s").build();

        assertThatThrownBy(() -> batch.setPrecision("fortnight")).isInstanceOf(IllegalArgumentException.class);
        assertThat(batch.precision()).isEqualTo(Precision.SECONDS);
        assertThatThrownBy(() -> batch.setPrecision("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> batch.setPrecision((String) null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(batch.precision()).isEqualTo(Precision.SECONDS);

        batch.setPrecision("us");
        assertThat(batch.precision()).isEqualTo(Precision.MICROSECONDS);
    }

    @Test
    void builderTreatsBlankPrecisionAsDefault() {
        assertThat(BatchPoints.builder().precision("").build().precision()).isEqualTo(Precision.MILLISECONDS);
        assertThat(BatchPoints.builder().precision((String) null).build().precision()).isEqualTo(Precision.MILLISECONDS);
    }

    @Test
    void keepsInsertionOrderDuplicatesAndNulls() {
        Point a = Point.builder("a").field("v", 1).build();
        Point b = Point.builder("b").field("v", 2).build();
        BatchPoints batch = BatchPoints.builder().build();

        batch.addPoint(a);
        batch.addPoints(Arrays.asList(null, b, a));

        assertThat(batch.points()).containsExactly(a, null, b, a);
    }

    @Test
    void carriesRetentionPolicyAndConsistency() {
        BatchPoints batch = BatchPoints.builder().retentionPolicy("rp1").writeConsistency("all").build();

        assertThat(batch.retentionPolicy()).isEqualTo("rp1");
        assertThat(batch.writeConsistency()).isEqualTo("all");
    }
}
