package com.tsdblink.point;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Ordered group of points written together in one request.
 *
 * <p>Not thread-safe: create one batch per writer. Null points are kept in insertion order and
 * skipped by transports when the batch is serialized.
 */
public final class BatchPoints {
    private final List<Point> points = new ArrayList<>();
    private String database;
    private Precision precision;
    private String retentionPolicy;
    private String writeConsistency;

    private BatchPoints(Builder b) {
        this.database = b.database;
        this.precision = b.precision;
        this.retentionPolicy = b.retentionPolicy;
        this.writeConsistency = b.writeConsistency;
    }

    public static Builder builder() {
        return new Builder();
    }

    public void addPoint(Point point) {
        points.add(point);
    }

    public void addPoints(Collection<Point> more) {
        if (more != null) points.addAll(more);
    }

    /** Read-only view in insertion order; may contain nulls. */
    public List<Point> points() {
        return Collections.unmodifiableList(points);
    }

    public String database() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public Precision precision() {
        return precision;
    }

    /**
     * Changes the precision; the previous value is kept when {@code unit} is invalid.
     *
     * @throws IllegalArgumentException when {@code unit} is null, blank or not one of {@code ns|us|ms|s}
     */
    public void setPrecision(String unit) {
        this.precision = Precision.parseStrict(unit);
    }

    public void setPrecision(Precision precision) {
        if (precision == null) throw new IllegalArgumentException("precision is required");
        this.precision = precision;
    }

    public String retentionPolicy() {
        return retentionPolicy;
    }

    public void setRetentionPolicy(String retentionPolicy) {
        this.retentionPolicy = retentionPolicy;
    }

    public String writeConsistency() {
        return writeConsistency;
    }

    public void setWriteConsistency(String writeConsistency) {
        this.writeConsistency = writeConsistency;
    }

    public static final class Builder {
        private String database;
        private Precision precision = Precision.DEFAULT;
        private String retentionPolicy;
        private String writeConsistency;

        public Builder database(String db) {
            this.database = db;
            return this;
        }

        /**
         * @throws IllegalArgumentException when {@code unit} is not one of {@code ns|us|ms|s}
         */
        public Builder precision(String unit) {
            this.precision = Precision.parse(unit);
            return this;
        }

        public Builder precision(Precision p) {
            this.precision = p == null ? Precision.DEFAULT : p;
            return this;
        }

        public Builder retentionPolicy(String rp) {
            this.retentionPolicy = rp;
            return this;
        }

        public Builder writeConsistency(String wc) {
            this.writeConsistency = wc;
            return this;
        }

        public BatchPoints build() {
            return new BatchPoints(this);
        }
    }
}
