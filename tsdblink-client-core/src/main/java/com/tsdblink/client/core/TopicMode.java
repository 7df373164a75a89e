package com.tsdblink.client.core;

/** What a topic is defined over. */
public enum TopicMode {
    /** Every table of a database. */
    DATABASE("database "),
    /** Every child table of a super table. */
    SUPER_TABLE("stable "),
    /** The rows selected by a query. */
    QUERY("");

    private final String keyword;

    TopicMode(String keyword) {
        this.keyword = keyword;
    }

    String createStatement(String topic, String content) {
        return "create topic if not exists " + topic + " as " + keyword + content;
    }
}
