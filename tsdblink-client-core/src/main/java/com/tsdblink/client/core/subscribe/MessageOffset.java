package com.tsdblink.client.core.subscribe;

/** Position of a message within its topic: partition plus offset inside the partition. */
public record MessageOffset(int partition, long position) {}
