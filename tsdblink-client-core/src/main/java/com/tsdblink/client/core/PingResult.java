package com.tsdblink.client.core;

import java.time.Duration;

public record PingResult(Duration roundTrip, String version) {}
