package com.kotsin.advisor.monitor;

import java.time.Instant;

public record MonitorStats(boolean running, long ticks, int activeSignals, Instant lastTickAt) {
}
