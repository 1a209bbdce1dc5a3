package com.kotsin.advisor.monitor;

public record CatchUpReport(int checked, int completed, int stopped, int updated, int skipped, int failed) {
}
