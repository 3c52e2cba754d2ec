package com.openness.crawler.evaluation;

public record DimensionSummary(int fulfilled, int total, double percentage) {

    public static DimensionSummary of(int fulfilled, int total) {
        return new DimensionSummary(fulfilled, total, total == 0 ? 0.0 : fulfilled * 100.0 / total);
    }
}
