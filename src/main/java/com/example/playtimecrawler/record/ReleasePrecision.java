package com.example.playtimecrawler.record;

public enum ReleasePrecision {
    DAY("day"),
    MONTH("month"),
    YEAR("year"),
    NONE("");

    private final String label;

    ReleasePrecision(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
