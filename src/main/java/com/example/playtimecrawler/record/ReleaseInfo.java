package com.example.playtimecrawler.record;

/**
 * Release date at whatever precision the page states it. Instances are only built through
 * the factories so the decomposed fields always agree with {@link #precision()}.
 */
public record ReleaseInfo(
        String date,
        ReleasePrecision precision,
        String year,
        String month,
        String day
) {
    private static final ReleaseInfo NONE = new ReleaseInfo(null, ReleasePrecision.NONE, null, null, null);

    public static ReleaseInfo ofDay(int year, int month, int day) {
        String y = String.format("%04d", year);
        String m = String.format("%02d", month);
        String d = String.format("%02d", day);
        return new ReleaseInfo(y + "-" + m + "-" + d, ReleasePrecision.DAY, y, m, d);
    }

    public static ReleaseInfo ofMonth(int year, int month) {
        String y = String.format("%04d", year);
        String m = String.format("%02d", month);
        return new ReleaseInfo(y + "-" + m, ReleasePrecision.MONTH, y, m, null);
    }

    public static ReleaseInfo ofYear(int year) {
        String y = String.format("%04d", year);
        return new ReleaseInfo(y, ReleasePrecision.YEAR, y, null, null);
    }

    public static ReleaseInfo none() {
        return NONE;
    }

    public boolean isKnown() {
        return precision != ReleasePrecision.NONE;
    }
}
