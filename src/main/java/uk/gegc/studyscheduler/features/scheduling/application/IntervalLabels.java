package uk.gegc.studyscheduler.features.scheduling.application;

/**
 * Short human-readable form of an interval, as shown on rating buttons.
 */
public final class IntervalLabels {

    private static final int DAYS_PER_MONTH = 30;
    private static final int DAYS_PER_YEAR = 365;

    private IntervalLabels() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String format(int days) {
        if (days < 1) {
            return "Today";
        }
        if (days == 1) {
            return "1 day";
        }
        if (days < DAYS_PER_MONTH) {
            return days + " days";
        }
        if (days < DAYS_PER_YEAR) {
            long months = Math.round(days / (double) DAYS_PER_MONTH);
            return months == 1 ? "1 month" : months + " months";
        }
        long years = Math.round(days / (double) DAYS_PER_YEAR);
        return years == 1 ? "1 year" : years + " years";
    }
}
