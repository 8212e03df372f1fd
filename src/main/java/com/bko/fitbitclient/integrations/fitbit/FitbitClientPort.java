package com.bko.fitbitclient.integrations.fitbit;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

public interface FitbitClientPort {
    default ActivitySummary getActivitySummaryForDay(LocalDate day) throws IOException {
        return getActivitySummaryForDay(day.format(DateTimeFormatter.ISO_LOCAL_DATE));
    }

    /** @param day a {@code yyyy-MM-dd} date, passed through to Fitbit as is */
    ActivitySummary getActivitySummaryForDay(String day) throws IOException;
    UserProfile getUserProfile() throws IOException;
}
