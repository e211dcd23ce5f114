package com.appointments.booking.util;

import java.time.LocalDate;

public final class DateLabels {

    private static final String[] WEEKDAYS = {"lun", "mar", "mer", "gio", "ven", "sab", "dom"};
    private static final String[] MONTHS = {
            "gen", "feb", "mar", "apr", "mag", "giu", "lug", "ago", "set", "ott", "nov", "dic"};

    private DateLabels() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Short Italian label such as {@code "lun 03 mar"}.
     */
    public static String shortLabel(LocalDate date) {
        return String.format("%s %02d %s",
                WEEKDAYS[date.getDayOfWeek().getValue() - 1],
                date.getDayOfMonth(),
                MONTHS[date.getMonthValue() - 1]);
    }
}
