package com.appointments.booking.util;

import java.util.List;

/**
 * Fixed, ordered list of bookable times of day. Half-hour steps from 09:00 to 17:00
 * with no slots between 12:00 and 14:00.
 */
public final class SlotCatalog {

    private static final List<String> SLOTS = List.of(
            "09:00", "09:30", "10:00", "10:30", "11:00", "11:30",
            "14:00", "14:30", "15:00", "15:30", "16:00", "16:30", "17:00");

    private SlotCatalog() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static List<String> slots() {
        return SLOTS;
    }

    public static boolean contains(String time) {
        return time != null && SLOTS.contains(time);
    }
}
