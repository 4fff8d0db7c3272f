package com.example.proposalwatch.service.window;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * HH:MM parsing and formatting shared by window and trigger settings.
 */
public final class TimeOfDay {

    private static final DateTimeFormatter INPUT = DateTimeFormatter.ofPattern("H:mm");
    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter KEY = DateTimeFormatter.ofPattern("HHmm");

    private TimeOfDay() {
    }

    /**
     * @throws DateTimeParseException for anything that is not H:MM or HH:MM
     */
    public static LocalTime parse(String value) {
        if (value == null) {
            throw new DateTimeParseException("time is missing", "", 0);
        }
        return LocalTime.parse(value.trim(), INPUT);
    }

    public static String display(LocalTime time) {
        return time.format(DISPLAY);
    }

    /**
     * Compact form used in job keys, e.g. 0930
     */
    public static String key(LocalTime time) {
        return time.format(KEY);
    }
}
