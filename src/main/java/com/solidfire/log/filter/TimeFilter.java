package com.solidfire.log.filter;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;

import com.solidfire.log.parser.HeaderParser;
import com.solidfire.log.parser.model.FlatRecord;

/**
 * Date and time-of-day window over the {@code date} and {@code time} fields written by
 * the header parser. Bounds are inclusive; an absent bound is open.
 */
public class TimeFilter {

    private final LocalDate startDate;
    private final LocalDate endDate;
    private final LocalTime startTime;
    private final LocalTime endTime;

    /**
     * @param startDate yyyy-MM-dd or null
     * @param endDate yyyy-MM-dd or null
     * @param startTime HH:mm:ss, HH:mm or null
     * @param endTime HH:mm:ss, HH:mm or null
     * @throws IllegalArgumentException if a bound cannot be parsed
     */
    public TimeFilter(String startDate, String endDate, String startTime, String endTime) {
        this.startDate = parseDate(startDate, "start date");
        this.endDate = parseDate(endDate, "end date");
        this.startTime = parseTime(startTime, "start time");
        this.endTime = parseTime(endTime, "end time");
    }

    public boolean isActive() {
        return startDate != null || endDate != null || startTime != null || endTime != null;
    }

    public boolean matches(FlatRecord record) {
        String dateValue = record.get(HeaderParser.DATE);
        String timeValue = record.get(HeaderParser.TIME);

        LocalDate recordDate = null;
        if (dateValue != null && !dateValue.isEmpty()) {
            try {
                recordDate = LocalDate.parse(dateValue);
            } catch (DateTimeParseException e) {
                return false;
            }
        }

        // an unparseable time only disables the time-of-day check
        LocalTime recordTime = parseRecordTime(timeValue);

        if (recordDate != null) {
            if (startDate != null && recordDate.isBefore(startDate)) {
                return false;
            }
            if (endDate != null && recordDate.isAfter(endDate)) {
                return false;
            }
        }
        if (recordTime != null) {
            if (startTime != null && recordTime.isBefore(startTime)) {
                return false;
            }
            if (endTime != null && recordTime.isAfter(endTime)) {
                return false;
            }
        }
        return true;
    }

    private static LocalTime parseRecordTime(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDate parseDate(String value, String label) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + label + " format (expected YYYY-MM-DD): " + value, e);
        }
    }

    private static LocalTime parseTime(String value, String label) {
        if (value == null) {
            return null;
        }
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + label + " format (expected HH:MM:SS or HH:MM): " + value, e);
        }
    }

    @Override
    public String toString() {
        return "TimeFilter [startDate=" + startDate + ", endDate=" + endDate + ", startTime=" + startTime
                + ", endTime=" + endTime + "]";
    }
}
