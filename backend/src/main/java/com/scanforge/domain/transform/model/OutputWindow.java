package com.scanforge.domain.transform.model;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Closed date interval for which scan results are produced. Lookback data before {@code start} is not part of it.
 */
public record OutputWindow(LocalDate start, LocalDate end) {

    public OutputWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Output window bounds are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException(
                    String.format("Output window start %s is after end %s", start, end));
        }
    }

    public static OutputWindow parse(String start, String end) {
        try {
            return new OutputWindow(LocalDate.parse(start), LocalDate.parse(end));
        } catch (DateTimeParseException | NullPointerException e) {
            throw new IllegalArgumentException(
                    String.format("Output window dates must be ISO-8601 (YYYY-MM-DD): %s, %s", start, end), e);
        }
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
