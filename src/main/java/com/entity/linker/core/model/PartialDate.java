package com.entity.linker.core.model;

import java.time.YearMonth;

/**
 * A calendar date whose month and day may be unknown.
 * Unknown components are {@code null}; a known day requires a known month.
 *
 * @param year  the year, always known
 * @param month the month (1-12), or {@code null} when unknown
 * @param day   the day of month, or {@code null} when unknown
 */
public record PartialDate(int year, Integer month, Integer day) implements Comparable<PartialDate> {

    public PartialDate {
        if (month == null && day != null) {
            throw new IllegalArgumentException("day requires a month");
        }
        if (month != null && (month < 1 || month > 12)) {
            throw new IllegalArgumentException("month must be between 1 and 12: " + month);
        }
        if (day != null && (day < 1 || day > YearMonth.of(year, month).lengthOfMonth())) {
            throw new IllegalArgumentException("invalid day " + day + " for " + year + "-" + month);
        }
    }

    public static PartialDate ofYear(int year) {
        return new PartialDate(year, null, null);
    }

    public static PartialDate ofMonth(int year, int month) {
        return new PartialDate(year, month, null);
    }

    public static PartialDate of(int year, int month, int day) {
        return new PartialDate(year, month, day);
    }

    public DatePrecision precision() {
        if (day != null) {
            return DatePrecision.DAY;
        }
        return month != null ? DatePrecision.MONTH : DatePrecision.YEAR;
    }

    /**
     * Returns the component at the given precision, or {@code null} when unknown.
     */
    public Integer component(DatePrecision precision) {
        return switch (precision) {
            case YEAR -> year;
            case MONTH -> month;
            case DAY -> day;
        };
    }

    /**
     * Drops every component finer than the given precision.
     */
    public PartialDate truncate(DatePrecision precision) {
        if (precision.ordinal() >= precision().ordinal()) {
            return this;
        }
        return precision == DatePrecision.YEAR ? ofYear(year) : ofMonth(year, month);
    }

    @Override
    public int compareTo(PartialDate other) {
        int cmp = Integer.compare(year, other.year);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(month != null ? month : 0, other.month != null ? other.month : 0);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(day != null ? day : 0, other.day != null ? other.day : 0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(String.format("%04d", year));
        if (month != null) {
            sb.append(String.format("-%02d", month));
        }
        if (day != null) {
            sb.append(String.format("-%02d", day));
        }
        return sb.toString();
    }
}
