/*
 * Copyright 2015-2025 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package uk.co.real_logic.ic.calendar;

import java.time.LocalDate;

/**
 * Day counting for the proleptic Gregorian calendar, using astronomical year numbering (year 0 is 1 BCE).
 * <p>
 * Days are counted from 1970-01-01, the same epoch day as {@link LocalDate#toEpochDay()}. Unlike the fixed
 * width codecs this works for negative years, since conversions reach back before the Iranian Calendar's 3000 BCE
 * epoch.
 */
public final class ProlepticGregorian
{
    public static final int MONTHS_IN_YEAR = 12;

    private static final int DAYS_IN_COMMON_YEAR = 365;
    private static final int DAYS_IN_400_YEAR_CYCLE = 146097;
    private static final int DAYS_UNTIL_START_OF_UNIX_EPOCH = 719528;

    // days from 0000-03-01 to the following 0001-01-01, so year estimates start in March
    private static final int DAYS_FROM_MARCH_TO_JANUARY = 60;

    private static final int[] MONTH_LENGTHS = { 31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31 };

    private ProlepticGregorian()
    {
    }

    public static boolean isLeap(final long year)
    {
        return (year & 3) == 0 && (year % 100 != 0 || year % 400 == 0);
    }

    public static int lengthOfMonth(final long year, final int month)
    {
        if (month < 1 || month > MONTHS_IN_YEAR)
        {
            throw new IllegalArgumentException("Invalid Gregorian month: " + month);
        }

        return month == 2 && isLeap(year) ? 29 : MONTH_LENGTHS[month - 1];
    }

    public static boolean isValid(final long year, final int month, final int day)
    {
        return month >= 1 && month <= MONTHS_IN_YEAR && day >= 1 && day <= lengthOfMonth(year, month);
    }

    public static long toEpochDay(final LocalDate date)
    {
        return toEpochDay(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * Converts a year/month/day representation of a date to the number of days since the epoch.
     *
     * @param year the year component of the date value to convert, may be zero or negative.
     * @param month the month component of the date value to convert
     * @param day the day component of the date value to convert
     * @return number of days since 1970-01-01, negative for earlier dates
     */
    public static long toEpochDay(final long year, final int month, final int day)
    {
        return yearsToDays(year) + monthsToDays(month, year) + (day - 1) - DAYS_UNTIL_START_OF_UNIX_EPOCH;
    }

    private static int monthsToDays(final int month, final long year)
    {
        int days = (367 * month - 362) / MONTHS_IN_YEAR;
        if (month > 2)
        {
            days--;
            if (!isLeap(year))
            {
                days--;
            }
        }
        return days;
    }

    private static long yearsToDays(final long years)
    {
        long days = DAYS_IN_COMMON_YEAR * years;
        if (years >= 0)
        {
            days += (years + 3) / 4 - (years + 99) / 100 + (years + 399) / 400;
        }
        else
        {
            days -= years / -4 - years / -100 + years / -400;
        }
        return days;
    }

    /**
     * Converts a number of days since the epoch back into a year, month and day.
     *
     * @param epochDay number of days since 1970-01-01.
     * @return the date in the proleptic Gregorian calendar, with a year that may be outside of the range of
     * {@link LocalDate}.
     */
    public static GregorianDate fromEpochDay(final long epochDay)
    {
        // adjust to 0000-03-01 so leap day is at end of four year cycle
        long zeroDay = epochDay + DAYS_UNTIL_START_OF_UNIX_EPOCH - DAYS_FROM_MARCH_TO_JANUARY;
        long adjustYears = 0;
        if (zeroDay < 0)
        {
            // shift into positive territory by whole 400 year cycles
            final long adjustCycles = (zeroDay + 1) / DAYS_IN_400_YEAR_CYCLE - 1;
            adjustYears = adjustCycles * 400;
            zeroDay -= adjustCycles * DAYS_IN_400_YEAR_CYCLE;
        }

        long yearEstimate = (400 * zeroDay + 591) / DAYS_IN_400_YEAR_CYCLE;
        long dayEstimate = estimateDayOfYear(zeroDay, yearEstimate);
        if (dayEstimate < 0)
        {
            // fix estimate
            yearEstimate--;
            dayEstimate = estimateDayOfYear(zeroDay, yearEstimate);
        }
        final int marchDay0 = (int)dayEstimate;

        // convert march-based values back to january-based
        final int marchMonth0 = (marchDay0 * 5 + 2) / 153;
        final int month = (marchMonth0 + 2) % 12 + 1;
        final int day = marchDay0 - (marchMonth0 * 306 + 5) / 10 + 1;
        final long year = yearEstimate + adjustYears + marchMonth0 / 10;

        return new GregorianDate(year, month, day);
    }

    /**
     * Converts a number of days since the epoch to a {@link LocalDate}.
     *
     * @param epochDay number of days since 1970-01-01.
     * @return the date.
     * @throws java.time.DateTimeException if the year is outside of the range of {@link LocalDate}.
     */
    public static LocalDate toLocalDate(final long epochDay)
    {
        return fromEpochDay(epochDay).toLocalDate();
    }

    private static long estimateDayOfYear(final long zeroDay, final long yearEst)
    {
        return zeroDay - (DAYS_IN_COMMON_YEAR * yearEst + yearEst / 4 - yearEst / 100 + yearEst / 400);
    }
}
