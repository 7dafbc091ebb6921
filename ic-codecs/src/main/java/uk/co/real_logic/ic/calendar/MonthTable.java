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

/**
 * Month lengths of the Iranian Calendar. The first six months have 31 days, the next five 30 days and the last
 * month 29 days, or 30 in a leap year.
 */
public final class MonthTable
{
    public static final int MONTHS_IN_YEAR = 12;
    public static final int MIN_MONTH = 1;
    public static final int MAX_MONTH = MONTHS_IN_YEAR;

    public static final int DAYS_IN_COMMON_YEAR = 365;
    public static final int DAYS_IN_LEAP_YEAR = 366;
    public static final int MAX_DAYS_IN_MONTH = 31;

    private static final int LAST_MONTH_COMMON_LENGTH = 29;
    private static final int LAST_MONTH_LEAP_LENGTH = 30;

    // index: month - 1
    private static final int[] NOMINAL_LENGTHS = { 31, 31, 31, 31, 31, 31, 30, 30, 30, 30, 30, 29 };

    // index: month - 1, value: days in the months before it, identical in leap and common years
    private static final int[] DAYS_BEFORE = new int[MONTHS_IN_YEAR];

    static
    {
        for (int i = 1; i < MONTHS_IN_YEAR; i++)
        {
            DAYS_BEFORE[i] = DAYS_BEFORE[i - 1] + NOMINAL_LENGTHS[i - 1];
        }
    }

    private MonthTable()
    {
    }

    public static boolean isValidMonth(final int month)
    {
        return month >= MIN_MONTH && month <= MAX_MONTH;
    }

    /**
     * Number of days in a month of the given year.
     *
     * @param year the year, only consulted for the last month.
     * @param month the month, 1-12.
     * @return the length of the month in days.
     * @throws InvalidMonthException if month is outside of 1-12.
     */
    public static int daysInMonth(final int year, final int month)
    {
        if (!isValidMonth(month))
        {
            throw new InvalidMonthException(month);
        }

        if (month == MAX_MONTH)
        {
            return LeapRule.isLeap(year) ? LAST_MONTH_LEAP_LENGTH : LAST_MONTH_COMMON_LENGTH;
        }

        return NOMINAL_LENGTHS[month - 1];
    }

    public static int daysInYear(final int year)
    {
        return LeapRule.isLeap(year) ? DAYS_IN_LEAP_YEAR : DAYS_IN_COMMON_YEAR;
    }

    /**
     * Total length of the months that precede the given month.
     *
     * @param month the month, 1-12.
     * @return the number of days from the first of the year to the first of the month.
     * @throws InvalidMonthException if month is outside of 1-12.
     */
    public static int daysBeforeMonth(final int month)
    {
        if (!isValidMonth(month))
        {
            throw new InvalidMonthException(month);
        }

        return DAYS_BEFORE[month - 1];
    }
}
