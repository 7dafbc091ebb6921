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
 * An immutable, always valid, date of the Iranian Calendar.
 * <p>
 * Years count from an epoch of 3000 BCE. There is no year zero: year -1 immediately precedes year 1. Months are
 * 1-based starting at Farvardin, so 1/1 is Nowruz.
 * <p>
 * Dates are ordered by year, then month, then day. Since there is no year zero this is also chronological
 * order across the epoch.
 */
public final class IcDate implements Comparable<IcDate>
{
    private final int year;
    private final int month;
    private final int day;

    private IcDate(final int year, final int month, final int day)
    {
        this.year = year;
        this.month = month;
        this.day = day;
    }

    /**
     * Create a date, validating its fields.
     *
     * @param year the year, any non-zero value.
     * @param month the month, 1-12.
     * @param day the day of the month, 1 up to the length of the month in that year.
     * @return the date.
     * @throws InvalidDateException if the fields don't form a valid date.
     */
    public static IcDate of(final int year, final int month, final int day)
    {
        if (!isValid(year, month, day))
        {
            throw new InvalidDateException(year, month, day);
        }

        return new IcDate(year, month, day);
    }

    /**
     * Check whether the fields form a valid date without throwing.
     *
     * @param year the year.
     * @param month the month.
     * @param day the day of the month.
     * @return true if {@link #of(int, int, int)} would succeed.
     */
    public static boolean isValid(final int year, final int month, final int day)
    {
        if (year == 0 || !MonthTable.isValidMonth(month))
        {
            return false;
        }

        return day >= 1 && day <= MonthTable.daysInMonth(year, month);
    }

    public int year()
    {
        return year;
    }

    public int month()
    {
        return month;
    }

    public int day()
    {
        return day;
    }

    public boolean isLeapYear()
    {
        return LeapRule.isLeap(year);
    }

    public int lengthOfMonth()
    {
        return MonthTable.daysInMonth(year, month);
    }

    public int lengthOfYear()
    {
        return MonthTable.daysInYear(year);
    }

    public int dayOfYear()
    {
        return OrdinalMapper.toOrdinal(this);
    }

    public YearMonthDay asTuple()
    {
        return new YearMonthDay(year, month, day);
    }

    public boolean isBefore(final IcDate other)
    {
        return compareTo(other) < 0;
    }

    public boolean isAfter(final IcDate other)
    {
        return compareTo(other) > 0;
    }

    public int compareTo(final IcDate other)
    {
        int result = Integer.compare(year, other.year);
        if (result == 0)
        {
            result = Integer.compare(month, other.month);
            if (result == 0)
            {
                result = Integer.compare(day, other.day);
            }
        }

        return result;
    }

    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (o == null || getClass() != o.getClass())
        {
            return false;
        }

        final IcDate icDate = (IcDate)o;

        return year == icDate.year && month == icDate.month && day == icDate.day;
    }

    public int hashCode()
    {
        int result = year;
        result = 31 * result + month;
        result = 31 * result + day;
        return result;
    }

    public String toString()
    {
        return "IcDate(" + year + ", " + month + ", " + day + ")";
    }
}
