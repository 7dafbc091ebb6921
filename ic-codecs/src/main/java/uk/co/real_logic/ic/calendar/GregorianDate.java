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

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Year;

/**
 * A date of the proleptic Gregorian calendar with a <code>long</code> year, using astronomical year numbering.
 * <p>
 * Every date of the Iranian Calendar has a Gregorian counterpart of this type, including those whose year is
 * outside of the range of {@link LocalDate}.
 */
public final class GregorianDate
{
    private final long year;
    private final int month;
    private final int day;

    GregorianDate(final long year, final int month, final int day)
    {
        this.year = year;
        this.month = month;
        this.day = day;
    }

    public static GregorianDate of(final LocalDate date)
    {
        return new GregorianDate(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    public long year()
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

    public long toEpochDay()
    {
        return ProlepticGregorian.toEpochDay(year, month, day);
    }

    public DayOfWeek dayOfWeek()
    {
        // 1970-01-01 was a Thursday
        return DayOfWeek.THURSDAY.plus(Math.floorMod(toEpochDay(), 7));
    }

    public boolean isSupportedByLocalDate()
    {
        return year >= Year.MIN_VALUE && year <= Year.MAX_VALUE;
    }

    /**
     * Convert to a {@link LocalDate}.
     *
     * @return the equivalent {@link LocalDate}.
     * @throws DateTimeException if the year is outside of the range of {@link LocalDate}.
     */
    public LocalDate toLocalDate()
    {
        if (!isSupportedByLocalDate())
        {
            throw new DateTimeException("Year " + year + " is outside of the range of LocalDate");
        }

        return LocalDate.of((int)year, month, day);
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

        final GregorianDate that = (GregorianDate)o;

        return year == that.year && month == that.month && day == that.day;
    }

    public int hashCode()
    {
        int result = Long.hashCode(year);
        result = 31 * result + month;
        result = 31 * result + day;
        return result;
    }

    /**
     * ISO-8601 text in the same form as {@link LocalDate#toString()}, eg "2026-01-22", "-3000-03-22" or
     * "+1000000000-01-01".
     *
     * @return the date as text.
     */
    public String toString()
    {
        final StringBuilder builder = new StringBuilder(16);
        final long absoluteYear = Math.abs(year);
        if (absoluteYear < 1000)
        {
            if (year < 0)
            {
                builder.append('-');
            }
            builder.append(absoluteYear + 10000).deleteCharAt(builder.length() - 5);
        }
        else
        {
            if (year > 9999)
            {
                builder.append('+');
            }
            builder.append(year);
        }

        return builder
            .append(month < 10 ? "-0" : "-").append(month)
            .append(day < 10 ? "-0" : "-").append(day)
            .toString();
    }
}
