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
 * A plain, unvalidated, year, month and day triple. Used to expose the fields of an {@link IcDate} and to carry
 * dates of other calendars which share its shape.
 */
public final class YearMonthDay
{
    private final int year;
    private final int month;
    private final int day;

    public YearMonthDay(final int year, final int month, final int day)
    {
        this.year = year;
        this.month = month;
        this.day = day;
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

        final YearMonthDay that = (YearMonthDay)o;

        return year == that.year && month == that.month && day == that.day;
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
        return "(" + year + ", " + month + ", " + day + ")";
    }
}
