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
 * Thrown when a year, month and day triple does not name a date of the calendar: the year is zero, the month is
 * outside of 1-12, or the day is outside of the month.
 */
public class InvalidDateException extends IllegalArgumentException
{
    private static final long serialVersionUID = 1L;

    private final int year;
    private final int month;
    private final int day;

    public InvalidDateException(final int year, final int month, final int day)
    {
        super(message(year, month, day));
        this.year = year;
        this.month = month;
        this.day = day;
    }

    private static String message(final int year, final int month, final int day)
    {
        final String reason;
        if (year == 0)
        {
            reason = "there is no year 0";
        }
        else if (!MonthTable.isValidMonth(month))
        {
            reason = "month must be 1-12";
        }
        else
        {
            reason = "month " + month + " of " + year + " has " + MonthTable.daysInMonth(year, month) + " days";
        }

        return "Invalid date: " + year + "/" + month + "/" + day + ", " + reason;
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
}
