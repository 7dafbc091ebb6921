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
 * Maps dates to and from their 1-based day of the year. 1/1 is day 1 and the last day of the year is 365 or 366.
 */
public final class OrdinalMapper
{
    private OrdinalMapper()
    {
    }

    public static int toOrdinal(final IcDate date)
    {
        return MonthTable.daysBeforeMonth(date.month()) + date.day();
    }

    /**
     * Find the date on a given day of a year.
     *
     * @param year the year, non-zero.
     * @param ordinal the day of the year, 1 up to the length of the year.
     * @return the date.
     * @throws OrdinalOutOfRangeException if the ordinal is outside of the year.
     * @throws InvalidDateException if the year is zero.
     */
    public static IcDate fromOrdinal(final int year, final int ordinal)
    {
        if (ordinal < 1 || ordinal > MonthTable.daysInYear(year))
        {
            throw new OrdinalOutOfRangeException(year, ordinal);
        }

        int remaining = ordinal;
        int month = MonthTable.MIN_MONTH;
        int monthLength = MonthTable.daysInMonth(year, month);
        while (remaining > monthLength)
        {
            remaining -= monthLength;
            month++;
            monthLength = MonthTable.daysInMonth(year, month);
        }

        return IcDate.of(year, month, remaining);
    }
}
