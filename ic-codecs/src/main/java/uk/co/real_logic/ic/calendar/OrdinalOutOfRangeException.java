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
 * Thrown when a day-of-year is outside of the length of its year.
 */
public class OrdinalOutOfRangeException extends IllegalArgumentException
{
    private static final long serialVersionUID = 1L;

    private final int year;
    private final int ordinal;

    public OrdinalOutOfRangeException(final int year, final int ordinal)
    {
        super("Ordinal day " + ordinal + " is outside of 1-" + MonthTable.daysInYear(year) + " for year " + year);
        this.year = year;
        this.ordinal = ordinal;
    }

    public int year()
    {
        return year;
    }

    public int ordinal()
    {
        return ordinal;
    }
}
