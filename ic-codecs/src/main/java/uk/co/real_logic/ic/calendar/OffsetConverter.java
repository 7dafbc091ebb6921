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
 * Converts to and from the Solar Hijri calendar. Months and leap years are structurally identical, so the
 * conversion is a constant shift of the year: <code>icYear = solarHijriYear + solarHijriOffset</code>.
 * <p>
 * The shift is linear, so Solar Hijri year 0 maps to Iranian Calendar year 3621 while Solar Hijri year -3621 has no
 * counterpart.
 */
public final class OffsetConverter
{
    private final int solarHijriOffset;

    public OffsetConverter()
    {
        this(new CalendarConfiguration());
    }

    public OffsetConverter(final CalendarConfiguration configuration)
    {
        configuration.conclude();
        solarHijriOffset = configuration.solarHijriOffset();
    }

    public YearMonthDay toSolarHijri(final IcDate date)
    {
        return new YearMonthDay(Math.subtractExact(date.year(), solarHijriOffset), date.month(), date.day());
    }

    /**
     * Convert a Solar Hijri date.
     *
     * @param year the Solar Hijri year.
     * @param month the month, 1-12.
     * @param day the day of the month.
     * @return the equivalent date.
     * @throws InvalidDateException if the shifted fields don't form a valid date.
     */
    public IcDate fromSolarHijri(final int year, final int month, final int day)
    {
        return IcDate.of(Math.addExact(year, solarHijriOffset), month, day);
    }

    public IcDate fromSolarHijri(final YearMonthDay date)
    {
        return fromSolarHijri(date.year(), date.month(), date.day());
    }

    public int toSolarHijriYear(final int year)
    {
        return Math.subtractExact(year, solarHijriOffset);
    }
}
