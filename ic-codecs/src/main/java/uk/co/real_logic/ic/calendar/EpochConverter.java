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
 * Converts between the Iranian Calendar and the proleptic Gregorian calendar.
 * <p>
 * Both sides are reduced to a serial day number, the number of days since 1970-01-01. On the Gregorian side this
 * is {@link ProlepticGregorian#toEpochDay(long, int, int)}. On the Iranian side it is the length of all whole years
 * between year 1 and the date's year, plus the date's day of year, offset so that the Nowruz of the configured
 * anchor year falls on the configured Gregorian month and day of <code>anchorYear - gregorianOffset</code>.
 * <p>
 * Every date converts to a {@link GregorianDate}, see {@link #toGregorianFields(IcDate)}. Conversions to and from
 * {@link LocalDate} are conveniences limited to its range.
 * <p>
 * Nowruz is only pinned for the anchor year: the 33 year cycle decides every other year's length, so other
 * years' Nowruz may fall a day or two either side of the anchor's Gregorian date. That keeps the conversion a
 * bijection, at the cost of not tracking the true equinox.
 * <p>
 * Instances are immutable and thread safe.
 */
public final class EpochConverter
{
    private final int gregorianOffset;
    private final int anchorYear;

    // serial day of 1/1 of year 1
    private final long epochDayOfYearOne;

    public EpochConverter()
    {
        this(new CalendarConfiguration());
    }

    public EpochConverter(final CalendarConfiguration configuration)
    {
        configuration.conclude();

        gregorianOffset = configuration.gregorianOffset();
        anchorYear = configuration.anchorYear();

        final long anchorNowruz = ProlepticGregorian.toEpochDay(
            toGregorianYear(anchorYear),
            configuration.nowruzMonth().getValue(),
            configuration.nowruzDay());
        epochDayOfYearOne = anchorNowruz - daysFromYearOne(anchorYear);
    }

    public int anchorYear()
    {
        return anchorYear;
    }

    /**
     * Convert a date to the proleptic Gregorian calendar. Defined for every valid date.
     *
     * @param date the date to convert.
     * @return the same day in the Gregorian calendar.
     */
    public GregorianDate toGregorianFields(final IcDate date)
    {
        return ProlepticGregorian.fromEpochDay(toEpochDay(date));
    }

    /**
     * Convert a date to the proleptic Gregorian calendar as a {@link LocalDate}.
     *
     * @param date the date to convert.
     * @return the same day in the Gregorian calendar.
     * @throws java.time.DateTimeException if the result is outside of the range of {@link LocalDate}, use
     * {@link #toGregorianFields(IcDate)} for dates that far from the epoch.
     */
    public LocalDate toGregorian(final IcDate date)
    {
        return toGregorianFields(date).toLocalDate();
    }

    /**
     * Convert a date of the proleptic Gregorian calendar.
     *
     * @param date the Gregorian date to convert.
     * @return the same day in the Iranian Calendar.
     */
    public IcDate fromGregorian(final LocalDate date)
    {
        return fromEpochDay(ProlepticGregorian.toEpochDay(date), date.getYear());
    }

    /**
     * Convert a date of the proleptic Gregorian calendar, the inverse of {@link #toGregorianFields(IcDate)}.
     *
     * @param date the Gregorian date to convert.
     * @return the same day in the Iranian Calendar.
     * @throws ArithmeticException if the year of the result doesn't fit in an <code>int</code>.
     */
    public IcDate fromGregorianFields(final GregorianDate date)
    {
        return fromEpochDay(date.toEpochDay(), date.year());
    }

    /**
     * The Gregorian date of the first day of a year.
     *
     * @param year the year, non-zero.
     * @return the Gregorian date of Nowruz of that year.
     * @throws InvalidDateException if year is zero.
     * @throws java.time.DateTimeException if the result is outside of the range of {@link LocalDate}.
     */
    public LocalDate nowruz(final int year)
    {
        return nowruzFields(year).toLocalDate();
    }

    public GregorianDate nowruzFields(final int year)
    {
        return toGregorianFields(IcDate.of(year, 1, 1));
    }

    /**
     * Number of days from one date to another.
     *
     * @param from the start date.
     * @param to the end date.
     * @return the number of days, negative if to is before from.
     */
    public long daysBetween(final IcDate from, final IcDate to)
    {
        return toEpochDay(to) - toEpochDay(from);
    }

    /**
     * Number of complete years from one date to another. A year is complete once the anniversary of the start
     * date's month and day has been reached.
     *
     * @param from the start date.
     * @param to the end date.
     * @return the number of complete years, negative if to is before from.
     */
    public long yearsBetween(final IcDate from, final IcDate to)
    {
        long years = yearIndex(to.year()) - yearIndex(from.year());
        final int anniversary = Integer.compare(monthDayKey(to), monthDayKey(from));
        if (years > 0 && anniversary < 0)
        {
            years--;
        }
        else if (years < 0 && anniversary > 0)
        {
            years++;
        }

        return years;
    }

    long toEpochDay(final IcDate date)
    {
        return epochDayOfYearOne + daysFromYearOne(date.year()) + OrdinalMapper.toOrdinal(date) - 1;
    }

    IcDate fromEpochDay(final long epochDay, final long gregorianYear)
    {
        // candidate from the fixed offset, assumes the day is on or after that year's Nowruz
        long year = fromGregorianYear(gregorianYear);
        long yearStart = startOfYear(year);

        // the cycle's mean year drifts from the Gregorian one by about a day every 3300 years
        final long driftInYears = Math.floorDiv((epochDay - yearStart) * LeapRule.CYCLE_LENGTH, LeapRule.DAYS_IN_CYCLE);
        if (driftInYears != 0)
        {
            year = plusYears(year, driftInYears);
            yearStart = startOfYear(year);
        }

        while (epochDay < yearStart)
        {
            year = plusYears(year, -1);
            yearStart = startOfYear(year);
        }

        while (epochDay >= yearStart + lengthOfYear(year))
        {
            yearStart += lengthOfYear(year);
            year = plusYears(year, 1);
        }

        return OrdinalMapper.fromOrdinal(Math.toIntExact(year), (int)(epochDay - yearStart) + 1);
    }

    private long startOfYear(final long year)
    {
        return epochDayOfYearOne + daysFromYearOne(year);
    }

    long toGregorianYear(final long year)
    {
        // Gregorian years are astronomical, so year -1 of this calendar lines up with Gregorian -gregorianOffset
        return year > 0 ? year - gregorianOffset : year - gregorianOffset + 1;
    }

    long fromGregorianYear(final long gregorianYear)
    {
        final long year = gregorianYear + gregorianOffset;
        return year > 0 ? year : year - 1;
    }

    /**
     * Number of days from 1/1 of year 1 to 1/1 of the given year, negative for years before the epoch.
     *
     * @param year a non-zero year.
     * @return the signed number of days.
     */
    static long daysFromYearOne(final long year)
    {
        final long wholeYears = year > 0 ? year - 1 : year;
        return MonthTable.DAYS_IN_COMMON_YEAR * wholeYears + LeapRule.leapYearsBefore(year - 1);
    }

    private static int lengthOfYear(final long year)
    {
        return LeapRule.isLeap(year) ? MonthTable.DAYS_IN_LEAP_YEAR : MonthTable.DAYS_IN_COMMON_YEAR;
    }

    // continuous numbering that closes the gap at year 0
    private static long yearIndex(final long year)
    {
        return year > 0 ? year : year + 1;
    }

    private static long plusYears(final long year, final long years)
    {
        final long index = yearIndex(year) + years;
        return index > 0 ? index : index - 1;
    }

    private static int monthDayKey(final IcDate date)
    {
        return date.month() * 100 + date.day();
    }
}
