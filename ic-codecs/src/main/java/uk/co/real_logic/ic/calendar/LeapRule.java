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

import org.agrona.collections.IntArrayList;

/**
 * The 33 year leap cycle of the Iranian Calendar.
 * <p>
 * A year is leap when its 1-based position within the cycle, <code>((year - 1) mod 33) + 1</code>, is one of
 * 1, 5, 9, 13, 17, 22, 26 or 30. This gives eight leap years per cycle and a mean year of 365.24219852 days.
 * The positions are data: they are not derivable from a formula.
 * <p>
 * Modulo and division are floored, so negative years sit in the cycle exactly like positive ones.
 */
public final class LeapRule
{
    public static final int CYCLE_LENGTH = 33;
    public static final int LEAP_YEARS_PER_CYCLE = 8;
    public static final int DAYS_IN_CYCLE = CYCLE_LENGTH * MonthTable.DAYS_IN_COMMON_YEAR + LEAP_YEARS_PER_CYCLE;
    public static final double AVERAGE_YEAR_LENGTH = 365.24219852;

    private static final int[] LEAP_POSITIONS = { 1, 5, 9, 13, 17, 22, 26, 30 };

    // index: cycle offset (position - 1), value: whether that offset is leap
    private static final boolean[] IS_LEAP_OFFSET = new boolean[CYCLE_LENGTH];

    // index: cycle offset r, value: number of leap offsets strictly below r
    private static final int[] LEAPS_BELOW_OFFSET = new int[CYCLE_LENGTH + 1];

    static
    {
        for (final int position : LEAP_POSITIONS)
        {
            IS_LEAP_OFFSET[position - 1] = true;
        }

        for (int offset = 0; offset < CYCLE_LENGTH; offset++)
        {
            LEAPS_BELOW_OFFSET[offset + 1] = LEAPS_BELOW_OFFSET[offset] + (IS_LEAP_OFFSET[offset] ? 1 : 0);
        }
    }

    private LeapRule()
    {
    }

    /**
     * Whether the year has a 30 day last month.
     *
     * @param year any year, positive or negative.
     * @return true if the year is a leap year under the 33 year cycle.
     */
    public static boolean isLeap(final long year)
    {
        return IS_LEAP_OFFSET[Math.floorMod(year - 1, CYCLE_LENGTH)];
    }

    /**
     * The position of the year within its 33 year cycle.
     *
     * @param year any year, positive or negative.
     * @return a position in the range 1-33.
     */
    public static int cyclePosition(final int year)
    {
        return (int)Math.floorMod(year - 1L, CYCLE_LENGTH) + 1;
    }

    /**
     * The 1-based number of the 33 year cycle containing the year. Year 1 starts cycle 1, year -1 is in cycle 0.
     *
     * @param year any year, positive or negative.
     * @return the cycle number.
     */
    public static long cycleNumber(final int year)
    {
        return Math.floorDiv(year - 1L, CYCLE_LENGTH) + 1;
    }

    public static int[] leapPositions()
    {
        return LEAP_POSITIONS.clone();
    }

    public static CycleInfo cycleInfo(final int year)
    {
        final int position = cyclePosition(year);
        final boolean leap = IS_LEAP_OFFSET[position - 1];

        int yearsToNextLeap = 0;
        if (!leap)
        {
            yearsToNextLeap = (CYCLE_LENGTH - position) + LEAP_POSITIONS[0];
            for (final int leapPosition : LEAP_POSITIONS)
            {
                if (leapPosition > position)
                {
                    yearsToNextLeap = leapPosition - position;
                    break;
                }
            }
        }

        return new CycleInfo(year, cycleNumber(year), position, leap, yearsToNextLeap);
    }

    /**
     * Finds the leap years within an inclusive range of years. The calendar has no year zero so it is never
     * reported, whatever its cycle position would be.
     *
     * @param startYear the first year to check, inclusive.
     * @param endYear the last year to check, inclusive.
     * @return the leap years in ascending order, empty if startYear is after endYear.
     */
    public static int[] leapYearsInRange(final int startYear, final int endYear)
    {
        final IntArrayList leapYears = new IntArrayList();
        for (long year = startYear; year <= endYear; year++)
        {
            if (year != 0 && isLeap(year))
            {
                leapYears.addInt((int)year);
            }
        }

        return leapYears.toIntArray();
    }

    /**
     * Signed count of leap cycle offsets in [0, elapsedYears), where year <code>y</code> has offset
     * <code>y - 1</code>. For negative arguments this is minus the count of leap offsets in [elapsedYears, 0).
     *
     * @param elapsedYears an offset from the start of year 1.
     * @return the signed number of leap years.
     */
    static long leapYearsBefore(final long elapsedYears)
    {
        final long cycles = Math.floorDiv(elapsedYears, CYCLE_LENGTH);
        final int remainder = (int)Math.floorMod(elapsedYears, CYCLE_LENGTH);

        return cycles * LEAP_YEARS_PER_CYCLE + LEAPS_BELOW_OFFSET[remainder];
    }
}
