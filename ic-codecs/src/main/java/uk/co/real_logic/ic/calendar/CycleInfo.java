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
 * Position of a year within the 33 year leap cycle, see {@link LeapRule#cycleInfo(int)}.
 */
public final class CycleInfo
{
    private final int year;
    private final long cycleNumber;
    private final int cyclePosition;
    private final boolean leap;
    private final int yearsToNextLeap;

    CycleInfo(
        final int year,
        final long cycleNumber,
        final int cyclePosition,
        final boolean leap,
        final int yearsToNextLeap)
    {
        this.year = year;
        this.cycleNumber = cycleNumber;
        this.cyclePosition = cyclePosition;
        this.leap = leap;
        this.yearsToNextLeap = yearsToNextLeap;
    }

    public int year()
    {
        return year;
    }

    public long cycleNumber()
    {
        return cycleNumber;
    }

    /**
     * The position within the cycle.
     *
     * @return a value in the range 1-33.
     */
    public int cyclePosition()
    {
        return cyclePosition;
    }

    public boolean isLeap()
    {
        return leap;
    }

    /**
     * Number of years until the next leap year, 0 if this year is itself leap.
     *
     * @return the number of years until the next leap year.
     */
    public int yearsToNextLeap()
    {
        return yearsToNextLeap;
    }

    public int cycleLength()
    {
        return LeapRule.CYCLE_LENGTH;
    }

    public int daysInYear()
    {
        return leap ? MonthTable.DAYS_IN_LEAP_YEAR : MonthTable.DAYS_IN_COMMON_YEAR;
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

        final CycleInfo that = (CycleInfo)o;

        return year == that.year &&
            cycleNumber == that.cycleNumber &&
            cyclePosition == that.cyclePosition &&
            leap == that.leap &&
            yearsToNextLeap == that.yearsToNextLeap;
    }

    public int hashCode()
    {
        int result = year;
        result = 31 * result + Long.hashCode(cycleNumber);
        result = 31 * result + cyclePosition;
        result = 31 * result + (leap ? 1 : 0);
        result = 31 * result + yearsToNextLeap;
        return result;
    }

    public String toString()
    {
        return "CycleInfo{" +
            "year=" + year +
            ", cycleNumber=" + cycleNumber +
            ", cyclePosition=" + cyclePosition +
            ", leap=" + leap +
            ", yearsToNextLeap=" + yearsToNextLeap +
            '}';
    }
}
