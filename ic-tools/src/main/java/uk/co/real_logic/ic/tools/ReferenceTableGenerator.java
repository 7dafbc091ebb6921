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
package uk.co.real_logic.ic.tools;

import uk.co.real_logic.ic.DebugLogger;
import uk.co.real_logic.ic.LogTag;
import uk.co.real_logic.ic.calendar.CalendarConfiguration;
import uk.co.real_logic.ic.calendar.CycleInfo;
import uk.co.real_logic.ic.calendar.EpochConverter;
import uk.co.real_logic.ic.calendar.LeapRule;
import uk.co.real_logic.ic.calendar.OffsetConverter;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes CSV reference tables with one row per year, for checking the calendar against other sources.
 */
public final class ReferenceTableGenerator
{
    public static final String YEAR_TABLE_HEADER =
        "ic_year,leap,days,cycle,position,nowruz_gregorian,solar_hijri_year";

    private static final char SEPARATOR = ',';
    private static final char NEW_LINE = '\n';
    private static final int ROWS_PER_PROGRESS_LOG = 1000;

    private final EpochConverter epochConverter;
    private final OffsetConverter offsetConverter;

    public ReferenceTableGenerator()
    {
        this(new CalendarConfiguration());
    }

    public ReferenceTableGenerator(final CalendarConfiguration configuration)
    {
        this(new EpochConverter(configuration), new OffsetConverter(configuration));
    }

    public ReferenceTableGenerator(final EpochConverter epochConverter, final OffsetConverter offsetConverter)
    {
        this.epochConverter = epochConverter;
        this.offsetConverter = offsetConverter;
    }

    /**
     * Check that a table can be written for every year from startYear to endYear inclusive, without writing
     * anything.
     *
     * @param startYear the first year of the table.
     * @param endYear the last year of the table.
     * @throws IllegalArgumentException if endYear is before startYear, or if a year in the range has no Solar
     * Hijri counterpart.
     */
    public void checkYearRange(final int startYear, final int endYear)
    {
        if (endYear < startYear)
        {
            throw new IllegalArgumentException(
                "endYear " + endYear + " is before startYear " + startYear);
        }

        // the Solar Hijri year is monotonic so the ends of the range bound it
        checkSolarHijriYear(startYear);
        checkSolarHijriYear(endYear);
    }

    /**
     * Write the header and a row for each year from startYear to endYear inclusive. Year 0 doesn't exist and is
     * skipped. Nothing is written if the range is rejected.
     *
     * @param startYear the first year of the table.
     * @param endYear the last year of the table.
     * @param out where the table is written, not closed by this method.
     * @return the number of rows written, excluding the header.
     * @throws IOException if out can't be written to.
     * @throws IllegalArgumentException if the range is rejected by {@link #checkYearRange(int, int)}.
     */
    public int writeYearTable(final int startYear, final int endYear, final Writer out) throws IOException
    {
        checkYearRange(startYear, endYear);

        DebugLogger.log(LogTag.TABLE, "Writing year table from ", startYear, " to ", endYear);

        out.write(YEAR_TABLE_HEADER);
        out.write(NEW_LINE);

        final StringBuilder row = new StringBuilder();
        int rows = 0;
        for (long year = startYear; year <= endYear; year++)
        {
            if (year == 0)
            {
                continue;
            }

            row.setLength(0);
            appendYearRow(row, (int)year);
            out.append(row);
            rows++;

            if (rows % ROWS_PER_PROGRESS_LOG == 0)
            {
                DebugLogger.log(LogTag.TABLE, "Rows written: ", rows);
            }
        }

        out.flush();
        DebugLogger.log(LogTag.TABLE, "Completed year table, rows = ", rows);

        return rows;
    }

    private void appendYearRow(final StringBuilder row, final int year)
    {
        final CycleInfo info = LeapRule.cycleInfo(year);

        row.append(year).append(SEPARATOR)
            .append(info.isLeap()).append(SEPARATOR)
            .append(info.daysInYear()).append(SEPARATOR)
            .append(info.cycleNumber()).append(SEPARATOR)
            .append(info.cyclePosition()).append(SEPARATOR)
            .append(epochConverter.nowruzFields(year)).append(SEPARATOR)
            .append(offsetConverter.toSolarHijriYear(year))
            .append(NEW_LINE);
    }

    private void checkSolarHijriYear(final int year)
    {
        try
        {
            offsetConverter.toSolarHijriYear(year);
        }
        catch (final ArithmeticException ex)
        {
            throw new IllegalArgumentException("Year " + year + " has no Solar Hijri year", ex);
        }
    }
}
