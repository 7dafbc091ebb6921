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

import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.SystemEpochClock;
import uk.co.real_logic.ic.DebugLogger;
import uk.co.real_logic.ic.LogTag;
import uk.co.real_logic.ic.calendar.CalendarConfiguration;
import uk.co.real_logic.ic.calendar.CycleInfo;
import uk.co.real_logic.ic.calendar.EpochConverter;
import uk.co.real_logic.ic.calendar.GregorianDate;
import uk.co.real_logic.ic.calendar.IcDate;
import uk.co.real_logic.ic.calendar.LeapRule;
import uk.co.real_logic.ic.calendar.MonthTable;
import uk.co.real_logic.ic.calendar.ProlepticGregorian;
import uk.co.real_logic.ic.calendar.YearMonthDay;
import uk.co.real_logic.ic.fields.NumericDateDecoder;
import uk.co.real_logic.ic.format.DateStyle;
import uk.co.real_logic.ic.format.IcDateFormatter;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Arrays;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Command line front end. Run without arguments to print today's date.
 * <p>
 * Errors are reported on the error stream with a non-zero exit status rather than thrown.
 */
public final class IcCalendarTool
{
    public static final String VERSION = "Iranian Calendar v1.0.0";

    public static final int SUCCESS = 0;
    public static final int FAILURE = 1;

    /**
     * Years from this one upwards are read as dates of the calendar by the convert command, earlier years as
     * Gregorian dates.
     */
    public static final int MIN_CONVERTED_IC_YEAR = 3000;

    private static final long MILLIS_IN_DAY = TimeUnit.DAYS.toMillis(1);
    private static final DateTimeFormatter GREGORIAN_FORMAT =
        DateTimeFormatter.ofPattern("dd MMMM uuuu", Locale.ENGLISH);

    private final EpochClock clock;
    private final PrintStream out;
    private final PrintStream err;
    private final CalendarConfiguration configuration;
    private final EpochConverter epochConverter;
    private final IcDateFormatter formatter;
    private final ReferenceTableGenerator tableGenerator;
    private final NumericDateDecoder dateDecoder = new NumericDateDecoder();

    public static void main(final String[] args)
    {
        final IcCalendarTool tool = new IcCalendarTool(
            new SystemEpochClock(), System.out, System.err, new CalendarConfiguration());

        final int status = tool.run(args);
        if (status != SUCCESS)
        {
            System.exit(status);
        }
    }

    public IcCalendarTool(
        final EpochClock clock,
        final PrintStream out,
        final PrintStream err,
        final CalendarConfiguration configuration)
    {
        this.clock = clock;
        this.out = out;
        this.err = err;
        this.configuration = configuration;
        this.epochConverter = new EpochConverter(configuration);
        this.formatter = new IcDateFormatter(configuration);
        this.tableGenerator = new ReferenceTableGenerator(configuration);
    }

    /**
     * Run a single command.
     *
     * @param args the command followed by its arguments, today if empty.
     * @return the exit status, {@link #SUCCESS} or {@link #FAILURE}.
     */
    public int run(final String... args)
    {
        final String command = args.length == 0 ? "today" : args[0];
        final String[] commandArgs = args.length == 0 ? args : Arrays.copyOfRange(args, 1, args.length);

        DebugLogger.log(LogTag.TOOL, "Running command: ", command, ", args = ", Arrays.toString(commandArgs));

        try
        {
            switch (command)
            {
                case "today":
                    return today();

                case "convert":
                    return hasArguments(commandArgs, 1, "convert YYYY-MM-DD") ? convert(commandArgs[0]) : FAILURE;

                case "leap":
                    return hasArguments(commandArgs, 1, "leap YEAR") ? leap(commandArgs[0]) : FAILURE;

                case "nowruz":
                    return hasArguments(commandArgs, 1, "nowruz YEAR") ? nowruz(commandArgs[0]) : FAILURE;

                case "info":
                    return info();

                case "table":
                    return hasArguments(commandArgs, 3, "table START_YEAR END_YEAR FILE") ?
                        table(commandArgs[0], commandArgs[1], commandArgs[2]) : FAILURE;

                case "--version":
                    out.println(VERSION);
                    return SUCCESS;

                case "help":
                case "-h":
                case "--help":
                    printUsage(out);
                    return SUCCESS;

                default:
                    err.println("Error: Unknown command '" + command + "'");
                    printUsage(err);
                    return FAILURE;
            }
        }
        catch (final IllegalArgumentException | DateTimeException | ArithmeticException e)
        {
            err.println("Error: " + e.getMessage());
            return FAILURE;
        }
        catch (final IOException e)
        {
            err.println("Error writing table: " + e.getMessage());
            return FAILURE;
        }
    }

    private int today()
    {
        final LocalDate gregorian = LocalDate.ofEpochDay(Math.floorDiv(clock.time(), MILLIS_IN_DAY));
        final IcDate today = epochConverter.fromGregorian(gregorian);

        out.println();
        out.println("Today's Date:");
        out.println("  IC:        " + formatter.format(today, DateStyle.PERSIAN));
        out.println("  Latin:     " + formatter.format(today, DateStyle.LATIN));
        out.println("  Numeric:   " + formatter.format(today, DateStyle.NUMERIC));
        out.println("  Gregorian: " + GREGORIAN_FORMAT.format(gregorian));
        out.println("  Full:      " + formatter.format(today, DateStyle.FULL));
        out.println();

        return SUCCESS;
    }

    private int convert(final String text)
    {
        final YearMonthDay fields = dateDecoder.decodeFields(text.getBytes(US_ASCII));

        if (fields.year() >= MIN_CONVERTED_IC_YEAR)
        {
            final IcDate date = IcDate.of(fields.year(), fields.month(), fields.day());
            final GregorianDate gregorian = epochConverter.toGregorianFields(date);
            DebugLogger.log(LogTag.CONVERSION, "Converted ", date, " to ", gregorian);

            out.println();
            out.println("IC -> Gregorian Conversion:");
            out.println("  IC:        " + formatter.format(date, DateStyle.PERSIAN));
            out.println("  Gregorian: " + formatGregorian(gregorian));
            out.println("  Numeric:   " + gregorian);
        }
        else
        {
            if (!ProlepticGregorian.isValid(fields.year(), fields.month(), fields.day()))
            {
                throw new IllegalArgumentException("Invalid Gregorian date: " + text);
            }

            final LocalDate gregorian = LocalDate.of(fields.year(), fields.month(), fields.day());
            final IcDate date = epochConverter.fromGregorian(gregorian);
            DebugLogger.log(LogTag.CONVERSION, "Converted ", gregorian, " to ", date);

            out.println();
            out.println("Gregorian -> IC Conversion:");
            out.println("  Gregorian: " + GREGORIAN_FORMAT.format(gregorian));
            out.println("  IC:        " + formatter.format(date, DateStyle.PERSIAN));
            out.println("  Numeric:   " + formatter.format(date, DateStyle.NUMERIC));
        }
        out.println();

        return SUCCESS;
    }

    private int leap(final String yearText)
    {
        final int year = parseYear(yearText);
        final CycleInfo info = LeapRule.cycleInfo(year);

        out.println();
        out.println("Leap Year Information for " + year + " " + configuration.calendarCode() + ":");
        out.println("  Is leap year:       " + (info.isLeap() ? "Yes" : "No"));
        out.println("  Days in year:       " + info.daysInYear());
        out.println("  33-year cycle:      #" + info.cycleNumber());
        out.println("  Position in cycle:  " + info.cyclePosition() + "/" + info.cycleLength());
        if (!info.isLeap())
        {
            out.println("  Next leap year in:  " + info.yearsToNextLeap() + " years");
        }
        out.println();

        return SUCCESS;
    }

    private int nowruz(final String yearText)
    {
        final int year = parseYear(yearText);
        final IcDate nowruz = IcDate.of(year, 1, 1);
        final GregorianDate gregorian = epochConverter.toGregorianFields(nowruz);

        out.println();
        out.println("Nowruz " + year + " " + configuration.calendarCode() + ":");
        out.println("  IC:          " + formatter.format(nowruz, DateStyle.PERSIAN));
        out.println("  Gregorian:   " + formatGregorian(gregorian));
        out.println("  Day of week: " + gregorian.dayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
        if (year != epochConverter.anchorYear())
        {
            out.println("  Note:        " + anchorNote());
        }
        out.println();

        return SUCCESS;
    }

    private int info()
    {
        final String code = configuration.calendarCode();
        final String title = configuration.calendarName() + " (" + code + ") Information";
        final int anchorYear = epochConverter.anchorYear();
        final IcDate anchorNowruz = IcDate.of(anchorYear, 1, 1);

        out.println();
        out.println(title);
        out.println(repeat('=', title.length()));
        out.println();
        out.println("Epoch:     1 " + IcDateFormatter.latinMonthName(1) + " 1 " + code + " = " +
            configuration.epochBce() + " BCE (proleptic Gregorian)");
        out.println("Structure: Identical to the Solar Hijri (Persian) calendar");
        out.println("Months:    " + MonthTable.MONTHS_IN_YEAR + " months (6x31, 5x30, 1x29/30 days)");
        out.println("Year:      " + MonthTable.DAYS_IN_COMMON_YEAR + " days (common), " +
            MonthTable.DAYS_IN_LEAP_YEAR + " days (leap)");
        out.println("Leap rule: " + LeapRule.CYCLE_LENGTH + "-year cycle (" + LeapRule.LEAP_YEARS_PER_CYCLE +
            " leap years per cycle, positions " + Arrays.toString(LeapRule.leapPositions()) + ")");
        out.println();
        out.println("Conversions:");
        out.println("  " + code + " = Gregorian + " + configuration.gregorianOffset());
        out.println("  " + code + " = Solar Hijri + " + configuration.solarHijriOffset());
        out.println();
        out.println("Anchor:    " + formatter.format(anchorNowruz, DateStyle.LATIN) + " = " +
            formatGregorian(epochConverter.toGregorianFields(anchorNowruz)));
        out.println("           " + anchorNote());
        out.println();

        return SUCCESS;
    }

    private int table(final String startText, final String endText, final String fileName) throws IOException
    {
        final int startYear = Integer.parseInt(startText);
        final int endYear = Integer.parseInt(endText);

        tableGenerator.checkYearRange(startYear, endYear);

        final int rows;
        try (Writer writer = Files.newBufferedWriter(Paths.get(fileName), UTF_8))
        {
            rows = tableGenerator.writeYearTable(startYear, endYear, writer);
        }

        out.println("Wrote " + rows + " years to " + fileName);

        return SUCCESS;
    }

    private String anchorNote()
    {
        return "Only the Nowruz of " + epochConverter.anchorYear() + " " + configuration.calendarCode() +
            " is pinned to " + configuration.nowruzDay() + " " +
            configuration.nowruzMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH) +
            ", other years follow the " + LeapRule.CYCLE_LENGTH + "-year cycle and may fall a day either side." +
            " Set -D" + CalendarConfiguration.ANCHOR_YEAR_PROPERTY + " to pin another year.";
    }

    private static String formatGregorian(final GregorianDate date)
    {
        if (date.isSupportedByLocalDate())
        {
            return GREGORIAN_FORMAT.format(date.toLocalDate());
        }

        final String monthName = Month.of(date.month()).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        return String.format(Locale.ROOT, "%02d %s %+d", date.day(), monthName, date.year());
    }

    private boolean hasArguments(final String[] commandArgs, final int required, final String usage)
    {
        if (commandArgs.length < required)
        {
            err.println("Usage: IcCalendarTool " + usage);
            return false;
        }

        return true;
    }

    private static int parseYear(final String yearText)
    {
        final int year;
        try
        {
            year = Integer.parseInt(yearText.trim());
        }
        catch (final NumberFormatException e)
        {
            throw new IllegalArgumentException("Invalid year '" + yearText + "'", e);
        }

        if (year == 0)
        {
            throw new IllegalArgumentException("Invalid year '" + yearText + "', there is no year 0");
        }

        return year;
    }

    private static String repeat(final char c, final int times)
    {
        final char[] chars = new char[times];
        Arrays.fill(chars, c);
        return new String(chars);
    }

    private static void printUsage(final PrintStream stream)
    {
        stream.println("Usage: IcCalendarTool [command] [args]");
        stream.println("  today                         Show today's date (default)");
        stream.println("  convert YYYY-MM-DD            Convert a date, years from " + MIN_CONVERTED_IC_YEAR +
            " are read as IC, earlier ones as Gregorian");
        stream.println("  leap YEAR                     Show leap year and cycle information");
        stream.println("  nowruz YEAR                   Show the Gregorian date of a year's Nowruz");
        stream.println("  info                          Show a summary of the calendar");
        stream.println("  table START_YEAR END_YEAR FILE Write a CSV reference table of years");
        stream.println("  --version                     Show the version");
    }
}
