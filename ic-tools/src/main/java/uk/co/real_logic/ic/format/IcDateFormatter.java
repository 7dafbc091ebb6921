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
package uk.co.real_logic.ic.format;

import uk.co.real_logic.ic.calendar.CalendarConfiguration;
import uk.co.real_logic.ic.calendar.IcDate;
import uk.co.real_logic.ic.calendar.InvalidMonthException;
import uk.co.real_logic.ic.calendar.MonthTable;
import uk.co.real_logic.ic.calendar.OffsetConverter;

import java.util.Locale;

/**
 * Formats dates for display. Thread safe.
 */
public final class IcDateFormatter
{
    private static final String[] PERSIAN_MONTH_NAMES =
    {
        "فروردین",
        "اردیبهشت",
        "خرداد",
        "تیر",
        "مرداد",
        "شهریور",
        "مهر",
        "آبان",
        "آذر",
        "دی",
        "بهمن",
        "اسفند",
    };

    private static final String[] LATIN_MONTH_NAMES =
    {
        "Farvardin",
        "Ordibehesht",
        "Khordad",
        "Tir",
        "Mordad",
        "Shahrivar",
        "Mehr",
        "Aban",
        "Azar",
        "Dey",
        "Bahman",
        "Esfand",
    };

    private static final String SOLAR_HIJRI_SUFFIX = "SH";

    private final String calendarCode;
    private final OffsetConverter offsetConverter;

    public IcDateFormatter()
    {
        this(new CalendarConfiguration());
    }

    public IcDateFormatter(final CalendarConfiguration configuration)
    {
        offsetConverter = new OffsetConverter(configuration);
        calendarCode = configuration.calendarCode();
    }

    public static String persianMonthName(final int month)
    {
        return PERSIAN_MONTH_NAMES[monthIndex(month)];
    }

    public static String latinMonthName(final int month)
    {
        return LATIN_MONTH_NAMES[monthIndex(month)];
    }

    public String calendarCode()
    {
        return calendarCode;
    }

    /**
     * Format in the {@link DateStyle#PERSIAN} style.
     *
     * @param date the date to format.
     * @return the formatted date.
     */
    public String format(final IcDate date)
    {
        return format(date, DateStyle.PERSIAN);
    }

    public String format(final IcDate date, final String styleName)
    {
        return format(date, DateStyle.fromName(styleName));
    }

    public String format(final IcDate date, final DateStyle style)
    {
        return appendTo(new StringBuilder(), date, style).toString();
    }

    public StringBuilder appendTo(final StringBuilder builder, final IcDate date, final DateStyle style)
    {
        switch (style)
        {
            case PERSIAN:
                return appendNamed(builder, date, persianMonthName(date.month()));

            case LATIN:
                return appendNamed(builder, date, latinMonthName(date.month()));

            case NUMERIC:
                return appendPadded(builder, date, '-');

            case COMPACT:
                return appendPadded(builder, date, '/');

            case FULL:
                appendNamed(builder, date, persianMonthName(date.month()));
                return builder
                    .append(" (")
                    .append(offsetConverter.toSolarHijriYear(date.year()))
                    .append(' ')
                    .append(SOLAR_HIJRI_SUFFIX)
                    .append(')');

            default:
                throw new IllegalArgumentException("Unknown format: " + style);
        }
    }

    private StringBuilder appendNamed(final StringBuilder builder, final IcDate date, final String monthName)
    {
        return builder
            .append(date.day())
            .append(' ')
            .append(monthName)
            .append(' ')
            .append(date.year())
            .append(' ')
            .append(calendarCode);
    }

    private static StringBuilder appendPadded(final StringBuilder builder, final IcDate date, final char separator)
    {
        return builder
            .append(String.format(Locale.ROOT, "%04d", date.year()))
            .append(separator)
            .append(String.format(Locale.ROOT, "%02d", date.month()))
            .append(separator)
            .append(String.format(Locale.ROOT, "%02d", date.day()));
    }

    private static int monthIndex(final int month)
    {
        if (!MonthTable.isValidMonth(month))
        {
            throw new InvalidMonthException(month);
        }

        return month - 1;
    }
}
