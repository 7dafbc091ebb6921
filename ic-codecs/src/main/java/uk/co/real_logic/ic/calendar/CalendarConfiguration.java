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

import java.time.Month;

/**
 * Configuration for the calendar's converters and tools.
 * <p>
 * Setters return <code>this</code> so they can be chained. A configuration is concluded when it is handed to a
 * converter, after which it is immutable and any setter throws an {@link IllegalStateException}. Converters copy
 * the values they need at construction.
 */
public final class CalendarConfiguration
{
    /**
     * Two letter code used as the suffix of formatted dates, eg "1 Bahman 5025 IC".
     */
    public static final String CALENDAR_CODE_PROPERTY = "ic.calendar.code";

    public static final String CALENDAR_NAME_PROPERTY = "ic.calendar.name";

    /**
     * Integer property for the year whose Nowruz is pinned to {@link #DEFAULT_NOWRUZ_MONTH} /
     * {@link #DEFAULT_NOWRUZ_DAY}. Every other year's Nowruz follows from the 33 year cycle.
     */
    public static final String ANCHOR_YEAR_PROPERTY = "ic.calendar.anchor_year";

    public static final String DEFAULT_CALENDAR_CODE = "IC";
    public static final String DEFAULT_CALENDAR_NAME = "Iranian Calendar";

    public static final int DEFAULT_EPOCH_BCE = 3000;
    public static final int DEFAULT_GREGORIAN_OFFSET = 3000;
    public static final int DEFAULT_SOLAR_HIJRI_OFFSET = 3621;
    public static final Month DEFAULT_NOWRUZ_MONTH = Month.MARCH;
    public static final int DEFAULT_NOWRUZ_DAY = 21;
    public static final int DEFAULT_ANCHOR_YEAR = 5025;

    private String calendarCode = System.getProperty(CALENDAR_CODE_PROPERTY, DEFAULT_CALENDAR_CODE);
    private String calendarName = System.getProperty(CALENDAR_NAME_PROPERTY, DEFAULT_CALENDAR_NAME);
    private int anchorYear = Integer.getInteger(ANCHOR_YEAR_PROPERTY, DEFAULT_ANCHOR_YEAR);
    private int epochBce = DEFAULT_EPOCH_BCE;
    private int gregorianOffset = DEFAULT_GREGORIAN_OFFSET;
    private int solarHijriOffset = DEFAULT_SOLAR_HIJRI_OFFSET;
    private Month nowruzMonth = DEFAULT_NOWRUZ_MONTH;
    private int nowruzDay = DEFAULT_NOWRUZ_DAY;

    private boolean concluded = false;

    public CalendarConfiguration calendarCode(final String calendarCode)
    {
        checkNotConcluded();
        this.calendarCode = calendarCode;
        return this;
    }

    public CalendarConfiguration calendarName(final String calendarName)
    {
        checkNotConcluded();
        this.calendarName = calendarName;
        return this;
    }

    /**
     * Sets the year whose Nowruz falls on the configured Gregorian month and day. Optional, defaults to
     * {@link #DEFAULT_ANCHOR_YEAR} or the value of {@link #ANCHOR_YEAR_PROPERTY}.
     *
     * @param anchorYear a non-zero year of the calendar.
     * @return this
     */
    public CalendarConfiguration anchorYear(final int anchorYear)
    {
        checkNotConcluded();
        this.anchorYear = anchorYear;
        return this;
    }

    public CalendarConfiguration epochBce(final int epochBce)
    {
        checkNotConcluded();
        this.epochBce = epochBce;
        return this;
    }

    /**
     * Sets the number of years added to a Gregorian year to get the calendar year starting at its Nowruz.
     *
     * @param gregorianOffset the offset in years.
     * @return this
     */
    public CalendarConfiguration gregorianOffset(final int gregorianOffset)
    {
        checkNotConcluded();
        this.gregorianOffset = gregorianOffset;
        return this;
    }

    public CalendarConfiguration solarHijriOffset(final int solarHijriOffset)
    {
        checkNotConcluded();
        this.solarHijriOffset = solarHijriOffset;
        return this;
    }

    /**
     * Sets the Gregorian month and day of the anchor year's Nowruz. This is a fixed approximation of the spring
     * equinox rather than an astronomical calculation.
     *
     * @param nowruzMonth the Gregorian month.
     * @param nowruzDay the Gregorian day of month.
     * @return this
     */
    public CalendarConfiguration nowruz(final Month nowruzMonth, final int nowruzDay)
    {
        checkNotConcluded();
        this.nowruzMonth = nowruzMonth;
        this.nowruzDay = nowruzDay;
        return this;
    }

    public String calendarCode()
    {
        return calendarCode;
    }

    public String calendarName()
    {
        return calendarName;
    }

    public int anchorYear()
    {
        return anchorYear;
    }

    public int epochBce()
    {
        return epochBce;
    }

    public int gregorianOffset()
    {
        return gregorianOffset;
    }

    public int solarHijriOffset()
    {
        return solarHijriOffset;
    }

    public Month nowruzMonth()
    {
        return nowruzMonth;
    }

    public int nowruzDay()
    {
        return nowruzDay;
    }

    public boolean isConcluded()
    {
        return concluded;
    }

    /**
     * Validate the configuration and make it immutable. Safe to call more than once.
     *
     * @return this
     * @throws IllegalArgumentException if a value is invalid.
     */
    public CalendarConfiguration conclude()
    {
        if (concluded)
        {
            return this;
        }

        if (calendarCode == null || calendarCode.isEmpty())
        {
            throw new IllegalArgumentException("calendarCode must be set");
        }

        if (calendarName == null || calendarName.isEmpty())
        {
            throw new IllegalArgumentException("calendarName must be set");
        }

        if (anchorYear == 0)
        {
            throw new IllegalArgumentException("anchorYear must not be 0, there is no year 0");
        }

        if (nowruzMonth == null)
        {
            throw new IllegalArgumentException("nowruzMonth must be set");
        }

        // Feb 29 can't be used as it doesn't exist in most years
        if (nowruzDay < 1 || nowruzDay > nowruzMonth.minLength())
        {
            throw new IllegalArgumentException(
                "nowruzDay " + nowruzDay + " is not a day of " + nowruzMonth + " in every year");
        }

        concluded = true;
        return this;
    }

    private void checkNotConcluded()
    {
        if (concluded)
        {
            throw new IllegalStateException("Configuration has been concluded and can no longer be modified");
        }
    }

    public String toString()
    {
        return "CalendarConfiguration{" +
            "calendarCode='" + calendarCode + '\'' +
            ", calendarName='" + calendarName + '\'' +
            ", anchorYear=" + anchorYear +
            ", epochBce=" + epochBce +
            ", gregorianOffset=" + gregorianOffset +
            ", solarHijriOffset=" + solarHijriOffset +
            ", nowruzMonth=" + nowruzMonth +
            ", nowruzDay=" + nowruzDay +
            '}';
    }
}
