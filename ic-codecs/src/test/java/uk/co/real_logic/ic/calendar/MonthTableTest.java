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

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class MonthTableTest
{
    @Test
    public void shouldHaveSixLongMonthsThenFiveThirtyDayMonths()
    {
        for (int month = 1; month <= 6; month++)
        {
            assertThat(MonthTable.daysInMonth(5026, month), is(31));
        }

        for (int month = 7; month <= 11; month++)
        {
            assertThat(MonthTable.daysInMonth(5026, month), is(30));
        }
    }

    @Test
    public void shouldLengthenLastMonthInLeapYears()
    {
        assertThat(MonthTable.daysInMonth(5025, 12), is(30));
        assertThat(MonthTable.daysInMonth(5026, 12), is(29));
    }

    @Test
    public void shouldSumMonthsToYearLength()
    {
        for (int year = -100; year <= 100; year++)
        {
            int total = 0;
            for (int month = 1; month <= 12; month++)
            {
                total += MonthTable.daysInMonth(year, month);
            }

            assertEquals("year " + year, MonthTable.daysInYear(year), total);
            assertEquals(LeapRule.isLeap(year) ? 366 : 365, total);
        }
    }

    @Test
    public void shouldAccumulateDaysBeforeMonth()
    {
        assertThat(MonthTable.daysBeforeMonth(1), is(0));
        assertThat(MonthTable.daysBeforeMonth(2), is(31));
        assertThat(MonthTable.daysBeforeMonth(7), is(186));
        assertThat(MonthTable.daysBeforeMonth(11), is(306));
        assertThat(MonthTable.daysBeforeMonth(12), is(336));
    }

    @Test(expected = InvalidMonthException.class)
    public void shouldRejectMonthZero()
    {
        MonthTable.daysInMonth(5025, 0);
    }

    @Test(expected = InvalidMonthException.class)
    public void shouldRejectDaysBeforeMonthThirteen()
    {
        MonthTable.daysBeforeMonth(13);
    }

    @Test
    public void shouldReportRejectedMonth()
    {
        try
        {
            MonthTable.daysInMonth(5025, 13);
            fail("Expected InvalidMonthException");
        }
        catch (final InvalidMonthException e)
        {
            assertThat(e.month(), is(13));
        }
    }
}
