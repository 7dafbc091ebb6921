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
import org.junit.experimental.theories.DataPoints;
import org.junit.experimental.theories.FromDataPoints;
import org.junit.experimental.theories.Theories;
import org.junit.experimental.theories.Theory;
import org.junit.runner.RunWith;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@RunWith(Theories.class)
public class IcDateTest
{
    @DataPoints("validDates")
    public static Iterable<int[]> validDates()
    {
        return Arrays.asList(
            new int[]{ 1, 1, 1 },
            new int[]{ -1, 12, 29 },
            new int[]{ -3, 12, 30 },
            new int[]{ 5025, 11, 2 },
            new int[]{ 5025, 12, 30 },
            new int[]{ 5026, 6, 31 },
            new int[]{ 5026, 12, 29 },
            new int[]{ Integer.MAX_VALUE, 1, 1 },
            new int[]{ Integer.MIN_VALUE, 12, 29 }
        );
    }

    @DataPoints("invalidDates")
    public static Iterable<int[]> invalidDates()
    {
        return Arrays.asList(
            new int[]{ 0, 1, 1 },
            new int[]{ 5025, 0, 1 },
            new int[]{ 5025, 13, 1 },
            new int[]{ 5025, 1, 0 },
            new int[]{ 5025, 1, 32 },
            new int[]{ 5025, 7, 31 },
            new int[]{ 5026, 12, 30 },
            new int[]{ -1, 12, 30 },
            new int[]{ 5025, -1, -1 }
        );
    }

    @Theory
    public void shouldCreateValidDates(@FromDataPoints("validDates") final int[] fields)
    {
        final IcDate date = IcDate.of(fields[0], fields[1], fields[2]);

        assertTrue(IcDate.isValid(fields[0], fields[1], fields[2]));
        assertEquals(new YearMonthDay(fields[0], fields[1], fields[2]), date.asTuple());
    }

    @Theory
    public void shouldRejectInvalidDates(@FromDataPoints("invalidDates") final int[] fields)
    {
        assertFalse(IcDate.isValid(fields[0], fields[1], fields[2]));

        try
        {
            IcDate.of(fields[0], fields[1], fields[2]);
            fail("Expected InvalidDateException for " + Arrays.toString(fields));
        }
        catch (final InvalidDateException e)
        {
            assertThat(e.year(), is(fields[0]));
            assertThat(e.month(), is(fields[1]));
            assertThat(e.day(), is(fields[2]));
        }
    }

    @Test
    public void shouldAllowLastDayOfLeapYearOnlyInLeapYears()
    {
        for (int year = -200; year <= 200; year++)
        {
            if (year != 0)
            {
                assertEquals("year " + year, LeapRule.isLeap(year), IcDate.isValid(year, 12, 30));
            }
        }
    }

    @Test
    public void shouldExplainMissingYearZero()
    {
        try
        {
            IcDate.of(0, 1, 1);
            fail("Expected InvalidDateException");
        }
        catch (final InvalidDateException e)
        {
            assertThat(e.getMessage(), containsString("no year 0"));
        }
    }

    @Test
    public void shouldOrderLexicographically()
    {
        final IcDate earlier = IcDate.of(5025, 11, 2);
        final IcDate later = IcDate.of(5026, 1, 1);

        assertThat(earlier.compareTo(later), lessThan(0));
        assertThat(later.compareTo(earlier), greaterThan(0));
        assertTrue(earlier.isBefore(later));
        assertTrue(later.isAfter(earlier));
        assertFalse(earlier.isAfter(earlier));
    }

    @Test
    public void shouldSortDates()
    {
        final List<IcDate> dates = new ArrayList<>(Arrays.asList(
            IcDate.of(5026, 1, 1),
            IcDate.of(-1, 12, 29),
            IcDate.of(5025, 11, 2),
            IcDate.of(5025, 1, 31),
            IcDate.of(1, 1, 1)));

        Collections.sort(dates);

        assertThat(dates, contains(
            IcDate.of(-1, 12, 29),
            IcDate.of(1, 1, 1),
            IcDate.of(5025, 1, 31),
            IcDate.of(5025, 11, 2),
            IcDate.of(5026, 1, 1)));
    }

    @Test
    public void shouldHaveStructuralEquality()
    {
        final IcDate date = IcDate.of(5025, 11, 2);

        assertEquals(date, IcDate.of(5025, 11, 2));
        assertEquals(date.hashCode(), IcDate.of(5025, 11, 2).hashCode());
        assertNotEquals(date, IcDate.of(5025, 11, 3));
        assertThat(date.compareTo(IcDate.of(5025, 11, 2)), is(0));
    }

    @Test
    public void shouldProvideConveniences()
    {
        final IcDate date = IcDate.of(5025, 12, 1);

        assertTrue(date.isLeapYear());
        assertThat(date.lengthOfMonth(), is(30));
        assertThat(date.lengthOfYear(), is(366));
        assertThat(date.dayOfYear(), is(337));
        assertThat(IcDate.of(5026, 12, 1).lengthOfMonth(), is(29));
    }

    @Test
    public void shouldToStringFields()
    {
        assertThat(IcDate.of(5025, 11, 2), hasToString("IcDate(5025, 11, 2)"));
        assertThat(IcDate.of(5025, 11, 2).asTuple(), hasToString("(5025, 11, 2)"));
    }
}
