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

public class OrdinalMapperTest
{
    @Test
    public void shouldMapFirstAndLastDays()
    {
        assertThat(OrdinalMapper.toOrdinal(IcDate.of(5025, 1, 1)), is(1));
        assertThat(OrdinalMapper.toOrdinal(IcDate.of(5025, 12, 30)), is(366));
        assertThat(OrdinalMapper.toOrdinal(IcDate.of(5026, 12, 29)), is(365));

        assertEquals(IcDate.of(5025, 1, 1), OrdinalMapper.fromOrdinal(5025, 1));
        assertEquals(IcDate.of(5025, 12, 30), OrdinalMapper.fromOrdinal(5025, 366));
        assertEquals(IcDate.of(5026, 12, 29), OrdinalMapper.fromOrdinal(5026, 365));
    }

    @Test
    public void shouldMapAcrossMonthBoundaries()
    {
        assertEquals(IcDate.of(5025, 6, 31), OrdinalMapper.fromOrdinal(5025, 186));
        assertEquals(IcDate.of(5025, 7, 1), OrdinalMapper.fromOrdinal(5025, 187));
        assertEquals(IcDate.of(5025, 11, 2), OrdinalMapper.fromOrdinal(5025, 308));
    }

    @Test
    public void shouldRoundTripEveryDayOfYear()
    {
        for (final int year : new int[]{ -33, -3, -1, 1, 5, 5025, 5026 })
        {
            final int daysInYear = MonthTable.daysInYear(year);
            for (int ordinal = 1; ordinal <= daysInYear; ordinal++)
            {
                final IcDate date = OrdinalMapper.fromOrdinal(year, ordinal);
                assertThat(date.year(), is(year));
                assertThat(OrdinalMapper.toOrdinal(date), is(ordinal));
            }
        }
    }

    @Test
    public void shouldRejectOrdinalAfterEndOfCommonYear()
    {
        try
        {
            OrdinalMapper.fromOrdinal(5026, 366);
            fail("Expected OrdinalOutOfRangeException");
        }
        catch (final OrdinalOutOfRangeException e)
        {
            assertThat(e.year(), is(5026));
            assertThat(e.ordinal(), is(366));
        }
    }

    @Test(expected = OrdinalOutOfRangeException.class)
    public void shouldRejectOrdinalZero()
    {
        OrdinalMapper.fromOrdinal(5025, 0);
    }

    @Test(expected = OrdinalOutOfRangeException.class)
    public void shouldRejectOrdinalAfterEndOfLeapYear()
    {
        OrdinalMapper.fromOrdinal(5025, 367);
    }

    @Test(expected = InvalidDateException.class)
    public void shouldRejectYearZero()
    {
        OrdinalMapper.fromOrdinal(0, 1);
    }
}
