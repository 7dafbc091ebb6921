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

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class GregorianDateTest
{
    @Test
    public void shouldPrintLikeLocalDate()
    {
        assertThat(new GregorianDate(2026, 1, 22).toString(), is("2026-01-22"));
        assertThat(new GregorianDate(622, 3, 22).toString(), is("0622-03-22"));
        assertThat(new GregorianDate(-5, 3, 22).toString(), is("-0005-03-22"));
        assertThat(new GregorianDate(-3000, 3, 22).toString(), is("-3000-03-22"));
        assertThat(new GregorianDate(1_000_000_000L, 1, 1).toString(), is("+1000000000-01-01"));
        assertThat(new GregorianDate(-2_147_486_202L, 8, 24).toString(), is("-2147486202-08-24"));
    }

    @Test
    public void shouldFindDayOfWeek()
    {
        assertThat(new GregorianDate(2026, 3, 22).dayOfWeek(), is(DayOfWeek.SUNDAY));
        assertThat(new GregorianDate(1970, 1, 1).dayOfWeek(), is(DayOfWeek.THURSDAY));
        assertThat(new GregorianDate(1969, 12, 31).dayOfWeek(), is(DayOfWeek.WEDNESDAY));
    }

    @Test
    public void shouldConvertToLocalDateWithinItsRange()
    {
        final LocalDate date = LocalDate.of(2025, 3, 21);
        final GregorianDate fields = GregorianDate.of(date);

        assertTrue(fields.isSupportedByLocalDate());
        assertEquals(date, fields.toLocalDate());
        assertEquals(date.toEpochDay(), fields.toEpochDay());
    }

    @Test(expected = DateTimeException.class)
    public void shouldNotConvertToLocalDateBeyondItsRange()
    {
        final GregorianDate fields = new GregorianDate(2_147_480_201L, 10, 18);

        assertFalse(fields.isSupportedByLocalDate());
        fields.toLocalDate();
    }

    @Test
    public void shouldCompareByFields()
    {
        assertEquals(new GregorianDate(-3000, 3, 22), new GregorianDate(-3000, 3, 22));
        assertEquals(new GregorianDate(-3000, 3, 22).hashCode(), new GregorianDate(-3000, 3, 22).hashCode());
        assertFalse(new GregorianDate(-3000, 3, 22).equals(new GregorianDate(-3000, 3, 21)));
    }
}
