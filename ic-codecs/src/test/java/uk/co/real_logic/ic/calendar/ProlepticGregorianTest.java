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
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.time.LocalDate;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;

@RunWith(Parameterized.class)
public class ProlepticGregorianTest
{
    private static final int DAYS_TO_CHECK = 800;

    private final LocalDate start;

    @Parameters(name = "{0}")
    public static Iterable<Object> data()
    {
        return Arrays.asList(
            new Object[]{ LocalDate.of(1970, 1, 1) },
            new Object[]{ LocalDate.of(1999, 12, 1) },
            new Object[]{ LocalDate.of(2026, 1, 1) },
            new Object[]{ LocalDate.of(1, 1, 1) },
            new Object[]{ LocalDate.of(0, 1, 1) },
            new Object[]{ LocalDate.of(-1, 2, 1) },
            new Object[]{ LocalDate.of(-100, 1, 1) },
            new Object[]{ LocalDate.of(-400, 1, 1) },
            new Object[]{ LocalDate.of(-2999, 1, 1) },
            new Object[]{ LocalDate.of(-3000, 3, 1) },
            new Object[]{ LocalDate.of(9999, 12, 1) },
            new Object[]{ LocalDate.of(-999_999, 1, 1) },
            new Object[]{ LocalDate.of(999_998, 1, 1) }
        );
    }

    public ProlepticGregorianTest(final LocalDate start)
    {
        this.start = start;
    }

    @Test
    public void shouldCountDaysLikeLocalDate()
    {
        for (int i = 0; i < DAYS_TO_CHECK; i++)
        {
            final LocalDate date = start.plusDays(i);
            assertEquals("Failed testcase for: " + date, date.toEpochDay(), ProlepticGregorian.toEpochDay(date));
        }
    }

    @Test
    public void shouldConvertEpochDaysLikeLocalDate()
    {
        for (int i = 0; i < DAYS_TO_CHECK; i++)
        {
            final LocalDate date = start.plusDays(i);
            final GregorianDate fields = ProlepticGregorian.fromEpochDay(date.toEpochDay());

            assertEquals("Failed testcase for: " + date, GregorianDate.of(date), fields);
            assertEquals(date.toString(), fields.toString());
            assertEquals(date.getDayOfWeek(), fields.dayOfWeek());
            assertEquals(date, ProlepticGregorian.toLocalDate(date.toEpochDay()));
        }
    }

    @Test
    public void shouldAgreeOnLeapYears()
    {
        final int year = start.getYear();
        assertEquals(start.isLeapYear(), ProlepticGregorian.isLeap(year));
        assertEquals(start.lengthOfMonth(), ProlepticGregorian.lengthOfMonth(year, start.getMonthValue()));
    }
}
