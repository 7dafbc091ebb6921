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
package uk.co.real_logic.ic.fields;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import uk.co.real_logic.ic.calendar.IcDate;

import java.util.Arrays;

@RunWith(Parameterized.class)
public class IcDateEncoderInvalidCasesTest
{
    private final IcDate date;

    @Parameters(name = "{0}")
    public static Iterable<Object> data()
    {
        return Arrays.asList(
            new Object[]{ IcDate.of(-1, 1, 1) },
            new Object[]{ IcDate.of(-3000, 1, 1) },
            new Object[]{ IcDate.of(10_000, 1, 1) }
        );
    }

    public IcDateEncoderInvalidCasesTest(final IcDate date)
    {
        this.date = date;
    }

    @Test(expected = IllegalArgumentException.class)
    public void cannotEncodeDate()
    {
        new IcDateEncoder().encode(date, new byte[IcDateEncoder.LENGTH]);
    }
}
