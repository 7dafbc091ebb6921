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

import java.util.Arrays;

import static java.nio.charset.StandardCharsets.US_ASCII;

@RunWith(Parameterized.class)
public class NumericDateDecoderInvalidCasesTest
{
    private final String text;

    @Parameters(name = "{0}")
    public static Iterable<Object> data()
    {
        return Arrays.asList(
            new String[]{ "5-01-1" },
            new String[]{ "-01-01" },
            new String[]{ "--01-01" },
            new String[]{ "5025/11/02" },
            new String[]{ "5025-1-02" },
            new String[]{ "5025-11-2" },
            new String[]{ "5025-00-01" },
            new String[]{ "5025-13-01" },
            new String[]{ "5025-01-00" },
            new String[]{ "5025-01-32" },
            new String[]{ "50a5-01-01" },
            new String[]{ "5025-0x-01" },
            new String[]{ "+5025-01-01" }
        );
    }

    public NumericDateDecoderInvalidCasesTest(final String text)
    {
        this.text = text;
    }

    @Test(expected = IllegalArgumentException.class)
    public void cannotDecodeFields()
    {
        new NumericDateDecoder().decodeFields(text.getBytes(US_ASCII));
    }
}
