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

import uk.co.real_logic.ic.calendar.IcDate;
import uk.co.real_logic.ic.util.MutableAsciiBuffer;

/**
 * An encoder for the fixed width numeric date format, <code>YYYY-MM-DD</code>. See {@link NumericDateDecoder}
 * for details of the format. Only years 1-9999 fit the fixed width.
 */
public final class IcDateEncoder
{
    public static final int LENGTH = 10;
    public static final int MIN_YEAR = 1;
    public static final int MAX_YEAR = 9999;
    public static final char SEPARATOR = '-';

    private static final int SIZE_OF_YEAR = 4;

    private final MutableAsciiBuffer flyweight = new MutableAsciiBuffer();

    /**
     * Encode a date to a <code>byte[]</code>.
     *
     * @param date the date to encode.
     * @param bytes a byte[] of at least {@link #LENGTH} bytes to encode the data into.
     * @return the length of the data encoded (always 10)
     */
    public int encode(final IcDate date, final byte[] bytes)
    {
        final MutableAsciiBuffer flyweight = this.flyweight;
        flyweight.wrap(bytes);
        return encode(date, flyweight, 0);
    }

    /**
     * Encode a date to a {@link MutableAsciiBuffer}.
     *
     * @param date the date to encode.
     * @param buffer a {@link MutableAsciiBuffer} to encode the data into.
     * @param offset the offset to start within buffer
     * @return the length of the data encoded (always 10)
     */
    public static int encode(final IcDate date, final MutableAsciiBuffer buffer, final int offset)
    {
        final int year = date.year();
        if (year < MIN_YEAR || year > MAX_YEAR)
        {
            throw new IllegalArgumentException(year + " is outside of the valid range for this encoder");
        }

        final int endYear = offset + SIZE_OF_YEAR;
        final int startMonth = endYear + NumericDateDecoder.SIZE_OF_SEPARATOR;
        final int endMonth = startMonth + NumericDateDecoder.SIZE_OF_MONTH;
        final int startDay = endMonth + NumericDateDecoder.SIZE_OF_SEPARATOR;

        buffer.putNaturalPaddedIntAscii(offset, SIZE_OF_YEAR, year);
        buffer.putCharAscii(endYear, SEPARATOR);
        buffer.putNaturalPaddedIntAscii(startMonth, NumericDateDecoder.SIZE_OF_MONTH, date.month());
        buffer.putCharAscii(endMonth, SEPARATOR);
        buffer.putNaturalPaddedIntAscii(startDay, NumericDateDecoder.SIZE_OF_DAY, date.day());

        return LENGTH;
    }
}
