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
import uk.co.real_logic.ic.calendar.InvalidDateException;
import uk.co.real_logic.ic.calendar.YearMonthDay;
import uk.co.real_logic.ic.util.AsciiBuffer;
import uk.co.real_logic.ic.util.MutableAsciiBuffer;

import static java.lang.String.format;

/**
 * A decoder for the numeric date format, <code>YYYY-MM-DD</code>.
 * <p>
 * The year may have any number of digits and an optional leading minus sign, so <code>-0100-01-01</code> and
 * <code>10000-01-01</code> are both accepted. The month and day are always two digits. The same text form is
 * used for Gregorian dates, so {@link #decodeFields(AsciiBuffer, int, int)} only range checks month 1-12 and day
 * 1-31 and leaves calendar specific validation to the caller.
 * <p>
 * See {@link IcDateEncoder} for how to encode this data type.
 */
public final class NumericDateDecoder
{
    public static final int SIZE_OF_MONTH = 2;
    public static final int SIZE_OF_DAY = 2;
    public static final int SIZE_OF_SEPARATOR = 1;

    // "-MM-DD"
    private static final int SIZE_OF_MONTH_AND_DAY =
        SIZE_OF_SEPARATOR + SIZE_OF_MONTH + SIZE_OF_SEPARATOR + SIZE_OF_DAY;
    public static final int MIN_LENGTH = 1 + SIZE_OF_MONTH_AND_DAY;

    private final MutableAsciiBuffer buffer = new MutableAsciiBuffer();

    /**
     * Decode a numeric date from a <code>byte[]</code> into a validated date.
     *
     * @param bytes a byte array containing just the date to decode.
     * @return the decoded date.
     * @throws InvalidDateException if the fields don't form a valid date.
     * @throws IllegalArgumentException if the text isn't in the numeric date format.
     */
    public IcDate decode(final byte[] bytes)
    {
        final MutableAsciiBuffer buffer = this.buffer;
        buffer.wrap(bytes);
        return decode(buffer, 0, bytes.length);
    }

    public YearMonthDay decodeFields(final byte[] bytes)
    {
        final MutableAsciiBuffer buffer = this.buffer;
        buffer.wrap(bytes);
        return decodeFields(buffer, 0, bytes.length);
    }

    public static IcDate decode(final AsciiBuffer buffer, final int offset, final int length)
    {
        final YearMonthDay fields = decodeFields(buffer, offset, length);
        return IcDate.of(fields.year(), fields.month(), fields.day());
    }

    /**
     * Decode the fields of a numeric date without validating them against any calendar.
     *
     * @param buffer the buffer containing the date.
     * @param offset the position in the buffer where the value starts.
     * @param length the length of the value in bytes.
     * @return the year, month and day.
     * @throws IllegalArgumentException if the text isn't in the numeric date format.
     */
    public static YearMonthDay decodeFields(final AsciiBuffer buffer, final int offset, final int length)
    {
        if (length < MIN_LENGTH)
        {
            throw new IllegalArgumentException(
                "not enough data, needs at least " + MIN_LENGTH + " bytes, but has " + length);
        }

        final int endYear = offset + length - SIZE_OF_MONTH_AND_DAY;
        final int startMonth = endYear + SIZE_OF_SEPARATOR;
        final int endMonth = startMonth + SIZE_OF_MONTH;
        final int startDay = endMonth + SIZE_OF_SEPARATOR;
        final int endDay = startDay + SIZE_OF_DAY;

        checkSeparator(buffer, endYear);
        checkSeparator(buffer, endMonth);

        final boolean negative = buffer.getByte(offset) == AsciiBuffer.NEGATIVE;
        final int startYear = negative ? offset + 1 : offset;
        if (startYear >= endYear)
        {
            throw new IllegalArgumentException("Missing year in: " + buffer.getAscii(offset, length));
        }

        final int year = buffer.getNatural(startYear, endYear);
        final int month = getValidInt(buffer, startMonth, endMonth, 1, 12);
        final int day = getValidInt(buffer, startDay, endDay, 1, 31);

        return new YearMonthDay(negative ? -year : year, month, day);
    }

    private static void checkSeparator(final AsciiBuffer buffer, final int index)
    {
        final char value = buffer.getChar(index);
        if (value != IcDateEncoder.SEPARATOR)
        {
            throw new IllegalArgumentException(
                format("Expected '%c' @ %d but was '%c'", IcDateEncoder.SEPARATOR, index, value));
        }
    }

    private static int getValidInt(
        final AsciiBuffer buffer,
        final int startInclusive,
        final int endExclusive,
        final int min,
        final int max)
    {
        final int value = buffer.getNatural(startInclusive, endExclusive);
        if (value < min || value > max)
        {
            throw new IllegalArgumentException(format("Invalid value: %s outside of range %d-%d", value, min, max));
        }
        return value;
    }
}
