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
package uk.co.real_logic.ic.util;

import org.agrona.DirectBuffer;
import uk.co.real_logic.ic.calendar.IcDate;

/**
 * Read only view over a data buffer holding US-ASCII encoded text.
 */
public interface AsciiBuffer extends DirectBuffer
{
    byte NEGATIVE = '-';

    int getNatural(int startInclusive, int endExclusive);

    char getChar(int index);

    /**
     * May not be the best performance conversion: don't use this on a critical application path.
     *
     * @param offset at which the string begins.
     * @param length of the string in bytes.
     * @return a String
     */
    String getAscii(int offset, int length);

    IcDate getIcDate(int offset, int length);
}
