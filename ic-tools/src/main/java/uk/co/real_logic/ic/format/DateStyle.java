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
package uk.co.real_logic.ic.format;

/**
 * Display styles supported by {@link IcDateFormatter}.
 */
public enum DateStyle
{
    /**
     * Persian month name, eg "1 بهمن 5025 IC".
     */
    PERSIAN,

    /**
     * Transliterated month name for ASCII contexts, eg "1 Bahman 5025 IC".
     */
    LATIN,

    /**
     * Zero padded, eg "5025-11-01".
     */
    NUMERIC,

    /**
     * Zero padded with slashes, eg "5025/11/01".
     */
    COMPACT,

    /**
     * Persian month name followed by the Solar Hijri year, eg "1 بهمن 5025 IC (1404 SH)".
     */
    FULL;

    /**
     * Look up a style by its name, ignoring case.
     *
     * @param name the name of the style, eg "latin".
     * @return the style.
     * @throws IllegalArgumentException if there's no style with that name.
     */
    public static DateStyle fromName(final String name)
    {
        if (name == null)
        {
            throw new IllegalArgumentException("Unknown format: null");
        }

        for (final DateStyle style : values())
        {
            if (style.name().equalsIgnoreCase(name))
            {
                return style;
            }
        }

        throw new IllegalArgumentException("Unknown format: " + name);
    }
}
