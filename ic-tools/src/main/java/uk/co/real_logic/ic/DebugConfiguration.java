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
package uk.co.real_logic.ic;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Stream;

import static java.lang.System.getProperty;
import static java.util.stream.Collectors.toCollection;

/**
 * System property configuration for the debug logging of the tools.
 */
public final class DebugConfiguration
{
    /**
     * Property that enables debug logging. Either "all" / "true" to enable every {@link LogTag}, or a comma
     * separated list of tag names, eg "TOOL,CONVERSION".
     */
    public static final String DEBUG_PRINT_PROPERTY = "ic.debug";

    /**
     * Property that names a file for debug logging output. Defaults to standard out.
     */
    public static final String DEBUG_FILE_PROPERTY = "ic.debug.file";

    /**
     * Property that, when set, prefixes every log line with the given value.
     */
    public static final String DEBUG_PRINT_THREAD_PROPERTY = "ic.debug.thread";

    public static final boolean DEBUG_PRINT_MESSAGES;
    public static final Set<LogTag> DEBUG_TAGS;
    public static final String DEBUG_PRINT_THREAD;
    public static final String DEBUG_FILE = getProperty(DEBUG_FILE_PROPERTY);

    static
    {
        final String debugPrintValue = getProperty(DEBUG_PRINT_PROPERTY);
        DEBUG_TAGS = parseTags(debugPrintValue);
        DEBUG_PRINT_MESSAGES = !DEBUG_TAGS.isEmpty();

        final String debugPrintThreadValue = getProperty(DEBUG_PRINT_THREAD_PROPERTY);
        DEBUG_PRINT_THREAD = debugPrintThreadValue == null ? null : debugPrintThreadValue + " : ";
    }

    private DebugConfiguration()
    {
    }

    /**
     * Parse the value of {@link #DEBUG_PRINT_PROPERTY}.
     *
     * @param value the property value, may be null.
     * @return the enabled tags, empty if none are enabled or the value can't be parsed.
     */
    static Set<LogTag> parseTags(final String value)
    {
        if (value == null || value.isEmpty())
        {
            return Collections.emptySet();
        }

        if ("all".equalsIgnoreCase(value) || "true".equalsIgnoreCase(value))
        {
            return EnumSet.allOf(LogTag.class);
        }

        try
        {
            return Stream
                .of(value.split(","))
                .map(String::trim)
                .map(LogTag::valueOf)
                .collect(toCollection(() -> EnumSet.noneOf(LogTag.class)));
        }
        catch (final IllegalArgumentException ignore)
        {
            // parse error in valueOf(), logging stays off
            return Collections.emptySet();
        }
    }
}
