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

import uk.co.real_logic.ic.AbstractDebugAppender.ThreadLocalAppender;

import java.util.Iterator;
import java.util.ServiceLoader;

import static uk.co.real_logic.ic.DebugConfiguration.DEBUG_FILE;
import static uk.co.real_logic.ic.DebugConfiguration.DEBUG_FILE_PROPERTY;
import static uk.co.real_logic.ic.DebugConfiguration.DEBUG_PRINT_MESSAGES;
import static uk.co.real_logic.ic.DebugConfiguration.DEBUG_TAGS;

/**
 * A logger purely for debug data, enabled per {@link LogTag} through
 * {@link DebugConfiguration#DEBUG_PRINT_PROPERTY}. Calls for disabled tags return before formatting anything.
 */
public final class DebugLogger
{
    private static final AbstractDebugAppender APPENDER;
    private static final ThreadLocal<ThreadLocalLogger> THREAD_LOCAL = ThreadLocal.withInitial(ThreadLocalLogger::new);

    static
    {
        final ServiceLoader<AbstractDebugAppender> loader = ServiceLoader.load(AbstractDebugAppender.class);
        final Iterator<AbstractDebugAppender> it = loader.iterator();
        if (it.hasNext())
        {
            APPENDER = it.next();
            if (DEBUG_FILE != null)
            {
                System.err.println("Warning: -D" + DEBUG_FILE_PROPERTY + " has been set, despite a custom " +
                    "AbstractDebugAppender (" + APPENDER.getClass() + ") being configured via the service loader. " +
                    "The file property will be ignored and your custom appender used instead.");
            }
        }
        else
        {
            APPENDER = DEBUG_PRINT_MESSAGES ? new PrintingDebugAppender() : null;
        }
    }

    private DebugLogger()
    {
    }

    public static boolean isEnabled(final LogTag tag)
    {
        return DEBUG_PRINT_MESSAGES && DEBUG_TAGS.contains(tag);
    }

    public static void log(final LogTag tag, final String message)
    {
        if (isEnabled(tag))
        {
            THREAD_LOCAL.get().start().append(message).log(tag);
        }
    }

    public static void log(final LogTag tag, final String prefix, final Object value)
    {
        if (isEnabled(tag))
        {
            THREAD_LOCAL.get().start().append(prefix).append(value).log(tag);
        }
    }

    public static void log(
        final LogTag tag,
        final String prefix,
        final Object first,
        final String separator,
        final Object second)
    {
        if (isEnabled(tag))
        {
            THREAD_LOCAL.get().start().append(prefix).append(first).append(separator).append(second).log(tag);
        }
    }

    static String threadName()
    {
        return Thread.currentThread().getName();
    }

    static final class ThreadLocalLogger
    {
        private final StringBuilder builder = new StringBuilder();
        private final ThreadLocalAppender appender = APPENDER.makeLocalAppender();

        ThreadLocalLogger start()
        {
            builder.setLength(0);
            return this;
        }

        ThreadLocalLogger append(final Object value)
        {
            builder.append(value);
            return this;
        }

        void log(final LogTag tag)
        {
            appender.log(tag, builder);
        }
    }
}
