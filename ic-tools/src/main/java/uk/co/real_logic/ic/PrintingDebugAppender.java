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

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;

import static java.nio.charset.StandardCharsets.UTF_8;
import static uk.co.real_logic.ic.DebugConfiguration.DEBUG_FILE;
import static uk.co.real_logic.ic.DebugConfiguration.DEBUG_FILE_PROPERTY;
import static uk.co.real_logic.ic.DebugConfiguration.DEBUG_PRINT_THREAD;

public class PrintingDebugAppender extends AbstractDebugAppender
{
    private final PrintWriter output;

    public PrintingDebugAppender()
    {
        output = makeOutputStream();
    }

    private PrintWriter makeOutputStream()
    {
        if (DEBUG_FILE == null)
        {
            return new PrintWriter(new OutputStreamWriter(System.out, UTF_8));
        }
        else
        {
            try
            {
                return new PrintWriter(new OutputStreamWriter(new FileOutputStream(DEBUG_FILE), UTF_8));
            }
            catch (final IOException ex)
            {
                throw new IllegalStateException(
                    "Unable to configure DebugLogger, please check " + DEBUG_FILE_PROPERTY, ex);
            }
        }
    }

    class PrintingThreadLocalAppender extends ThreadLocalAppender
    {
        private final StringBuilder builder = new StringBuilder();
        private final String threadName;

        PrintingThreadLocalAppender()
        {
            this.threadName = ":" + DebugLogger.threadName();
        }

        public void log(final LogTag tag, final StringBuilder stringBuilder)
        {
            final StringBuilder builder = this.builder;
            builder.setLength(0);
            if (DEBUG_PRINT_THREAD != null)
            {
                builder.append(DEBUG_PRINT_THREAD);
            }
            builder.append(System.currentTimeMillis());
            builder.append(threadName);
            builder.append(tag.logStr());
            builder.append(' ');
            builder.append(stringBuilder);

            synchronized (output)
            {
                output.println(builder);
                output.flush();
            }
        }
    }

    public ThreadLocalAppender makeLocalAppender()
    {
        return new PrintingThreadLocalAppender();
    }
}
