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

public enum LogTag
{
    /**
     * Logs each command run by the command line tool and its arguments.
     */
    TOOL,

    /**
     * Logs conversions performed on behalf of the command line tool, with both sides of the conversion.
     */
    CONVERSION,

    /**
     * Logs progress of reference table generation. This is a low volume LogTag to enable.
     */
    TABLE;

    private final char[] logStr;

    LogTag()
    {
        logStr = ("[" + name() + "]").toCharArray();
    }

    public char[] logStr()
    {
        return logStr;
    }
}
