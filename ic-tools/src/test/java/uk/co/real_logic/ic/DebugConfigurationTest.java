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

import org.junit.Test;

import java.util.EnumSet;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

public class DebugConfigurationTest
{
    @Test
    public void shouldEnableNothingByDefault()
    {
        assertThat(DebugConfiguration.parseTags(null), is(empty()));
        assertThat(DebugConfiguration.parseTags(""), is(empty()));
    }

    @Test
    public void shouldEnableAllTags()
    {
        assertThat(DebugConfiguration.parseTags("all"), is(EnumSet.allOf(LogTag.class)));
        assertThat(DebugConfiguration.parseTags("TRUE"), is(EnumSet.allOf(LogTag.class)));
    }

    @Test
    public void shouldEnableListedTags()
    {
        assertThat(DebugConfiguration.parseTags("TOOL, TABLE"), is(EnumSet.of(LogTag.TOOL, LogTag.TABLE)));
    }

    @Test
    public void shouldIgnoreUnknownTags()
    {
        assertThat(DebugConfiguration.parseTags("TOOL,NOT_A_TAG"), is(empty()));
    }
}
