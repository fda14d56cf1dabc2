/*
 * Copyright 2015-2023 Real Logic Limited.
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
package uk.co.real_logic.nifgen;

/**
 * Extension point for the {@link DebugLogger}. Implementations are discovered through the
 * {@link java.util.ServiceLoader}, if none is registered a {@link PrintingDebugAppender} is used.
 */
public abstract class AbstractDebugAppender
{
    /**
     * Append a single, already formatted, log line.
     *
     * @param logTag the tag the line was logged under.
     * @param message the formatted message, without a trailing line separator.
     */
    public abstract void log(LogTag logTag, CharSequence message);
}
