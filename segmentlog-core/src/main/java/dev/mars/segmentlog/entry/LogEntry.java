/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.segmentlog.entry;

import dev.mars.segmentlog.naming.Severity;

import java.util.Objects;

/**
 * A single log entry.
 *
 * @param timeNanos time the entry was logged, nanoseconds since the epoch
 * @param severity  entry severity
 * @param file      source file that logged the entry (may be empty)
 * @param line      source line, or 0 if unknown
 * @param message   formatted message
 */
public record LogEntry(long timeNanos, Severity severity, String file, int line, String message) {

    public LogEntry {
        Objects.requireNonNull(severity, "severity");
        file = file == null ? "" : file;
        message = message == null ? "" : message;
    }

    /** Creates an entry with no source location. */
    public static LogEntry of(long timeNanos, Severity severity, String message) {
        return new LogEntry(timeNanos, severity, "", 0, message);
    }
}
