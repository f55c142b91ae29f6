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
package dev.mars.segmentlog.storage;

import dev.mars.segmentlog.entry.BinaryEntryCodec;
import dev.mars.segmentlog.entry.LogEntry;
import dev.mars.segmentlog.naming.LogFileNames;
import dev.mars.segmentlog.naming.ProcessIdentity;
import dev.mars.segmentlog.naming.Severity;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Builds segment files on disk for storage tests.
 */
final class SegmentFixtures {

    static final ProcessIdentity IDENTITY = new ProcessIdentity("app", "host", "alice", 4242);
    static final LogFileNames NAMES = new LogFileNames(IDENTITY);
    static final BinaryEntryCodec CODEC = new BinaryEntryCodec();

    static final long NANOS_PER_SECOND = 1_000_000_000L;

    private SegmentFixtures() {
    }

    static long seconds(long s) {
        return s * NANOS_PER_SECOND;
    }

    /** Writes a segment created at {@code createdSecond} holding {@code entries}. */
    static Path writeSegment(Path dir, Severity severity, long createdSecond, LogEntry... entries)
            throws IOException {
        return writeSegment(dir, NAMES, severity, createdSecond, entries);
    }

    static Path writeSegment(Path dir, LogFileNames names, Severity severity, long createdSecond,
                             LogEntry... entries) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (LogEntry entry : entries) {
            out.writeBytes(CODEC.encode(entry));
        }
        Path file = dir.resolve(names.nameFor(severity, Instant.ofEpochSecond(createdSecond)).fileName());
        Files.createDirectories(dir);
        Files.write(file, out.toByteArray());
        return file;
    }

    /** An entry logged at {@code second} (whole seconds) carrying {@code message}. */
    static LogEntry entryAt(long second, Severity severity, String message) {
        return LogEntry.of(seconds(second), severity, message);
    }
}
