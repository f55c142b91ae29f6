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

import dev.mars.segmentlog.entry.LogEntry;
import dev.mars.segmentlog.naming.LogFileNames;
import dev.mars.segmentlog.naming.Severity;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static dev.mars.segmentlog.storage.SegmentFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SegmentLogWriter}: severity fan-out, rotation and lifecycle.
 */
class SegmentLogWriterTest {

    /** Encoded size of an entry with an empty file name and a one-character message. */
    private static final int RECORD_SIZE = 27 + 1 + 4;

    @TempDir
    Path tempDir;

    private ManualClock clock;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2026-03-01T10:00:00Z"));
    }

    private SegmentLogWriter writer(long maxSegmentBytes) {
        SegmentCreator creator = new SegmentCreator(LogDirectories.of(tempDir), NAMES);
        return new SegmentLogWriter(creator, CODEC, maxSegmentBytes, false, clock);
    }

    private List<LogEntry> fetchAll(Severity severity) {
        EntryFetcher fetcher = new EntryFetcher(new LogFileLister(LogDirectories.of(tempDir)), CODEC, 1000);
        return fetcher.fetch(severity, 0, Long.MAX_VALUE);
    }

    private List<Path> segmentsOf(Severity severity) throws Exception {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.filter(p -> LogFileNames.isLogFileName(p.getFileName().toString()))
                    .filter(p -> p.getFileName().toString().contains(".log." + severity.name() + "."))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    // ========================================================================
    // Fan-out
    // ========================================================================

    @Nested
    @DisplayName("Severity fan-out")
    class FanOut {

        @Test
        @DisplayName("An entry lands in its own stream and every lower one")
        void testErrorEntryFansOut() throws Exception {
            LogEntry error = entryAt(100, Severity.ERROR, "e");
            try (SegmentLogWriter writer = writer(1 << 20)) {
                writer.write(error);
            }

            assertEquals(List.of(error), fetchAll(Severity.INFO));
            assertEquals(List.of(error), fetchAll(Severity.WARNING));
            assertEquals(List.of(error), fetchAll(Severity.ERROR));
            assertTrue(fetchAll(Severity.FATAL).isEmpty());
            assertTrue(segmentsOf(Severity.FATAL).isEmpty());
        }

        @Test
        @DisplayName("INFO entries are written to the INFO stream only")
        void testInfoEntryStaysInInfo() throws Exception {
            try (SegmentLogWriter writer = writer(1 << 20)) {
                writer.write(entryAt(100, Severity.INFO, "i"));
                writer.write(entryAt(101, Severity.FATAL, "f"));

                assertTrue(writer.currentSegment(Severity.INFO).isPresent());
                assertTrue(writer.currentSegment(Severity.FATAL).isPresent());
            }

            assertEquals(2, fetchAll(Severity.INFO).size());
            assertEquals(1, fetchAll(Severity.WARNING).size());
            assertEquals(1, fetchAll(Severity.FATAL).size());
        }

        @Test
        @DisplayName("No segment exists for a severity until it is written")
        void testSegmentsCreatedLazily() {
            try (SegmentLogWriter writer = writer(1 << 20)) {
                assertTrue(writer.currentSegment(Severity.INFO).isEmpty());
                writer.write(entryAt(100, Severity.WARNING, "w"));
                assertTrue(writer.currentSegment(Severity.WARNING).isPresent());
                assertTrue(writer.currentSegment(Severity.ERROR).isEmpty());
            }
        }
    }

    // ========================================================================
    // Rotation
    // ========================================================================

    @Nested
    @DisplayName("Rotation")
    class Rotation {

        @Test
        @DisplayName("A full segment is replaced by a new one named for the current time")
        void testRotatesWhenFull() throws Exception {
            try (SegmentLogWriter writer = writer(2 * RECORD_SIZE)) {
                writer.write(entryAt(100, Severity.INFO, "a"));
                writer.write(entryAt(101, Severity.INFO, "b"));
                Path first = writer.currentSegment(Severity.INFO).orElseThrow();

                clock.advance(Duration.ofSeconds(5));
                writer.write(entryAt(106, Severity.INFO, "c"));
                Path second = writer.currentSegment(Severity.INFO).orElseThrow();

                assertNotEquals(first, second);
                assertEquals(2 * RECORD_SIZE, Files.size(first));
                assertEquals(RECORD_SIZE, Files.size(second));
            }

            assertEquals(2, segmentsOf(Severity.INFO).size());
            assertEquals(List.of("a", "b", "c"),
                    fetchAll(Severity.INFO).stream().map(LogEntry::message).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Rotation waits for the clock to move past the current segment's second")
        void testRotationDeferredWithinSameSecond() throws Exception {
            try (SegmentLogWriter writer = writer(RECORD_SIZE)) {
                writer.write(entryAt(100, Severity.INFO, "a"));
                writer.write(entryAt(100, Severity.INFO, "b"));
                writer.write(entryAt(100, Severity.INFO, "c"));
                Path only = writer.currentSegment(Severity.INFO).orElseThrow();
                assertEquals(3 * RECORD_SIZE, Files.size(only));

                clock.advance(Duration.ofSeconds(1));
                writer.write(entryAt(101, Severity.INFO, "d"));
                assertNotEquals(only, writer.currentSegment(Severity.INFO).orElseThrow());
            }

            assertEquals(2, segmentsOf(Severity.INFO).size());
        }

        @Test
        @DisplayName("A single oversized entry is still written to an empty segment")
        void testOversizedEntryWritten() throws Exception {
            try (SegmentLogWriter writer = writer(8)) {
                writer.write(entryAt(100, Severity.INFO, "a"));
            }

            assertEquals(1, fetchAll(Severity.INFO).size());
        }

        @Test
        @DisplayName("Reopening an existing segment counts its bytes toward the limit")
        void testExistingBytesCounted() throws Exception {
            try (SegmentLogWriter writer = writer(2 * RECORD_SIZE)) {
                writer.write(entryAt(100, Severity.INFO, "a"));
            }
            try (SegmentLogWriter writer = writer(2 * RECORD_SIZE)) {
                // same second: the first writer's segment is reopened for append
                writer.write(entryAt(100, Severity.INFO, "b"));
                Path reopened = writer.currentSegment(Severity.INFO).orElseThrow();
                assertEquals(2 * RECORD_SIZE, Files.size(reopened));

                clock.advance(Duration.ofSeconds(1));
                writer.write(entryAt(101, Severity.INFO, "c"));
                assertNotEquals(reopened, writer.currentSegment(Severity.INFO).orElseThrow());
            }

            assertEquals(2, segmentsOf(Severity.INFO).size());
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("close() is idempotent and rejects further writes")
        void testCloseIdempotent() {
            SegmentLogWriter writer = writer(1 << 20);
            writer.write(entryAt(100, Severity.INFO, "a"));
            writer.close();
            writer.close();

            assertThrows(IllegalStateException.class, () -> writer.write(entryAt(101, Severity.INFO, "b")));
            assertThrows(IllegalStateException.class, writer::flush);
            assertTrue(writer.currentSegment(Severity.INFO).isEmpty());
        }

        @Test
        @DisplayName("flush() with sync enabled forces open segments")
        void testFlushWithSync() {
            SegmentCreator creator = new SegmentCreator(LogDirectories.of(tempDir), NAMES);
            try (SegmentLogWriter writer = new SegmentLogWriter(creator, CODEC, 1 << 20, true, clock)) {
                writer.write(entryAt(100, Severity.ERROR, "e"));
                assertDoesNotThrow(writer::flush);
            }
            assertEquals(1, fetchAll(Severity.ERROR).size());
        }

        @Test
        @DisplayName("Segment creation failure surfaces as LogStorageException")
        void testCreationFailure() throws Exception {
            Path blocked = Files.writeString(tempDir.resolve("blocked"), "x");
            SegmentCreator creator = new SegmentCreator(LogDirectories.of(blocked), NAMES);
            try (SegmentLogWriter writer = new SegmentLogWriter(creator, CODEC, 1 << 20, false, clock)) {
                assertThrows(LogStorageException.class, () -> writer.write(entryAt(100, Severity.INFO, "a")));
            }
        }

        @Test
        @DisplayName("Non-positive segment size is rejected")
        void testInvalidMaxSegmentBytes() {
            SegmentCreator creator = new SegmentCreator(LogDirectories.of(tempDir), NAMES);
            assertThrows(IllegalArgumentException.class,
                    () -> new SegmentLogWriter(creator, CODEC, 0, false, clock));
        }
    }

    /** Clock whose time only moves when a test advances it. */
    private static final class ManualClock extends Clock {
        private Instant now;

        ManualClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
