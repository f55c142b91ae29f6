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

import dev.mars.segmentlog.naming.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Instant;

import static dev.mars.segmentlog.storage.SegmentFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for {@link SegmentCreator}.
 */
class SegmentCreatorTest {

    private static final Instant T1 = Instant.parse("2026-01-02T03:04:05Z");
    private static final Instant T2 = Instant.parse("2026-01-02T04:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void testCreatesNamedSegmentAndSymlink() throws Exception {
        SegmentCreator creator = new SegmentCreator(LogDirectories.of(tempDir), NAMES);

        try (CreatedSegment segment = creator.create(Severity.INFO, T1)) {
            assertEquals(tempDir.resolve("app.host.alice.log.INFO.2026-01-02T03_04_05Z.4242"), segment.path());
            assertTrue(Files.isRegularFile(segment.path()));
            assumeTrue(segment.symlinkUpdated(), "symlinks not supported");

            Path link = tempDir.resolve("app.INFO");
            assertTrue(Files.isSymbolicLink(link));
            assertEquals(segment.path().getFileName(), Files.readSymbolicLink(link));
        }
    }

    @Test
    void testSymlinkMovesToNewestSegment() throws Exception {
        SegmentCreator creator = new SegmentCreator(LogDirectories.of(tempDir), NAMES);

        try (CreatedSegment first = creator.create(Severity.ERROR, T1);
             CreatedSegment second = creator.create(Severity.ERROR, T2)) {
            assumeTrue(first.symlinkUpdated() && second.symlinkUpdated(), "symlinks not supported");

            assertEquals(second.path().getFileName(), Files.readSymbolicLink(tempDir.resolve("app.ERROR")));
            assertTrue(Files.exists(first.path()));
        }
    }

    @Test
    void testOpensForAppend() throws Exception {
        SegmentCreator creator = new SegmentCreator(LogDirectories.of(tempDir), NAMES);

        try (CreatedSegment segment = creator.create(Severity.INFO, T1)) {
            segment.channel().write(ByteBuffer.wrap("first;".getBytes(StandardCharsets.UTF_8)));
        }
        try (CreatedSegment again = creator.create(Severity.INFO, T1)) {
            again.channel().write(ByteBuffer.wrap("second".getBytes(StandardCharsets.UTF_8)));
            assertEquals("first;second", Files.readString(again.path()));
        }
    }

    @Test
    void testFirstWorkingDirectoryWins() throws Exception {
        Path blocked = Files.writeString(tempDir.resolve("blocked"), "a file, not a directory");
        Path preferred = tempDir.resolve("preferred");
        Path fallback = tempDir.resolve("fallback");
        SegmentCreator creator = new SegmentCreator(LogDirectories.of(blocked, preferred, fallback), NAMES);

        try (CreatedSegment segment = creator.create(Severity.WARNING, T1)) {
            assertEquals(preferred, segment.path().getParent());
            assertFalse(Files.exists(fallback));
        }
    }

    @Test
    void testAllDirectoriesFailing() throws Exception {
        Path blockedA = Files.writeString(tempDir.resolve("a"), "x");
        Path blockedB = Files.writeString(tempDir.resolve("b"), "x");
        SegmentCreator creator = new SegmentCreator(LogDirectories.of(blockedA, blockedB), NAMES);

        LogStorageException e = assertThrows(LogStorageException.class, () -> creator.create(Severity.INFO, T1));
        assertNotNull(e.getCause());
    }

    @Test
    void testNoDirectoriesConfigured() {
        SegmentCreator creator = new SegmentCreator(LogDirectories.of(), NAMES);

        assertThrows(LogStorageException.class, () -> creator.create(Severity.INFO, T1));
    }

    @Test
    void testSymlinkFailureIsNotFatal() throws Exception {
        // a non-empty directory where the symlink should go cannot be removed
        Path linkDir = Files.createDirectories(tempDir.resolve("app.FATAL"));
        Files.writeString(linkDir.resolve("keep"), "x");
        SegmentCreator creator = new SegmentCreator(LogDirectories.of(tempDir), NAMES);

        try (CreatedSegment segment = creator.create(Severity.FATAL, T1)) {
            assertFalse(segment.symlinkUpdated());
            assertTrue(Files.isRegularFile(segment.path(), LinkOption.NOFOLLOW_LINKS));
        }
    }
}
