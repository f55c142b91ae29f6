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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static dev.mars.segmentlog.storage.SegmentFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LogFileAccess}.
 */
class LogFileAccessTest {

    @TempDir
    Path tempDir;

    @Test
    void testOpenByBareName() throws Exception {
        Path file = writeSegment(tempDir, Severity.INFO, 100, entryAt(100, Severity.INFO, "hello"));
        LogFileAccess access = new LogFileAccess(LogDirectories.of(tempDir));

        try (InputStream in = access.open(file.getFileName().toString(), false)) {
            assertArrayEquals(Files.readAllBytes(file), in.readAllBytes());
        }
    }

    @Test
    void testSearchesDirectoriesInOrder() throws Exception {
        Path first = tempDir.resolve("first");
        Path second = tempDir.resolve("second");
        Files.createDirectories(first);
        Path file = writeSegment(second, Severity.ERROR, 100);
        LogFileAccess access = new LogFileAccess(LogDirectories.of(first, second));

        assertEquals(file, access.resolve(file.getFileName().toString(), false));
    }

    @Test
    void testAbsolutePathRejectedWhenUntrusted() throws Exception {
        Path file = writeSegment(tempDir, Severity.INFO, 100);
        LogFileAccess access = new LogFileAccess(LogDirectories.of(tempDir));

        assertThrows(LogAccessException.class, () -> access.open(file.toString(), false));
    }

    @Test
    void testAbsolutePathAllowedWhenTrusted() throws Exception {
        Path file = writeSegment(tempDir, Severity.INFO, 100, entryAt(100, Severity.INFO, "x"));
        LogFileAccess access = new LogFileAccess(LogDirectories.of());

        try (InputStream in = access.open(file.toString(), true)) {
            assertEquals(Files.size(file), in.readAllBytes().length);
        }
    }

    @Test
    void testTrustedAbsolutePathMustBeLogFile() throws Exception {
        Path other = Files.writeString(tempDir.resolve("passwd"), "root:x:0:0");
        LogFileAccess access = new LogFileAccess(LogDirectories.of(tempDir));

        assertThrows(LogAccessException.class, () -> access.open(other.toString(), true));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "../app.host.alice.log.INFO.1970-01-01T00_01_40Z.4242",
            "sub/app.host.alice.log.INFO.1970-01-01T00_01_40Z.4242",
            "sub\\app.host.alice.log.INFO.1970-01-01T00_01_40Z.4242",
            "..",
            ".",
            "",
            "notes.txt",
            "app.INFO"
    })
    void testRejectsPolicyViolations(String name) {
        LogFileAccess access = new LogFileAccess(LogDirectories.of(tempDir));

        assertThrows(LogAccessException.class, () -> access.open(name, true));
    }

    @Test
    void testMissingLogFile() {
        LogFileAccess access = new LogFileAccess(LogDirectories.of(tempDir));

        LogStorageException e = assertThrows(LogStorageException.class,
                () -> access.open("app.host.alice.log.INFO.1970-01-01T00_01_40Z.4242", false));
        assertFalse(e instanceof LogAccessException);
    }

    @Test
    void testDirectoryWithLogNameIsNotOpened() throws Exception {
        String name = "app.host.alice.log.INFO.1970-01-01T00_01_40Z.4242";
        Files.createDirectories(tempDir.resolve(name));
        LogFileAccess access = new LogFileAccess(LogDirectories.of(tempDir));

        assertThrows(LogStorageException.class, () -> access.open(name, false));
    }
}
