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

import dev.mars.segmentlog.naming.FileDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Lists verified log files across all candidate directories.
 */
public final class LogFileLister {

    private static final Logger LOG = LoggerFactory.getLogger(LogFileLister.class);

    private final LogDirectories directories;

    public LogFileLister(LogDirectories directories) {
        this.directories = Objects.requireNonNull(directories, "directories");
    }

    /**
     * Returns one {@link LogFileInfo} per verified log file, in no particular order.
     * <p>
     * Entries that are not log files (other files, subdirectories, symlinks) are skipped.
     *
     * @throws LogStorageException if any candidate directory cannot be read; nothing
     *                             found in earlier directories is returned
     */
    public List<LogFileInfo> list() {
        List<LogFileInfo> results = new ArrayList<>();
        for (Path dir : directories.candidates()) {
            int before = results.size();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                for (Path entry : stream) {
                    readEntry(entry).ifPresent(results::add);
                }
            } catch (IOException | DirectoryIteratorException e) {
                LOG.error("Failed to list log directory {}: {}", dir, e.getMessage(), e);
                throw new LogStorageException("Failed to list log directory " + dir, e);
            }
            LOG.debug("Listed {} log files in {}", results.size() - before, dir);
        }
        return results;
    }

    private static Optional<LogFileInfo> readEntry(Path entry) throws IOException {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (NoSuchFileException e) {
            // removed between the directory read and the stat
            LOG.debug("Skipping vanished entry {}", entry);
            return Optional.empty();
        }

        Optional<FileDetails> details = LogFileVerifier.verify(entry, attrs);
        if (details.isEmpty()) {
            LOG.trace("Skipping non-log entry {}", entry);
            return Optional.empty();
        }
        return Optional.of(new LogFileInfo(
                entry.getFileName().toString(),
                entry,
                attrs.size(),
                attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS),
                details.get()));
    }
}
