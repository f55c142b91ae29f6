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

import dev.mars.segmentlog.naming.LogFileNames;
import dev.mars.segmentlog.naming.SegmentName;
import dev.mars.segmentlog.naming.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Creates new log segments.
 * <p>
 * Candidate directories are tried in preference order and the first one that
 * accepts the file wins. After a successful open the severity's "latest"
 * symlink is replaced with one pointing at the new segment; failures there
 * are logged and otherwise ignored.
 */
public final class SegmentCreator {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentCreator.class);

    private final LogDirectories directories;
    private final LogFileNames names;

    public SegmentCreator(LogDirectories directories, LogFileNames names) {
        this.directories = Objects.requireNonNull(directories, "directories");
        this.names = Objects.requireNonNull(names, "names");
    }

    public LogFileNames names() {
        return names;
    }

    /**
     * Opens (append, create) a new segment for {@code severity} created at {@code time}.
     *
     * @return the open segment
     * @throws LogStorageException if no directory is configured or every directory fails
     */
    public CreatedSegment create(Severity severity, Instant time) {
        List<Path> dirs = directories.candidates();
        if (dirs.isEmpty()) {
            LOG.error("Cannot create {} segment: no log directories", severity);
            throw new LogStorageException("Cannot create log segment: no log directories configured");
        }

        SegmentName name = names.nameFor(severity, time);
        IOException lastError = null;
        for (Path dir : dirs) {
            Path file = dir.resolve(name.fileName());
            FileChannel channel;
            try {
                Files.createDirectories(dir);
                // APPEND rather than truncating: a name collision within the same second reuses the file
                channel = FileChannel.open(file,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND,
                        StandardOpenOption.WRITE);
            } catch (IOException e) {
                LOG.warn("Cannot create segment {} in {}: {}", name.fileName(), dir, e.getMessage());
                lastError = e;
                continue;
            }

            boolean linked = updateSymlink(dir.resolve(name.symlinkName()), name.fileName());
            LOG.info("Created {} segment: path={}, symlinkUpdated={}", severity, file, linked);
            return new CreatedSegment(channel, file, linked);
        }

        LOG.error("Cannot create {} segment in any of {}", severity, dirs);
        throw new LogStorageException("Cannot create log segment " + name.fileName() +
                " in any of " + dirs, lastError);
    }

    /**
     * Points {@code link} at {@code target} (a name relative to the link's directory).
     *
     * @return false if the old link could not be removed or the new one created
     */
    private static boolean updateSymlink(Path link, String target) {
        try {
            Files.deleteIfExists(link);
            Files.createSymbolicLink(link, Path.of(target));
            LOG.trace("Symlink updated: {} -> {}", link, target);
            return true;
        } catch (IOException | UnsupportedOperationException e) {
            LOG.warn("Could not update symlink {} -> {}: {}", link, target, e.getMessage());
            return false;
        }
    }
}
