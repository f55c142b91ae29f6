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
import dev.mars.segmentlog.naming.LogFileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;

/**
 * Decides whether a directory entry is a log file.
 * <p>
 * Only regular files qualify. Attributes are read without following links, so the
 * "latest" symlink is never mistaken for a second copy of the segment it points to.
 */
public final class LogFileVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(LogFileVerifier.class);

    private LogFileVerifier() {
    }

    /**
     * Verifies an entry whose attributes have already been read.
     *
     * @return decoded details, or empty if the entry is not a regular file with a log file name
     */
    public static Optional<FileDetails> verify(Path path, BasicFileAttributes attrs) {
        if (!attrs.isRegularFile()) {
            return Optional.empty();
        }
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        return LogFileNames.parse(fileName.toString());
    }

    /**
     * Reads the attributes of {@code path} (without following links) and verifies it.
     *
     * @return decoded details, or empty if the path is missing, unreadable or not a log file
     */
    public static Optional<FileDetails> verify(Path path) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class,
                    LinkOption.NOFOLLOW_LINKS);
            return verify(path, attrs);
        } catch (IOException e) {
            LOG.debug("Cannot stat {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
