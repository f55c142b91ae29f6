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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Opens log files by name for reading.
 * <p>
 * Requests from untrusted callers (for example an admin HTTP endpoint) must pass
 * {@code allowAbsolute = false}: only bare names matching the log file grammar are
 * accepted, and they are resolved against the candidate directories. Absolute paths
 * are accepted only in trusted, local use such as a command-line log viewer, and
 * even then the target must be a verified log file.
 */
public final class LogFileAccess {

    private static final Logger LOG = LoggerFactory.getLogger(LogFileAccess.class);

    private final LogDirectories directories;

    public LogFileAccess(LogDirectories directories) {
        this.directories = Objects.requireNonNull(directories, "directories");
    }

    /**
     * Opens a log file.
     *
     * @param fileName      a bare log file name, or an absolute path when {@code allowAbsolute}
     * @param allowAbsolute whether absolute paths are permitted
     * @return an open stream; the caller closes it
     * @throws LogAccessException  if the name violates the access policy
     * @throws LogStorageException if no candidate directory holds a matching log file
     */
    public InputStream open(String fileName, boolean allowAbsolute) {
        Path path = resolve(fileName, allowAbsolute);
        try {
            LOG.debug("Opening log file {}", path);
            return Files.newInputStream(path);
        } catch (IOException e) {
            LOG.error("Failed to open log file {}: {}", path, e.getMessage(), e);
            throw new LogStorageException("Failed to open log file " + path, e);
        }
    }

    /**
     * Applies the access policy and locates the file without opening it.
     *
     * @return the path of a verified log file
     */
    public Path resolve(String fileName, boolean allowAbsolute) {
        if (fileName == null || fileName.isEmpty()) {
            throw new LogAccessException("Log file name must not be empty");
        }

        if (isAbsolute(fileName)) {
            if (!allowAbsolute) {
                LOG.warn("Rejected absolute log file path: {}", fileName);
                throw new LogAccessException("Absolute pathnames are forbidden: " + fileName);
            }
            Path path = Path.of(fileName);
            if (LogFileVerifier.verify(path).isEmpty()) {
                throw new LogAccessException("Not a log file: " + fileName);
            }
            return path;
        }

        if (fileName.indexOf('/') >= 0 || fileName.indexOf('\\') >= 0
                || fileName.equals(".") || fileName.equals("..")) {
            LOG.warn("Rejected log file name with path components: {}", fileName);
            throw new LogAccessException("Pathnames must be basenames only: " + fileName);
        }
        if (!LogFileNames.isLogFileName(fileName)) {
            throw new LogAccessException("Not a log file name: " + fileName);
        }

        for (Path dir : directories.candidates()) {
            Path candidate = dir.resolve(fileName);
            if (LogFileVerifier.verify(candidate).isPresent()) {
                return candidate;
            }
        }
        throw new LogStorageException("Log file not found in any log directory: " + fileName);
    }

    private static boolean isAbsolute(String fileName) {
        try {
            return fileName.startsWith("/") || Path.of(fileName).isAbsolute();
        } catch (InvalidPathException e) {
            throw new LogAccessException("Invalid log file name: " + fileName);
        }
    }
}
