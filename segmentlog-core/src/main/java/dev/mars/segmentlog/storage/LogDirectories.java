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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The candidate log directories, in preference order.
 * <p>
 * <b>INVARIANT:</b> the list is computed exactly once, on first use, and never
 * changes afterwards. Readers after initialization take no lock.
 */
public final class LogDirectories {

    private static final Logger LOG = LoggerFactory.getLogger(LogDirectories.class);

    private final Object initLock = new Object();
    private final Supplier<List<Path>> source;
    private volatile List<Path> resolved;

    /**
     * @param source supplies the configured directories; invoked at most once
     */
    public LogDirectories(Supplier<List<Path>> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /** Directories taken from {@link SegmentLogConfig#logDirs()}. */
    public static LogDirectories from(SegmentLogConfig config) {
        return new LogDirectories(config::logDirs);
    }

    /** Fixed directories, mainly for tests and tools. */
    public static LogDirectories of(Path... dirs) {
        List<Path> list = List.of(dirs);
        return new LogDirectories(() -> list);
    }

    /**
     * Returns the candidate directories: absolute, normalized, without duplicates.
     * May be empty if nothing is configured.
     */
    public List<Path> candidates() {
        List<Path> dirs = resolved;
        if (dirs == null) {
            synchronized (initLock) {
                dirs = resolved;
                if (dirs == null) {
                    dirs = resolve(source.get());
                    resolved = dirs;
                }
            }
        }
        return dirs;
    }

    private static List<Path> resolve(List<Path> configured) {
        Set<Path> unique = new LinkedHashSet<>();
        if (configured != null) {
            for (Path dir : configured) {
                if (dir != null) {
                    unique.add(dir.toAbsolutePath().normalize());
                }
            }
        }
        List<Path> dirs = List.copyOf(new ArrayList<>(unique));
        if (dirs.isEmpty()) {
            LOG.warn("No log directories configured");
        } else {
            LOG.info("Log directories resolved: {}", dirs);
        }
        return dirs;
    }
}
