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
import dev.mars.segmentlog.naming.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;

/**
 * Rotated, self-describing log files for one process.
 * <p>
 * Wires the configuration into the naming codec, directory listing, segment
 * creation, file access, entry fetch and the segment writer:
 * <pre>
 * SegmentLogConfig ─► LogDirectories ─┬─► LogFileLister ─► EntryFetcher
 *                                     ├─► LogFileAccess
 * ProcessIdentity ─► LogFileNames ────┴─► SegmentCreator ─► SegmentLogWriter
 * </pre>
 *
 * @see SegmentLogConfig
 */
public final class SegmentLog implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentLog.class);

    private final SegmentLogConfig config;
    private final LogDirectories directories;
    private final LogFileNames names;
    private final LogFileLister lister;
    private final LogFileAccess access;
    private final EntryFetcher fetcher;
    private final SegmentLogWriter writer;

    /**
     * Creates a SegmentLog with configuration loaded from
     * system properties, environment variables, properties file, or defaults.
     */
    public SegmentLog() {
        this(SegmentLogConfig.load());
    }

    public SegmentLog(SegmentLogConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config configuration
     * @param clock  source of segment creation times
     */
    public SegmentLog(SegmentLogConfig config, Clock clock) {
        this.config = config;
        BinaryEntryCodec codec = new BinaryEntryCodec();
        this.directories = LogDirectories.from(config);
        this.names = new LogFileNames(config.identity());
        this.lister = new LogFileLister(directories);
        this.access = new LogFileAccess(directories);
        this.fetcher = new EntryFetcher(lister, codec, config.entriesCutoff());
        this.writer = new SegmentLogWriter(new SegmentCreator(directories, names), codec,
                config.maxSegmentSizeBytes(), config.syncEnabled(), clock);

        LOG.info("SegmentLog initialized: identity={}, maxSegmentSize={} MB, entriesCutoff={}",
                config.identity(), config.maxSegmentSizeMb(), config.entriesCutoff());
    }

    public SegmentLogConfig config() {
        return config;
    }

    public LogFileNames names() {
        return names;
    }

    public LogDirectories directories() {
        return directories;
    }

    /** Appends an entry; see {@link SegmentLogWriter#write(LogEntry)}. */
    public void append(LogEntry entry) {
        writer.write(entry);
    }

    /** See {@link SegmentLogWriter#flush()}. */
    public void flush() {
        writer.flush();
    }

    /** See {@link LogFileLister#list()}. */
    public List<LogFileInfo> listLogFiles() {
        return lister.list();
    }

    /** See {@link LogFileAccess#open(String, boolean)}. */
    public InputStream openLogFile(String fileName, boolean allowAbsolute) {
        return access.open(fileName, allowAbsolute);
    }

    /** See {@link EntryFetcher#fetch(Severity, long, long)}. */
    public List<LogEntry> fetchEntries(Severity severity, long startTimeNanos, long endTimeNanos) {
        return fetcher.fetch(severity, startTimeNanos, endTimeNanos);
    }

    @Override
    public void close() {
        writer.close();
    }
}
