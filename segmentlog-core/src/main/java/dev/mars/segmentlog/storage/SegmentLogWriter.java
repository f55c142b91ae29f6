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

import dev.mars.segmentlog.entry.EntryEncoder;
import dev.mars.segmentlog.entry.LogEntry;
import dev.mars.segmentlog.naming.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Appends entries to per-severity segments, rotating them by size.
 * <p>
 * An entry of severity S is written to the current segment of every severity
 * at or below S, so the INFO stream holds everything and the FATAL stream holds
 * only FATAL entries. A segment is created on the first write to its severity and
 * replaced by a new one once it has reached the configured size.
 * <p>
 * <b>Thread Safety:</b> all methods are synchronized; one writer per process.
 */
public final class SegmentLogWriter implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentLogWriter.class);

    private final SegmentCreator creator;
    private final EntryEncoder encoder;
    private final long maxSegmentBytes;
    private final boolean syncEnabled;
    private final Clock clock;

    private final Map<Severity, ActiveSegment> active = new EnumMap<>(Severity.class);
    private boolean closed = false;

    /**
     * @param creator         creates segments on first write and on rotation
     * @param encoder         serializes entries
     * @param maxSegmentBytes size at which a segment is rotated
     * @param syncEnabled     whether {@link #flush()} fsyncs
     * @param clock           source of segment creation times
     */
    public SegmentLogWriter(SegmentCreator creator, EntryEncoder encoder, long maxSegmentBytes,
                            boolean syncEnabled, Clock clock) {
        if (maxSegmentBytes <= 0) {
            throw new IllegalArgumentException("maxSegmentBytes must be positive: " + maxSegmentBytes);
        }
        this.creator = Objects.requireNonNull(creator, "creator");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.maxSegmentBytes = maxSegmentBytes;
        this.syncEnabled = syncEnabled;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends {@code entry} to the streams of its severity and every lower one.
     *
     * @throws LogStorageException   if a segment cannot be created or written
     * @throws IllegalStateException if the writer is closed
     */
    public synchronized void write(LogEntry entry) {
        Objects.requireNonNull(entry, "entry");
        checkNotClosed();
        byte[] record = encoder.encode(entry);
        for (Severity severity : Severity.values()) {
            if (!entry.severity().isAtLeast(severity)) {
                break;
            }
            ActiveSegment segment = segmentFor(severity, record.length);
            try {
                ByteBuffer buf = ByteBuffer.wrap(record);
                while (buf.hasRemaining()) {
                    segment.created.channel().write(buf);
                }
                segment.bytesWritten += record.length;
            } catch (IOException e) {
                LOG.error("Failed to write {} entry to {}: {}", severity, segment.created.path(), e.getMessage(), e);
                throw new LogStorageException("Failed to write to log segment " + segment.created.path(), e);
            }
        }
        LOG.trace("Wrote {} entry: time={}, {} bytes", entry.severity(), entry.timeNanos(), record.length);
    }

    /**
     * Forces written entries to disk when sync is enabled; otherwise a no-op,
     * since writes are not buffered in process.
     */
    public synchronized void flush() {
        checkNotClosed();
        if (!syncEnabled) {
            return;
        }
        for (ActiveSegment segment : active.values()) {
            try {
                segment.created.channel().force(false);
            } catch (IOException e) {
                LOG.error("Failed to sync {}: {}", segment.created.path(), e.getMessage(), e);
                throw new LogStorageException("Failed to sync log segment " + segment.created.path(), e);
            }
        }
    }

    /** Path of the segment currently written for {@code severity}, if one is open. */
    public synchronized Optional<Path> currentSegment(Severity severity) {
        ActiveSegment segment = active.get(severity);
        return segment == null ? Optional.empty() : Optional.of(segment.created.path());
    }

    @Override
    public synchronized void close() {
        if (closed) {
            LOG.debug("Writer already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        for (ActiveSegment segment : active.values()) {
            closeQuietly(segment);
        }
        active.clear();
        LOG.info("Segment writer closed");
    }

    private ActiveSegment segmentFor(Severity severity, int recordLength) {
        ActiveSegment current = active.get(severity);
        Instant now = clock.instant();
        if (current != null && current.bytesWritten > 0
                && current.bytesWritten + recordLength > maxSegmentBytes) {
            String nextName = creator.names().nameFor(severity, now).fileName();
            if (current.created.path().getFileName().toString().equals(nextName)) {
                // names have second precision; keep appending until the clock moves on
                LOG.trace("Deferring {} rotation: {} would be reopened", severity, nextName);
                return current;
            }
            LOG.info("Rotating {} segment {} at {} bytes", severity, current.created.path(), current.bytesWritten);
            closeQuietly(current);
            active.remove(severity);
            current = null;
        }
        if (current == null) {
            current = new ActiveSegment(creator.create(severity, now));
            active.put(severity, current);
        }
        return current;
    }

    private static void closeQuietly(ActiveSegment segment) {
        try {
            segment.created.close();
        } catch (IOException e) {
            LOG.warn("Error closing segment {}: {}", segment.created.path(), e.getMessage());
        }
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("SegmentLogWriter is closed");
        }
    }

    private static final class ActiveSegment {
        private final CreatedSegment created;
        private long bytesWritten;

        ActiveSegment(CreatedSegment created) {
            this.created = created;
            try {
                // the name may collide with an existing file from the same second
                this.bytesWritten = created.channel().size();
            } catch (IOException e) {
                LOG.debug("Cannot size {}: {}", created.path(), e.getMessage());
                this.bytesWritten = 0;
            }
        }
    }
}
