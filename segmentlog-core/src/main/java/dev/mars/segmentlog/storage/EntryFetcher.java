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

import dev.mars.segmentlog.entry.EntryDecoder;
import dev.mars.segmentlog.entry.EntryDecoderFactory;
import dev.mars.segmentlog.entry.LogEntry;
import dev.mars.segmentlog.naming.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reconstructs a time-ordered view of log entries across rotated segments.
 * <p>
 * Algorithm:
 * <ol>
 *   <li>List all log files; keep those whose severity equals the requested one and
 *       whose creation time is at or before the end of the window.</li>
 *   <li>Find the boundary: the latest creation time at or before the start of the
 *       window. Segments created before it cannot hold entries in the window.</li>
 *   <li>Read segments newest first, keeping entries inside {@code [start, end]}.</li>
 *   <li>Stop once the entry cutoff is reached, or once the boundary segments are read.</li>
 * </ol>
 * A segment's creation time is a lower bound for the entries in it; nothing else about
 * the files is assumed.
 * <p>
 * <b>All or nothing:</b> a listing, open or decode failure fails the whole fetch and
 * no partial result is returned.
 * <p>
 * <b>Thread Safety:</b> stateless apart from configuration; each call opens and closes
 * its own files. The newest segment may be appended to while it is read, in which case
 * entries written after the read reached them are simply not returned.
 */
public final class EntryFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(EntryFetcher.class);

    private static final Comparator<LogFileInfo> NEWEST_FIRST =
            Comparator.comparingLong((LogFileInfo f) -> f.details().timeNanos())
                    .thenComparing(LogFileInfo::name)
                    .reversed();

    private final LogFileLister lister;
    private final EntryDecoderFactory decoders;
    private final int entriesCutoff;

    /**
     * @param lister        source of candidate files
     * @param decoders      opens a decoder per file
     * @param entriesCutoff maximum number of entries a fetch returns
     */
    public EntryFetcher(LogFileLister lister, EntryDecoderFactory decoders, int entriesCutoff) {
        if (entriesCutoff <= 0) {
            throw new IllegalArgumentException("entriesCutoff must be positive: " + entriesCutoff);
        }
        this.lister = Objects.requireNonNull(lister, "lister");
        this.decoders = Objects.requireNonNull(decoders, "decoders");
        this.entriesCutoff = entriesCutoff;
    }

    public int entriesCutoff() {
        return entriesCutoff;
    }

    /**
     * Fetches the entries of one severity stream within a time window.
     * <p>
     * Segment selection matches the file severity exactly. Each severity stream
     * already contains every entry at that severity or worse when written by
     * {@link SegmentLogWriter}.
     *
     * @param severity       severity of the stream to read
     * @param startTimeNanos start of the window, inclusive
     * @param endTimeNanos   end of the window, inclusive
     * @return at most {@link #entriesCutoff()} of the most recent entries in the window,
     *         oldest first; empty if no segment matches
     * @throws LogStorageException if listing, opening or decoding any segment fails
     */
    public List<LogEntry> fetch(Severity severity, long startTimeNanos, long endTimeNanos) {
        Objects.requireNonNull(severity, "severity");
        if (startTimeNanos > endTimeNanos) {
            LOG.debug("Empty window: start={} > end={}", startTimeNanos, endTimeNanos);
            return List.of();
        }

        List<LogFileInfo> segments = new ArrayList<>();
        boolean hasBoundary = false;
        long boundaryNanos = Long.MIN_VALUE;
        for (LogFileInfo file : lister.list()) {
            if (file.details().severity() != severity) {
                continue;
            }
            long created = file.details().timeNanos();
            if (created > endTimeNanos) {
                continue;
            }
            segments.add(file);
            if (created <= startTimeNanos && (!hasBoundary || created > boundaryNanos)) {
                boundaryNanos = created;
                hasBoundary = true;
            }
        }

        if (segments.isEmpty()) {
            LOG.debug("No {} segments created at or before {}", severity, endTimeNanos);
            return List.of();
        }

        segments.sort(NEWEST_FIRST);
        List<LogEntry> newestFirst = new ArrayList<>();
        int scanned = 0;
        for (LogFileInfo segment : segments) {
            if (hasBoundary && segment.details().timeNanos() < boundaryNanos) {
                // older than the boundary segment: nothing at or after the window start
                break;
            }
            newestFirst.addAll(readSegment(segment, startTimeNanos, endTimeNanos));
            scanned++;
            if (newestFirst.size() >= entriesCutoff) {
                LOG.debug("Entry cutoff {} reached after {} segments", entriesCutoff, scanned);
                break;
            }
        }

        List<LogEntry> result = newestFirst.size() > entriesCutoff
                ? new ArrayList<>(newestFirst.subList(0, entriesCutoff))
                : newestFirst;
        Collections.reverse(result);
        // stable: entries sharing a timestamp keep their file order
        result.sort(Comparator.comparingLong(LogEntry::timeNanos));

        LOG.info("Fetched {} {} entries in [{}, {}] from {} of {} candidate segments",
                result.size(), severity, startTimeNanos, endTimeNanos, scanned, segments.size());
        return result;
    }

    /**
     * Reads every entry of one segment that falls inside the window.
     *
     * @return the kept entries, newest first
     */
    private List<LogEntry> readSegment(LogFileInfo segment, long startTimeNanos, long endTimeNanos) {
        Deque<LogEntry> kept = new ArrayDeque<>();
        int decoded = 0;
        try (InputStream in = Files.newInputStream(segment.path());
             EntryDecoder decoder = decoders.open(in)) {
            Optional<LogEntry> next;
            while ((next = decoder.next()).isPresent()) {
                LogEntry entry = next.get();
                decoded++;
                if (entry.timeNanos() >= startTimeNanos && entry.timeNanos() <= endTimeNanos) {
                    kept.addFirst(entry);
                }
            }
        } catch (IOException e) {
            LOG.error("Failed to read log segment {}: {}", segment.path(), e.getMessage(), e);
            throw new LogStorageException("Failed to read log segment " + segment.path(), e);
        }
        LOG.trace("Read segment {}: {} decoded, {} in window", segment.name(), decoded, kept.size());
        return new ArrayList<>(kept);
    }
}
