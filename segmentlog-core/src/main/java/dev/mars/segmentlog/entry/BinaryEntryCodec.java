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
package dev.mars.segmentlog.entry;

import dev.mars.segmentlog.naming.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.CRC32C;

/**
 * Default binary entry format.
 * <p>
 * <b>Record Format (big-endian):</b>
 * <pre>
 * MAGIC(4) VERSION(2) SEVERITY(1) TIME_NANOS(8) LINE(4) FILE_LEN(4) MESSAGE_LEN(4)
 * FILE(FILE_LEN, UTF-8) MESSAGE(MESSAGE_LEN, UTF-8) CRC32C(4)
 * </pre>
 * The CRC covers the header and both variable-length fields.
 * <p>
 * <b>Reading:</b>
 * <ul>
 *   <li>EOF on a record boundary is the end of data.</li>
 *   <li>EOF inside a record is also the end of data. The newest segment may
 *       still be appended to while it is read, so a short tail is expected.</li>
 *   <li>A bad magic number, version, severity, length or CRC is corruption
 *       and raises {@link CorruptEntryException}.</li>
 * </ul>
 */
public final class BinaryEntryCodec implements EntryEncoder, EntryDecoderFactory {

    private static final Logger LOG = LoggerFactory.getLogger(BinaryEntryCodec.class);

    /** Magic number: 'SLOG' in ASCII */
    static final int MAGIC = 0x534C4F47;

    /** Record format version */
    static final short VERSION = 1;

    /** Header size: MAGIC(4) + VERSION(2) + SEVERITY(1) + TIME(8) + LINE(4) + FILE_LEN(4) + MESSAGE_LEN(4) */
    static final int HEADER_SIZE = 4 + 2 + 1 + 8 + 4 + 4 + 4;

    /** CRC size */
    static final int CRC_SIZE = 4;

    /** Upper bound on FILE_LEN + MESSAGE_LEN */
    static final int MAX_BODY_SIZE = 16 * 1024 * 1024;

    @Override
    public byte[] encode(LogEntry entry) {
        Objects.requireNonNull(entry, "entry");
        byte[] file = entry.file().getBytes(StandardCharsets.UTF_8);
        byte[] message = entry.message().getBytes(StandardCharsets.UTF_8);
        if ((long) file.length + message.length > MAX_BODY_SIZE) {
            throw new IllegalArgumentException("Entry too large: " + (file.length + message.length) +
                    " bytes (max: " + MAX_BODY_SIZE + ")");
        }

        int recordSize = HEADER_SIZE + file.length + message.length + CRC_SIZE;
        ByteBuffer buf = ByteBuffer.allocate(recordSize);
        buf.putInt(MAGIC);
        buf.putShort(VERSION);
        buf.put((byte) entry.severity().code());
        buf.putLong(entry.timeNanos());
        buf.putInt(entry.line());
        buf.putInt(file.length);
        buf.putInt(message.length);
        buf.put(file);
        buf.put(message);

        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, recordSize - CRC_SIZE);
        buf.putInt((int) crc.getValue());
        return buf.array();
    }

    @Override
    public EntryDecoder open(InputStream in) {
        return new Decoder(in);
    }

    /**
     * Sequential decoder over one stream.
     * Not thread-safe.
     */
    private static final class Decoder implements EntryDecoder {
        private final InputStream in;
        private long position = 0;
        private boolean exhausted = false;

        Decoder(InputStream in) {
            this.in = new BufferedInputStream(Objects.requireNonNull(in, "in"));
        }

        @Override
        public Optional<LogEntry> next() throws IOException {
            if (exhausted) {
                return Optional.empty();
            }

            byte[] header = in.readNBytes(HEADER_SIZE);
            if (header.length == 0) {
                return end();
            }
            if (header.length < HEADER_SIZE) {
                return tornTail("header", header.length, HEADER_SIZE);
            }

            ByteBuffer hb = ByteBuffer.wrap(header);
            int magic = hb.getInt();
            short version = hb.getShort();
            int severityCode = hb.get();
            long timeNanos = hb.getLong();
            int line = hb.getInt();
            int fileLen = hb.getInt();
            int messageLen = hb.getInt();

            if (magic != MAGIC || version != VERSION) {
                throw corrupt("invalid header: magic=0x" + Integer.toHexString(magic) + ", version=" + version);
            }
            Optional<Severity> severity = Severity.fromCode(severityCode);
            if (severity.isEmpty()) {
                throw corrupt("unknown severity code " + severityCode);
            }
            if (fileLen < 0 || messageLen < 0 || (long) fileLen + messageLen > MAX_BODY_SIZE) {
                throw corrupt("invalid lengths: file=" + fileLen + ", message=" + messageLen);
            }

            int bodyLen = fileLen + messageLen;
            byte[] body = in.readNBytes(bodyLen);
            if (body.length < bodyLen) {
                return tornTail("body", body.length, bodyLen);
            }
            byte[] crcBytes = in.readNBytes(CRC_SIZE);
            if (crcBytes.length < CRC_SIZE) {
                return tornTail("CRC", crcBytes.length, CRC_SIZE);
            }

            CRC32C crc = new CRC32C();
            crc.update(header);
            crc.update(body);
            int expectedCrc = ByteBuffer.wrap(crcBytes).getInt();
            if ((int) crc.getValue() != expectedCrc) {
                throw corrupt("CRC mismatch: expected=" + expectedCrc + ", computed=" + (int) crc.getValue());
            }

            LogEntry entry = new LogEntry(
                    timeNanos,
                    severity.get(),
                    new String(body, 0, fileLen, StandardCharsets.UTF_8),
                    line,
                    new String(body, fileLen, messageLen, StandardCharsets.UTF_8));
            LOG.trace("Decoded entry at pos {}: time={}, severity={}", position, timeNanos, entry.severity());
            position += HEADER_SIZE + bodyLen + CRC_SIZE;
            return Optional.of(entry);
        }

        @Override
        public void close() throws IOException {
            in.close();
        }

        private Optional<LogEntry> end() {
            exhausted = true;
            return Optional.empty();
        }

        private Optional<LogEntry> tornTail(String part, int read, int expected) {
            LOG.debug("Incomplete {} at pos {}: read {} bytes, expected {}; treating as end of data",
                    part, position, read, expected);
            return end();
        }

        private CorruptEntryException corrupt(String reason) {
            exhausted = true;
            return new CorruptEntryException("Corrupt entry at pos " + position + ": " + reason);
        }
    }
}
