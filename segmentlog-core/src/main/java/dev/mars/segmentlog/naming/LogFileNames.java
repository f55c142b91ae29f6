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
package dev.mars.segmentlog.naming;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes and decodes log segment file names.
 * <p>
 * <b>Grammar:</b>
 * <pre>
 * {program}.{host}.{user}.log.{SEVERITY}.{timestamp}.{pid}
 * </pre>
 * <ul>
 *   <li>Identity fields are escaped: every {@code _} is doubled, then every {@code .}
 *       becomes a single {@code _}. The escaped text never contains the separator.</li>
 *   <li>{@code SEVERITY} is a {@link Severity} constant name.</li>
 *   <li>{@code timestamp} is {@code yyyy-MM-dd'T'HH:mm:ssXXX} in UTC with every
 *       {@code :} replaced by {@code _} (colons are not allowed on some filesystems).</li>
 *   <li>{@code pid} is a decimal integer.</li>
 * </ul>
 * The companion symlink is {@code {program}.{SEVERITY}} with the program name unescaped.
 * <p>
 * <b>Round trip:</b> for every name this class produces,
 * {@code nameFor(parse(name))} yields the same name.
 */
public final class LogFileNames {

    /** Literal token between the identity fields and the severity. */
    public static final String LOG_TOKEN = "log";

    private static final Pattern FILE_NAME = Pattern.compile(
            "([^.]+)\\.([^.]+)\\.([^.]+)\\." + LOG_TOKEN + "\\.([^.]+)\\.([^.]+)\\.(\\d+)");

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssXXX").withResolverStyle(ResolverStyle.STRICT);

    private final ProcessIdentity identity;
    private final String escapedPrefix;

    /**
     * @param identity the identity written into every name this instance produces
     */
    public LogFileNames(ProcessIdentity identity) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.escapedPrefix = escape(identity.program()) + "." +
                escape(identity.host()) + "." +
                escape(identity.userName()) + "." + LOG_TOKEN + ".";
    }

    public ProcessIdentity identity() {
        return identity;
    }

    /**
     * Returns the file name for a new segment of {@code severity} created at {@code time},
     * together with the symlink name for that severity.
     * <p>
     * Sub-second precision of {@code time} is dropped.
     */
    public SegmentName nameFor(Severity severity, Instant time) {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(time, "time");
        String fileName = escapedPrefix + severity.name() + "." + formatTime(time) + "." + identity.pid();
        return new SegmentName(fileName, symlinkName(severity));
    }

    /** Name of the "latest" symlink for {@code severity}. */
    public String symlinkName(Severity severity) {
        return identity.program() + "." + severity.name();
    }

    /**
     * Encodes a name from decoded details, using the details' own identity.
     */
    public static String fileName(FileDetails details) {
        return new LogFileNames(details.identity()).nameFor(details.severity(), details.time()).fileName();
    }

    /**
     * Decodes a file name.
     * <p>
     * Never throws on malformed input.
     *
     * @param fileName a bare file name
     * @return the decoded details, or empty if the name is not a log file name
     */
    public static Optional<FileDetails> parse(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher m = FILE_NAME.matcher(fileName);
        if (!m.matches()) {
            return Optional.empty();
        }

        Optional<Severity> severity = Severity.fromName(m.group(4));
        if (severity.isEmpty()) {
            return Optional.empty();
        }

        Optional<Instant> time = parseTime(m.group(5));
        if (time.isEmpty()) {
            return Optional.empty();
        }

        long pid;
        try {
            pid = Long.parseLong(m.group(6));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        return Optional.of(new FileDetails(
                unescape(m.group(1)),
                unescape(m.group(2)),
                unescape(m.group(3)),
                severity.get(),
                time.get(),
                pid));
    }

    /** True if {@code fileName} decodes as a log file name. */
    public static boolean isLogFileName(String fileName) {
        return parse(fileName).isPresent();
    }

    /**
     * Doubles every underscore, then replaces every period with an underscore.
     */
    static String escape(String s) {
        return s.replace("_", "__").replace(".", "_");
    }

    /**
     * Reverses {@link #escape(String)}, scanning left to right: {@code __} is an
     * underscore and a lone {@code _} is a period.
     * <p>
     * Underscore runs are consumed in pairs first, so re-escaping the result
     * always reproduces the input.
     */
    static String unescape(String s) {
        if (s.indexOf('_') < 0) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c != '_') {
                sb.append(c);
                i++;
            } else if (i + 1 < s.length() && s.charAt(i + 1) == '_') {
                sb.append('_');
                i += 2;
            } else {
                sb.append('.');
                i++;
            }
        }
        return sb.toString();
    }

    static String formatTime(Instant time) {
        OffsetDateTime utc = time.truncatedTo(ChronoUnit.SECONDS).atOffset(ZoneOffset.UTC);
        return TIME_FORMAT.format(utc).replace(':', '_');
    }

    static Optional<Instant> parseTime(String token) {
        try {
            return Optional.of(OffsetDateTime.parse(token.replace('_', ':'), TIME_FORMAT).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
