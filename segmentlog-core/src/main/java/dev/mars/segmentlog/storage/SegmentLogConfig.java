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

import dev.mars.segmentlog.naming.ProcessIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Configuration for segment logging.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dsegmentlog.logDirs=/var/log/app})</li>
 *   <li>Environment variables (e.g., {@code SEGMENTLOG_LOG_DIRS})</li>
 *   <li>Properties file ({@code segmentlog.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>logDirs</td><td>segmentlog.logDirs</td><td>SEGMENTLOG_LOG_DIRS</td><td>java.io.tmpdir</td></tr>
 *   <tr><td>program</td><td>segmentlog.program</td><td>SEGMENTLOG_PROGRAM</td><td>segmentlog</td></tr>
 *   <tr><td>maxSegmentSizeMb</td><td>segmentlog.maxSegmentSizeMb</td><td>SEGMENTLOG_MAX_SEGMENT_SIZE_MB</td><td>1800</td></tr>
 *   <tr><td>entriesCutoff</td><td>segmentlog.entriesCutoff</td><td>SEGMENTLOG_ENTRIES_CUTOFF</td><td>100000</td></tr>
 *   <tr><td>syncEnabled</td><td>segmentlog.syncEnabled</td><td>SEGMENTLOG_SYNC_ENABLED</td><td>false</td></tr>
 * </table>
 * {@code logDirs} is a comma separated list in preference order.
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # segmentlog.properties
 * segmentlog.logDirs=/var/log/myapp,/tmp
 * segmentlog.program=myapp
 * segmentlog.maxSegmentSizeMb=512
 * segmentlog.entriesCutoff=50000
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * SegmentLogConfig config = SegmentLogConfig.builder()
 *     .logDirs(List.of(Path.of("/var/log/myapp")))
 *     .program("myapp")
 *     .build();
 *
 * try (SegmentLog log = new SegmentLog(config)) {
 *     log.append(LogEntry.of(System.currentTimeMillis() * 1_000_000L, Severity.INFO, "started"));
 * }
 * </pre>
 */
public final class SegmentLogConfig {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentLogConfig.class);

    private static final String PROPERTIES_FILE = "segmentlog.properties";

    // Property keys
    private static final String PROP_LOG_DIRS = "segmentlog.logDirs";
    private static final String PROP_PROGRAM = "segmentlog.program";
    private static final String PROP_MAX_SEGMENT_SIZE_MB = "segmentlog.maxSegmentSizeMb";
    private static final String PROP_ENTRIES_CUTOFF = "segmentlog.entriesCutoff";
    private static final String PROP_SYNC_ENABLED = "segmentlog.syncEnabled";

    // Environment variable keys
    private static final String ENV_LOG_DIRS = "SEGMENTLOG_LOG_DIRS";
    private static final String ENV_PROGRAM = "SEGMENTLOG_PROGRAM";
    private static final String ENV_MAX_SEGMENT_SIZE_MB = "SEGMENTLOG_MAX_SEGMENT_SIZE_MB";
    private static final String ENV_ENTRIES_CUTOFF = "SEGMENTLOG_ENTRIES_CUTOFF";
    private static final String ENV_SYNC_ENABLED = "SEGMENTLOG_SYNC_ENABLED";

    // Defaults
    private static final String DEFAULT_PROGRAM = "segmentlog";
    private static final int DEFAULT_MAX_SEGMENT_SIZE_MB = 1800;
    private static final int DEFAULT_ENTRIES_CUTOFF = 100_000;
    private static final boolean DEFAULT_SYNC_ENABLED = false;

    private final List<Path> logDirs;
    private final String program;
    private final ProcessIdentity identity;
    private final int maxSegmentSizeMb;
    private final int entriesCutoff;
    private final boolean syncEnabled;

    private SegmentLogConfig(Builder builder) {
        this.logDirs = List.copyOf(builder.logDirs);
        this.program = builder.program;
        this.identity = builder.identity;
        this.maxSegmentSizeMb = builder.maxSegmentSizeMb;
        this.entriesCutoff = builder.entriesCutoff;
        this.syncEnabled = builder.syncEnabled;
    }

    /** Candidate log directories in preference order. */
    public List<Path> logDirs() {
        return logDirs;
    }

    /** Program name written into file and symlink names. */
    public String program() {
        return program;
    }

    /** Identity written into file names. */
    public ProcessIdentity identity() {
        return identity;
    }

    /** Segment size in MB at which the writer rotates to a new segment. */
    public int maxSegmentSizeMb() {
        return maxSegmentSizeMb;
    }

    /** Segment size in bytes at which the writer rotates to a new segment. */
    public long maxSegmentSizeBytes() {
        return (long) maxSegmentSizeMb * 1024 * 1024;
    }

    /** Number of entries after which a fetch stops opening older segments. */
    public int entriesCutoff() {
        return entriesCutoff;
    }

    /** Whether {@code flush()} also fsyncs segments. */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    @Override
    public String toString() {
        return "SegmentLogConfig{" +
                "logDirs=" + logDirs +
                ", program=" + program +
                ", identity=" + identity +
                ", maxSegmentSizeMb=" + maxSegmentSizeMb +
                ", entriesCutoff=" + entriesCutoff +
                ", syncEnabled=" + syncEnabled +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code SegmentLogConfig.builder().build()}.
     */
    public static SegmentLogConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link SegmentLogConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private List<Path> logDirs;
        private String program;
        private ProcessIdentity identity;
        private Integer maxSegmentSizeMb;
        private Integer entriesCutoff;
        private Boolean syncEnabled;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the candidate log directories, in preference order. */
        public Builder logDirs(List<Path> logDirs) {
            this.logDirs = new ArrayList<>(logDirs);
            return this;
        }

        /** Sets a single log directory. */
        public Builder logDir(Path logDir) {
            return logDirs(List.of(logDir));
        }

        /** Sets the program name (ignored when an explicit identity is set). */
        public Builder program(String program) {
            this.program = program;
            return this;
        }

        /** Sets the full process identity instead of resolving it from the running JVM. */
        public Builder identity(ProcessIdentity identity) {
            this.identity = identity;
            return this;
        }

        /** Sets the rotation size in MB (default: 1800). */
        public Builder maxSegmentSizeMb(int maxSegmentSizeMb) {
            this.maxSegmentSizeMb = maxSegmentSizeMb;
            return this;
        }

        /** Sets the fetch entry cutoff (default: 100000). */
        public Builder entriesCutoff(int entriesCutoff) {
            this.entriesCutoff = entriesCutoff;
            return this;
        }

        /** Enables or disables fsync on flush (default: false). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public SegmentLogConfig build() {
            if (logDirs == null) {
                logDirs = resolvePaths(PROP_LOG_DIRS, ENV_LOG_DIRS,
                        List.of(Path.of(System.getProperty("java.io.tmpdir"))));
            }
            if (identity != null) {
                program = identity.program();
            } else {
                if (program == null) {
                    program = resolveString(PROP_PROGRAM, ENV_PROGRAM, DEFAULT_PROGRAM);
                }
                identity = ProcessIdentity.current(program);
            }
            if (maxSegmentSizeMb == null) {
                maxSegmentSizeMb = resolveInt(PROP_MAX_SEGMENT_SIZE_MB, ENV_MAX_SEGMENT_SIZE_MB,
                        DEFAULT_MAX_SEGMENT_SIZE_MB);
            }
            if (entriesCutoff == null) {
                entriesCutoff = resolveInt(PROP_ENTRIES_CUTOFF, ENV_ENTRIES_CUTOFF, DEFAULT_ENTRIES_CUTOFF);
            }
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }

            if (maxSegmentSizeMb <= 0) {
                throw new IllegalArgumentException("maxSegmentSizeMb must be positive: " + maxSegmentSizeMb);
            }
            if (entriesCutoff <= 0) {
                throw new IllegalArgumentException("entriesCutoff must be positive: " + entriesCutoff);
            }
            return new SegmentLogConfig(this);
        }

        /** Returns the first non-blank value from system property, environment, then file. */
        private String lookup(String sysProp, String envVar) {
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value;
            }
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }
            return null;
        }

        private List<Path> resolvePaths(String sysProp, String envVar, List<Path> defaultValue) {
            String value = lookup(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            List<Path> paths = new ArrayList<>();
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    paths.add(Path.of(part.trim()));
                }
            }
            return paths.isEmpty() ? defaultValue : paths;
        }

        private String resolveString(String sysProp, String envVar, String defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? value.trim() : defaultValue;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = lookup(sysProp, envVar);
            if (value != null) {
                try {
                    return Integer.parseInt(value.trim());
                } catch (NumberFormatException e) {
                    LOG.warn("Ignoring non-numeric {}='{}', using default {}", sysProp, value, defaultValue);
                }
            }
            return defaultValue;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = SegmentLogConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
