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
package dev.mars.cowdb.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for cowdb storage and sessions.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dcowdb.lockTimeoutMs=5000})</li>
 *   <li>Environment variables (e.g., {@code COWDB_LOCK_TIMEOUT_MS})</li>
 *   <li>Properties file ({@code cowdb.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>syncEnabled</td><td>cowdb.syncEnabled</td><td>COWDB_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>lockTimeoutMs</td><td>cowdb.lockTimeoutMs</td><td>COWDB_LOCK_TIMEOUT_MS</td><td>30000</td></tr>
 *   <tr><td>maxRecordSizeMb</td><td>cowdb.maxRecordSizeMb</td><td>COWDB_MAX_RECORD_SIZE_MB</td><td>16</td></tr>
 *   <tr><td>releaseLockOnCommit</td><td>cowdb.releaseLockOnCommit</td><td>COWDB_RELEASE_LOCK_ON_COMMIT</td><td>true</td></tr>
 * </table>
 * <p>
 * A {@code lockTimeoutMs} of zero or less waits for the lock indefinitely.
 * With {@code releaseLockOnCommit=false} a session keeps the write lock across
 * commits until it is closed, so a caller can run several commits as one batch
 * without another writer interleaving.
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # cowdb.properties
 * cowdb.syncEnabled=true
 * cowdb.lockTimeoutMs=30000
 * cowdb.maxRecordSizeMb=16
 * cowdb.releaseLockOnCommit=true
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * StorageConfig config = StorageConfig.builder()
 *     .lockTimeoutMs(5_000)
 *     .releaseLockOnCommit(false)
 *     .build();
 *
 * try (CowDb&lt;String, String&gt; db = CowDb.connect(Path.of("data.cowdb"), config)) {
 *     ...
 * }
 * </pre>
 */
public final class StorageConfig {

    private static final Logger LOG = LoggerFactory.getLogger(StorageConfig.class);

    private static final String PROPERTIES_FILE = "cowdb.properties";

    // Property keys
    private static final String PROP_SYNC_ENABLED = "cowdb.syncEnabled";
    private static final String PROP_LOCK_TIMEOUT_MS = "cowdb.lockTimeoutMs";
    private static final String PROP_MAX_RECORD_SIZE_MB = "cowdb.maxRecordSizeMb";
    private static final String PROP_RELEASE_LOCK_ON_COMMIT = "cowdb.releaseLockOnCommit";

    // Environment variable keys
    private static final String ENV_SYNC_ENABLED = "COWDB_SYNC_ENABLED";
    private static final String ENV_LOCK_TIMEOUT_MS = "COWDB_LOCK_TIMEOUT_MS";
    private static final String ENV_MAX_RECORD_SIZE_MB = "COWDB_MAX_RECORD_SIZE_MB";
    private static final String ENV_RELEASE_LOCK_ON_COMMIT = "COWDB_RELEASE_LOCK_ON_COMMIT";

    // Defaults
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final long DEFAULT_LOCK_TIMEOUT_MS = 30_000L;
    private static final int DEFAULT_MAX_RECORD_SIZE_MB = 16;
    private static final boolean DEFAULT_RELEASE_LOCK_ON_COMMIT = true;

    private final boolean syncEnabled;
    private final long lockTimeoutMs;
    private final int maxRecordSizeMb;
    private final boolean releaseLockOnCommit;

    private StorageConfig(Builder builder) {
        this.syncEnabled = builder.syncEnabled;
        this.lockTimeoutMs = builder.lockTimeoutMs;
        this.maxRecordSizeMb = builder.maxRecordSizeMb;
        this.releaseLockOnCommit = builder.releaseLockOnCommit;
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** How long {@link Storage#lock()} waits before failing; zero or less waits forever. */
    public long lockTimeoutMs() {
        return lockTimeoutMs;
    }

    /** Maximum record payload size in MB. */
    public int maxRecordSizeMb() {
        return maxRecordSizeMb;
    }

    /** Maximum record payload size in bytes. */
    public int maxRecordSizeBytes() {
        return maxRecordSizeMb * 1024 * 1024;
    }

    /** Whether a session releases the write lock once a commit is published. */
    public boolean releaseLockOnCommit() {
        return releaseLockOnCommit;
    }

    @Override
    public String toString() {
        return "StorageConfig{" +
                "syncEnabled=" + syncEnabled +
                ", lockTimeoutMs=" + lockTimeoutMs +
                ", maxRecordSizeMb=" + maxRecordSizeMb +
                ", releaseLockOnCommit=" + releaseLockOnCommit +
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
     * Shorthand for {@code StorageConfig.builder().build()}.
     */
    public static StorageConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link StorageConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Boolean syncEnabled;
        private Long lockTimeoutMs;
        private Integer maxRecordSizeMb;
        private Boolean releaseLockOnCommit;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets the lock acquisition timeout in milliseconds (default: 30000). */
        public Builder lockTimeoutMs(long lockTimeoutMs) {
            this.lockTimeoutMs = lockTimeoutMs;
            return this;
        }

        /** Sets the maximum record payload size in MB (default: 16). */
        public Builder maxRecordSizeMb(int maxRecordSizeMb) {
            if (maxRecordSizeMb <= 0) {
                throw new IllegalArgumentException("maxRecordSizeMb must be positive: " + maxRecordSizeMb);
            }
            this.maxRecordSizeMb = maxRecordSizeMb;
            return this;
        }

        /** Sets whether the write lock is released after each commit (default: true). */
        public Builder releaseLockOnCommit(boolean releaseLockOnCommit) {
            this.releaseLockOnCommit = releaseLockOnCommit;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public StorageConfig build() {
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (lockTimeoutMs == null) {
                lockTimeoutMs = resolveLong(PROP_LOCK_TIMEOUT_MS, ENV_LOCK_TIMEOUT_MS, DEFAULT_LOCK_TIMEOUT_MS);
            }
            if (maxRecordSizeMb == null) {
                long resolved = resolveLong(PROP_MAX_RECORD_SIZE_MB, ENV_MAX_RECORD_SIZE_MB, DEFAULT_MAX_RECORD_SIZE_MB);
                if (resolved <= 0 || resolved > 1024) {
                    LOG.warn("Ignoring out-of-range maxRecordSizeMb={}, using {}", resolved, DEFAULT_MAX_RECORD_SIZE_MB);
                    resolved = DEFAULT_MAX_RECORD_SIZE_MB;
                }
                maxRecordSizeMb = (int) resolved;
            }
            if (releaseLockOnCommit == null) {
                releaseLockOnCommit = resolveBoolean(PROP_RELEASE_LOCK_ON_COMMIT, ENV_RELEASE_LOCK_ON_COMMIT,
                        DEFAULT_RELEASE_LOCK_ON_COMMIT);
            }

            return new StorageConfig(this);
        }

        private String lookup(String sysProp, String envVar, int source) {
            return switch (source) {
                case 0 -> System.getProperty(sysProp);
                case 1 -> System.getenv(envVar);
                default -> fileProperties.getProperty(sysProp);
            };
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            // sysprop > env > file
            for (int source = 0; source < 3; source++) {
                String value = lookup(sysProp, envVar, source);
                if (value != null && !value.isBlank()) {
                    return Boolean.parseBoolean(value.trim());
                }
            }
            return defaultValue;
        }

        private long resolveLong(String sysProp, String envVar, long defaultValue) {
            for (int source = 0; source < 3; source++) {
                String value = lookup(sysProp, envVar, source);
                if (value != null && !value.isBlank()) {
                    try {
                        return Long.parseLong(value.trim());
                    } catch (NumberFormatException e) {
                        LOG.warn("Ignoring unparseable value for {}: '{}'", sysProp, value);
                    }
                }
            }
            return defaultValue;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = StorageConfig.class.getClassLoader()
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
