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
package dev.mars.tracelog.storage;

import dev.mars.tracelog.gate.FeatureGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration for the investigation store.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dtracelog.maxEntries=1000})</li>
 *   <li>Environment variables (e.g., {@code TRACELOG_MAX_ENTRIES})</li>
 *   <li>Properties file ({@code tracelog.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 * The persisted {@code enabled} flag is never read from the environment:
 * {@code TRACELOG_ENABLED} is the runtime override handled by
 * {@link dev.mars.tracelog.gate.FeatureGate}.
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>enabled</td><td>tracelog.enabled</td><td>-</td><td>true</td></tr>
 *   <tr><td>investigationsPath</td><td>tracelog.investigationsPath</td><td>TRACELOG_INVESTIGATIONS_PATH</td><td>data/live/investigations.jsonl</td></tr>
 *   <tr><td>maxEntries</td><td>tracelog.maxEntries</td><td>TRACELOG_MAX_ENTRIES</td><td>500</td></tr>
 *   <tr><td>retentionDays</td><td>tracelog.retentionDays</td><td>TRACELOG_RETENTION_DAYS</td><td>30</td></tr>
 *   <tr><td>maxFileBytes</td><td>tracelog.maxFileBytes</td><td>TRACELOG_MAX_FILE_BYTES</td><td>5242880</td></tr>
 *   <tr><td>tenantScopingRequired</td><td>tracelog.tenantScopingRequired</td><td>TRACELOG_TENANT_SCOPING_REQUIRED</td><td>true</td></tr>
 *   <tr><td>defaultTenantId</td><td>tracelog.defaultTenantId</td><td>TRACELOG_DEFAULT_TENANT_ID</td><td>default</td></tr>
 *   <tr><td>syncEnabled</td><td>tracelog.syncEnabled</td><td>TRACELOG_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>tracelog.minFreeSpaceMb</td><td>TRACELOG_MIN_FREE_SPACE_MB</td><td>16</td></tr>
 *   <tr><td>maxRecordBytes</td><td>tracelog.maxRecordBytes</td><td>TRACELOG_MAX_RECORD_BYTES</td><td>1048576</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # tracelog.properties
 * tracelog.enabled=true
 * tracelog.investigationsPath=/var/lib/tracelog/investigations.jsonl
 * tracelog.maxEntries=500
 * tracelog.retentionDays=30
 * tracelog.maxFileBytes=5242880
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * InvestigationStoreConfig config = InvestigationStoreConfig.builder()
 *     .investigationsPath(Path.of("/var/lib/tracelog/investigations.jsonl"))
 *     .maxEntries(1000)
 *     .retentionDays(14)
 *     .build();
 *
 * try (FileInvestigationStore store = new FileInvestigationStore(config)) {
 *     store.open().join();
 * }
 * </pre>
 */
public final class InvestigationStoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(InvestigationStoreConfig.class);

    private static final String PROPERTIES_FILE = "tracelog.properties";

    // Property keys
    private static final String PROP_ENABLED = "tracelog.enabled";
    private static final String PROP_INVESTIGATIONS_PATH = "tracelog.investigationsPath";
    private static final String PROP_MAX_ENTRIES = "tracelog.maxEntries";
    private static final String PROP_RETENTION_DAYS = "tracelog.retentionDays";
    private static final String PROP_MAX_FILE_BYTES = "tracelog.maxFileBytes";
    private static final String PROP_TENANT_SCOPING_REQUIRED = "tracelog.tenantScopingRequired";
    private static final String PROP_DEFAULT_TENANT_ID = "tracelog.defaultTenantId";
    private static final String PROP_SYNC_ENABLED = "tracelog.syncEnabled";
    private static final String PROP_MIN_FREE_SPACE_MB = "tracelog.minFreeSpaceMb";
    private static final String PROP_MAX_RECORD_BYTES = "tracelog.maxRecordBytes";

    // Environment variable keys
    private static final String ENV_INVESTIGATIONS_PATH = "TRACELOG_INVESTIGATIONS_PATH";
    private static final String ENV_MAX_ENTRIES = "TRACELOG_MAX_ENTRIES";
    private static final String ENV_RETENTION_DAYS = "TRACELOG_RETENTION_DAYS";
    private static final String ENV_MAX_FILE_BYTES = "TRACELOG_MAX_FILE_BYTES";
    private static final String ENV_TENANT_SCOPING_REQUIRED = "TRACELOG_TENANT_SCOPING_REQUIRED";
    private static final String ENV_DEFAULT_TENANT_ID = "TRACELOG_DEFAULT_TENANT_ID";
    private static final String ENV_SYNC_ENABLED = "TRACELOG_SYNC_ENABLED";
    private static final String ENV_MIN_FREE_SPACE_MB = "TRACELOG_MIN_FREE_SPACE_MB";
    private static final String ENV_MAX_RECORD_BYTES = "TRACELOG_MAX_RECORD_BYTES";

    // Defaults
    private static final boolean DEFAULT_ENABLED = true;
    private static final Path DEFAULT_INVESTIGATIONS_PATH = Path.of("data", "live", "investigations.jsonl");
    private static final int DEFAULT_MAX_ENTRIES = 500;
    private static final int DEFAULT_RETENTION_DAYS = 30;
    private static final long DEFAULT_MAX_FILE_BYTES = 5L * 1024 * 1024;
    private static final boolean DEFAULT_TENANT_SCOPING_REQUIRED = true;
    private static final String DEFAULT_TENANT_ID = "default";
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 16;
    private static final int DEFAULT_MAX_RECORD_BYTES = 1024 * 1024;

    private final boolean enabled;
    private final Path investigationsPath;
    private final int maxEntries;
    private final int retentionDays;
    private final long maxFileBytes;
    private final boolean tenantScopingRequired;
    private final String defaultTenantId;
    private final boolean syncEnabled;
    private final int minFreeSpaceMb;
    private final int maxRecordBytes;

    private InvestigationStoreConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.investigationsPath = builder.investigationsPath;
        this.maxEntries = builder.maxEntries;
        this.retentionDays = builder.retentionDays;
        this.maxFileBytes = builder.maxFileBytes;
        this.tenantScopingRequired = builder.tenantScopingRequired;
        this.defaultTenantId = builder.defaultTenantId;
        this.syncEnabled = builder.syncEnabled;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
        this.maxRecordBytes = builder.maxRecordBytes;
    }

    /** Persisted enabled flag (may be overridden at runtime). */
    public boolean enabled() {
        return enabled;
    }

    /** Location of the active NDJSON log; archives and the lock file live beside it. */
    public Path investigationsPath() {
        return investigationsPath;
    }

    /** Maximum number of live records; the oldest is evicted first. */
    public int maxEntries() {
        return maxEntries;
    }

    /** Age limit in days; 0 disables age-based expiry. */
    public int retentionDays() {
        return retentionDays;
    }

    /** Size at which the active log is rotated. */
    public long maxFileBytes() {
        return maxFileBytes;
    }

    /** Whether reads must name a tenant unless the caller is administrative. */
    public boolean tenantScopingRequired() {
        return tenantScopingRequired;
    }

    /**
     * Tenant stamped on records submitted without one. Only used when tenant scoping
     * is not required; returns null otherwise.
     */
    public String defaultTenantId() {
        return tenantScopingRequired ? null : defaultTenantId;
    }

    /** Whether each append is forced to disk before it completes. */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Minimum free disk space in MB required before writes; 0 disables the check. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    /** Maximum serialized size of one record line. */
    public int maxRecordBytes() {
        return maxRecordBytes;
    }

    @Override
    public String toString() {
        return "InvestigationStoreConfig{" +
                "enabled=" + enabled +
                ", investigationsPath=" + investigationsPath +
                ", maxEntries=" + maxEntries +
                ", retentionDays=" + retentionDays +
                ", maxFileBytes=" + maxFileBytes +
                ", tenantScopingRequired=" + tenantScopingRequired +
                ", defaultTenantId=" + defaultTenantId +
                ", syncEnabled=" + syncEnabled +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", maxRecordBytes=" + maxRecordBytes +
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
     * Shorthand for {@code InvestigationStoreConfig.builder().build()}.
     */
    public static InvestigationStoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link InvestigationStoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Boolean enabled;
        private Path investigationsPath;
        private Integer maxEntries;
        private Integer retentionDays;
        private Long maxFileBytes;
        private Boolean tenantScopingRequired;
        private String defaultTenantId;
        private Boolean syncEnabled;
        private Integer minFreeSpaceMb;
        private Integer maxRecordBytes;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the persisted enabled flag (default: true). */
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /** Sets the active log location. */
        public Builder investigationsPath(Path investigationsPath) {
            this.investigationsPath = investigationsPath;
            return this;
        }

        /** Sets the active log location from a string path. */
        public Builder investigationsPath(String investigationsPath) {
            this.investigationsPath = Path.of(investigationsPath);
            return this;
        }

        /** Sets the live record cap (default: 500). */
        public Builder maxEntries(int maxEntries) {
            if (maxEntries < 1) {
                throw new IllegalArgumentException("maxEntries must be >= 1, was " + maxEntries);
            }
            this.maxEntries = maxEntries;
            return this;
        }

        /** Sets the retention window in days, 0 to disable (default: 30). */
        public Builder retentionDays(int retentionDays) {
            if (retentionDays < 0) {
                throw new IllegalArgumentException("retentionDays must be >= 0, was " + retentionDays);
            }
            this.retentionDays = retentionDays;
            return this;
        }

        /** Sets the rotation threshold in bytes (default: 5 MiB). */
        public Builder maxFileBytes(long maxFileBytes) {
            if (maxFileBytes < 1) {
                throw new IllegalArgumentException("maxFileBytes must be >= 1, was " + maxFileBytes);
            }
            this.maxFileBytes = maxFileBytes;
            return this;
        }

        /** Requires a tenant on every non-administrative read (default: true). */
        public Builder tenantScopingRequired(boolean tenantScopingRequired) {
            this.tenantScopingRequired = tenantScopingRequired;
            return this;
        }

        /** Sets the tenant used when scoping is not required (default: "default"). */
        public Builder defaultTenantId(String defaultTenantId) {
            if (defaultTenantId == null || defaultTenantId.isBlank()) {
                throw new IllegalArgumentException("defaultTenantId must not be blank");
            }
            this.defaultTenantId = defaultTenantId;
            return this;
        }

        /** Enables or disables fsync per append (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets minimum free disk space in MB, 0 to disable (default: 16). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            if (minFreeSpaceMb < 0) {
                throw new IllegalArgumentException("minFreeSpaceMb must be >= 0, was " + minFreeSpaceMb);
            }
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /** Sets the maximum serialized record size in bytes (default: 1 MiB). */
        public Builder maxRecordBytes(int maxRecordBytes) {
            if (maxRecordBytes < 1) {
                throw new IllegalArgumentException("maxRecordBytes must be >= 1, was " + maxRecordBytes);
            }
            this.maxRecordBytes = maxRecordBytes;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public InvestigationStoreConfig build() {
            if (enabled == null) {
                enabled = resolveBoolean(PROP_ENABLED, null, DEFAULT_ENABLED);
            }
            if (investigationsPath == null) {
                investigationsPath = Path.of(resolveString(PROP_INVESTIGATIONS_PATH, ENV_INVESTIGATIONS_PATH,
                        DEFAULT_INVESTIGATIONS_PATH.toString()));
            }
            if (maxEntries == null) {
                maxEntries = resolveInt(PROP_MAX_ENTRIES, ENV_MAX_ENTRIES, DEFAULT_MAX_ENTRIES, 1);
            }
            if (retentionDays == null) {
                retentionDays = resolveInt(PROP_RETENTION_DAYS, ENV_RETENTION_DAYS, DEFAULT_RETENTION_DAYS, 0);
            }
            if (maxFileBytes == null) {
                maxFileBytes = resolveLong(PROP_MAX_FILE_BYTES, ENV_MAX_FILE_BYTES, DEFAULT_MAX_FILE_BYTES, 1);
            }
            if (tenantScopingRequired == null) {
                tenantScopingRequired = resolveBoolean(PROP_TENANT_SCOPING_REQUIRED, ENV_TENANT_SCOPING_REQUIRED,
                        DEFAULT_TENANT_SCOPING_REQUIRED);
            }
            if (defaultTenantId == null) {
                defaultTenantId = resolveString(PROP_DEFAULT_TENANT_ID, ENV_DEFAULT_TENANT_ID, DEFAULT_TENANT_ID);
            }
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolveInt(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB,
                        DEFAULT_MIN_FREE_SPACE_MB, 0);
            }
            if (maxRecordBytes == null) {
                maxRecordBytes = resolveInt(PROP_MAX_RECORD_BYTES, ENV_MAX_RECORD_BYTES,
                        DEFAULT_MAX_RECORD_BYTES, 1);
            }

            return new InvestigationStoreConfig(this);
        }

        /**
         * Returns the first non-blank value from system property, environment
         * variable (when {@code envVar} is non-null), then properties file.
         */
        private String lookup(String sysProp, String envVar) {
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            if (envVar != null) {
                value = System.getenv(envVar);
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            return null;
        }

        private String resolveString(String sysProp, String envVar, String defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? value : defaultValue;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = lookup(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            Optional<Boolean> parsed = FeatureGate.parseFlag(value);
            if (parsed.isEmpty()) {
                LOG.warn("Ignoring {}={}: not a boolean, using default {}", sysProp, value, defaultValue);
                return defaultValue;
            }
            return parsed.get();
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue, int minimum) {
            return (int) resolveLong(sysProp, envVar, defaultValue, minimum, Integer.MAX_VALUE);
        }

        private long resolveLong(String sysProp, String envVar, long defaultValue, long minimum) {
            return resolveLong(sysProp, envVar, defaultValue, minimum, Long.MAX_VALUE);
        }

        private long resolveLong(String sysProp, String envVar, long defaultValue, long minimum, long maximum) {
            String value = lookup(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                long parsed = Long.parseLong(value);
                if (parsed < minimum || parsed > maximum) {
                    LOG.warn("Ignoring {}={}: must be between {} and {}, using default {}",
                            sysProp, value, minimum, maximum, defaultValue);
                    return defaultValue;
                }
                return parsed;
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring {}={}: not a number, using default {}", sysProp, value, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = InvestigationStoreConfig.class.getClassLoader()
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
