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
package dev.mars.tracelog.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Resolves whether investigation persistence is effectively enabled.
 * <p>
 * Two signals feed the gate:
 * <ol>
 *   <li>the persisted configuration flag ({@code tracelog.enabled})</li>
 *   <li>a runtime override: an operator override set through {@link #override(Boolean)},
 *       falling back to the {@value #OVERRIDE_ENV} environment variable</li>
 * </ol>
 * A present override always wins. When the gate is closed the store accepts appends
 * as no-ops and answers reads with empty results, so disabling persistence never
 * surfaces as a failure to callers.
 * <p>
 * Callers evaluate {@link #isEnabled()} once per operation and use that value for
 * the whole operation.
 */
public final class FeatureGate {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureGate.class);

    /** Environment variable carrying the runtime override. */
    public static final String OVERRIDE_ENV = "TRACELOG_ENABLED";

    private final boolean configured;
    private final UnaryOperator<String> environment;
    private final AtomicReference<Boolean> operatorOverride = new AtomicReference<>();
    private final Set<String> reportedValues = ConcurrentHashMap.newKeySet();

    /**
     * Creates a gate reading the override from the process environment.
     *
     * @param configured the persisted configuration flag
     */
    public FeatureGate(boolean configured) {
        this(configured, System::getenv);
    }

    /**
     * @param configured  the persisted configuration flag
     * @param environment lookup used for {@value #OVERRIDE_ENV}
     */
    public FeatureGate(boolean configured, UnaryOperator<String> environment) {
        this.configured = configured;
        this.environment = environment;
    }

    /**
     * Pure resolution rule: the override, when present, wins over the configured value.
     */
    public static boolean resolve(boolean configured, Optional<Boolean> override) {
        return override.orElse(configured);
    }

    /** Effective state, evaluated now. */
    public boolean isEnabled() {
        return resolve(configured, currentOverride());
    }

    /** The persisted configuration flag. */
    public boolean configured() {
        return configured;
    }

    /** The override currently in force, if any. */
    public Optional<Boolean> currentOverride() {
        Boolean operator = operatorOverride.get();
        if (operator != null) {
            return Optional.of(operator);
        }
        String raw = environment.apply(OVERRIDE_ENV);
        Optional<Boolean> parsed = parseFlag(raw);
        if (parsed.isEmpty() && raw != null && !raw.isBlank() && reportedValues.add(raw)) {
            LOG.warn("Ignoring unrecognized {} value: '{}'", OVERRIDE_ENV, raw);
        }
        return parsed;
    }

    /**
     * Sets an operator override. Passing null clears it.
     */
    public void override(Boolean enabled) {
        Boolean previous = operatorOverride.getAndSet(enabled);
        LOG.info("Traceability override changed: {} -> {} (effective enabled={})",
                previous, enabled, isEnabled());
    }

    public void clearOverride() {
        override(null);
    }

    /**
     * Parses a boolean flag. Accepts true/false, 1/0, yes/no, on/off in any case;
     * blank or unrecognized values count as absent.
     */
    public static Optional<Boolean> parseFlag(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
            case "on":
                return Optional.of(Boolean.TRUE);
            case "false":
            case "0":
            case "no":
            case "off":
                return Optional.of(Boolean.FALSE);
            default:
                return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "FeatureGate{configured=" + configured + ", override=" + currentOverride().orElse(null) + '}';
    }
}
