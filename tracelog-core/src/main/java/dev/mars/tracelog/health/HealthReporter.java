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
package dev.mars.tracelog.health;

import dev.mars.tracelog.gate.FeatureGate;
import dev.mars.tracelog.model.SchemaRegistry;
import dev.mars.tracelog.storage.InvestigationStore;
import dev.mars.tracelog.storage.InvestigationStoreConfig;
import dev.mars.tracelog.storage.StoreState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Projects the store's in-memory counters into a {@link HealthSnapshot}.
 * <p>
 * Holds no state of its own and never touches the log file, so it can be
 * polled as often as the hosting process likes, including while the store is
 * failing writes.
 */
public final class HealthReporter {

    private static final Logger LOG = LoggerFactory.getLogger(HealthReporter.class);

    private final InvestigationStore store;

    public HealthReporter(InvestigationStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public HealthSnapshot snapshot() {
        FeatureGate gate = store.gate();
        boolean featureEnabled = gate.isEnabled();
        boolean overrideActive = gate.currentOverride().isPresent();
        InvestigationStoreConfig config = store.config();
        StoreState state = store.state();

        HealthSnapshot snapshot = new HealthSnapshot(
                state.open() && featureEnabled,
                featureEnabled,
                state.path().toString(),
                config.maxEntries(),
                config.retentionDays(),
                config.maxFileBytes(),
                SchemaRegistry.CURRENT_VERSION,
                state.lastWriteAt(),
                state.lastError(),
                state.entryCount(),
                state.byteSize(),
                state.archivedSegments(),
                config.tenantScopingRequired(),
                overrideActive);
        LOG.trace("Health snapshot: {}", snapshot);
        return snapshot;
    }
}
