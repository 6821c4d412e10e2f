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
package dev.mars.tracelog.demo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.tracelog.health.HealthSnapshot;
import dev.mars.tracelog.model.Evidence;
import dev.mars.tracelog.model.InvestigationRecord;
import dev.mars.tracelog.model.JsonMappers;
import dev.mars.tracelog.model.RecordType;
import dev.mars.tracelog.query.CallerScope;
import dev.mars.tracelog.query.InvestigationQueryService;
import dev.mars.tracelog.query.QueryRequest;
import dev.mars.tracelog.storage.FileInvestigationStore;
import dev.mars.tracelog.storage.InvestigationStoreConfig;
import dev.mars.tracelog.storage.QueryPage;

import java.io.PrintStream;
import java.util.List;

/**
 * Demo entry point for the investigation store.
 * <p>
 * Ingests a few investigations for two tenants, then reads them back the way an
 * API would: a newest-first page, JSON and CSV exports, and the health snapshot.
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link InvestigationStoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (log file only)</li>
 *   <li>System properties: {@code -Dtracelog.investigationsPath=/path -Dtracelog.maxEntries=100 ...}</li>
 *   <li>Environment variables: {@code TRACELOG_INVESTIGATIONS_PATH, TRACELOG_MAX_ENTRIES, ...}</li>
 *   <li>Properties file: {@code tracelog.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 * {@code TRACELOG_ENABLED=false} switches persistence off without touching the config.
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl tracelog-demo -am
 *
 * # Run with default configuration
 * java -jar tracelog-demo/target/tracelog-demo-1.0-SNAPSHOT.jar
 *
 * # Run against a specific log file
 * java -jar tracelog-demo/target/tracelog-demo-1.0-SNAPSHOT.jar /tmp/investigations.jsonl
 * </pre>
 *
 * @see InvestigationStoreConfig
 */
public class TraceDemo {

    public static void main(String[] args) throws Exception {
        PrintStream out = System.out;
        out.println("+---------------------------------------+");
        out.println("|       Investigation Store Demo        |");
        out.println("+---------------------------------------+");
        out.println();

        InvestigationStoreConfig config = args.length > 0 && !args[0].isBlank()
                ? InvestigationStoreConfig.builder().investigationsPath(args[0]).build()
                : InvestigationStoreConfig.load();

        out.println("Configuration: " + config);
        out.println();

        ObjectMapper mapper = JsonMappers.shared();

        try (FileInvestigationStore store = new FileInvestigationStore(config)) {
            store.open().join();
            out.println("[OK] Store opened at: " + config.investigationsPath().toAbsolutePath());
            out.println("[OK] Replayed " + store.state().entryCount() + " live investigations");

            for (InvestigationRecord record : sampleRecords(mapper)) {
                String id = store.append(record).join();
                out.printf("[OK] Appended %s for tenant %s (%s)%n", id, record.tenantId(), record.componentId());
            }

            InvestigationQueryService service = new InvestigationQueryService(store);

            QueryPage page = service.query(CallerScope.TENANT, QueryRequest.forTenant("acme").withLimit(3));
            out.println("\n  Newest investigations for acme:");
            for (InvestigationRecord record : page.records()) {
                out.printf("    %s  %-8s %-12s %s%n",
                        record.createdAt(), record.status(), record.componentId(), record.summary());
            }
            page.next().ifPresent(cursor -> out.println("    ... more (cursor " + cursor + ")"));

            out.println("\n  JSON export (acme, billing):");
            service.export(CallerScope.TENANT,
                    QueryRequest.forTenant("acme").withComponent("billing").withFormat("json"), out);
            out.println();

            out.println("\n  CSV export (all tenants):");
            service.export(CallerScope.ADMINISTRATIVE, QueryRequest.forTenant(null).withFormat("csv"), out);

            HealthSnapshot health = service.health();
            out.println("\n  Health:");
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(health));

            out.println("\n+---------------------------------------+");
            out.println("|  Demo complete!                       |");
            out.println("|  Run again to see records replayed.   |");
            out.println("+---------------------------------------+");
        }
    }

    private static List<InvestigationRecord> sampleRecords(ObjectMapper mapper) {
        ObjectNode slackMessage = mapper.createObjectNode()
                .put("channel", "#billing-oncall")
                .put("text", "invoice totals off by one cent since the rounding change");
        ObjectNode commit = mapper.createObjectNode()
                .put("repo", "billing-service")
                .put("sha", "4f1c2e9");

        return List.of(
                InvestigationRecord.builder()
                        .tenantId("acme")
                        .componentId("billing")
                        .projectId("payments")
                        .question("Why are invoice totals drifting?")
                        .addEvidence(new Evidence("ev-1", "slack", slackMessage))
                        .addEvidence(new Evidence("ev-2", "git", commit))
                        .build(),
                InvestigationRecord.builder()
                        .tenantId("acme")
                        .componentId("auth")
                        .projectId("payments")
                        .type(RecordType.INCIDENT)
                        .severity("high")
                        .status("evidence-collected")
                        .question("Login failures after the session store migration")
                        .build(),
                InvestigationRecord.builder()
                        .tenantId("globex")
                        .componentId("search")
                        .projectId("catalog")
                        .answer("Reindex job skipped the archived products partition")
                        .status("closed")
                        .build());
    }
}
