/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.dq.config;

import lombok.Data;
import org.fireflyframework.dq.compiler.CompilationStrategy;
import org.fireflyframework.dq.definition.MetadataRegistryDefaults;
import org.fireflyframework.dq.resiliency.CollaboratorResiliencyConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties of the data quality compiler.
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   dq:
 *     configs-path: /etc/dq/configs
 *     environment: test
 *     dq-summary-table: my-project.dq.dq_summary
 *     strategy: COLLECT_ALL
 *     metadata-defaults:
 *       projects: my-project
 *       locations: us-central1
 *     resiliency:
 *       timeout-ms: 10000
 *     collaborators:
 *       summary-executor:
 *         timeout-ms: 600000
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.dq")
public class DqCompilerProperties {

    private boolean enabled = true;

    /**
     * YAML file or directory holding the entity, row filter, rule and rule binding definitions.
     */
    private String configsPath;

    /**
     * Default environment used when a request does not name one.
     */
    private String environment;

    /**
     * Fully-qualified summary table read for the high watermark of incremental bindings.
     */
    private String dqSummaryTable;

    private boolean progressWatermark = true;

    private CompilationStrategy strategy = CompilationStrategy.COLLECT_ALL;

    /**
     * Whether executed summary rows are logged as JSON, one line per row.
     */
    private boolean summaryToLog = false;

    private MetadataDefaults metadataDefaults = new MetadataDefaults();

    private CollaboratorResiliencyConfig resiliency = new CollaboratorResiliencyConfig();

    private Map<String, CollaboratorResiliencyConfig> collaborators = new HashMap<>();

    /**
     * Dataplex coordinates filling entity URIs; {@code metadata_registry_defaults}
     * declared in YAML take precedence.
     */
    @Data
    public static class MetadataDefaults {

        private String projects;
        private String locations;
        private String lakes;
        private String zones;

        public MetadataRegistryDefaults toMetadataRegistryDefaults() {
            return MetadataRegistryDefaults.builder()
                    .projects(projects)
                    .locations(locations)
                    .lakes(lakes)
                    .zones(zones)
                    .build();
        }
    }
}
