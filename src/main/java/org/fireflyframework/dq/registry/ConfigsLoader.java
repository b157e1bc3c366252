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

package org.fireflyframework.dq.registry;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dq.definition.MetadataRegistryDefaults;
import org.fireflyframework.dq.exception.ConflictingDefinitionException;
import org.fireflyframework.dq.exception.InvalidDefinitionException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Loads YAML definition documents into a fresh {@link ConfigRegistry}.
 *
 * <p>A path may be a single file or a directory; directories are walked
 * recursively and every {@code .yml}/{@code .yaml} file is read in sorted path
 * order. Loading happens in two passes: {@code rule_dimensions} and
 * {@code metadata_registry_defaults} are collected from all documents first, then
 * entities, row filters, rules and rule bindings are parsed and registered.</p>
 */
@Slf4j
public class ConfigsLoader {

    private static final String RULE_DIMENSIONS = "rule_dimensions";
    private static final String METADATA_REGISTRY_DEFAULTS = "metadata_registry_defaults";

    private final ObjectMapper yamlMapper;
    private final DefinitionParser parser;

    public ConfigsLoader() {
        this(new ObjectMapper(new YAMLFactory().enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)));
    }

    public ConfigsLoader(ObjectMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
        this.parser = new DefinitionParser(yamlMapper);
    }

    /**
     * Loads every definition document found under {@code path}.
     *
     * @param path a YAML file or a directory of YAML files
     * @return a registry holding every loaded definition
     */
    public ConfigRegistry load(Path path) {
        Map<String, JsonNode> documents = new LinkedHashMap<>();
        for (Path file : listConfigFiles(path)) {
            documents.put(file.toString(), readFile(file));
        }
        log.info("Loading data quality configs from {} file(s) under {}", documents.size(), path);
        return loadDocuments(documents);
    }

    /**
     * Loads definitions from in-memory YAML documents.
     *
     * @param documents YAML text keyed by a source name used in diagnostics
     * @return a registry holding every loaded definition
     */
    public ConfigRegistry loadYaml(Map<String, String> documents) {
        Map<String, JsonNode> parsed = new LinkedHashMap<>();
        documents.forEach((source, content) -> parsed.put(source, readContent(source, content)));
        return loadDocuments(parsed);
    }

    private ConfigRegistry loadDocuments(Map<String, JsonNode> documents) {
        ConfigRegistry registry = new ConfigRegistry();

        Set<String> ruleDimensions = new TreeSet<>();
        MetadataRegistryDefaults defaults = null;
        for (Map.Entry<String, JsonNode> document : documents.entrySet()) {
            JsonNode root = document.getValue();
            JsonNode dimensions = root.get(RULE_DIMENSIONS);
            if (dimensions != null && !dimensions.isNull()) {
                if (!dimensions.isArray()) {
                    throw new InvalidDefinitionException(document.getKey(), "'rule_dimensions' must be a list", null);
                }
                dimensions.forEach(dimension -> ruleDimensions.add(dimension.asText().toLowerCase(Locale.ROOT)));
            }
            JsonNode defaultsNode = root.get(METADATA_REGISTRY_DEFAULTS);
            if (defaultsNode != null && !defaultsNode.isNull()) {
                MetadataRegistryDefaults parsed = parser.parseMetadataDefaults(defaultsNode);
                if (defaults != null && !defaults.equals(parsed)) {
                    throw new ConflictingDefinitionException(ConfigKind.METADATA_REGISTRY_DEFAULTS, "dataplex");
                }
                defaults = parsed;
            }
        }
        registry.setMetadataDefaults(defaults);

        for (JsonNode root : documents.values()) {
            forEachDefinition(root, ConfigKind.ENTITY,
                    (id, node) -> registry.registerEntity(parser.parseEntity(id, node)));
            forEachDefinition(root, ConfigKind.ROW_FILTER,
                    (id, node) -> registry.registerRowFilter(parser.parseRowFilter(id, node)));
            forEachDefinition(root, ConfigKind.RULE,
                    (id, node) -> registry.registerRule(parser.parseRule(id, node, ruleDimensions)));
            forEachDefinition(root, ConfigKind.RULE_BINDING,
                    (id, node) -> registry.registerRuleBinding(parser.parseRuleBinding(id, node)));
        }

        log.info("Loaded {} entities, {} row filters, {} rules, {} rule bindings",
                registry.listIds(ConfigKind.ENTITY).size(),
                registry.listIds(ConfigKind.ROW_FILTER).size(),
                registry.listIds(ConfigKind.RULE).size(),
                registry.listIds(ConfigKind.RULE_BINDING).size());
        return registry;
    }

    private void forEachDefinition(JsonNode root, ConfigKind kind, DefinitionConsumer consumer) {
        JsonNode section = root.get(kind.getConfigKey());
        if (section == null || section.isNull()) {
            return;
        }
        if (!section.isObject()) {
            throw new InvalidDefinitionException(kind, kind.getConfigKey(),
                    "top-level section must be a mapping of ID to definition.");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            consumer.accept(field.getKey(), field.getValue());
        }
    }

    private List<Path> listConfigFiles(Path path) {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }
        try (Stream<Path> files = Files.walk(path)) {
            List<Path> configFiles = new ArrayList<>(files
                    .filter(Files::isRegularFile)
                    .filter(ConfigsLoader::isYaml)
                    .sorted()
                    .toList());
            if (configFiles.isEmpty()) {
                log.warn("No YAML configs found under {}", path);
            }
            return configFiles;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list configs under " + path, e);
        }
    }

    private JsonNode readFile(Path file) {
        try {
            return readContent(file.toString(), Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configs file " + file, e);
        }
    }

    private JsonNode readContent(String source, String content) {
        try {
            JsonNode root = yamlMapper.readTree(content);
            if (root == null || root.isMissingNode() || root.isNull()) {
                log.debug("Skipping empty configs document {}", source);
                return yamlMapper.createObjectNode();
            }
            if (!root.isObject()) {
                throw new InvalidDefinitionException(source, "document root must be a mapping", null);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new InvalidDefinitionException(source, e.getOriginalMessage(), e);
        }
    }

    private static boolean isYaml(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    @FunctionalInterface
    private interface DefinitionConsumer {
        void accept(String identifier, JsonNode node);
    }
}
