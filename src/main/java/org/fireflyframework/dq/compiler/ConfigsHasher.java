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

package org.fireflyframework.dq.compiler;

import org.fireflyframework.dq.definition.CompiledRule;
import org.fireflyframework.dq.definition.CompiledRuleBinding;
import org.fireflyframework.dq.definition.Entity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the content hash ({@code configs_hashsum}) of a compiled rule binding.
 *
 * <p>The hash is the hex SHA-256 of the canonical JSON of the binding's semantic
 * fields: table, column, row filter, rules, metadata and incremental column.
 * Rules are ordered by rule id and map keys are sorted, so neither the order of
 * {@code rule_ids} nor the key order of the source YAML affects it. The binding
 * id, the environment name and the source file are not part of the content.</p>
 */
public class ConfigsHasher {

    public String hash(CompiledRuleBinding binding) {
        return sha256Hex(CanonicalJson.write(semanticContent(binding)));
    }

    Map<String, Object> semanticContent(CompiledRuleBinding binding) {
        Entity entity = binding.getEntity();
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("table_id", entity.getTableId());
        content.put("source_database", entity.getSourceDatabase().name());
        content.put("column_id", binding.getColumnId());
        content.put("column_name", binding.getColumnName());
        content.put("row_filter_id", binding.getRowFilterId());
        content.put("row_filter_sql", binding.getRowFilterSql());
        content.put("incremental_time_filter_column", binding.getIncrementalTimeFilterColumnName());
        content.put("dataplex_lake", entity.getDataplexLake());
        content.put("dataplex_zone", entity.getDataplexZone());
        content.put("dataplex_asset_id", entity.getDataplexAssetId());
        content.put("metadata", binding.getMetadata());

        List<Map<String, Object>> rules = binding.getRules().stream()
                .sorted(Comparator.comparing(CompiledRule::getRuleId))
                .map(rule -> {
                    Map<String, Object> ruleContent = new LinkedHashMap<>();
                    ruleContent.put("rule_id", rule.getRuleId());
                    ruleContent.put("rule_type", rule.getRuleType().name());
                    ruleContent.put("dimension", rule.getDimension());
                    ruleContent.put("sql", rule.getSql());
                    return ruleContent;
                })
                .toList();
        content.put("rules", rules);
        return content;
    }

    private static String sha256Hex(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
