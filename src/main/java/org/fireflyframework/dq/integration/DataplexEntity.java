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

package org.fireflyframework.dq.integration;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;
import org.fireflyframework.dq.exception.InvalidEntityUriException;

import java.util.List;

/**
 * An entity registered in a Dataplex zone.
 *
 * <p>{@code name} is the full resource name
 * {@code projects/p/locations/l/lakes/k/zones/z/entities/e}; {@code dataPath} is
 * the path of the backing BigQuery table,
 * {@code projects/p/datasets/d/tables/t}.</p>
 */
@Data
@Builder
public class DataplexEntity {

    private final String name;
    private final String id;
    private final String type;
    private final String asset;
    private final String dataPath;
    private final String system;

    @Singular
    private final List<DataplexSchemaField> fields;

    public String getLake() {
        return nameSegment(5);
    }

    public String getZone() {
        return nameSegment(7);
    }

    private String nameSegment(int index) {
        String[] segments = name != null ? name.split("/") : new String[0];
        if (segments.length <= index) {
            throw new InvalidEntityUriException(String.valueOf(name), "malformed Dataplex entity name");
        }
        return segments[index];
    }
}
