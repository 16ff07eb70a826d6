/*
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
package io.dashboard.access.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A chart or table from {@code visualization_configs}.
 */
public record VisualizationConfig(
        String id,
        String vizName,
        String vizType,
        String queryId,
        String dataKey,
        Optional<String> xAxisField,
        Optional<String> yAxisField,
        List<String> colorScheme,
        Optional<String> title,
        Optional<String> subtitle,
        boolean allowDrillDown,
        Map<String, Object> drillDownConfig,
        Map<String, String> chartOptions,
        Optional<String> defaultForTab,
        int displayOrder,
        boolean active)
{
    static final String DRILL_DOWN_QUERY_ID = "query_id";

    public VisualizationConfig
    {
        requireNonNull(id, "id is null");
        requireNonNull(vizName, "vizName is null");
        requireNonNull(vizType, "vizType is null");
        requireNonNull(queryId, "queryId is null");
        requireNonNull(dataKey, "dataKey is null");
        requireNonNull(xAxisField, "xAxisField is null");
        requireNonNull(yAxisField, "yAxisField is null");
        colorScheme = ImmutableList.copyOf(requireNonNull(colorScheme, "colorScheme is null"));
        requireNonNull(title, "title is null");
        requireNonNull(subtitle, "subtitle is null");
        drillDownConfig = ImmutableMap.copyOf(requireNonNull(drillDownConfig, "drillDownConfig is null"));
        chartOptions = ImmutableMap.copyOf(requireNonNull(chartOptions, "chartOptions is null"));
        requireNonNull(defaultForTab, "defaultForTab is null");
    }

    /**
     * Returns the query run when a user drills into this visualization.
     */
    public Optional<String> drillDownQueryId()
    {
        return Optional.ofNullable(drillDownConfig.get(DRILL_DOWN_QUERY_ID))
                .map(Object::toString)
                .filter(queryId -> !queryId.isBlank());
    }
}
