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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.airlift.json.ObjectMapperProvider;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * Maps rows of the configuration tables to configuration records.
 * <p>
 * Structured columns may arrive either as JSON text or as values already decoded
 * by the driver. Every optional column has an explicit default. A missing
 * required column or an unparsable value is a {@link ConfigurationException}.
 */
final class ConfigRowMapper
{
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapperProvider().get();

    private ConfigRowMapper() {}

    static QueryConfig toQueryConfig(Map<String, Object> row)
    {
        String id = requiredString(row, "id");
        return new QueryConfig(
                id,
                requiredString(row, "name"),
                optionalString(row, "description"),
                requiredString(row, "category"),
                requiredString(row, "sql_template"),
                toParameters(id, row.get("parameters")),
                objectList(row, "output_schema"),
                stringList(row, "required_permissions"),
                bool(row, "allow_drill_down", false),
                optionalString(row, "drill_down_query_id"),
                integer(row, "cache_ttl_seconds", QueryConfig.DEFAULT_CACHE_TTL_SECONDS),
                stringList(row, "tags"),
                bool(row, "is_active", true));
    }

    static FilterConfig toFilterConfig(Map<String, Object> row)
    {
        return new FilterConfig(
                requiredString(row, "id"),
                requiredString(row, "filter_name"),
                requiredString(row, "label"),
                requiredString(row, "filter_type"),
                requiredString(row, "data_type"),
                requiredString(row, "data_source"),
                objectList(row, "static_options"),
                optionalString(row, "options_query"),
                optionalString(row, "default_value"),
                stringList(row, "applies_to_tabs"),
                stringList(row, "applies_to_queries"),
                optionalString(row, "filter_expression_template"),
                integer(row, "display_order", 0),
                bool(row, "is_required", false),
                bool(row, "is_active", true));
    }

    static VisualizationConfig toVisualizationConfig(Map<String, Object> row)
    {
        return new VisualizationConfig(
                requiredString(row, "id"),
                requiredString(row, "viz_name"),
                requiredString(row, "viz_type"),
                requiredString(row, "query_id"),
                requiredString(row, "data_key"),
                optionalString(row, "x_axis_field"),
                optionalString(row, "y_axis_field"),
                stringList(row, "color_scheme"),
                optionalString(row, "title"),
                optionalString(row, "subtitle"),
                bool(row, "allow_drill_down", false),
                objectMap(row, "drill_down_config"),
                stringMap(row, "chart_options"),
                optionalString(row, "default_for_tab"),
                integer(row, "display_order", 0),
                bool(row, "is_active", true));
    }

    /**
     * Converts a {@code system_config} value according to its declared type:
     * {@code int} to {@link Long}, {@code boolean} to {@link Boolean},
     * {@code json} to {@link JsonNode}, anything else is kept as text.
     */
    static Object toSystemConfigValue(String key, String value, String type)
    {
        switch (type) {
            case "int":
                try {
                    return Long.parseLong(value.trim());
                }
                catch (NumberFormatException e) {
                    throw new ConfigurationException("System configuration " + key + " is not an integer: " + value, e);
                }
            case "boolean":
                return Boolean.parseBoolean(value.trim());
            case "json":
                try {
                    return OBJECT_MAPPER.readTree(value);
                }
                catch (JsonProcessingException e) {
                    throw new ConfigurationException("System configuration " + key + " is not valid JSON", e);
                }
            default:
                return value;
        }
    }

    private static List<QueryParameter> toParameters(String queryId, Object value)
    {
        JsonNode parameters = toJsonNode("parameters", value);
        if (parameters.isMissingNode() || parameters.isNull()) {
            return ImmutableList.of();
        }
        if (!parameters.isArray()) {
            throw new ConfigurationException("Parameters of query configuration " + queryId + " must be a list");
        }

        ImmutableList.Builder<QueryParameter> result = ImmutableList.builder();
        for (JsonNode parameter : parameters) {
            JsonNode name = parameter.path("name");
            if (!name.isTextual() || name.asText().isBlank()) {
                throw new ConfigurationException("Parameter without a name in query configuration " + queryId);
            }
            JsonNode defaultValue = parameter.path("default_value");
            result.add(new QueryParameter(
                    name.asText(),
                    parameter.path("required").asBoolean(false),
                    defaultValue.isMissingNode() || defaultValue.isNull() ? Optional.empty() : Optional.of(defaultValue.asText())));
        }
        return result.build();
    }

    private static String requiredString(Map<String, Object> row, String column)
    {
        return optionalString(row, column)
                .orElseThrow(() -> new ConfigurationException("Malformed configuration row: missing " + column));
    }

    private static Optional<String> optionalString(Map<String, Object> row, String column)
    {
        return Optional.ofNullable(row.get(column)).map(Object::toString);
    }

    private static boolean bool(Map<String, Object> row, String column, boolean defaultValue)
    {
        Object value = row.get(column);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    private static int integer(Map<String, Object> row, String column, int defaultValue)
    {
        Object value = row.get(column);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        }
        catch (NumberFormatException e) {
            throw new ConfigurationException("Malformed configuration row: " + column + " is not a number: " + value, e);
        }
    }

    private static List<String> stringList(Map<String, Object> row, String column)
    {
        JsonNode node = toJsonNode(column, row.get(column));
        if (node.isMissingNode() || node.isNull()) {
            return ImmutableList.of();
        }
        if (!node.isArray()) {
            throw new ConfigurationException("Malformed configuration row: " + column + " must be a list");
        }
        ImmutableList.Builder<String> values = ImmutableList.builder();
        node.forEach(element -> values.add(element.asText()));
        return values.build();
    }

    private static List<Map<String, Object>> objectList(Map<String, Object> row, String column)
    {
        JsonNode node = toJsonNode(column, row.get(column));
        if (node.isMissingNode() || node.isNull()) {
            return ImmutableList.of();
        }
        if (!node.isArray()) {
            throw new ConfigurationException("Malformed configuration row: " + column + " must be a list");
        }
        List<Map<String, Object>> values = OBJECT_MAPPER.convertValue(node, new TypeReference<List<Map<String, Object>>>() {});
        return values.stream()
                .filter(Objects::nonNull)
                .collect(toImmutableList());
    }

    private static Map<String, Object> objectMap(Map<String, Object> row, String column)
    {
        JsonNode node = toJsonNode(column, row.get(column));
        if (node.isMissingNode() || node.isNull()) {
            return ImmutableMap.of();
        }
        if (!node.isObject()) {
            throw new ConfigurationException("Malformed configuration row: " + column + " must be an object");
        }
        ImmutableMap.Builder<String, Object> values = ImmutableMap.builder();
        node.fields().forEachRemaining(field -> {
            if (!field.getValue().isNull()) {
                values.put(field.getKey(), field.getValue().isValueNode() ? field.getValue().asText() : field.getValue());
            }
        });
        return values.buildOrThrow();
    }

    private static Map<String, String> stringMap(Map<String, Object> row, String column)
    {
        ImmutableMap.Builder<String, String> values = ImmutableMap.builder();
        objectMap(row, column).forEach((key, value) -> values.put(key, value.toString()));
        return values.buildOrThrow();
    }

    private static JsonNode toJsonNode(String column, Object value)
    {
        if (value == null) {
            return MissingNode.getInstance();
        }
        if (value instanceof JsonNode) {
            return (JsonNode) value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.isEmpty()) {
                return MissingNode.getInstance();
            }
            try {
                return OBJECT_MAPPER.readTree(text);
            }
            catch (JsonProcessingException e) {
                throw new ConfigurationException("Malformed configuration row: " + column + " is not valid JSON", e);
            }
        }
        if (value instanceof Collection || value instanceof Map) {
            return OBJECT_MAPPER.valueToTree(value);
        }
        throw new ConfigurationException("Malformed configuration row: unsupported value for " + column);
    }
}
