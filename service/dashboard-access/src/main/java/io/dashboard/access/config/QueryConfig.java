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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static java.util.Objects.requireNonNull;

/**
 * A named, parameterized query from {@code dashboard_queries}.
 * <p>
 * Every {@code ${name}} placeholder of the template must be declared as a
 * parameter; a record violating this cannot be constructed.
 *
 * @param cacheTtlSeconds how long callers may cache the query's results; not
 * used for caching the configuration itself
 */
public record QueryConfig(
        String id,
        String name,
        Optional<String> description,
        String category,
        String sqlTemplate,
        List<QueryParameter> parameters,
        List<Map<String, Object>> outputSchema,
        List<String> requiredPermissions,
        boolean allowDrillDown,
        Optional<String> drillDownQueryId,
        int cacheTtlSeconds,
        List<String> tags,
        boolean active)
{
    public static final int DEFAULT_CACHE_TTL_SECONDS = 300;

    public QueryConfig
    {
        requireNonNull(id, "id is null");
        requireNonNull(name, "name is null");
        requireNonNull(description, "description is null");
        requireNonNull(category, "category is null");
        requireNonNull(sqlTemplate, "sqlTemplate is null");
        parameters = ImmutableList.copyOf(requireNonNull(parameters, "parameters is null"));
        outputSchema = ImmutableList.copyOf(requireNonNull(outputSchema, "outputSchema is null"));
        requiredPermissions = ImmutableList.copyOf(requireNonNull(requiredPermissions, "requiredPermissions is null"));
        requireNonNull(drillDownQueryId, "drillDownQueryId is null");
        tags = ImmutableList.copyOf(requireNonNull(tags, "tags is null"));

        Set<String> declared = parameters.stream()
                .map(QueryParameter::name)
                .collect(toImmutableSet());
        for (String placeholder : SqlTemplate.placeholders(sqlTemplate)) {
            if (!declared.contains(placeholder)) {
                throw new ConfigurationException("Query configuration " + id + " uses undeclared parameter: " + placeholder);
            }
        }
    }
}
