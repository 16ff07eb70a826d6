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
package io.dashboard.access.authz;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.airlift.json.JsonCodec;
import io.airlift.log.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.airlift.json.JsonCodec.jsonCodec;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Per-table row filters and restricted columns applied to non-admin users.
 * <p>
 * The policy is read from a JSON file:
 * <pre>
 * {
 *   "rules": [
 *     {"table": "sales.orders.order_lines", "filter": "region = 'WEST'"},
 *     {"table": "hr.people.*", "restrictedColumns": ["ssn", "salary"]}
 *   ]
 * }
 * </pre>
 * Several rules matching the same table have their filters combined with
 * {@code AND} and their restricted columns merged.
 */
public class RowFilterPolicy
{
    private static final Logger log = Logger.get(RowFilterPolicy.class);
    private static final JsonCodec<RowFilterPolicy> CODEC = jsonCodec(RowFilterPolicy.class);

    private final List<RowFilterRule> rules;

    @JsonCreator
    public RowFilterPolicy(@JsonProperty("rules") List<RowFilterRule> rules)
    {
        this.rules = ImmutableList.copyOf(requireNonNull(rules, "rules is null"));
    }

    public static RowFilterPolicy empty()
    {
        return new RowFilterPolicy(ImmutableList.of());
    }

    public static RowFilterPolicy load(Path path)
    {
        try {
            RowFilterPolicy policy = CODEC.fromJson(Files.readString(path));
            log.info("Loaded %s row filter rules from %s", policy.getRules().size(), path);
            return policy;
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to read row filter policy " + path, e);
        }
    }

    public static RowFilterPolicy fromJson(String json)
    {
        return CODEC.fromJson(json);
    }

    @JsonProperty
    public List<RowFilterRule> getRules()
    {
        return rules;
    }

    public boolean isEmpty()
    {
        return rules.isEmpty();
    }

    /**
     * Returns the combined filter expression for a table, if any rule declares one.
     */
    public Optional<String> getRowFilter(String catalog, String schema, String table)
    {
        List<String> filters = rules.stream()
                .filter(rule -> rule.appliesTo(catalog, schema, table))
                .map(RowFilterRule::getFilter)
                .flatMap(Optional::stream)
                .collect(toImmutableList());
        return conjunction(filters);
    }

    /**
     * Joins filters with {@code AND}, parenthesizing each one when there is more than one.
     */
    static Optional<String> conjunction(List<String> filters)
    {
        if (filters.isEmpty()) {
            return Optional.empty();
        }
        if (filters.size() == 1) {
            return Optional.of(filters.get(0));
        }
        return Optional.of(filters.stream()
                .map(filter -> "(" + filter + ")")
                .collect(joining(" AND ")));
    }

    public Set<String> getRestrictedColumns(String catalog, String schema, String table)
    {
        ImmutableSet.Builder<String> columns = ImmutableSet.builder();
        rules.stream()
                .filter(rule -> rule.appliesTo(catalog, schema, table))
                .forEach(rule -> columns.addAll(rule.getRestrictedColumns()));
        return columns.build();
    }

    /**
     * Returns the filters of the referenced tables keyed by qualified table name.
     */
    public Map<String, String> filtersFor(List<TableReference> references, String defaultCatalog)
    {
        Map<String, String> filters = new LinkedHashMap<>();
        for (TableReference reference : references) {
            getRowFilter(reference.catalogOr(defaultCatalog), reference.schema(), reference.table())
                    .ifPresent(filter -> filters.put(reference.qualifiedName(defaultCatalog), filter));
        }
        return ImmutableMap.copyOf(filters);
    }

    /**
     * Returns the rules whose table pattern falls inside the given schema.
     */
    public List<RowFilterRule> rulesForSchema(String catalog, String schema)
    {
        return rules.stream()
                .filter(rule -> rule.appliesToSchema(catalog, schema))
                .collect(toImmutableList());
    }
}
