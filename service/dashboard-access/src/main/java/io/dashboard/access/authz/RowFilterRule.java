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
import com.google.common.collect.ImmutableSet;

import java.util.Optional;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * One entry of the row filter policy file.
 * <p>
 * {@code table} is a qualified table name or a wildcard ({@code catalog.schema.*},
 * {@code catalog.*}, {@code *}).
 */
public class RowFilterRule
{
    private final String table;
    private final Optional<String> filter;
    private final Set<String> restrictedColumns;

    @JsonCreator
    public RowFilterRule(
            @JsonProperty("table") String table,
            @JsonProperty("filter") Optional<String> filter,
            @JsonProperty("restrictedColumns") Optional<Set<String>> restrictedColumns)
    {
        this.table = requireNonNull(table, "table is null");
        this.filter = requireNonNull(filter, "filter is null");
        this.restrictedColumns = ImmutableSet.copyOf(requireNonNull(restrictedColumns, "restrictedColumns is null").orElse(ImmutableSet.of()));
        checkArgument(filter.isPresent() || !this.restrictedColumns.isEmpty(), "rule for %s declares neither a filter nor restricted columns", table);
    }

    @JsonProperty
    public String getTable()
    {
        return table;
    }

    @JsonProperty
    public Optional<String> getFilter()
    {
        return filter;
    }

    @JsonProperty
    public Set<String> getRestrictedColumns()
    {
        return restrictedColumns;
    }

    public boolean appliesTo(String catalog, String schema, String tableName)
    {
        return table.equals(catalog + "." + schema + "." + tableName) ||
                table.equals(catalog + "." + schema + ".*") ||
                table.equals(catalog + ".*") ||
                table.equals("*");
    }

    /**
     * Returns whether this rule covers some table of the schema.
     */
    public boolean appliesToSchema(String catalog, String schema)
    {
        return table.startsWith(catalog + "." + schema + ".") ||
                table.equals(catalog + ".*") ||
                table.equals("*");
    }
}
