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
package io.dashboard.access.model;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * The catalog resources and row/column restrictions that apply to one user.
 * <p>
 * Resource sets hold qualified names ({@code catalog}, {@code catalog.schema},
 * {@code catalog.schema.table}) and may contain wildcard entries. Membership is
 * tested as an exact match first, then the schema wildcard, the catalog wildcard
 * and finally the global wildcard:
 * <ul>
 *   <li>catalog: {@code c}, {@code *}</li>
 *   <li>schema: {@code c.s}, {@code c.*}, {@code *.*}, {@code *}</li>
 *   <li>table: {@code c.s.t}, {@code c.s.*}, {@code c.*.*}, {@code c.*}, {@code *.*.*}, {@code *}</li>
 * </ul>
 * <p>
 * A scope is computed per request by walking the catalog hierarchy, which is
 * expensive; callers should compute it once and pass it down.
 */
public final class DataAccessScope
{
    public static final String WILDCARD = "*";

    private final Set<String> accessibleCatalogs;
    private final Set<String> accessibleSchemas;
    private final Set<String> accessibleTables;
    private final Map<String, String> rowLevelFilters;
    private final Map<String, Set<String>> restrictedColumns;
    private final Map<String, AccessLevel> accessLevels;

    private DataAccessScope(
            Set<String> accessibleCatalogs,
            Set<String> accessibleSchemas,
            Set<String> accessibleTables,
            Map<String, String> rowLevelFilters,
            Map<String, Set<String>> restrictedColumns,
            Map<String, AccessLevel> accessLevels)
    {
        this.accessibleCatalogs = ImmutableSet.copyOf(accessibleCatalogs);
        this.accessibleSchemas = ImmutableSet.copyOf(accessibleSchemas);
        this.accessibleTables = ImmutableSet.copyOf(accessibleTables);
        this.rowLevelFilters = ImmutableMap.copyOf(rowLevelFilters);
        ImmutableMap.Builder<String, Set<String>> columns = ImmutableMap.builder();
        restrictedColumns.forEach((table, names) -> columns.put(table, ImmutableSet.copyOf(names)));
        this.restrictedColumns = columns.buildOrThrow();
        this.accessLevels = ImmutableMap.copyOf(accessLevels);
    }

    public static DataAccessScope empty()
    {
        return builder().build();
    }

    /**
     * Scope of an admin: every catalog, schema and table.
     */
    public static DataAccessScope unrestricted()
    {
        return builder()
                .addCatalog(WILDCARD)
                .addSchema("*.*")
                .addTable("*.*.*")
                .build();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public Set<String> getAccessibleCatalogs()
    {
        return accessibleCatalogs;
    }

    public Set<String> getAccessibleSchemas()
    {
        return accessibleSchemas;
    }

    public Set<String> getAccessibleTables()
    {
        return accessibleTables;
    }

    public Map<String, String> getRowLevelFilters()
    {
        return rowLevelFilters;
    }

    public Map<String, Set<String>> getRestrictedColumns()
    {
        return restrictedColumns;
    }

    public Map<String, AccessLevel> getAccessLevels()
    {
        return accessLevels;
    }

    public boolean canAccessCatalog(String catalog)
    {
        return accessibleCatalogs.contains(catalog) ||
                accessibleCatalogs.contains(WILDCARD);
    }

    public boolean canAccessSchema(String catalog, String schema)
    {
        return accessibleSchemas.contains(catalog + "." + schema) ||
                accessibleSchemas.contains(catalog + ".*") ||
                accessibleSchemas.contains("*.*") ||
                accessibleSchemas.contains(WILDCARD);
    }

    public boolean canAccessTable(String catalog, String schema, String table)
    {
        return accessibleTables.contains(catalog + "." + schema + "." + table) ||
                accessibleTables.contains(catalog + "." + schema + ".*") ||
                accessibleTables.contains(catalog + ".*.*") ||
                accessibleTables.contains(catalog + ".*") ||
                accessibleTables.contains("*.*.*") ||
                accessibleTables.contains(WILDCARD);
    }

    public Optional<String> getRowFilter(String qualifiedTable)
    {
        return Optional.ofNullable(rowLevelFilters.get(qualifiedTable));
    }

    public Set<String> getRestrictedColumns(String qualifiedTable)
    {
        return restrictedColumns.getOrDefault(qualifiedTable, ImmutableSet.of());
    }

    public AccessLevel getAccessLevel(String resource)
    {
        return accessLevels.getOrDefault(resource, AccessLevel.NONE);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("catalogs", accessibleCatalogs)
                .add("schemas", accessibleSchemas)
                .add("tables", accessibleTables)
                .add("rowLevelFilters", rowLevelFilters.keySet())
                .add("restrictedColumns", restrictedColumns.keySet())
                .toString();
    }

    public static final class Builder
    {
        private final Set<String> catalogs = new LinkedHashSet<>();
        private final Set<String> schemas = new LinkedHashSet<>();
        private final Set<String> tables = new LinkedHashSet<>();
        private final Map<String, String> rowLevelFilters = new HashMap<>();
        private final Map<String, Set<String>> restrictedColumns = new HashMap<>();
        private final Map<String, AccessLevel> accessLevels = new HashMap<>();

        private Builder() {}

        public Builder addCatalog(String catalog)
        {
            catalogs.add(requireNonNull(catalog, "catalog is null"));
            return this;
        }

        public Builder addSchema(String qualifiedSchema)
        {
            schemas.add(requireNonNull(qualifiedSchema, "qualifiedSchema is null"));
            return this;
        }

        public Builder addTable(String qualifiedTable)
        {
            tables.add(requireNonNull(qualifiedTable, "qualifiedTable is null"));
            return this;
        }

        public Builder putRowFilter(String qualifiedTable, String expression)
        {
            rowLevelFilters.put(requireNonNull(qualifiedTable, "qualifiedTable is null"), requireNonNull(expression, "expression is null"));
            return this;
        }

        public Builder putRestrictedColumns(String qualifiedTable, Set<String> columns)
        {
            restrictedColumns.computeIfAbsent(requireNonNull(qualifiedTable, "qualifiedTable is null"), key -> new LinkedHashSet<>())
                    .addAll(columns);
            return this;
        }

        public Builder putAccessLevel(String resource, AccessLevel level)
        {
            accessLevels.put(requireNonNull(resource, "resource is null"), requireNonNull(level, "level is null"));
            return this;
        }

        public DataAccessScope build()
        {
            return new DataAccessScope(catalogs, schemas, tables, rowLevelFilters, restrictedColumns, accessLevels);
        }
    }
}
