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

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A table named in a statement, as written ({@code schema.table} or
 * {@code catalog.schema.table}).
 */
public record TableReference(String reference, Optional<String> catalog, String schema, String table)
{
    public TableReference
    {
        requireNonNull(reference, "reference is null");
        requireNonNull(catalog, "catalog is null");
        requireNonNull(schema, "schema is null");
        requireNonNull(table, "table is null");
    }

    /**
     * Returns {@code catalog.schema.table}, using {@code defaultCatalog} for two-part references.
     */
    public String qualifiedName(String defaultCatalog)
    {
        return catalogOr(defaultCatalog) + "." + schema + "." + table;
    }

    public String catalogOr(String defaultCatalog)
    {
        return catalog.orElse(defaultCatalog);
    }
}
