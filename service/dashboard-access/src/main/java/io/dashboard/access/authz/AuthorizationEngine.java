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

import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.dashboard.access.CollaboratorException;
import io.dashboard.access.DashboardAccessConfig;
import io.dashboard.access.audit.AuditEvent;
import io.dashboard.access.audit.AuditSink;
import io.dashboard.access.model.AccessLevel;
import io.dashboard.access.model.DataAccessScope;
import io.dashboard.access.model.UserContext;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.dashboard.access.authz.AccessDeniedException.denyRowFilter;
import static io.dashboard.access.authz.Privileges.SELECT;
import static io.dashboard.access.authz.Privileges.USAGE;
import static java.util.Objects.requireNonNull;

/**
 * Answers whether a user may use a catalog, schema or table, aggregates the
 * user's complete {@link DataAccessScope}, and rewrites statements with
 * row-level security predicates.
 * <p>
 * Decisions follow the namespace hierarchy: a schema check first requires
 * {@code USAGE} on the catalog and a table check first requires {@code USAGE} on
 * the schema. When the parent check fails the privilege store is not consulted
 * for the child. Admins pass every check without any lookup.
 * <p>
 * Results are cached in a {@link PermissionCache}. A privilege store failure is
 * logged and treated as a denial; such denials are not cached, so the next check
 * asks the store again.
 */
public class AuthorizationEngine
{
    private static final Logger log = Logger.get(AuthorizationEngine.class);

    private static final Pattern WHERE_KEYWORD = Pattern.compile("\\bWHERE\\b", Pattern.CASE_INSENSITIVE);

    private final PrivilegeStore privilegeStore;
    private final CatalogEnumerator catalogEnumerator;
    private final PermissionCache permissionCache;
    private final RowFilterPolicy rowFilterPolicy;
    private final AuditSink auditSink;
    private final String defaultCatalog;
    private final Clock clock;

    @Inject
    public AuthorizationEngine(
            DashboardAccessConfig config,
            PrivilegeStore privilegeStore,
            CatalogEnumerator catalogEnumerator,
            PermissionCache permissionCache,
            RowFilterPolicy rowFilterPolicy,
            AuditSink auditSink)
    {
        this(config, privilegeStore, catalogEnumerator, permissionCache, rowFilterPolicy, auditSink, Clock.systemUTC());
    }

    public AuthorizationEngine(
            DashboardAccessConfig config,
            PrivilegeStore privilegeStore,
            CatalogEnumerator catalogEnumerator,
            PermissionCache permissionCache,
            RowFilterPolicy rowFilterPolicy,
            AuditSink auditSink,
            Clock clock)
    {
        this.defaultCatalog = requireNonNull(config, "config is null").getDefaultCatalog();
        this.privilegeStore = requireNonNull(privilegeStore, "privilegeStore is null");
        this.catalogEnumerator = requireNonNull(catalogEnumerator, "catalogEnumerator is null");
        this.permissionCache = requireNonNull(permissionCache, "permissionCache is null");
        this.rowFilterPolicy = requireNonNull(rowFilterPolicy, "rowFilterPolicy is null");
        this.auditSink = requireNonNull(auditSink, "auditSink is null");
        this.clock = requireNonNull(clock, "clock is null");
    }

    public boolean checkCatalogAccess(UserContext user, String catalog, String privilege)
    {
        if (user.isAdmin()) {
            return true;
        }
        return checkPrivilege(user, SecurableType.CATALOG, catalog, privilege);
    }

    public boolean checkSchemaAccess(UserContext user, String catalog, String schema, String privilege)
    {
        if (user.isAdmin()) {
            return true;
        }
        if (!checkCatalogAccess(user, catalog, USAGE)) {
            return false;
        }
        return checkPrivilege(user, SecurableType.SCHEMA, catalog + "." + schema, privilege);
    }

    public boolean checkTableAccess(UserContext user, String catalog, String schema, String table, String privilege)
    {
        if (user.isAdmin()) {
            return true;
        }
        if (!checkSchemaAccess(user, catalog, schema, USAGE)) {
            return false;
        }
        return checkPrivilege(user, SecurableType.TABLE, catalog + "." + schema + "." + table, privilege);
    }

    /**
     * Builds the complete access scope of a user.
     * <p>
     * Admins receive global wildcards. For other users every catalog is
     * enumerated and kept when it passes {@code USAGE}; the schemas of each kept
     * catalog are enumerated and filtered the same way. Row filters and restricted
     * columns of the policy are attached for the accessible schemas. A failing
     * enumeration is logged and the affected subtree is left out, so the result
     * may be partial but is never an error.
     * <p>
     * This walks the whole hierarchy; compute it once per request.
     */
    public DataAccessScope getUserDataScope(UserContext user)
    {
        if (user.isAdmin()) {
            return DataAccessScope.unrestricted();
        }

        DataAccessScope.Builder scope = DataAccessScope.builder();
        List<String> catalogs;
        try {
            catalogs = catalogEnumerator.listCatalogs();
        }
        catch (CollaboratorException e) {
            log.warn("Could not list catalogs for %s: %s", user.getEmail(), e.getMessage());
            return scope.build();
        }

        Set<RowFilterRule> applicableRules = new LinkedHashSet<>();
        for (String catalog : catalogs) {
            if (!checkCatalogAccess(user, catalog, USAGE)) {
                continue;
            }
            scope.addCatalog(catalog);
            scope.putAccessLevel(catalog, AccessLevel.READ);

            List<String> schemas;
            try {
                schemas = catalogEnumerator.listSchemas(catalog);
            }
            catch (CollaboratorException e) {
                log.debug("Could not list schemas in %s: %s", catalog, e.getMessage());
                continue;
            }
            for (String schema : schemas) {
                if (checkSchemaAccess(user, catalog, schema, USAGE)) {
                    String qualifiedSchema = catalog + "." + schema;
                    scope.addSchema(qualifiedSchema);
                    scope.putAccessLevel(qualifiedSchema, AccessLevel.READ);
                    applicableRules.addAll(rowFilterPolicy.rulesForSchema(catalog, schema));
                }
            }
        }

        Map<String, List<String>> filtersByTable = new LinkedHashMap<>();
        for (RowFilterRule rule : applicableRules) {
            rule.getFilter().ifPresent(filter -> filtersByTable.computeIfAbsent(rule.getTable(), table -> new ArrayList<>()).add(filter));
            if (!rule.getRestrictedColumns().isEmpty()) {
                scope.putRestrictedColumns(rule.getTable(), rule.getRestrictedColumns());
            }
        }
        filtersByTable.forEach((table, filters) -> RowFilterPolicy.conjunction(filters)
                .ifPresent(filter -> scope.putRowFilter(table, filter)));
        return scope.build();
    }

    /**
     * Rewrites a statement with the row filters of the policy for the tables it references.
     */
    public String injectRowLevelSecurity(String sql, UserContext user)
    {
        if (user.isAdmin()) {
            return sql;
        }
        return injectRowLevelSecurity(sql, user, rowFilterPolicy.filtersFor(TableReferenceExtractor.extract(sql), defaultCatalog));
    }

    /**
     * Rewrites a statement so that non-admin users only see permitted rows.
     * <p>
     * Without explicit filters the identity predicate
     * {@code current_user() = '<email>'} is combined with the first existing
     * {@code WHERE} condition using {@code AND}. A statement without a
     * {@code WHERE} clause is returned unchanged in that case, since a predicate
     * cannot be placed safely without understanding the statement structure.
     * <p>
     * With explicit filters, the filters of the tables referenced by the
     * statement are combined with the first {@code WHERE} condition. When the
     * statement has no {@code WHERE} clause the rewrite is refused.
     * <p>
     * The predicate is inserted directly after the keyword, so an existing
     * condition with a top-level {@code OR} binds looser than the injected one.
     *
     * @param tableFilters filter expressions keyed by qualified table name
     * @throws AccessDeniedException if explicit filters apply but cannot be injected
     */
    public String injectRowLevelSecurity(String sql, UserContext user, Map<String, String> tableFilters)
    {
        if (user.isAdmin()) {
            return sql;
        }

        Matcher where = WHERE_KEYWORD.matcher(sql);
        boolean hasWhere = where.find();

        if (tableFilters.isEmpty()) {
            if (!hasWhere) {
                log.debug("No WHERE clause, default row filter not applied for %s", user.getEmail());
                return sql;
            }
            return insertAfter(sql, where.end(), defaultPredicate(user));
        }

        List<String> predicates = new ArrayList<>();
        String firstFilteredTable = null;
        for (TableReference reference : TableReferenceExtractor.extract(sql)) {
            String filter = tableFilters.get(reference.qualifiedName(defaultCatalog));
            if (filter == null) {
                filter = tableFilters.get(reference.reference());
            }
            if (filter != null) {
                predicates.add("(" + filter + ")");
                if (firstFilteredTable == null) {
                    firstFilteredTable = reference.reference();
                }
            }
        }
        if (predicates.isEmpty()) {
            return sql;
        }
        if (!hasWhere) {
            denyRowFilter(firstFilteredTable);
        }
        return insertAfter(sql, where.end(), String.join(" AND ", predicates));
    }

    /**
     * Checks {@code SELECT} on every table referenced by the statement.
     * Two-part references are resolved against the default catalog. Validation
     * stops at the first denied table.
     */
    public QueryValidation validateQueryPermissions(String sql, UserContext user)
    {
        if (user.isAdmin()) {
            return QueryValidation.granted();
        }

        for (TableReference reference : TableReferenceExtractor.extract(sql)) {
            if (!checkTableAccess(user, reference.catalogOr(defaultCatalog), reference.schema(), reference.table(), SELECT)) {
                log.debug("User %s denied SELECT on %s", user.getEmail(), reference.reference());
                return QueryValidation.deniedTable(reference.reference());
            }
        }
        return QueryValidation.granted();
    }

    /**
     * Emits an audit event for an authorization decision.
     */
    public void auditAccess(UserContext user, String resource, String action, boolean granted)
    {
        auditSink.emit(new AuditEvent(
                clock.instant(),
                user.getEmail(),
                user.getUserId(),
                resource,
                action,
                granted,
                user.getGroups()));
    }

    public Map<String, String> rowFiltersFor(String sql)
    {
        return ImmutableMap.copyOf(rowFilterPolicy.filtersFor(TableReferenceExtractor.extract(sql), defaultCatalog));
    }

    public void clearCache()
    {
        permissionCache.clear();
    }

    public void clearCache(String userEmail)
    {
        permissionCache.clear(userEmail);
    }

    private boolean checkPrivilege(UserContext user, SecurableType securableType, String qualifiedName, String privilege)
    {
        String email = user.getEmail();
        Optional<Boolean> cached = permissionCache.get(email, qualifiedName, privilege);
        if (cached.isPresent()) {
            return cached.get();
        }

        boolean allowed;
        try {
            allowed = privilegeStore.getEffectivePrivileges(securableType, qualifiedName, email).stream()
                    .anyMatch(privilege::equalsIgnoreCase);
        }
        catch (CollaboratorException e) {
            log.warn("Permission check failed for %s on %s %s: %s", email, securableType.typeName(), qualifiedName, e.getMessage());
            return false;
        }

        permissionCache.put(email, qualifiedName, privilege, allowed);
        log.debug("%s %s %s on %s %s", email, allowed ? "has" : "lacks", privilege, securableType.typeName(), qualifiedName);
        return allowed;
    }

    private static String defaultPredicate(UserContext user)
    {
        return "current_user() = '" + user.getEmail().replace("'", "''") + "'";
    }

    private static String insertAfter(String sql, int position, String predicate)
    {
        return sql.substring(0, position) + " " + predicate + " AND" + sql.substring(position);
    }
}
