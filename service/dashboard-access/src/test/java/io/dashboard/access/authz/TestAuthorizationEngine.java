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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.dashboard.access.DashboardAccessConfig;
import io.dashboard.access.TestingClock;
import io.dashboard.access.audit.TestingAuditSink;
import io.dashboard.access.config.JdbcCatalogEnumerator;
import io.dashboard.access.config.JdbcConnectionFactory;
import io.dashboard.access.model.AccessLevel;
import io.dashboard.access.model.DataAccessScope;
import io.dashboard.access.model.UserContext;
import io.dashboard.access.model.UserRoles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static io.dashboard.access.authz.Privileges.SELECT;
import static io.dashboard.access.authz.Privileges.USAGE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestAuthorizationEngine
{
    private static final String ALICE = "a@b.com";
    private static final UserRoles ROLES = new UserRoles(ImmutableList.of("admins"), ImmutableList.of("analysts"));

    private TestingPrivilegeStore privilegeStore;
    private TestingCatalogEnumerator catalogEnumerator;
    private TestingAuditSink auditSink;
    private PermissionCache permissionCache;
    private UserContext alice;
    private UserContext admin;

    @BeforeEach
    public void setUp()
    {
        privilegeStore = new TestingPrivilegeStore();
        catalogEnumerator = new TestingCatalogEnumerator();
        auditSink = new TestingAuditSink();
        permissionCache = PermissionCache.withoutExpiry();
        alice = UserContext.create(ALICE, "u1", null, ImmutableList.of("users"), ROLES, Instant.EPOCH);
        admin = UserContext.create("root@b.com", "u0", null, ImmutableList.of("admins"), ROLES, Instant.EPOCH);
    }

    @Test
    public void testAdminBypassesAllChecks()
    {
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());

        assertThat(engine.checkCatalogAccess(admin, "c", USAGE)).isTrue();
        assertThat(engine.checkSchemaAccess(admin, "c", "s", USAGE)).isTrue();
        assertThat(engine.checkTableAccess(admin, "c", "s", "t", SELECT)).isTrue();
        assertThat(engine.validateQueryPermissions("SELECT * FROM c.s.t", admin).allowed()).isTrue();
        assertThat(engine.getUserDataScope(admin).canAccessTable("any", "schema", "table")).isTrue();
        assertThat(privilegeStore.getTotalCalls()).isZero();
    }

    @Test
    public void testAdminQueryIsNotRewritten()
    {
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());
        String sql = "SELECT * FROM t WHERE active = true";

        assertThat(engine.injectRowLevelSecurity(sql, admin, ImmutableMap.of())).isEqualTo(sql);
        assertThat(engine.injectRowLevelSecurity(sql, admin, ImmutableMap.of("c.s.t", "region = 'west'"))).isEqualTo(sql);
    }

    @Test
    public void testTableCheckStopsAtSchema()
    {
        privilegeStore.grantCatalog("c", ALICE, "USAGE")
                .grantTable("c.s.t", ALICE, "SELECT");
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());

        assertThat(engine.checkTableAccess(alice, "c", "s", "t", SELECT)).isFalse();
        assertThat(privilegeStore.getCallCount(SecurableType.SCHEMA, "c.s", ALICE)).isEqualTo(1);
        assertThat(privilegeStore.getCallCount(SecurableType.TABLE, "c.s.t", ALICE)).isZero();
    }

    @Test
    public void testSchemaCheckStopsAtCatalog()
    {
        privilegeStore.grantSchema("c.s", ALICE, "USAGE");
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());

        assertThat(engine.checkSchemaAccess(alice, "c", "s", USAGE)).isFalse();
        assertThat(privilegeStore.getCallCount(SecurableType.SCHEMA, "c.s", ALICE)).isZero();
    }

    @Test
    public void testFullHierarchyGrant()
    {
        grantHierarchy();
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());

        assertThat(engine.checkTableAccess(alice, "c", "s", "t", SELECT)).isTrue();
        assertThat(engine.checkTableAccess(alice, "c", "s", "t", "select")).isTrue();
        assertThat(engine.checkTableAccess(alice, "c", "s", "t", Privileges.MODIFY)).isFalse();
    }

    @Test
    public void testRepeatedChecksUseCache()
    {
        grantHierarchy();
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());

        for (int i = 0; i < 5; i++) {
            assertThat(engine.checkTableAccess(alice, "c", "s", "t", SELECT)).isTrue();
        }
        assertThat(privilegeStore.getCallCount(SecurableType.CATALOG, "c", ALICE)).isEqualTo(1);
        assertThat(privilegeStore.getCallCount(SecurableType.SCHEMA, "c.s", ALICE)).isEqualTo(1);
        assertThat(privilegeStore.getCallCount(SecurableType.TABLE, "c.s.t", ALICE)).isEqualTo(1);

        engine.clearCache(ALICE);
        engine.checkCatalogAccess(alice, "c", USAGE);
        assertThat(privilegeStore.getCallCount(SecurableType.CATALOG, "c", ALICE)).isEqualTo(2);

        engine.clearCache();
        assertThat(permissionCache.size()).isZero();
    }

    @Test
    public void testStoreFailureDeniesWithoutCaching()
    {
        privilegeStore.failOn("c");
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());

        assertThat(engine.checkCatalogAccess(alice, "c", USAGE)).isFalse();
        assertThat(permissionCache.size()).isZero();

        privilegeStore.recover("c").grantCatalog("c", ALICE, "USAGE");
        assertThat(engine.checkCatalogAccess(alice, "c", USAGE)).isTrue();
        assertThat(privilegeStore.getCallCount(SecurableType.CATALOG, "c", ALICE)).isEqualTo(2);
    }

    @Test
    public void testUserDataScope()
    {
        catalogEnumerator.addSchemas("mv_catalog", "demo_health", "finance", "hidden")
                .addSchemas("other", "public");
        privilegeStore.grantCatalog("mv_catalog", ALICE, "USAGE")
                .grantSchema("mv_catalog.demo_health", ALICE, "USAGE")
                .grantSchema("mv_catalog.finance", ALICE, "USAGE", "SELECT");
        RowFilterPolicy policy = RowFilterPolicy.fromJson("""
                {"rules": [
                  {"table": "mv_catalog.demo_health.members", "filter": "region = 'west'", "restrictedColumns": ["date_of_birth"]},
                  {"table": "mv_catalog.demo_health.*", "restrictedColumns": ["ssn"]},
                  {"table": "mv_catalog.hidden.secrets", "filter": "false"}
                ]}
                """);
        AuthorizationEngine engine = createEngine(policy);

        DataAccessScope scope = engine.getUserDataScope(alice);

        assertThat(scope.getAccessibleCatalogs()).containsExactly("mv_catalog");
        assertThat(scope.getAccessibleSchemas()).containsExactly("mv_catalog.demo_health", "mv_catalog.finance");
        assertThat(scope.getAccessibleTables()).isEmpty();
        assertThat(scope.getRowFilter("mv_catalog.demo_health.members")).contains("region = 'west'");
        assertThat(scope.getRowFilter("mv_catalog.hidden.secrets")).isEmpty();
        assertThat(scope.getRestrictedColumns("mv_catalog.demo_health.members")).containsExactly("date_of_birth");
        assertThat(scope.getRestrictedColumns("mv_catalog.demo_health.*")).containsExactly("ssn");
        assertThat(scope.getAccessLevel("mv_catalog")).isEqualTo(AccessLevel.READ);
        assertThat(scope.getAccessLevel("mv_catalog.finance")).isEqualTo(AccessLevel.READ);
        assertThat(scope.getAccessLevel("other")).isEqualTo(AccessLevel.NONE);
    }

    @Test
    public void testUserDataScopeOmitsFailingSubtrees()
    {
        catalogEnumerator.addSchemas("broken", "s")
                .addSchemas("good", "s")
                .failSchemaListing("broken");
        privilegeStore.grantCatalog("broken", ALICE, "USAGE")
                .grantCatalog("good", ALICE, "USAGE")
                .grantSchema("good.s", ALICE, "USAGE");
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());

        DataAccessScope scope = engine.getUserDataScope(alice);

        assertThat(scope.getAccessibleCatalogs()).containsExactly("broken", "good");
        assertThat(scope.getAccessibleSchemas()).containsExactly("good.s");
    }

    @Test
    public void testUserDataScopeWhenCatalogListingFails()
    {
        catalogEnumerator.failCatalogListing();
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());

        DataAccessScope scope = engine.getUserDataScope(alice);

        assertThat(scope.getAccessibleCatalogs()).isEmpty();
        assertThat(scope.getAccessibleSchemas()).isEmpty();
    }

    @Test
    public void testUserDataScopeCombinesFiltersOnSameTable()
    {
        catalogEnumerator.addSchemas("mv_catalog", "demo_health");
        privilegeStore.grantCatalog("mv_catalog", ALICE, "USAGE")
                .grantSchema("mv_catalog.demo_health", ALICE, "USAGE");
        RowFilterPolicy policy = RowFilterPolicy.fromJson("""
                {"rules": [
                  {"table": "mv_catalog.demo_health.members", "filter": "region = 'west'"},
                  {"table": "mv_catalog.demo_health.members", "filter": "deleted = false", "restrictedColumns": ["ssn"]}
                ]}
                """);
        AuthorizationEngine engine = createEngine(policy);

        DataAccessScope scope = engine.getUserDataScope(alice);

        assertThat(scope.getRowFilter("mv_catalog.demo_health.members"))
                .contains("(region = 'west') AND (deleted = false)")
                .isEqualTo(policy.getRowFilter("mv_catalog", "demo_health", "members"));
        assertThat(scope.getRestrictedColumns("mv_catalog.demo_health.members")).containsExactly("ssn");
    }

    @Test
    public void testUserDataScopeWithoutMetadataConnection()
    {
        DashboardAccessConfig config = new DashboardAccessConfig();
        AuthorizationEngine engine = new AuthorizationEngine(
                config,
                privilegeStore,
                new JdbcCatalogEnumerator(new JdbcConnectionFactory(config)),
                permissionCache,
                RowFilterPolicy.empty(),
                auditSink);

        DataAccessScope scope = engine.getUserDataScope(alice);

        assertThat(scope.getAccessibleCatalogs()).isEmpty();
        assertThat(scope.getAccessibleSchemas()).isEmpty();
    }

    @Test
    public void testDefaultRowFilterWithWhere()
    {
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());

        assertThat(engine.injectRowLevelSecurity("SELECT * FROM t WHERE active = true", alice, ImmutableMap.of()))
                .isEqualTo("SELECT * FROM t WHERE current_user() = 'a@b.com' AND active = true");
        assertThat(engine.injectRowLevelSecurity("select * from t where active = true", alice, ImmutableMap.of()))
                .isEqualTo("select * from t where current_user() = 'a@b.com' AND active = true");
    }

    @Test
    public void testDefaultRowFilterWithoutWhere()
    {
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());
        String sql = "SELECT * FROM t";

        assertThat(engine.injectRowLevelSecurity(sql, alice, ImmutableMap.of())).isEqualTo(sql);
        // keyword inside an identifier is not a WHERE clause
        assertThat(engine.injectRowLevelSecurity("SELECT somewhere FROM t", alice, ImmutableMap.of())).isEqualTo("SELECT somewhere FROM t");
    }

    @Test
    public void testDefaultRowFilterEscapesQuotes()
    {
        UserContext quoted = UserContext.create("o'brien@b.com", "u9", null, ImmutableList.of("users"), ROLES, Instant.EPOCH);
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());

        assertThat(engine.injectRowLevelSecurity("SELECT * FROM t WHERE x = 1", quoted, ImmutableMap.of()))
                .isEqualTo("SELECT * FROM t WHERE current_user() = 'o''brien@b.com' AND x = 1");
    }

    @Test
    public void testExplicitRowFilters()
    {
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());
        ImmutableMap<String, String> filters = ImmutableMap.of(
                "c.s.members", "region = 'west'",
                "hive_metastore.s.claims", "status <> 'void'",
                "c.s.unrelated", "false");

        assertThat(engine.injectRowLevelSecurity("SELECT * FROM c.s.members m JOIN s.claims c ON m.id = c.member_id WHERE m.active", alice, filters))
                .isEqualTo("SELECT * FROM c.s.members m JOIN s.claims c ON m.id = c.member_id WHERE (region = 'west') AND (status <> 'void') AND m.active");
    }

    @Test
    public void testExplicitRowFilterWithoutWhereIsDenied()
    {
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());

        assertThatThrownBy(() -> engine.injectRowLevelSecurity("SELECT * FROM c.s.members", alice, ImmutableMap.of("c.s.members", "region = 'west'")))
                .isInstanceOf(AccessDeniedException.class)
                .hasMessageContaining("c.s.members")
                .satisfies(e -> assertThat(((AccessDeniedException) e).getResource()).contains("c.s.members"));
    }

    @Test
    public void testPolicyRowFilters()
    {
        RowFilterPolicy policy = RowFilterPolicy.fromJson("""
                {"rules": [{"table": "c.s.members", "filter": "region = 'west'"}]}
                """);
        AuthorizationEngine engine = createEngine(policy);

        assertThat(engine.rowFiltersFor("SELECT * FROM c.s.members")).containsEntry("c.s.members", "region = 'west'");
        assertThat(engine.injectRowLevelSecurity("SELECT * FROM c.s.members WHERE x = 1", alice))
                .isEqualTo("SELECT * FROM c.s.members WHERE (region = 'west') AND x = 1");
        assertThat(engine.injectRowLevelSecurity("SELECT * FROM c.s.other WHERE x = 1", alice))
                .isEqualTo("SELECT * FROM c.s.other WHERE current_user() = 'a@b.com' AND x = 1");
    }

    @Test
    public void testValidateQueryPermissions()
    {
        grantHierarchy();
        privilegeStore.grantTable("c.s.secret_table", ALICE, "USAGE");
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());

        QueryValidation granted = engine.validateQueryPermissions("SELECT * FROM c.s.t", alice);
        assertThat(granted).isEqualTo(QueryValidation.granted());
        assertThat(granted.allowed()).isTrue();
        assertThat(granted.reason()).isEmpty();
        assertThat(granted.deniedTable()).isEmpty();

        QueryValidation denied = engine.validateQueryPermissions("SELECT * FROM c.s.t JOIN c.s.secret_table x ON true", alice);
        assertThat(denied.allowed()).isFalse();
        assertThat(denied.reason()).contains("Access denied to table c.s.secret_table");
        assertThat(denied.deniedTable()).contains("c.s.secret_table");
    }

    @Test
    public void testValidateUsesDefaultCatalog()
    {
        privilegeStore.grantCatalog("hive_metastore", ALICE, "USAGE")
                .grantSchema("hive_metastore.sales", ALICE, "USAGE")
                .grantTable("hive_metastore.sales.orders", ALICE, "SELECT");
        AuthorizationEngine engine = createEngine(RowFilterPolicy.empty());

        assertThat(engine.validateQueryPermissions("SELECT * FROM sales.orders", alice).allowed()).isTrue();
        assertThat(engine.validateQueryPermissions("SELECT * FROM sales.returns", alice).reason())
                .contains("Access denied to table sales.returns");
    }

    @Test
    public void testAuditAccess()
    {
        TestingClock clock = new TestingClock();
        AuthorizationEngine engine = new AuthorizationEngine(
                new DashboardAccessConfig(),
                privilegeStore,
                catalogEnumerator,
                permissionCache,
                RowFilterPolicy.empty(),
                auditSink,
                clock);

        engine.auditAccess(alice, "c.s.t", "execute", false);

        assertThat(auditSink.getEvents()).singleElement().satisfies(event -> {
            assertThat(event.getTimestamp()).isEqualTo(clock.instant());
            assertThat(event.getUserEmail()).isEqualTo(ALICE);
            assertThat(event.getUserId()).isEqualTo("u1");
            assertThat(event.getResource()).isEqualTo("c.s.t");
            assertThat(event.getAction()).isEqualTo("execute");
            assertThat(event.isGranted()).isFalse();
            assertThat(event.getGroups()).containsExactly("users");
        });
    }

    private void grantHierarchy()
    {
        privilegeStore.grantCatalog("c", ALICE, "USAGE")
                .grantSchema("c.s", ALICE, "USAGE")
                .grantTable("c.s.t", ALICE, "SELECT");
    }

    private AuthorizationEngine createEngine(RowFilterPolicy policy)
    {
        return new AuthorizationEngine(new DashboardAccessConfig(), privilegeStore, catalogEnumerator, permissionCache, policy, auditSink);
    }
}
