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
package io.dashboard.access;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Module;
import io.dashboard.access.audit.AuditSink;
import io.dashboard.access.audit.TestingAuditSink;
import io.dashboard.access.auth.AuthenticationException;
import io.dashboard.access.auth.IdentityLookup;
import io.dashboard.access.auth.TestingIdentityLookup;
import io.dashboard.access.authz.AccessDeniedException;
import io.dashboard.access.authz.CatalogEnumerator;
import io.dashboard.access.authz.PrivilegeStore;
import io.dashboard.access.authz.TestingCatalogEnumerator;
import io.dashboard.access.authz.TestingPrivilegeStore;
import io.dashboard.access.config.MetadataStore;
import io.dashboard.access.config.TestingMetadataStore;
import io.dashboard.access.model.DataAccessScope;
import io.dashboard.access.model.UserContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.google.common.io.Resources.getResource;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestDashboardAccessService
{
    private static final String ALICE = "alice@example.com";
    private static final String ROOT = "root@example.com";

    private TestingIdentityLookup identityLookup;
    private TestingPrivilegeStore privilegeStore;
    private TestingCatalogEnumerator catalogEnumerator;
    private TestingMetadataStore metadataStore;
    private TestingAuditSink auditSink;
    private DashboardAccessService service;

    @BeforeEach
    public void setUp()
            throws Exception
    {
        identityLookup = new TestingIdentityLookup()
                .addIdentity("token-alice", ALICE, ImmutableList.of("users"))
                .addIdentity("token-root", ROOT, ImmutableList.of("admins"));
        privilegeStore = new TestingPrivilegeStore()
                .grantCatalog("mv_catalog", ALICE, "USAGE")
                .grantSchema("mv_catalog.demo_health", ALICE, "USAGE")
                .grantTable("mv_catalog.demo_health.members", ALICE, "SELECT");
        catalogEnumerator = new TestingCatalogEnumerator()
                .addSchemas("mv_catalog", "demo_health", "finance");
        metadataStore = new TestingMetadataStore();
        auditSink = new TestingAuditSink();

        Map<String, String> properties = ImmutableMap.<String, String>builder()
                .put("openfga.api.url", "http://localhost:8080")
                .put("openfga.store.id", "01HVMMBCJ6BRQ7ANR8WZ1Q9YYM")
                .put("authorization.row-filter-policy-file", Path.of(getResource("row-filter-policy.json").toURI()).toString())
                .buildOrThrow();

        Module collaborators = binder -> {
            binder.bind(IdentityLookup.class).toInstance(identityLookup);
            binder.bind(PrivilegeStore.class).toInstance(privilegeStore);
            binder.bind(CatalogEnumerator.class).toInstance(catalogEnumerator);
            binder.bind(MetadataStore.class).toInstance(metadataStore);
            binder.bind(AuditSink.class).toInstance(auditSink);
        };
        service = DashboardAccessFactory.create(properties, collaborators);
    }

    @AfterEach
    public void tearDown()
    {
        service.shutdown();
    }

    @Test
    public void testAuthenticate()
    {
        UserContext alice = service.authenticate(Optional.of("token-alice"));
        assertThat(alice.getEmail()).isEqualTo(ALICE);
        assertThat(alice.isAdmin()).isFalse();

        service.authenticate(Optional.of("token-alice"));
        assertThat(identityLookup.getLookupCount()).isEqualTo(1);

        assertThat(service.authenticate(Optional.of("token-root")).isAdmin()).isTrue();
        assertThatThrownBy(() -> service.authenticate(Optional.empty()))
                .isInstanceOf(AuthenticationException.class);
    }

    @Test
    public void testAuthorizeAndRewrite()
    {
        UserContext alice = service.authenticate(Optional.of("token-alice"));

        assertThat(service.authorizeAndRewrite("SELECT * FROM mv_catalog.demo_health.members WHERE plan = 'gold'", alice))
                .isEqualTo("SELECT * FROM mv_catalog.demo_health.members WHERE (region = 'west') AND plan = 'gold'");
        assertThatThrownBy(() -> service.authorizeAndRewrite("SELECT * FROM mv_catalog.finance.ledger WHERE true", alice))
                .isInstanceOf(AccessDeniedException.class);
        assertThat(auditSink.getEvents()).hasSize(2);
    }

    @Test
    public void testResolveAndAuthorize()
    {
        addQuery("members_by_plan", "SELECT * FROM mv_catalog.demo_health.members WHERE plan = '${plan}'");
        UserContext alice = service.authenticate(Optional.of("token-alice"));

        assertThat(service.resolveQuery("members_by_plan", ImmutableMap.of("plan", "gold")))
                .isEqualTo("SELECT * FROM mv_catalog.demo_health.members WHERE plan = 'gold'");
        assertThat(service.resolveAndAuthorize("members_by_plan", ImmutableMap.of("plan", "gold"), alice))
                .isEqualTo("SELECT * FROM mv_catalog.demo_health.members WHERE (region = 'west') AND plan = 'gold'");
    }

    @Test
    public void testResolveDrillDown()
    {
        Map<String, Object> query = new HashMap<>();
        query.put("id", "member_detail");
        query.put("name", "Member detail");
        query.put("category", "members");
        query.put("sql_template", "SELECT * FROM ${catalog}.${schema}.members WHERE member_id = '${member_id}'");
        query.put("parameters", "[{\"name\": \"catalog\"}, {\"name\": \"schema\"}, {\"name\": \"member_id\", \"required\": true}]");
        metadataStore.addResponse("dashboard_queries", ImmutableList.of("member_detail"), ImmutableList.of(query));

        Map<String, Object> visualization = new HashMap<>();
        visualization.put("id", "members_chart");
        visualization.put("viz_name", "Members");
        visualization.put("viz_type", "bar");
        visualization.put("query_id", "members_by_plan");
        visualization.put("data_key", "count");
        visualization.put("allow_drill_down", true);
        visualization.put("drill_down_config", "{\"query_id\": \"member_detail\"}");
        metadataStore.addResponse("visualization_configs", ImmutableList.of("members_chart"), ImmutableList.of(visualization));

        UserContext alice = service.authenticate(Optional.of("token-alice"));
        assertThat(service.resolveDrillDown("members_chart", ImmutableMap.of("member_id", "M-7"), alice))
                .isEqualTo("SELECT * FROM mv_catalog.demo_health.members WHERE (region = 'west') AND member_id = 'M-7'");
    }

    @Test
    public void testDataScope()
    {
        DataAccessScope scope = service.getDataScope(service.authenticate(Optional.of("token-alice")));

        assertThat(scope.getAccessibleSchemas()).containsExactly("mv_catalog.demo_health");
        assertThat(scope.getRowFilter("mv_catalog.demo_health.members")).contains("region = 'west'");
        assertThat(scope.getRowFilter("mv_catalog.finance.*")).isEmpty();
    }

    @Test
    public void testAdminOperations()
    {
        addQuery("members_by_plan", "SELECT * FROM t WHERE plan = '${plan}'");
        UserContext alice = service.authenticate(Optional.of("token-alice"));
        UserContext root = service.authenticate(Optional.of("token-root"));

        assertThatThrownBy(() -> service.listQueries(alice, Optional.empty()))
                .isInstanceOf(AccessDeniedException.class)
                .hasMessageContaining("Admin privileges required");
        assertThatThrownBy(() -> service.refreshConfiguration(alice))
                .isInstanceOf(AccessDeniedException.class);
        assertThat(service.listFilters(root, Optional.empty(), Optional.empty())).isEmpty();

        service.resolveQuery("members_by_plan", ImmutableMap.of("plan", "gold"));
        service.resolveQuery("members_by_plan", ImmutableMap.of("plan", "gold"));
        int queries = metadataStore.getQueryCount();

        service.refreshConfiguration(root);
        service.resolveQuery("members_by_plan", ImmutableMap.of("plan", "gold"));
        assertThat(metadataStore.getQueryCount()).isEqualTo(queries + 1);
    }

    @Test
    public void testShutdownClearsSessions()
    {
        service.authenticate(Optional.of("token-alice"));
        service.shutdown();
        service.shutdown();

        service.authenticate(Optional.of("token-alice"));
        assertThat(identityLookup.getLookupCount()).isEqualTo(2);
    }

    private void addQuery(String id, String sqlTemplate)
    {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("name", id);
        row.put("category", "members");
        row.put("sql_template", sqlTemplate);
        row.put("parameters", "[{\"name\": \"plan\", \"required\": true}]");
        metadataStore.addResponse("dashboard_queries", ImmutableList.of(id), ImmutableList.of(row));
    }
}
