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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.units.Duration;
import io.airlift.units.MinDuration;
import jakarta.validation.constraints.NotNull;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Configuration properties for the dashboard access core.
 * <p>
 * This class holds the settings consumed by the authentication gateway, the
 * authorization engine and the configuration store:
 * <ul>
 *   <li>Location of the governed configuration tables (catalog, schema, JDBC connection)</li>
 *   <li>Cache lifetimes for sessions, permissions and configuration records</li>
 *   <li>The development-mode bypass and its synthetic identity</li>
 *   <li>Group names that grant the admin and analyst roles</li>
 *   <li>Identity lookup endpoint and row-level security policy</li>
 * </ul>
 * <p>
 * Example:
 * <pre>
 * metadata.catalog=mv_catalog
 * metadata.schema=config_schema
 * session-cache.ttl=5m
 * auth.dev-mode=false
 * </pre>
 */
public class DashboardAccessConfig
{
    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private String metadataCatalog = "mv_catalog";
    private String metadataSchema = "config_schema";
    private String metadataJdbcUrl;
    private Optional<String> metadataUser = Optional.empty();
    private Optional<String> metadataPassword = Optional.empty();
    private Duration metadataQueryTimeout = new Duration(30, SECONDS);
    private String dataCatalog = "mv_catalog";
    private String dataSchema = "demo_health";
    private Duration sessionCacheTtl = new Duration(5, MINUTES);
    private Duration sessionMaxAge = new Duration(60, MINUTES);
    private Optional<Duration> permissionCacheExpireAfterWrite = Optional.empty();
    private Duration configurationCacheTtl = new Duration(5, MINUTES);
    private boolean devMode;
    private String devModeUserEmail = "dev@example.com";
    private String devModeUserId = "dev-user-id";
    private Set<String> adminGroups = ImmutableSet.of("admins", "account admins", "workspace admins");
    private Set<String> analystGroups = ImmutableSet.of("analysts", "data_analysts", "analytics_team");
    private String identityEndpointUri;
    private Duration identityRequestTimeout = new Duration(10, SECONDS);
    private String defaultCatalog = "hive_metastore";
    private Optional<String> rowFilterPolicyFile = Optional.empty();

    /**
     * Returns the catalog holding the governed configuration tables
     * ({@code dashboard_queries}, {@code filter_definitions}, ...).
     */
    @NotNull
    public String getMetadataCatalog()
    {
        return metadataCatalog;
    }

    @Config("metadata.catalog")
    @ConfigDescription("Catalog containing the dashboard configuration tables")
    public DashboardAccessConfig setMetadataCatalog(String metadataCatalog)
    {
        this.metadataCatalog = metadataCatalog;
        return this;
    }

    @NotNull
    public String getMetadataSchema()
    {
        return metadataSchema;
    }

    @Config("metadata.schema")
    @ConfigDescription("Schema containing the dashboard configuration tables")
    public DashboardAccessConfig setMetadataSchema(String metadataSchema)
    {
        this.metadataSchema = metadataSchema;
        return this;
    }

    /**
     * Returns the JDBC URL used to read configuration tables and enumerate
     * catalogs and schemas. Required when the JDBC collaborators are bound.
     */
    public String getMetadataJdbcUrl()
    {
        return metadataJdbcUrl;
    }

    @Config("metadata.jdbc-url")
    @ConfigDescription("JDBC URL of the SQL warehouse holding the configuration tables")
    public DashboardAccessConfig setMetadataJdbcUrl(String metadataJdbcUrl)
    {
        this.metadataJdbcUrl = metadataJdbcUrl;
        return this;
    }

    public Optional<String> getMetadataUser()
    {
        return metadataUser;
    }

    @Config("metadata.user")
    public DashboardAccessConfig setMetadataUser(String metadataUser)
    {
        this.metadataUser = Optional.ofNullable(metadataUser);
        return this;
    }

    public Optional<String> getMetadataPassword()
    {
        return metadataPassword;
    }

    @Config("metadata.password")
    public DashboardAccessConfig setMetadataPassword(String metadataPassword)
    {
        this.metadataPassword = Optional.ofNullable(metadataPassword);
        return this;
    }

    @MinDuration("1s")
    public Duration getMetadataQueryTimeout()
    {
        return metadataQueryTimeout;
    }

    @Config("metadata.query-timeout")
    @ConfigDescription("Maximum time to wait for a configuration table query")
    public DashboardAccessConfig setMetadataQueryTimeout(Duration metadataQueryTimeout)
    {
        this.metadataQueryTimeout = metadataQueryTimeout;
        return this;
    }

    /**
     * Returns the catalog substituted for the {@code catalog} parameter of drill-down queries.
     */
    @NotNull
    public String getDataCatalog()
    {
        return dataCatalog;
    }

    @Config("data.catalog")
    @ConfigDescription("Default catalog passed to drill-down query templates")
    public DashboardAccessConfig setDataCatalog(String dataCatalog)
    {
        this.dataCatalog = dataCatalog;
        return this;
    }

    @NotNull
    public String getDataSchema()
    {
        return dataSchema;
    }

    @Config("data.schema")
    @ConfigDescription("Default schema passed to drill-down query templates")
    public DashboardAccessConfig setDataSchema(String dataSchema)
    {
        this.dataSchema = dataSchema;
        return this;
    }

    /**
     * Returns how long a validated credential is served from the session cache.
     * <p>
     * A revoked credential remains accepted for up to this long after revocation.
     * This window is independent of {@link #getSessionMaxAge()}.
     */
    @NotNull
    @MinDuration("0s")
    public Duration getSessionCacheTtl()
    {
        return sessionCacheTtl;
    }

    @Config("session-cache.ttl")
    @ConfigDescription("How long a validated credential is served from the session cache")
    public DashboardAccessConfig setSessionCacheTtl(Duration sessionCacheTtl)
    {
        this.sessionCacheTtl = sessionCacheTtl;
        return this;
    }

    @NotNull
    @MinDuration("1s")
    public Duration getSessionMaxAge()
    {
        return sessionMaxAge;
    }

    @Config("session.max-age")
    @ConfigDescription("Maximum age of an authenticated session for callers that require a fresh session")
    public DashboardAccessConfig setSessionMaxAge(Duration sessionMaxAge)
    {
        this.sessionMaxAge = sessionMaxAge;
        return this;
    }

    /**
     * Returns the optional expiry of permission cache entries.
     * <p>
     * When empty (the default) cached permission decisions live until the cache is
     * cleared explicitly, so grants changed in the catalog are only observed after
     * a clear or a restart.
     */
    public Optional<Duration> getPermissionCacheExpireAfterWrite()
    {
        return permissionCacheExpireAfterWrite;
    }

    @Config("permission-cache.expire-after-write")
    @ConfigDescription("Expire cached permission decisions after this duration; unset keeps them until cleared")
    public DashboardAccessConfig setPermissionCacheExpireAfterWrite(Duration permissionCacheExpireAfterWrite)
    {
        this.permissionCacheExpireAfterWrite = Optional.ofNullable(permissionCacheExpireAfterWrite);
        return this;
    }

    @NotNull
    @MinDuration("0s")
    public Duration getConfigurationCacheTtl()
    {
        return configurationCacheTtl;
    }

    @Config("configuration.cache-ttl")
    @ConfigDescription("How long query, filter and visualization definitions are cached")
    public DashboardAccessConfig setConfigurationCacheTtl(Duration configurationCacheTtl)
    {
        this.configurationCacheTtl = configurationCacheTtl;
        return this;
    }

    /**
     * Indicates whether requests without a credential are served as a synthetic
     * admin identity. Intended for local testing only.
     */
    public boolean isDevMode()
    {
        return devMode;
    }

    @Config("auth.dev-mode")
    @ConfigDescription("Serve requests without a credential as a synthetic admin user (local testing only)")
    public DashboardAccessConfig setDevMode(boolean devMode)
    {
        this.devMode = devMode;
        return this;
    }

    @NotNull
    public String getDevModeUserEmail()
    {
        return devModeUserEmail;
    }

    @Config("auth.dev-mode.user-email")
    public DashboardAccessConfig setDevModeUserEmail(String devModeUserEmail)
    {
        this.devModeUserEmail = devModeUserEmail;
        return this;
    }

    @NotNull
    public String getDevModeUserId()
    {
        return devModeUserId;
    }

    @Config("auth.dev-mode.user-id")
    public DashboardAccessConfig setDevModeUserId(String devModeUserId)
    {
        this.devModeUserId = devModeUserId;
        return this;
    }

    /**
     * Returns the lower-cased group names whose members are admins.
     */
    @NotNull
    public Set<String> getAdminGroups()
    {
        return adminGroups;
    }

    @Config("auth.admin-groups")
    @ConfigDescription("Comma separated groups whose members are dashboard admins")
    public DashboardAccessConfig setAdminGroups(String adminGroups)
    {
        this.adminGroups = parseGroups(adminGroups);
        return this;
    }

    @NotNull
    public Set<String> getAnalystGroups()
    {
        return analystGroups;
    }

    @Config("auth.analyst-groups")
    @ConfigDescription("Comma separated groups whose members are analysts")
    public DashboardAccessConfig setAnalystGroups(String analystGroups)
    {
        this.analystGroups = parseGroups(analystGroups);
        return this;
    }

    /**
     * Returns the URI of the SCIM "Me" endpoint that resolves a bearer credential
     * into the caller's identity and group membership.
     */
    public String getIdentityEndpointUri()
    {
        return identityEndpointUri;
    }

    @Config("identity.endpoint-uri")
    @ConfigDescription("URI of the endpoint returning the identity behind a bearer credential")
    public DashboardAccessConfig setIdentityEndpointUri(String identityEndpointUri)
    {
        this.identityEndpointUri = identityEndpointUri;
        return this;
    }

    @NotNull
    @MinDuration("1ms")
    public Duration getIdentityRequestTimeout()
    {
        return identityRequestTimeout;
    }

    @Config("identity.request-timeout")
    public DashboardAccessConfig setIdentityRequestTimeout(Duration identityRequestTimeout)
    {
        this.identityRequestTimeout = identityRequestTimeout;
        return this;
    }

    /**
     * Returns the catalog assumed for two-part {@code schema.table} references.
     */
    @NotNull
    public String getDefaultCatalog()
    {
        return defaultCatalog;
    }

    @Config("authorization.default-catalog")
    @ConfigDescription("Catalog assumed for table references written as schema.table")
    public DashboardAccessConfig setDefaultCatalog(String defaultCatalog)
    {
        this.defaultCatalog = defaultCatalog;
        return this;
    }

    /**
     * Returns the optional path of a JSON file declaring per-table row filters and
     * restricted columns.
     */
    public Optional<String> getRowFilterPolicyFile()
    {
        return rowFilterPolicyFile;
    }

    @Config("authorization.row-filter-policy-file")
    @ConfigDescription("Path to a JSON file with per-table row filters and restricted columns")
    public DashboardAccessConfig setRowFilterPolicyFile(String rowFilterPolicyFile)
    {
        this.rowFilterPolicyFile = Optional.ofNullable(rowFilterPolicyFile);
        return this;
    }

    private static Set<String> parseGroups(String groups)
    {
        if (groups == null) {
            return ImmutableSet.of();
        }
        return LIST_SPLITTER.splitToStream(groups)
                .map(group -> group.toLowerCase(Locale.ENGLISH))
                .collect(toImmutableSet());
    }
}
