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

import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.dashboard.access.auth.AuthenticationGateway;
import io.dashboard.access.authz.AuthorizationEngine;
import io.dashboard.access.authz.QueryAuthorizationPipeline;
import io.dashboard.access.config.ConfigurationStore;
import io.dashboard.access.config.FilterConfig;
import io.dashboard.access.config.QueryConfig;
import io.dashboard.access.model.DataAccessScope;
import io.dashboard.access.model.UserContext;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Entry point used by request handlers: authenticates callers, resolves
 * configured queries and turns statements into access-checked SQL ready for
 * execution.
 * <p>
 * Errors surface as {@link io.dashboard.access.auth.AuthenticationException}
 * (401), {@link io.dashboard.access.authz.AccessDeniedException} (403) and
 * {@link io.dashboard.access.config.ConfigurationException} (400).
 */
public class DashboardAccessService
{
    private static final Logger log = Logger.get(DashboardAccessService.class);

    private final AuthenticationGateway authenticationGateway;
    private final AuthorizationEngine authorizationEngine;
    private final QueryAuthorizationPipeline queryAuthorizationPipeline;
    private final ConfigurationStore configurationStore;
    private final LifeCycleManagerWrapper lifeCycleManager;

    @Inject
    public DashboardAccessService(
            AuthenticationGateway authenticationGateway,
            AuthorizationEngine authorizationEngine,
            QueryAuthorizationPipeline queryAuthorizationPipeline,
            ConfigurationStore configurationStore,
            LifeCycleManagerWrapper lifeCycleManager)
    {
        this.authenticationGateway = requireNonNull(authenticationGateway, "authenticationGateway is null");
        this.authorizationEngine = requireNonNull(authorizationEngine, "authorizationEngine is null");
        this.queryAuthorizationPipeline = requireNonNull(queryAuthorizationPipeline, "queryAuthorizationPipeline is null");
        this.configurationStore = requireNonNull(configurationStore, "configurationStore is null");
        this.lifeCycleManager = requireNonNull(lifeCycleManager, "lifeCycleManager is null");
    }

    public UserContext authenticate(Optional<String> credential)
    {
        return authenticationGateway.authenticate(credential);
    }

    /**
     * Checks and rewrites an ad-hoc statement for {@code user}.
     */
    public String authorizeAndRewrite(String sql, UserContext user)
    {
        return queryAuthorizationPipeline.authorize(sql, user);
    }

    public String resolveQuery(String queryId, Map<String, ?> parameters)
    {
        return configurationStore.buildQueryFromTemplate(queryId, parameters);
    }

    public String resolveAndAuthorize(String queryId, Map<String, ?> parameters, UserContext user)
    {
        return queryAuthorizationPipeline.authorize(resolveQuery(queryId, parameters), user);
    }

    public String resolveDrillDown(String vizId, Map<String, ?> context, UserContext user)
    {
        return queryAuthorizationPipeline.authorize(configurationStore.buildDrillDownQuery(vizId, context), user);
    }

    public DataAccessScope getDataScope(UserContext user)
    {
        return authorizationEngine.getUserDataScope(user);
    }

    public List<QueryConfig> listQueries(UserContext user, Optional<String> category)
    {
        authenticationGateway.requireAdmin(user);
        return configurationStore.getAllQueries(category);
    }

    public List<FilterConfig> listFilters(UserContext user, Optional<String> filterType, Optional<String> tab)
    {
        authenticationGateway.requireAdmin(user);
        return configurationStore.getFilterConfigs(filterType, tab);
    }

    /**
     * Drops cached configuration and permission decisions so changes in the
     * configuration tables and the privilege store take effect immediately.
     */
    public void refreshConfiguration(UserContext user)
    {
        authenticationGateway.requireAdmin(user);
        configurationStore.clearCache();
        authorizationEngine.clearCache();
        log.info("Configuration refreshed by %s", user.getEmail());
    }

    public void shutdown()
    {
        authenticationGateway.clearSessions();
        lifeCycleManager.stop();
    }
}
