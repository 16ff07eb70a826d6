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
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import com.google.inject.util.Modules;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.dashboard.access.audit.AuditSink;
import io.dashboard.access.audit.LoggingAuditSink;
import io.dashboard.access.auth.AuthenticationGateway;
import io.dashboard.access.auth.HttpIdentityLookup;
import io.dashboard.access.auth.IdentityLookup;
import io.dashboard.access.auth.SessionCache;
import io.dashboard.access.authz.AuthorizationEngine;
import io.dashboard.access.authz.CatalogEnumerator;
import io.dashboard.access.authz.OpenFgaConfig;
import io.dashboard.access.authz.OpenFgaPrivilegeStore;
import io.dashboard.access.authz.PermissionCache;
import io.dashboard.access.authz.PrivilegeStore;
import io.dashboard.access.authz.QueryAuthorizationPipeline;
import io.dashboard.access.authz.RowFilterPolicy;
import io.dashboard.access.config.ConfigurationCache;
import io.dashboard.access.config.ConfigurationStore;
import io.dashboard.access.config.JdbcCatalogEnumerator;
import io.dashboard.access.config.JdbcConnectionFactory;
import io.dashboard.access.config.JdbcMetadataStore;
import io.dashboard.access.config.MetadataStore;

import java.nio.file.Path;
import java.util.List;

import static io.airlift.configuration.ConfigBinder.configBinder;

/**
 * Binds the configuration, the caches, the external collaborators and the
 * services built on them. Every binding is a singleton so the caches are shared
 * by all requests.
 * <p>
 * Collaborator bindings may be replaced by override modules.
 */
public class DashboardAccessModule
        extends AbstractConfigurationAwareModule
{
    private final List<Module> collaboratorOverrides;

    public DashboardAccessModule(Module... collaboratorOverrides)
    {
        this.collaboratorOverrides = ImmutableList.copyOf(collaboratorOverrides);
    }

    @Override
    protected void setup(Binder binder)
    {
        configBinder(binder).bindConfig(DashboardAccessConfig.class);
        configBinder(binder).bindConfig(OpenFgaConfig.class);

        binder.bind(SessionCache.class).in(Scopes.SINGLETON);
        binder.bind(PermissionCache.class).in(Scopes.SINGLETON);
        binder.bind(ConfigurationCache.class).in(Scopes.SINGLETON);

        binder.install(Modules.override(new CollaboratorModule()).with(collaboratorOverrides));

        binder.bind(AuthenticationGateway.class).in(Scopes.SINGLETON);
        binder.bind(AuthorizationEngine.class).in(Scopes.SINGLETON);
        binder.bind(QueryAuthorizationPipeline.class).in(Scopes.SINGLETON);
        binder.bind(ConfigurationStore.class).in(Scopes.SINGLETON);

        binder.bind(LifeCycleManagerWrapper.class).in(Scopes.SINGLETON);
        binder.bind(DashboardAccessService.class).in(Scopes.SINGLETON);
    }

    @Provides
    @Singleton
    public static RowFilterPolicy createRowFilterPolicy(DashboardAccessConfig config)
    {
        return config.getRowFilterPolicyFile()
                .map(Path::of)
                .map(RowFilterPolicy::load)
                .orElseGet(RowFilterPolicy::empty);
    }

    private static class CollaboratorModule
            implements Module
    {
        @Override
        public void configure(Binder binder)
        {
            binder.bind(IdentityLookup.class).to(HttpIdentityLookup.class).in(Scopes.SINGLETON);
            binder.bind(PrivilegeStore.class).to(OpenFgaPrivilegeStore.class).in(Scopes.SINGLETON);
            binder.bind(JdbcConnectionFactory.class).in(Scopes.SINGLETON);
            binder.bind(CatalogEnumerator.class).to(JdbcCatalogEnumerator.class).in(Scopes.SINGLETON);
            binder.bind(MetadataStore.class).to(JdbcMetadataStore.class).in(Scopes.SINGLETON);
            binder.bind(AuditSink.class).to(LoggingAuditSink.class).in(Scopes.SINGLETON);
        }
    }
}
