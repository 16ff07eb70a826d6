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

import com.google.inject.Injector;
import com.google.inject.Module;
import io.airlift.bootstrap.Bootstrap;
import io.airlift.json.JsonModule;
import io.airlift.log.Logger;
import io.dashboard.access.config.ConfigurationStore;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Creates a fully wired {@link DashboardAccessService} from configuration properties.
 * <p>
 * Collaborator bindings can be replaced by passing override modules, for
 * example to plug in a different privilege store.
 */
public final class DashboardAccessFactory
{
    private static final Logger log = Logger.get(DashboardAccessFactory.class);

    private DashboardAccessFactory() {}

    public static DashboardAccessService create(Map<String, String> config, Module... overrides)
    {
        requireNonNull(config, "config is null");

        Bootstrap app = new Bootstrap(
                new JsonModule(),
                new DashboardAccessModule(overrides));

        Injector injector = app
                .doNotInitializeLogging()
                .setRequiredConfigurationProperties(config)
                .initialize();

        if (!injector.getInstance(ConfigurationStore.class).validateConfigTablesExist()) {
            log.warn("Configuration tables may not be properly set up");
        }
        return injector.getInstance(DashboardAccessService.class);
    }
}
