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
package io.dashboard.access.config;

import com.google.common.collect.ImmutableList;
import io.airlift.testing.TestingTicker;
import io.airlift.units.Duration;
import io.dashboard.access.CollaboratorException;
import io.dashboard.access.DashboardAccessConfig;
import org.junit.jupiter.api.Test;

import static java.util.concurrent.TimeUnit.MINUTES;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestJdbcMetadataStore
{
    private final DashboardAccessConfig config = new DashboardAccessConfig();

    @Test
    public void testQueryWithoutJdbcUrl()
    {
        JdbcMetadataStore metadataStore = new JdbcMetadataStore(config, new JdbcConnectionFactory(config));

        assertThatThrownBy(() -> metadataStore.query("SELECT 1", ImmutableList.of()))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("metadata.jdbc-url is not configured")
                .satisfies(e -> assertThat(((CollaboratorException) e).getCollaborator()).isEqualTo("metadata store"));
    }

    @Test
    public void testListingWithoutJdbcUrl()
    {
        JdbcCatalogEnumerator enumerator = new JdbcCatalogEnumerator(new JdbcConnectionFactory(config));

        assertThatThrownBy(enumerator::listCatalogs)
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("metadata.jdbc-url is not configured");
        assertThatThrownBy(() -> enumerator.listSchemas("mv_catalog"))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("mv_catalog");
    }

    @Test
    public void testValidateConfigTablesWithoutJdbcUrl()
    {
        ConfigurationStore store = new ConfigurationStore(
                config,
                new JdbcMetadataStore(config, new JdbcConnectionFactory(config)),
                new ConfigurationCache(new Duration(5, MINUTES), new TestingTicker()));

        assertThat(store.validateConfigTablesExist()).isFalse();
    }
}
