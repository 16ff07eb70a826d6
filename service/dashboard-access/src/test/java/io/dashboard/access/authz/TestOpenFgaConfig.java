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
import io.airlift.configuration.ConfigurationFactory;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class TestOpenFgaConfig
{
    @Test
    public void testDefaults()
    {
        OpenFgaConfig config = new OpenFgaConfig();

        assertThat(config.getApiUrl()).isNull();
        assertThat(config.getStoreId()).isNull();
        assertThat(config.getModelId()).isEmpty();
        assertThat(config.getApiToken()).isEmpty();
        assertThat(config.getPrivileges()).containsExactly("USAGE", "SELECT", "MODIFY");
    }

    @Test
    public void testExplicitPropertyMappings()
    {
        Map<String, String> properties = ImmutableMap.<String, String>builder()
                .put("openfga.api.url", "http://localhost:8080")
                .put("openfga.store.id", "test_store")
                .put("openfga.model.id", "test_model")
                .put("openfga.api.token", "test_token")
                .put("openfga.privileges", "usage, select")
                .buildOrThrow();

        OpenFgaConfig config = new ConfigurationFactory(properties).build(OpenFgaConfig.class);

        assertThat(config.getApiUrl()).isEqualTo("http://localhost:8080");
        assertThat(config.getStoreId()).isEqualTo("test_store");
        assertThat(config.getModelId()).contains("test_model");
        assertThat(config.getApiToken()).contains("test_token");
        assertThat(config.getPrivileges()).containsExactly("USAGE", "SELECT");
    }
}
