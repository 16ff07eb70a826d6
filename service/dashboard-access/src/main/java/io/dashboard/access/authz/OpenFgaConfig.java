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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Connection settings for the OpenFGA privilege store.
 * <pre>
 * openfga.api.url=https://openfga.example.com
 * openfga.store.id=01ABCDEF12345678
 * openfga.model.id=01ABCDEF87654321
 * </pre>
 */
public class OpenFgaConfig
{
    private static final Splitter PRIVILEGE_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private String apiUrl;
    private String storeId;
    private String modelId;
    private Optional<String> apiToken = Optional.empty();
    private List<String> privileges = ImmutableList.of(Privileges.USAGE, Privileges.SELECT, Privileges.MODIFY);

    @NotNull
    public String getApiUrl()
    {
        return apiUrl;
    }

    @Config("openfga.api.url")
    @ConfigDescription("URL for OpenFGA API server")
    public OpenFgaConfig setApiUrl(String apiUrl)
    {
        this.apiUrl = apiUrl;
        return this;
    }

    @NotNull
    public String getStoreId()
    {
        return storeId;
    }

    @Config("openfga.store.id")
    @ConfigDescription("OpenFGA store ID")
    public OpenFgaConfig setStoreId(String storeId)
    {
        this.storeId = storeId;
        return this;
    }

    /**
     * Authorization model to evaluate checks against. When unset the store's
     * latest model is used.
     */
    public Optional<String> getModelId()
    {
        return Optional.ofNullable(modelId);
    }

    @Config("openfga.model.id")
    @ConfigDescription("OpenFGA authorization model ID")
    public OpenFgaConfig setModelId(String modelId)
    {
        this.modelId = modelId;
        return this;
    }

    public Optional<String> getApiToken()
    {
        return apiToken;
    }

    @Config("openfga.api.token")
    @ConfigDescription("API token for OpenFGA if authentication is required")
    public OpenFgaConfig setApiToken(String apiToken)
    {
        this.apiToken = Optional.ofNullable(apiToken);
        return this;
    }

    /**
     * Relations checked for every resource when computing effective privileges.
     */
    @NotEmpty
    public List<String> getPrivileges()
    {
        return privileges;
    }

    @Config("openfga.privileges")
    @ConfigDescription("Comma separated privilege relations checked for each resource")
    public OpenFgaConfig setPrivileges(String privileges)
    {
        this.privileges = PRIVILEGE_SPLITTER.splitToStream(privileges)
                .map(privilege -> privilege.toUpperCase(Locale.ENGLISH))
                .collect(ImmutableList.toImmutableList());
        return this;
    }
}
