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
package io.dashboard.access.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.airlift.json.ObjectMapperProvider;
import io.airlift.log.Logger;
import io.dashboard.access.CollaboratorException;
import io.dashboard.access.DashboardAccessConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Resolves bearer credentials by calling a SCIM {@code Me} endpoint on behalf of
 * the caller.
 * <p>
 * The endpoint is expected to answer with a SCIM user resource:
 * <pre>
 * {
 *   "id": "1234",
 *   "userName": "alice@example.com",
 *   "displayName": "Alice",
 *   "emails": [{"value": "alice@example.com"}],
 *   "groups": [{"display": "analysts"}]
 * }
 * </pre>
 * Any non-200 status, transport failure or unparsable body is reported as a
 * {@link CollaboratorException}; the credential itself is never included in the
 * message.
 */
public class HttpIdentityLookup
        implements IdentityLookup
{
    private static final Logger log = Logger.get(HttpIdentityLookup.class);
    private static final String COLLABORATOR = "identity lookup";

    private final HttpClient httpClient;
    private final ObjectMapper json;
    private final URI endpoint;
    private final Duration requestTimeout;

    @Inject
    public HttpIdentityLookup(DashboardAccessConfig config)
    {
        this(config, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getIdentityRequestTimeout().toMillis()))
                .build());
    }

    public HttpIdentityLookup(DashboardAccessConfig config, HttpClient httpClient)
    {
        requireNonNull(config.getIdentityEndpointUri(), "identity endpoint URI is null");
        this.endpoint = URI.create(config.getIdentityEndpointUri());
        this.requestTimeout = Duration.ofMillis(config.getIdentityRequestTimeout().toMillis());
        this.httpClient = requireNonNull(httpClient, "httpClient is null");
        this.json = new ObjectMapperProvider().get();
    }

    @Override
    public ResolvedIdentity lookup(String credential)
    {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .header("Authorization", "Bearer " + credential)
                .header("Accept", "application/scim+json, application/json")
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(COLLABORATOR, "Interrupted while resolving identity", e);
        }
        catch (IOException e) {
            throw new CollaboratorException(COLLABORATOR, "Request to " + endpoint + " failed: " + e.getMessage(), e);
        }

        if (response.statusCode() != 200) {
            log.debug("Identity endpoint %s answered with status %s", endpoint, response.statusCode());
            throw new CollaboratorException(COLLABORATOR, "Identity endpoint returned status " + response.statusCode());
        }

        try {
            return parseScimUser(json.readTree(response.body()));
        }
        catch (IOException e) {
            throw new CollaboratorException(COLLABORATOR, "Malformed identity response: " + e.getMessage(), e);
        }
    }

    static ResolvedIdentity parseScimUser(JsonNode user)
    {
        String userId = user.path("id").asText(null);
        if (userId == null) {
            throw new CollaboratorException(COLLABORATOR, "Identity response has no user id");
        }

        String email = user.path("userName").asText(null);
        if (email == null) {
            JsonNode emails = user.path("emails");
            email = emails.isArray() && emails.size() > 0 ? emails.get(0).path("value").asText("unknown") : "unknown";
        }

        ImmutableList.Builder<String> groups = ImmutableList.builder();
        for (JsonNode group : user.path("groups")) {
            String display = group.path("display").asText(null);
            if (display != null) {
                groups.add(display);
            }
        }

        Optional<String> displayName = Optional.ofNullable(user.path("displayName").asText(null));
        return new ResolvedIdentity(email, userId, displayName, groups.build());
    }
}
