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
import com.google.inject.Inject;
import dev.openfga.sdk.api.client.model.ClientCheckRequest;
import dev.openfga.sdk.api.client.model.ClientCheckResponse;
import dev.openfga.sdk.api.configuration.ApiToken;
import dev.openfga.sdk.api.configuration.ClientConfiguration;
import dev.openfga.sdk.api.configuration.Credentials;
import dev.openfga.sdk.errors.FgaError;
import dev.openfga.sdk.errors.FgaInvalidParameterException;
import io.airlift.log.Logger;
import io.dashboard.access.CollaboratorException;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static java.util.Objects.requireNonNull;

/**
 * {@link PrivilegeStore} backed by an OpenFGA authorization service.
 * <p>
 * The effective privileges of a principal on a resource are the configured
 * privilege relations for which an OpenFGA {@code check} succeeds. Relations
 * are checked in lower case against objects named by securable type and dotted
 * name, for example {@code schema:main.sales}, with the user
 * {@code user:<email>}.
 * <p>
 * Connection errors are retried with exponential backoff, recreating the
 * underlying API client between attempts. Any other failure, or exhausting the
 * retries, surfaces as a {@link CollaboratorException}.
 */
public class OpenFgaPrivilegeStore
        implements PrivilegeStore
{
    private static final Logger log = Logger.get(OpenFgaPrivilegeStore.class);

    static final String COLLABORATOR = "privilege store";

    private static final int MAX_RETRIES = 3;
    private static final int RETRY_DELAY_MS = 200;

    private final OpenFgaConfig config;
    private final List<String> privileges;
    private final Object apiClientLock = new Object();
    private dev.openfga.sdk.api.client.OpenFgaClient apiClient;

    @Inject
    public OpenFgaPrivilegeStore(OpenFgaConfig config)
    {
        this.config = requireNonNull(config, "config is null");
        this.privileges = ImmutableList.copyOf(config.getPrivileges());
        log.info("Initializing OpenFGA privilege store with API URL: %s, Store ID: %s", config.getApiUrl(), config.getStoreId());
        this.apiClient = createApiClient();
    }

    @Override
    public List<String> getEffectivePrivileges(SecurableType securableType, String qualifiedName, String principal)
    {
        String object = securableType.typeName() + ":" + qualifiedName;
        String user = "user:" + principal;

        ImmutableList.Builder<String> granted = ImmutableList.builder();
        for (String privilege : privileges) {
            String relation = privilege.toLowerCase(Locale.ENGLISH);
            if (check(user, relation, object)) {
                granted.add(privilege);
            }
        }
        return granted.build();
    }

    private boolean check(String user, String relation, String object)
    {
        ClientCheckRequest checkRequest = new ClientCheckRequest();
        checkRequest.user(user);
        checkRequest.relation(relation);
        checkRequest._object(object);

        OpenFgaOperation<ClientCheckResponse> checkOperation = new OpenFgaOperation<>()
        {
            @Override
            public CompletableFuture<ClientCheckResponse> execute()
                    throws FgaInvalidParameterException
            {
                return currentClient().check(checkRequest);
            }

            @Override
            public String getDebugDescription()
            {
                return "OpenFGA 'check' operation for " + user + " on " + object + " with relation " + relation;
            }
        };

        try {
            ClientCheckResponse response = executeWithRetry(checkOperation);
            boolean allowed = Boolean.TRUE.equals(response.getAllowed());
            log.debug("OpenFGA check result: %s has %s relation to %s = %s", user, relation, object, allowed);
            return allowed;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(COLLABORATOR, "Interrupted during " + checkOperation.getDebugDescription(), e);
        }
        catch (ExecutionException | FgaInvalidParameterException e) {
            throw new CollaboratorException(COLLABORATOR, "Failed " + checkOperation.getDebugDescription(), e);
        }
    }

    /**
     * Executes an OpenFGA call, retrying on connection errors.
     */
    protected <T> T executeWithRetry(OpenFgaOperation<T> operation)
            throws ExecutionException, InterruptedException, FgaInvalidParameterException
    {
        ExecutionException lastException = null;

        for (int retries = 0; retries < MAX_RETRIES; retries++) {
            try {
                return operation.execute().get();
            }
            catch (ExecutionException e) {
                lastException = e;
                if (!isConnectionException(e.getCause())) {
                    log.error("Non-connection error from OpenFGA API: %s", extractErrorDetails(e));
                    throw e;
                }

                log.warn("Connection error while calling OpenFGA API, retrying (%d/%d): %s",
                        retries + 1, MAX_RETRIES, extractErrorDetails(e));
                synchronized (apiClientLock) {
                    apiClient = createApiClient();
                }
                Thread.sleep((long) RETRY_DELAY_MS * (1L << retries));
            }
        }

        String details = extractErrorDetails(lastException);
        log.error("Failed to execute OpenFGA operation after %d retries: %s", MAX_RETRIES, details);
        throw new ExecutionException("Failed to execute operation after " + MAX_RETRIES + " retries: " + details, lastException);
    }

    private dev.openfga.sdk.api.client.OpenFgaClient currentClient()
    {
        synchronized (apiClientLock) {
            return apiClient;
        }
    }

    private dev.openfga.sdk.api.client.OpenFgaClient createApiClient()
    {
        try {
            ClientConfiguration clientConfig = new ClientConfiguration();
            clientConfig.apiUrl(config.getApiUrl());
            clientConfig.storeId(config.getStoreId());
            config.getModelId().ifPresent(clientConfig::authorizationModelId);
            config.getApiToken().ifPresent(token -> clientConfig.credentials(new Credentials(new ApiToken(token))));
            return new dev.openfga.sdk.api.client.OpenFgaClient(clientConfig);
        }
        catch (FgaInvalidParameterException e) {
            throw new CollaboratorException(COLLABORATOR, "Failed to create OpenFGA client", e);
        }
    }

    private static String extractErrorDetails(ExecutionException e)
    {
        StringBuilder details = new StringBuilder(e.getMessage() != null ? e.getMessage() : "No message");
        Throwable cause = e.getCause();
        if (cause != null) {
            details.append(" - Cause: ").append(cause.getClass().getSimpleName());
            if (cause.getMessage() != null) {
                details.append(": ").append(cause.getMessage());
            }
            if (cause instanceof FgaError apiError) {
                String responseBody = apiError.getResponseData();
                if (responseBody != null && !responseBody.isEmpty()) {
                    details.append(" - API Error: ").append(responseBody);
                }
            }
        }
        return details.toString();
    }

    private static boolean isConnectionException(Throwable t)
    {
        if (t == null) {
            return false;
        }
        return t instanceof IOException ||
                (t.getMessage() != null &&
                        (t.getMessage().contains("Connection") ||
                                t.getMessage().contains("timeout") ||
                                t.getMessage().contains("connect")));
    }

    @FunctionalInterface
    protected interface OpenFgaOperation<T>
    {
        CompletableFuture<T> execute()
                throws FgaInvalidParameterException;

        default String getDebugDescription()
        {
            return "OpenFGA operation";
        }
    }
}
