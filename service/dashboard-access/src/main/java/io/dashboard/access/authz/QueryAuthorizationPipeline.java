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

import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.dashboard.access.model.UserContext;

import static io.dashboard.access.authz.AccessDeniedException.denySelectTable;
import static java.util.Objects.requireNonNull;

/**
 * Validates a statement against the caller's table privileges and rewrites it
 * with row-level security before it is handed to the query executor.
 * <p>
 * Every invocation emits exactly one audit event, granted or denied.
 */
public class QueryAuthorizationPipeline
{
    private static final Logger log = Logger.get(QueryAuthorizationPipeline.class);

    static final String QUERY_RESOURCE = "query";
    static final String EXECUTE_ACTION = "execute";

    private final AuthorizationEngine authorizationEngine;

    @Inject
    public QueryAuthorizationPipeline(AuthorizationEngine authorizationEngine)
    {
        this.authorizationEngine = requireNonNull(authorizationEngine, "authorizationEngine is null");
    }

    /**
     * Returns the statement to execute on behalf of {@code user}.
     *
     * @throws AccessDeniedException if a referenced table may not be read, or
     * if a row filter applies but cannot be injected
     */
    public String authorize(String sql, UserContext user)
    {
        requireNonNull(sql, "sql is null");
        requireNonNull(user, "user is null");

        QueryValidation validation = authorizationEngine.validateQueryPermissions(sql, user);
        if (!validation.allowed()) {
            String deniedTable = validation.deniedTable().orElse(QUERY_RESOURCE);
            authorizationEngine.auditAccess(user, deniedTable, EXECUTE_ACTION, false);
            log.debug("Query denied for %s: %s", user.getEmail(), validation.reason().orElse(""));
            denySelectTable(deniedTable, validation.reason().orElseThrow());
        }

        String rewritten;
        try {
            rewritten = authorizationEngine.injectRowLevelSecurity(sql, user);
        }
        catch (AccessDeniedException e) {
            authorizationEngine.auditAccess(user, e.getResource().orElse(QUERY_RESOURCE), EXECUTE_ACTION, false);
            throw e;
        }

        authorizationEngine.auditAccess(user, QUERY_RESOURCE, EXECUTE_ACTION, true);
        return rewritten;
    }
}
