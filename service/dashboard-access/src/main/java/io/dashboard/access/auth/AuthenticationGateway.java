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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.dashboard.access.CollaboratorException;
import io.dashboard.access.DashboardAccessConfig;
import io.dashboard.access.model.UserContext;
import io.dashboard.access.model.UserRoles;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import static io.dashboard.access.authz.AccessDeniedException.denyAdminPanel;
import static io.dashboard.access.authz.AccessDeniedException.denyGroupMembership;
import static java.util.Objects.requireNonNull;

/**
 * Turns an inbound bearer credential into a validated {@link UserContext}.
 * <p>
 * Validated contexts are kept in a {@link SessionCache} keyed by the raw
 * credential, so repeated requests with the same credential do not call the
 * identity lookup again until the cache entry expires.
 * <p>
 * When development mode is enabled, a request without a credential is served as
 * a synthetic admin identity built from the configured defaults. Development mode
 * is off unless explicitly configured.
 * <p>
 * Authentication failures are terminal: the caller is never downgraded to an
 * anonymous identity and the lookup is not retried.
 */
public class AuthenticationGateway
{
    private static final Logger log = Logger.get(AuthenticationGateway.class);

    private static final ImmutableList<String> DEV_MODE_GROUPS = ImmutableList.of("users", "admins");

    private final IdentityLookup identityLookup;
    private final SessionCache sessionCache;
    private final UserRoles userRoles;
    private final boolean devMode;
    private final String devModeUserEmail;
    private final String devModeUserId;
    private final Duration sessionMaxAge;
    private final Clock clock;

    @Inject
    public AuthenticationGateway(DashboardAccessConfig config, IdentityLookup identityLookup, SessionCache sessionCache)
    {
        this(config, identityLookup, sessionCache, Clock.systemUTC());
    }

    @VisibleForTesting
    public AuthenticationGateway(DashboardAccessConfig config, IdentityLookup identityLookup, SessionCache sessionCache, Clock clock)
    {
        requireNonNull(config, "config is null");
        this.identityLookup = requireNonNull(identityLookup, "identityLookup is null");
        this.sessionCache = requireNonNull(sessionCache, "sessionCache is null");
        this.userRoles = new UserRoles(config.getAdminGroups(), config.getAnalystGroups());
        this.devMode = config.isDevMode();
        this.devModeUserEmail = config.getDevModeUserEmail();
        this.devModeUserId = config.getDevModeUserId();
        this.sessionMaxAge = Duration.ofMillis(config.getSessionMaxAge().toMillis());
        this.clock = requireNonNull(clock, "clock is null");
    }

    /**
     * Authenticates the caller.
     *
     * @param credential the bearer credential, empty when the request carried none
     * @return the cached or freshly validated user context
     * @throws AuthenticationException when the credential is missing and development
     * mode is off, or when the identity lookup rejects it
     */
    public UserContext authenticate(Optional<String> credential)
    {
        requireNonNull(credential, "credential is null");
        if (credential.isEmpty() || credential.get().isBlank()) {
            if (devMode) {
                log.warn("DEV MODE: Using test user %s", devModeUserEmail);
                return UserContext.createAdmin(devModeUserEmail, devModeUserId, DEV_MODE_GROUPS, clock.instant());
            }
            throw new AuthenticationException("Missing authentication token");
        }

        String token = credential.get();
        Optional<UserContext> cached = sessionCache.get(token);
        if (cached.isPresent()) {
            log.debug("Serving cached session for %s", cached.get().getEmail());
            return cached.get();
        }

        UserContext user = validate(token);
        sessionCache.put(token, user);
        return user;
    }

    public UserContext authenticate(String credential)
    {
        return authenticate(Optional.ofNullable(credential));
    }

    /**
     * Authenticates the caller and additionally requires the session to be younger
     * than {@code maxSessionAge}. A cached context that is too old is rejected even
     * though its cache entry is still fresh.
     */
    public UserContext authenticateFresh(Optional<String> credential, Duration maxSessionAge)
    {
        UserContext user = authenticate(credential);
        if (!user.isSessionValid(maxSessionAge, clock.instant())) {
            credential.ifPresent(sessionCache::invalidate);
            throw new AuthenticationException("Session expired, please re-authenticate");
        }
        return user;
    }

    public UserContext authenticateFresh(Optional<String> credential)
    {
        return authenticateFresh(credential, sessionMaxAge);
    }

    public void requireAdmin(UserContext user)
    {
        if (!user.isAdmin()) {
            denyAdminPanel(user.getEmail());
        }
    }

    public void requireGroup(UserContext user, String group)
    {
        if (!user.hasGroup(group) && !user.isAdmin()) {
            denyGroupMembership(user.getEmail(), group);
        }
    }

    public void invalidate(String credential)
    {
        sessionCache.invalidate(credential);
    }

    public void clearSessions()
    {
        sessionCache.clear();
    }

    private UserContext validate(String token)
    {
        ResolvedIdentity identity;
        try {
            identity = identityLookup.lookup(token);
        }
        catch (CollaboratorException e) {
            log.error("Failed to extract user from token: %s", e.getMessage());
            throw new AuthenticationException("Invalid or expired token: " + e.getMessage(), e);
        }

        UserContext user = UserContext.create(
                identity.email(),
                identity.userId(),
                identity.displayName().orElse(null),
                identity.groups(),
                userRoles,
                clock.instant());
        log.info("Authenticated user: %s (admin: %s)", user.getEmail(), user.isAdmin());
        return user;
    }
}
