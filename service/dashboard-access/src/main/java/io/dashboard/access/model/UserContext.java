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
package io.dashboard.access.model;

import com.google.common.collect.ImmutableSet;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Authenticated identity of the caller together with the role flags derived from
 * its group membership.
 * <p>
 * Instances are created once by the authentication gateway and never modified.
 * In particular the admin flag is computed at authentication time and is not
 * re-derived for the lifetime of the session.
 */
public final class UserContext
{
    public static final Duration DEFAULT_MAX_SESSION_AGE = Duration.ofMinutes(60);

    private final String email;
    private final String userId;
    private final String displayName;
    private final Set<String> groups;
    private final boolean admin;
    private final boolean analyst;
    private final boolean viewer;
    private final Set<String> roles;
    private final Instant authenticatedAt;

    private UserContext(
            String email,
            String userId,
            String displayName,
            Set<String> groups,
            boolean admin,
            boolean analyst,
            boolean viewer,
            Instant authenticatedAt)
    {
        this.email = requireNonNull(email, "email is null");
        this.userId = requireNonNull(userId, "userId is null");
        this.displayName = requireNonNull(displayName, "displayName is null");
        this.groups = ImmutableSet.copyOf(requireNonNull(groups, "groups is null"));
        this.admin = admin;
        this.analyst = analyst;
        this.viewer = viewer;
        this.roles = UserRoles.rolesFor(admin, analyst, viewer);
        this.authenticatedAt = requireNonNull(authenticatedAt, "authenticatedAt is null");
    }

    /**
     * Creates a context whose role flags are derived from {@code groups}.
     */
    public static UserContext create(String email, String userId, String displayName, Collection<String> groups, UserRoles userRoles, Instant authenticatedAt)
    {
        Set<String> groupSet = ImmutableSet.copyOf(groups);
        return new UserContext(
                email,
                userId,
                displayName != null ? displayName : defaultDisplayName(email),
                groupSet,
                userRoles.isAdmin(groupSet),
                userRoles.isAnalyst(groupSet),
                userRoles.isViewer(groupSet),
                authenticatedAt);
    }

    /**
     * Creates a context with an explicit admin flag, as used for the development-mode identity.
     */
    public static UserContext createAdmin(String email, String userId, Collection<String> groups, Instant authenticatedAt)
    {
        return new UserContext(email, userId, defaultDisplayName(email), ImmutableSet.copyOf(groups), true, true, true, authenticatedAt);
    }

    public String getEmail()
    {
        return email;
    }

    public String getUserId()
    {
        return userId;
    }

    public String getDisplayName()
    {
        return displayName;
    }

    public Set<String> getGroups()
    {
        return groups;
    }

    public boolean isAdmin()
    {
        return admin;
    }

    public boolean isAnalyst()
    {
        return analyst;
    }

    public boolean isViewer()
    {
        return viewer;
    }

    public Set<String> getRoles()
    {
        return roles;
    }

    public Instant getAuthenticatedAt()
    {
        return authenticatedAt;
    }

    /**
     * Checks whether the session was authenticated less than {@code maxAge} before {@code now}.
     * <p>
     * This is independent of the session cache lifetime: a cached context may be
     * served while its session is already too old for callers that require a
     * fresh login.
     */
    public boolean isSessionValid(Duration maxAge, Instant now)
    {
        return Duration.between(authenticatedAt, now).compareTo(maxAge) < 0;
    }

    public boolean isSessionValid(Duration maxAge)
    {
        return isSessionValid(maxAge, Instant.now());
    }

    public boolean isSessionValid()
    {
        return isSessionValid(DEFAULT_MAX_SESSION_AGE);
    }

    public boolean hasGroup(String group)
    {
        return groups.contains(group);
    }

    public boolean hasRole(String role)
    {
        return admin || roles.contains(role);
    }

    public boolean canAccessAdminPanel()
    {
        return admin || hasRole(UserRoles.DASHBOARD_ADMIN);
    }

    public boolean canConfigureQueries()
    {
        return admin || hasRole(UserRoles.QUERY_ADMIN);
    }

    public boolean canConfigureFilters()
    {
        return admin || hasRole(UserRoles.FILTER_ADMIN);
    }

    public boolean canViewAnalytics()
    {
        return admin || analyst || viewer;
    }

    private static String defaultDisplayName(String email)
    {
        int at = email.indexOf('@');
        return at > 0 ? email.substring(0, at) : email;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UserContext that = (UserContext) o;
        return admin == that.admin &&
                Objects.equals(email, that.email) &&
                Objects.equals(userId, that.userId) &&
                Objects.equals(groups, that.groups) &&
                Objects.equals(authenticatedAt, that.authenticatedAt);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(email, userId, groups, admin, authenticatedAt);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("email", email)
                .add("userId", userId)
                .add("groups", groups)
                .add("admin", admin)
                .add("authenticatedAt", authenticatedAt)
                .toString();
    }
}
