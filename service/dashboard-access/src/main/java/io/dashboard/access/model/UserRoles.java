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

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static java.util.Objects.requireNonNull;

/**
 * Derives role flags from group membership.
 * <p>
 * Group names are compared case-insensitively against the configured admin and
 * analyst groups. Admins are also analysts; any user with at least one group is
 * a viewer.
 */
public final class UserRoles
{
    public static final String DASHBOARD_ADMIN = "dashboard_admin";
    public static final String QUERY_ADMIN = "query_admin";
    public static final String FILTER_ADMIN = "filter_admin";
    public static final String ANALYST = "analyst";
    public static final String VIEWER = "viewer";

    private final Set<String> adminGroups;
    private final Set<String> analystGroups;

    public UserRoles(Collection<String> adminGroups, Collection<String> analystGroups)
    {
        this.adminGroups = lowerCase(requireNonNull(adminGroups, "adminGroups is null"));
        this.analystGroups = lowerCase(requireNonNull(analystGroups, "analystGroups is null"));
    }

    public boolean isAdmin(Collection<String> groups)
    {
        return groups.stream()
                .map(group -> group.toLowerCase(Locale.ENGLISH))
                .anyMatch(adminGroups::contains);
    }

    public boolean isAnalyst(Collection<String> groups)
    {
        return isAdmin(groups) || groups.stream()
                .map(group -> group.toLowerCase(Locale.ENGLISH))
                .anyMatch(analystGroups::contains);
    }

    public boolean isViewer(Collection<String> groups)
    {
        return !groups.isEmpty() || isAnalyst(groups);
    }

    /**
     * Returns the dashboard roles implied by the given flags.
     */
    public static Set<String> rolesFor(boolean admin, boolean analyst, boolean viewer)
    {
        ImmutableSet.Builder<String> roles = ImmutableSet.builder();
        if (admin) {
            roles.add(DASHBOARD_ADMIN, QUERY_ADMIN, FILTER_ADMIN);
        }
        if (analyst) {
            roles.add(ANALYST);
        }
        if (viewer) {
            roles.add(VIEWER);
        }
        return roles.build();
    }

    private static Set<String> lowerCase(Collection<String> groups)
    {
        return groups.stream()
                .map(group -> group.toLowerCase(Locale.ENGLISH))
                .collect(toImmutableSet());
    }
}
