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

import io.dashboard.access.DashboardAccessException;

import java.util.Optional;

import static java.lang.String.format;

/**
 * The identity is known but lacks a privilege on a named resource.
 * Callers map it to a 403 response.
 */
public class AccessDeniedException
        extends DashboardAccessException
{
    public static final String PREFIX = "Access Denied: ";

    private final Optional<String> resource;
    private final Optional<String> privilege;

    public AccessDeniedException(String message)
    {
        this(message, Optional.empty(), Optional.empty());
    }

    public AccessDeniedException(String message, Optional<String> resource, Optional<String> privilege)
    {
        super(PREFIX + message);
        this.resource = resource;
        this.privilege = privilege;
    }

    public Optional<String> getResource()
    {
        return resource;
    }

    public Optional<String> getPrivilege()
    {
        return privilege;
    }

    public static void denySelectTable(String tableName, String reason)
    {
        throw new AccessDeniedException(reason, Optional.of(tableName), Optional.of("SELECT"));
    }

    public static void denyRowFilter(String tableName)
    {
        throw new AccessDeniedException(
                format("Cannot apply row filter for table %s to a statement without a WHERE clause", tableName),
                Optional.of(tableName),
                Optional.of("SELECT"));
    }

    public static void denyAdminPanel(String user)
    {
        throw new AccessDeniedException(
                format("Admin privileges required. User %s is not an admin.", user),
                Optional.of("admin"),
                Optional.of("ADMIN"));
    }

    public static void denyGroupMembership(String user, String group)
    {
        throw new AccessDeniedException(
                format("Group '%s' membership required. User %s is not a member.", group, user),
                Optional.of("group:" + group),
                Optional.empty());
    }
}
