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

import java.util.List;

/**
 * Source of privilege grants for governed resources.
 */
public interface PrivilegeStore
{
    /**
     * Returns the privileges effectively granted to {@code principal} on a resource,
     * including those inherited through group membership.
     *
     * @param securableType the level of the resource
     * @param qualifiedName the dotted name of the resource ({@code catalog},
     * {@code catalog.schema} or {@code catalog.schema.table})
     * @param principal the user email
     * @throws io.dashboard.access.CollaboratorException if the resource does not
     * exist or the store cannot be reached
     */
    List<String> getEffectivePrivileges(SecurableType securableType, String qualifiedName, String principal);
}
