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
package io.dashboard.access;

import static java.util.Objects.requireNonNull;

/**
 * Raised when an external dependency (identity lookup, privilege store,
 * catalog enumerator or metadata store) cannot be reached or returns an error.
 * <p>
 * The authorization engine converts this into a denial, scope aggregation
 * omits the affected resource, and the configuration store propagates it.
 */
public class CollaboratorException
        extends DashboardAccessException
{
    private final String collaborator;

    public CollaboratorException(String collaborator, String message)
    {
        super(collaborator + ": " + message);
        this.collaborator = requireNonNull(collaborator, "collaborator is null");
    }

    public CollaboratorException(String collaborator, String message, Throwable cause)
    {
        super(collaborator + ": " + message, cause);
        this.collaborator = requireNonNull(collaborator, "collaborator is null");
    }

    public String getCollaborator()
    {
        return collaborator;
    }
}
