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

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Outcome of checking every table referenced by a statement.
 *
 * @param allowed whether all referenced tables may be read
 * @param reason human-readable reason when not allowed
 * @param deniedTable the first reference that was denied, as written in the statement
 */
public record QueryValidation(boolean allowed, Optional<String> reason, Optional<String> deniedTable)
{
    private static final QueryValidation ALLOWED = new QueryValidation(true, Optional.empty(), Optional.empty());

    public QueryValidation
    {
        requireNonNull(reason, "reason is null");
        requireNonNull(deniedTable, "deniedTable is null");
        checkArgument(allowed == reason.isEmpty(), "reason must be present exactly when denied");
    }

    public static QueryValidation granted()
    {
        return ALLOWED;
    }

    public static QueryValidation deniedTable(String reference)
    {
        return new QueryValidation(false, Optional.of("Access denied to table " + reference), Optional.of(reference));
    }
}
