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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Identity returned by an {@link IdentityLookup} for a valid credential.
 */
public record ResolvedIdentity(String email, String userId, Optional<String> displayName, List<String> groups)
{
    public ResolvedIdentity
    {
        requireNonNull(email, "email is null");
        requireNonNull(userId, "userId is null");
        requireNonNull(displayName, "displayName is null");
        groups = ImmutableList.copyOf(requireNonNull(groups, "groups is null"));
    }

    public ResolvedIdentity(String email, String userId, List<String> groups)
    {
        this(email, userId, Optional.empty(), groups);
    }
}
