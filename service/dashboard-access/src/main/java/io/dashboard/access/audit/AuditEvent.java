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
package io.dashboard.access.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableSortedSet;

import java.time.Instant;
import java.util.Set;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * A single authorization decision.
 */
public final class AuditEvent
{
    private final Instant timestamp;
    private final String userEmail;
    private final String userId;
    private final String resource;
    private final String action;
    private final boolean granted;
    private final Set<String> groups;

    public AuditEvent(Instant timestamp, String userEmail, String userId, String resource, String action, boolean granted, Set<String> groups)
    {
        this.timestamp = requireNonNull(timestamp, "timestamp is null");
        this.userEmail = requireNonNull(userEmail, "userEmail is null");
        this.userId = requireNonNull(userId, "userId is null");
        this.resource = requireNonNull(resource, "resource is null");
        this.action = requireNonNull(action, "action is null");
        this.granted = granted;
        this.groups = ImmutableSortedSet.copyOf(requireNonNull(groups, "groups is null"));
    }

    public Instant getTimestamp()
    {
        return timestamp;
    }

    @JsonProperty("timestamp")
    public String getFormattedTimestamp()
    {
        return timestamp.toString();
    }

    @JsonProperty
    public String getUserEmail()
    {
        return userEmail;
    }

    @JsonProperty
    public String getUserId()
    {
        return userId;
    }

    @JsonProperty
    public String getResource()
    {
        return resource;
    }

    @JsonProperty
    public String getAction()
    {
        return action;
    }

    @JsonProperty
    public boolean isGranted()
    {
        return granted;
    }

    @JsonProperty
    public Set<String> getGroups()
    {
        return groups;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("timestamp", timestamp)
                .add("userEmail", userEmail)
                .add("resource", resource)
                .add("action", action)
                .add("granted", granted)
                .toString();
    }
}
