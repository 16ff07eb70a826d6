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
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.inject.Inject;
import io.airlift.units.Duration;
import io.dashboard.access.DashboardAccessConfig;
import io.dashboard.access.model.UserContext;

import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Maps raw credentials to the {@link UserContext} they were validated into.
 * <p>
 * Entries are served for a fixed time after they were written. A revoked
 * credential therefore stays accepted until its entry expires. The cache is safe
 * for concurrent use; when two requests validate the same credential at the same
 * time the last completed write wins.
 */
public class SessionCache
{
    private final Cache<String, UserContext> sessions;

    @Inject
    public SessionCache(DashboardAccessConfig config)
    {
        this(config.getSessionCacheTtl(), Ticker.systemTicker());
    }

    @VisibleForTesting
    public SessionCache(Duration ttl, Ticker ticker)
    {
        requireNonNull(ttl, "ttl is null");
        this.sessions = CacheBuilder.newBuilder()
                .expireAfterWrite(ttl.toMillis(), MILLISECONDS)
                .ticker(requireNonNull(ticker, "ticker is null"))
                .build();
    }

    public Optional<UserContext> get(String credential)
    {
        return Optional.ofNullable(sessions.getIfPresent(credential));
    }

    public void put(String credential, UserContext user)
    {
        sessions.put(credential, user);
    }

    public void invalidate(String credential)
    {
        sessions.invalidate(credential);
    }

    public void clear()
    {
        sessions.invalidateAll();
    }

    public long size()
    {
        sessions.cleanUp();
        return sessions.size();
    }
}
