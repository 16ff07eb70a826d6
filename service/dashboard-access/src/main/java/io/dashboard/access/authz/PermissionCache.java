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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.inject.Inject;
import io.airlift.units.Duration;
import io.dashboard.access.DashboardAccessConfig;

import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Caches permission decisions keyed by user, qualified resource and privilege.
 * <p>
 * By default entries never expire: a grant or revoke in the catalog is only
 * observed after {@link #clear()} or a restart. A bounded expiry may be set with
 * {@code permission-cache.expire-after-write}, in which case decisions may be
 * stale for at most that long.
 */
public class PermissionCache
{
    private final Cache<PermissionKey, Boolean> decisions;

    @Inject
    public PermissionCache(DashboardAccessConfig config)
    {
        this(config.getPermissionCacheExpireAfterWrite(), Ticker.systemTicker());
    }

    @VisibleForTesting
    public PermissionCache(Optional<Duration> expireAfterWrite, Ticker ticker)
    {
        CacheBuilder<Object, Object> builder = CacheBuilder.newBuilder()
                .ticker(requireNonNull(ticker, "ticker is null"));
        expireAfterWrite.ifPresent(duration -> builder.expireAfterWrite(duration.toMillis(), MILLISECONDS));
        this.decisions = builder.build();
    }

    public static PermissionCache withoutExpiry()
    {
        return new PermissionCache(Optional.empty(), Ticker.systemTicker());
    }

    public Optional<Boolean> get(String userEmail, String qualifiedResource, String privilege)
    {
        return Optional.ofNullable(decisions.getIfPresent(new PermissionKey(userEmail, qualifiedResource, privilege)));
    }

    public void put(String userEmail, String qualifiedResource, String privilege, boolean allowed)
    {
        decisions.put(new PermissionKey(userEmail, qualifiedResource, privilege), allowed);
    }

    public void clear()
    {
        decisions.invalidateAll();
    }

    public void clear(String userEmail)
    {
        decisions.asMap().keySet().removeIf(key -> key.userEmail().equals(userEmail));
    }

    public long size()
    {
        decisions.cleanUp();
        return decisions.size();
    }

    private record PermissionKey(String userEmail, String qualifiedResource, String privilege)
    {
        PermissionKey
        {
            requireNonNull(userEmail, "userEmail is null");
            requireNonNull(qualifiedResource, "qualifiedResource is null");
            requireNonNull(privilege, "privilege is null");
        }
    }
}
