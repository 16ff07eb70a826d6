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
package io.dashboard.access.config;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.inject.Inject;
import io.airlift.units.Duration;
import io.dashboard.access.DashboardAccessConfig;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Source of the time-bounded caches behind configuration lookups. Each lookup
 * kind gets its own typed cache; all of them share one expiry and are cleared
 * together.
 */
public class ConfigurationCache
{
    private final Duration ttl;
    private final Ticker ticker;
    private final List<Cache<?, ?>> lookups = new CopyOnWriteArrayList<>();

    @Inject
    public ConfigurationCache(DashboardAccessConfig config)
    {
        this(config.getConfigurationCacheTtl(), Ticker.systemTicker());
    }

    @VisibleForTesting
    public ConfigurationCache(Duration ttl, Ticker ticker)
    {
        this.ttl = requireNonNull(ttl, "ttl is null");
        this.ticker = requireNonNull(ticker, "ticker is null");
    }

    public <K, V> Cache<K, V> newLookup()
    {
        Cache<K, V> lookup = CacheBuilder.newBuilder()
                .expireAfterWrite(ttl.toMillis(), MILLISECONDS)
                .ticker(ticker)
                .build();
        lookups.add(lookup);
        return lookup;
    }

    public void clear()
    {
        lookups.forEach(Cache::invalidateAll);
    }
}
