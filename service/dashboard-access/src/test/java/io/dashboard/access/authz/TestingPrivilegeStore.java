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

import com.google.common.collect.ImmutableList;
import io.dashboard.access.CollaboratorException;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory privilege store that records every lookup.
 */
public class TestingPrivilegeStore
        implements PrivilegeStore
{
    private final Map<GrantKey, List<String>> grants = new HashMap<>();
    private final Map<GrantKey, Integer> callCounts = new HashMap<>();
    private final Set<String> failingResources = new HashSet<>();
    private int totalCalls;

    public TestingPrivilegeStore grant(SecurableType securableType, String qualifiedName, String principal, String... privileges)
    {
        grants.put(new GrantKey(securableType, qualifiedName, principal), ImmutableList.copyOf(privileges));
        return this;
    }

    public TestingPrivilegeStore grantCatalog(String catalog, String principal, String... privileges)
    {
        return grant(SecurableType.CATALOG, catalog, principal, privileges);
    }

    public TestingPrivilegeStore grantSchema(String qualifiedSchema, String principal, String... privileges)
    {
        return grant(SecurableType.SCHEMA, qualifiedSchema, principal, privileges);
    }

    public TestingPrivilegeStore grantTable(String qualifiedTable, String principal, String... privileges)
    {
        return grant(SecurableType.TABLE, qualifiedTable, principal, privileges);
    }

    public TestingPrivilegeStore failOn(String qualifiedName)
    {
        failingResources.add(qualifiedName);
        return this;
    }

    public TestingPrivilegeStore recover(String qualifiedName)
    {
        failingResources.remove(qualifiedName);
        return this;
    }

    @Override
    public synchronized List<String> getEffectivePrivileges(SecurableType securableType, String qualifiedName, String principal)
    {
        GrantKey key = new GrantKey(securableType, qualifiedName, principal);
        callCounts.merge(key, 1, Integer::sum);
        totalCalls++;
        if (failingResources.contains(qualifiedName)) {
            throw new CollaboratorException("privilege store", "Resource not found: " + qualifiedName);
        }
        return grants.getOrDefault(key, ImmutableList.of());
    }

    public synchronized int getCallCount(SecurableType securableType, String qualifiedName, String principal)
    {
        return callCounts.getOrDefault(new GrantKey(securableType, qualifiedName, principal), 0);
    }

    public synchronized int getTotalCalls()
    {
        return totalCalls;
    }

    private record GrantKey(SecurableType securableType, String qualifiedName, String principal) {}
}
