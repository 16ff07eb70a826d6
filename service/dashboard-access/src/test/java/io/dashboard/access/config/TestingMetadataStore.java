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

import com.google.common.collect.ImmutableList;
import io.dashboard.access.CollaboratorException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Answers statements with canned rows. A response is selected by a fragment of
 * the statement text and the exact bound parameters; unmatched statements return
 * no rows. Every executed statement is recorded.
 */
public class TestingMetadataStore
        implements MetadataStore
{
    private final List<Response> responses = new ArrayList<>();
    private final Set<String> failingFragments = new HashSet<>();
    private final List<Statement> executed = new ArrayList<>();

    public TestingMetadataStore addResponse(String sqlFragment, List<Object> parameters, List<Map<String, Object>> rows)
    {
        responses.add(new Response(sqlFragment, ImmutableList.copyOf(parameters), ImmutableList.copyOf(rows)));
        return this;
    }

    public TestingMetadataStore failOn(String sqlFragment)
    {
        failingFragments.add(sqlFragment);
        return this;
    }

    @Override
    public synchronized List<Map<String, Object>> query(String sql, List<Object> parameters)
    {
        executed.add(new Statement(sql, ImmutableList.copyOf(parameters)));
        for (String fragment : failingFragments) {
            if (sql.contains(fragment)) {
                throw new CollaboratorException("metadata store", "Table or view not found: " + fragment);
            }
        }
        return responses.stream()
                .filter(response -> sql.contains(response.sqlFragment()) && response.parameters().equals(parameters))
                .map(Response::rows)
                .findFirst()
                .orElse(ImmutableList.of());
    }

    public synchronized List<Statement> getExecuted()
    {
        return ImmutableList.copyOf(executed);
    }

    public synchronized int getQueryCount()
    {
        return executed.size();
    }

    public record Statement(String sql, List<Object> parameters) {}

    private record Response(String sqlFragment, List<Object> parameters, List<Map<String, Object>> rows) {}
}
