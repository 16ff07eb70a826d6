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

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A dashboard filter from {@code filter_definitions}.
 *
 * @param filterType {@code global} or {@code local}
 * @param dataType {@code select}, {@code multiselect}, {@code daterange} or {@code text}
 * @param dataSource {@code static}, {@code dynamic} or {@code query}
 */
public record FilterConfig(
        String id,
        String filterName,
        String label,
        String filterType,
        String dataType,
        String dataSource,
        List<Map<String, Object>> staticOptions,
        Optional<String> optionsQuery,
        Optional<String> defaultValue,
        List<String> appliesToTabs,
        List<String> appliesToQueries,
        Optional<String> filterExpressionTemplate,
        int displayOrder,
        boolean required,
        boolean active)
{
    public FilterConfig
    {
        requireNonNull(id, "id is null");
        requireNonNull(filterName, "filterName is null");
        requireNonNull(label, "label is null");
        requireNonNull(filterType, "filterType is null");
        requireNonNull(dataType, "dataType is null");
        requireNonNull(dataSource, "dataSource is null");
        staticOptions = ImmutableList.copyOf(requireNonNull(staticOptions, "staticOptions is null"));
        requireNonNull(optionsQuery, "optionsQuery is null");
        requireNonNull(defaultValue, "defaultValue is null");
        appliesToTabs = ImmutableList.copyOf(requireNonNull(appliesToTabs, "appliesToTabs is null"));
        appliesToQueries = ImmutableList.copyOf(requireNonNull(appliesToQueries, "appliesToQueries is null"));
        requireNonNull(filterExpressionTemplate, "filterExpressionTemplate is null");
    }

    public boolean appliesToTab(String tab)
    {
        return appliesToTabs.contains(tab);
    }
}
