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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code ${name}} placeholder handling for configured SQL templates.
 * <p>
 * Values are substituted literally without quoting or escaping; templates
 * supply their own quotes, for example {@code region = '${region}'}.
 */
public final class SqlTemplate
{
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_]+)}");

    private SqlTemplate() {}

    /**
     * Returns the distinct placeholder names in order of first appearance.
     */
    public static Set<String> placeholders(String template)
    {
        ImmutableSet.Builder<String> names = ImmutableSet.builder();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names.build();
    }

    /**
     * Replaces every occurrence of each named placeholder with its value in one
     * pass over the template. Inserted values are never scanned again.
     * Placeholders without a value are left in place.
     */
    public static String render(String template, Map<String, String> values)
    {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sql = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(sql, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(sql);
        return sql.toString();
    }

    /**
     * Returns the placeholders of the template that have no value.
     */
    public static Set<String> unresolved(String template, Map<String, String> values)
    {
        return Sets.difference(placeholders(template), values.keySet()).immutableCopy();
    }

    public static String placeholder(String name)
    {
        return "${" + name + "}";
    }
}
