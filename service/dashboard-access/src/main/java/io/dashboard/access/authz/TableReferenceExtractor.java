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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds table references in SQL text without parsing it.
 * <p>
 * A reference is a {@code FROM} or {@code JOIN} keyword (any case) followed by a
 * dotted identifier of two or three segments made of letters, digits and
 * underscores. This is a best-effort scan: single-segment names, quoted
 * identifiers and table functions are not reported, and text inside string
 * literals or comments may be. Callers must treat the result as a lower bound of
 * the tables a statement touches.
 */
public final class TableReferenceExtractor
{
    private static final Pattern TABLE_REFERENCE = Pattern.compile(
            "\\b(?:FROM|JOIN)\\s+([a-zA-Z0-9_]+(?:\\.[a-zA-Z0-9_]+){1,2})",
            Pattern.CASE_INSENSITIVE);

    private TableReferenceExtractor() {}

    /**
     * Returns the distinct references in order of first appearance.
     */
    public static List<TableReference> extract(String sql)
    {
        Map<String, TableReference> references = new LinkedHashMap<>();
        Matcher matcher = TABLE_REFERENCE.matcher(sql);
        while (matcher.find()) {
            String reference = matcher.group(1);
            references.computeIfAbsent(reference, TableReferenceExtractor::toTableReference);
        }
        return ImmutableList.copyOf(references.values());
    }

    private static TableReference toTableReference(String reference)
    {
        String[] parts = reference.split("\\.");
        if (parts.length == 3) {
            return new TableReference(reference, Optional.of(parts[0]), parts[1], parts[2]);
        }
        return new TableReference(reference, Optional.empty(), parts[0], parts[1]);
    }
}
