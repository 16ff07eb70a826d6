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

import java.util.List;
import java.util.Map;

/**
 * Executes read-only statements against the tables holding dashboard configuration.
 */
public interface MetadataStore
{
    /**
     * Runs {@code sql} with {@code parameters} bound positionally to its {@code ?} markers.
     *
     * @return one map per row, keyed by lower-case column label, in result order
     * @throws io.dashboard.access.CollaboratorException if the statement fails
     */
    List<Map<String, Object>> query(String sql, List<Object> parameters);
}
