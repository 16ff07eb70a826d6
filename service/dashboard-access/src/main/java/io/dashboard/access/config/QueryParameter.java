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

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A declared template parameter of a {@link QueryConfig}.
 */
public record QueryParameter(String name, boolean required, Optional<String> defaultValue)
{
    public QueryParameter
    {
        requireNonNull(name, "name is null");
        checkArgument(!name.isBlank(), "name is blank");
        requireNonNull(defaultValue, "defaultValue is null");
    }
}
