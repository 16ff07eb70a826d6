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

import java.util.Locale;

/**
 * Levels of the governed namespace hierarchy on which privileges are granted.
 */
public enum SecurableType
{
    CATALOG,
    SCHEMA,
    TABLE;

    public String typeName()
    {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
