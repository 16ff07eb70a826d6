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
package io.dashboard.access.auth;

/**
 * Resolves a bearer credential into the identity it was issued to.
 */
public interface IdentityLookup
{
    /**
     * Returns the identity behind {@code credential}.
     *
     * @throws io.dashboard.access.CollaboratorException if the credential is invalid,
     * expired, malformed, or the lookup service cannot be reached
     */
    ResolvedIdentity lookup(String credential);
}
