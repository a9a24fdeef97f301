/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.issueoperator.k8s.store;

import io.fabric8.kubernetes.api.model.Secret;

/** Access to the secrets holding the ticketing tokens. */
public interface CredentialStore {

    /** Returns the secret, or null if it does not exist. */
    Secret get(String namespace, String name);

    /**
     * Creates the secret unless one with the same name already exists. An existing secret is
     * never modified.
     *
     * @return true if this call created the secret
     */
    boolean createIfAbsent(Secret secret);
}
