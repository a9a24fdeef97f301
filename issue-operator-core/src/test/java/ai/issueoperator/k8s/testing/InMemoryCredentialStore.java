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
package ai.issueoperator.k8s.testing;

import ai.issueoperator.k8s.store.CredentialStore;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

public class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, Secret> secrets = new HashMap<>();
    private int creations;

    /** Simulates a human filling in the token. */
    public void putToken(String namespace, String name, String key, String token) {
        final Secret existing = secrets.get(namespace + "/" + name);
        final SecretBuilder builder =
                existing == null
                        ? new SecretBuilder()
                                .withNewMetadata()
                                .withNamespace(namespace)
                                .withName(name)
                                .endMetadata()
                        : new SecretBuilder(existing);
        secrets.put(
                namespace + "/" + name,
                builder.withData(
                                Map.of(
                                        key,
                                        Base64.getEncoder()
                                                .encodeToString(
                                                        token.getBytes(StandardCharsets.UTF_8))))
                        .build());
    }

    public int getCreations() {
        return creations;
    }

    @Override
    public Secret get(String namespace, String name) {
        final Secret secret = secrets.get(namespace + "/" + name);
        return secret == null ? null : new SecretBuilder(secret).build();
    }

    @Override
    public boolean createIfAbsent(Secret secret) {
        final String key =
                secret.getMetadata().getNamespace() + "/" + secret.getMetadata().getName();
        if (secrets.containsKey(key)) {
            return false;
        }
        secrets.put(key, new SecretBuilder(secret).build());
        creations++;
        return true;
    }
}
