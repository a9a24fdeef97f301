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

import ai.issueoperator.k8s.util.KubeUtil;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class KubernetesCredentialStore implements CredentialStore {

    private final KubernetesClient client;

    public KubernetesCredentialStore(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Secret get(String namespace, String name) {
        return client.secrets().inNamespace(namespace).withName(name).get();
    }

    @Override
    public boolean createIfAbsent(Secret secret) {
        try {
            client.resource(secret).inNamespace(secret.getMetadata().getNamespace()).create();
            return true;
        } catch (KubernetesClientException e) {
            if (KubeUtil.isConflict(e)) {
                log.info(
                        "Secret {}/{} already exists, keeping it",
                        secret.getMetadata().getNamespace(),
                        secret.getMetadata().getName());
                return false;
            }
            throw e;
        }
    }
}
