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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.issueoperator.k8s.api.crds.IssueRequestCustomResource;
import ai.issueoperator.k8s.testing.IssueRequests;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

@EnableKubernetesMockClient(crud = true)
class KubernetesStoresTest {

    static KubernetesClient client;

    private static Secret secret(String name, String value) {
        return new SecretBuilder()
                .withNewMetadata()
                .withNamespace("ns1")
                .withName(name)
                .endMetadata()
                .withData(Map.of("token", value))
                .build();
    }

    @Test
    void testCredentialStore() {
        final CredentialStore store = new KubernetesCredentialStore(client);
        assertNull(store.get("ns1", "s1"));

        assertTrue(store.createIfAbsent(secret("s1", "")));
        assertFalse(store.createIfAbsent(secret("s1", "Z2hwX2FiYw==")));

        assertEquals("", store.get("ns1", "s1").getData().get("token"));
    }

    @Test
    void testIssueRequestFinalizers() {
        final IssueRequestStore store = new KubernetesIssueRequestStore(client);
        client.resource(
                        IssueRequests.issueRequest(
                                "ns1", "r1", "https://github.com/acme/widgets", "t", "d"))
                .create();
        final IssueRequestKey key = new IssueRequestKey("ns1", "r1");
        assertEquals("t", store.get(key).getSpec().getTitle());

        final IssueRequestCustomResource added =
                store.editFinalizers(
                        key,
                        finalizers -> {
                            final List<String> result = new ArrayList<>(finalizers);
                            result.add("example.com/guard");
                            return result;
                        });
        assertEquals(List.of("example.com/guard"), added.getMetadata().getFinalizers());
        assertEquals(
                List.of("example.com/guard"), store.get(key).getMetadata().getFinalizers());

        final IssueRequestCustomResource unchanged = store.editFinalizers(key, f -> f);
        assertEquals(
                added.getMetadata().getResourceVersion(),
                unchanged.getMetadata().getResourceVersion());

        final IssueRequestCustomResource removed =
                store.editFinalizers(key, finalizers -> new ArrayList<>());
        assertTrue(
                removed.getMetadata().getFinalizers() == null
                        || removed.getMetadata().getFinalizers().isEmpty());

        store.delete(key);
        assertNull(store.get(key));
    }

    @Test
    void testMissingIssueRequest() {
        final IssueRequestStore store = new KubernetesIssueRequestStore(client);
        final IssueRequestKey key = new IssueRequestKey("ns1", "missing");
        assertNull(store.get(key));
        assertNull(store.editFinalizers(key, f -> List.of("x")));
    }
}
