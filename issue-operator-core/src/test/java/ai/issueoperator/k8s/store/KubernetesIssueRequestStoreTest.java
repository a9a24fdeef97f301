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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.issueoperator.k8s.api.crds.IssueRequestCustomResource;
import ai.issueoperator.k8s.api.crds.IssueRequestStatus;
import ai.issueoperator.k8s.testing.IssueRequests;
import ai.issueoperator.k8s.util.SerializationUtil;
import io.fabric8.kubernetes.api.model.StatusBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import java.net.HttpURLConnection;
import org.junit.jupiter.api.Test;

@EnableKubernetesMockClient
class KubernetesIssueRequestStoreTest {

    private static final String STATUS_PATH =
            "/apis/issueoperator.ai/v1alpha1/namespaces/ns1/issuerequests/r1/status";

    static KubernetesMockServer server;
    static KubernetesClient client;

    private static IssueRequestCustomResource syncedRequest() {
        final IssueRequestCustomResource resource =
                IssueRequests.issueRequest(
                        "ns1", "r1", "https://github.com/acme/widgets", "t", "d");
        resource.getMetadata().setResourceVersion("7");
        final IssueRequestStatus status = new IssueRequestStatus();
        status.setIssueNumber(42);
        status.setIssueRepository("acme/widgets");
        resource.setStatus(status);
        return resource;
    }

    @Test
    void testUpdateStatus() throws Exception {
        final IssueRequestCustomResource resource = syncedRequest();
        final IssueRequestCustomResource stored = SerializationUtil.deepCloneObject(resource);
        stored.getMetadata().setResourceVersion("8");
        server.expect()
                .put()
                .withPath(STATUS_PATH)
                .andReturn(HttpURLConnection.HTTP_OK, stored)
                .once();

        final IssueRequestCustomResource updated =
                new KubernetesIssueRequestStore(client).updateStatus(resource);

        assertEquals("8", updated.getMetadata().getResourceVersion());
        assertEquals(42, updated.getStatus().getIssueNumber());
        assertEquals("acme/widgets", updated.getStatus().getIssueRepository());
    }

    @Test
    void testUpdateStatusConflict() {
        server.expect()
                .put()
                .withPath(STATUS_PATH)
                .andReturn(
                        HttpURLConnection.HTTP_CONFLICT,
                        new StatusBuilder()
                                .withCode(HttpURLConnection.HTTP_CONFLICT)
                                .withReason("Conflict")
                                .withMessage("the object has been modified")
                                .build())
                .once();

        final WriteConflictException e =
                assertThrows(
                        WriteConflictException.class,
                        () ->
                                new KubernetesIssueRequestStore(client)
                                        .updateStatus(syncedRequest()));
        assertEquals(new IssueRequestKey("ns1", "r1"), e.getKey());
        assertTrue(e.getCause() instanceof KubernetesClientException);
    }
}
