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

import ai.issueoperator.k8s.api.crds.IssueRequestCustomResource;
import ai.issueoperator.k8s.util.KubeUtil;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.Resource;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class KubernetesIssueRequestStore implements IssueRequestStore {

    private final KubernetesClient client;

    public KubernetesIssueRequestStore(KubernetesClient client) {
        this.client = client;
    }

    private Resource<IssueRequestCustomResource> resource(IssueRequestKey key) {
        return client.resources(IssueRequestCustomResource.class)
                .inNamespace(key.namespace())
                .withName(key.name());
    }

    @Override
    public IssueRequestCustomResource get(IssueRequestKey key) {
        return resource(key).get();
    }

    @Override
    public IssueRequestCustomResource updateStatus(IssueRequestCustomResource resource)
            throws WriteConflictException {
        try {
            return client.resource(resource).updateStatus();
        } catch (KubernetesClientException e) {
            if (KubeUtil.isConflict(e)) {
                throw new WriteConflictException(IssueRequestKey.of(resource), e);
            }
            throw e;
        }
    }

    @Override
    public IssueRequestCustomResource editFinalizers(
            IssueRequestKey key, UnaryOperator<List<String>> edit) {
        final Resource<IssueRequestCustomResource> resource = resource(key);
        final IssueRequestCustomResource current = resource.get();
        if (current == null) {
            return null;
        }
        final List<String> finalizers = finalizersOf(current);
        if (edit.apply(new ArrayList<>(finalizers)).equals(finalizers)) {
            return current;
        }
        try {
            return resource.edit(
                    latest -> {
                        latest.getMetadata().setFinalizers(edit.apply(finalizersOf(latest)));
                        return latest;
                    });
        } catch (KubernetesClientException e) {
            if (KubeUtil.isNotFound(e)) {
                log.info("Resource {} disappeared while editing finalizers", key);
                return null;
            }
            throw e;
        }
    }

    @Override
    public void delete(IssueRequestKey key) {
        resource(key).delete();
    }

    private static List<String> finalizersOf(IssueRequestCustomResource resource) {
        final List<String> finalizers = resource.getMetadata().getFinalizers();
        return finalizers == null ? new ArrayList<>() : new ArrayList<>(finalizers);
    }
}
