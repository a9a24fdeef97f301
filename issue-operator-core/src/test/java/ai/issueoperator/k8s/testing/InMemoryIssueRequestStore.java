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

import ai.issueoperator.k8s.api.crds.IssueRequestCustomResource;
import ai.issueoperator.k8s.api.crds.IssueRequestSpec;
import ai.issueoperator.k8s.api.crds.IssueRequestStatus;
import ai.issueoperator.k8s.store.IssueRequestKey;
import ai.issueoperator.k8s.store.IssueRequestStore;
import ai.issueoperator.k8s.store.WriteConflictException;
import ai.issueoperator.k8s.util.SerializationUtil;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Store that mimics the API server: resource versions checked on status writes, status and
 * spec written through separate channels, two-phase deletion through finalizers.
 */
public class InMemoryIssueRequestStore implements IssueRequestStore {

    private final Map<IssueRequestKey, IssueRequestCustomResource> resources = new HashMap<>();
    private final AtomicInteger versions = new AtomicInteger();
    private int pendingStatusConflicts;
    private int pendingFinalizerFailures;
    private int pendingGetFailures;
    private int statusWrites;

    public IssueRequestCustomResource create(IssueRequestCustomResource resource) {
        final IssueRequestCustomResource stored = SerializationUtil.deepCloneObject(resource);
        stored.getMetadata().setUid(UUID.randomUUID().toString());
        stored.getMetadata().setResourceVersion(nextVersion());
        resources.put(IssueRequestKey.of(stored), stored);
        return copy(stored);
    }

    /** Simulates a user editing the spec. */
    public void editSpec(IssueRequestKey key, Consumer<IssueRequestSpec> edit) {
        final IssueRequestCustomResource stored = resources.get(key);
        edit.accept(stored.getSpec());
        stored.getMetadata().setResourceVersion(nextVersion());
    }

    /** Simulates a status written by an older operator release. */
    public void editStatus(IssueRequestKey key, Consumer<IssueRequestStatus> edit) {
        final IssueRequestCustomResource stored = resources.get(key);
        edit.accept(stored.getStatus());
        stored.getMetadata().setResourceVersion(nextVersion());
    }

    public void conflictOnNextStatusWrites(int count) {
        pendingStatusConflicts = count;
    }

    public void failNextGets(int count) {
        pendingGetFailures = count;
    }

    public void failNextFinalizerEdits(int count) {
        pendingFinalizerFailures = count;
    }

    public int getStatusWrites() {
        return statusWrites;
    }

    public boolean exists(IssueRequestKey key) {
        return resources.containsKey(key);
    }

    @Override
    public IssueRequestCustomResource get(IssueRequestKey key) {
        if (pendingGetFailures > 0) {
            pendingGetFailures--;
            throw new KubernetesClientException("connection reset");
        }
        return copy(resources.get(key));
    }

    @Override
    public IssueRequestCustomResource updateStatus(IssueRequestCustomResource resource)
            throws WriteConflictException {
        final IssueRequestKey key = IssueRequestKey.of(resource);
        final IssueRequestCustomResource stored = resources.get(key);
        if (stored == null) {
            throw new KubernetesClientException("not found", 404, null);
        }
        if (pendingStatusConflicts > 0) {
            pendingStatusConflicts--;
            // someone else wrote in the meantime
            stored.getMetadata().setResourceVersion(nextVersion());
        }
        if (!stored.getMetadata()
                .getResourceVersion()
                .equals(resource.getMetadata().getResourceVersion())) {
            throw new WriteConflictException(key, null);
        }
        stored.setStatus(SerializationUtil.deepCloneObject(resource.getStatus()));
        stored.getMetadata().setResourceVersion(nextVersion());
        statusWrites++;
        return copy(stored);
    }

    @Override
    public IssueRequestCustomResource editFinalizers(
            IssueRequestKey key, UnaryOperator<List<String>> edit) {
        if (pendingFinalizerFailures > 0) {
            pendingFinalizerFailures--;
            throw new KubernetesClientException("connection refused");
        }
        final IssueRequestCustomResource stored = resources.get(key);
        if (stored == null) {
            return null;
        }
        final List<String> current =
                stored.getMetadata().getFinalizers() == null
                        ? new ArrayList<>()
                        : new ArrayList<>(stored.getMetadata().getFinalizers());
        final List<String> edited = edit.apply(new ArrayList<>(current));
        if (!edited.equals(current)) {
            stored.getMetadata().setFinalizers(edited);
            stored.getMetadata().setResourceVersion(nextVersion());
        }
        if (stored.isMarkedForDeletion() && edited.isEmpty()) {
            resources.remove(key);
            return null;
        }
        return copy(stored);
    }

    @Override
    public void delete(IssueRequestKey key) {
        final IssueRequestCustomResource stored = resources.get(key);
        if (stored == null) {
            return;
        }
        final List<String> finalizers = stored.getMetadata().getFinalizers();
        if (finalizers == null || finalizers.isEmpty()) {
            resources.remove(key);
            return;
        }
        if (stored.getMetadata().getDeletionTimestamp() == null) {
            stored.getMetadata().setDeletionTimestamp(Instant.now().toString());
            stored.getMetadata().setResourceVersion(nextVersion());
        }
    }

    private String nextVersion() {
        return String.valueOf(versions.incrementAndGet());
    }

    private static IssueRequestCustomResource copy(IssueRequestCustomResource resource) {
        return SerializationUtil.deepCloneObject(resource);
    }
}
