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
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Access to IssueRequest resources. Transport failures surface as unchecked {@link
 * io.fabric8.kubernetes.client.KubernetesClientException}s.
 */
public interface IssueRequestStore {

    /** Returns the current resource, or null if it does not exist. */
    IssueRequestCustomResource get(IssueRequestKey key);

    /**
     * Replaces the status of the resource, guarded by its resource version. The spec is never
     * written.
     *
     * @return the stored resource, carrying the new resource version
     * @throws WriteConflictException if the resource changed since it was read
     */
    IssueRequestCustomResource updateStatus(IssueRequestCustomResource resource)
            throws WriteConflictException;

    /**
     * Applies {@code edit} to the finalizers of the latest version of the resource and writes
     * back only the finalizers.
     *
     * @return the stored resource, or null if it does not exist
     */
    IssueRequestCustomResource editFinalizers(
            IssueRequestKey key, UnaryOperator<List<String>> edit);

    /** Requests deletion. Deleting a missing resource is not an error. */
    void delete(IssueRequestKey key);
}
