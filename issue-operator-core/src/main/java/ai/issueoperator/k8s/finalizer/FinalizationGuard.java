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
package ai.issueoperator.k8s.finalizer;

import ai.issueoperator.k8s.api.crds.IssueRequestCustomResource;
import ai.issueoperator.k8s.store.IssueRequestKey;
import ai.issueoperator.k8s.store.IssueRequestStore;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Adds and removes the finalizer that keeps an IssueRequest around until its remote issue has
 * been closed. Only the finalizer list is written, against the latest version of the resource.
 */
@Slf4j
public class FinalizationGuard {

    private final IssueRequestStore store;
    private final String finalizer;

    public FinalizationGuard(IssueRequestStore store, String finalizer) {
        this.store = store;
        this.finalizer = finalizer;
    }

    public boolean isPresent(IssueRequestCustomResource issueRequest) {
        final List<String> finalizers = issueRequest.getMetadata().getFinalizers();
        return finalizers != null && finalizers.contains(finalizer);
    }

    /** @return the resource carrying the finalizer, or null if it no longer exists */
    public IssueRequestCustomResource ensure(IssueRequestCustomResource issueRequest) {
        if (isPresent(issueRequest)) {
            return issueRequest;
        }
        final IssueRequestKey key = IssueRequestKey.of(issueRequest);
        final IssueRequestCustomResource updated =
                store.editFinalizers(
                        key,
                        finalizers -> {
                            if (finalizers.contains(finalizer)) {
                                return finalizers;
                            }
                            final List<String> result = new ArrayList<>(finalizers);
                            result.add(finalizer);
                            return result;
                        });
        if (updated != null) {
            log.info("Added finalizer {} to {}", finalizer, key);
        }
        return updated;
    }

    /** @return the resource without the finalizer, or null if it no longer exists */
    public IssueRequestCustomResource remove(IssueRequestCustomResource issueRequest) {
        final IssueRequestKey key = IssueRequestKey.of(issueRequest);
        final IssueRequestCustomResource updated =
                store.editFinalizers(
                        key,
                        finalizers -> {
                            final List<String> result = new ArrayList<>(finalizers);
                            result.removeIf(finalizer::equals);
                            return result;
                        });
        log.info("Removed finalizer {} from {}", finalizer, key);
        return updated;
    }
}
