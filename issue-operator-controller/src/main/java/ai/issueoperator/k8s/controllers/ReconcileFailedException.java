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
package ai.issueoperator.k8s.controllers;

import ai.issueoperator.k8s.store.IssueRequestKey;
import lombok.Getter;

/** Hands a failed pass over to the operator's retry policy. */
@Getter
public class ReconcileFailedException extends RuntimeException {

    private final IssueRequestKey key;

    public ReconcileFailedException(IssueRequestKey key, Throwable cause) {
        super("Failed to reconcile IssueRequest " + key + ": " + cause.getMessage(), cause);
        this.key = key;
    }
}
