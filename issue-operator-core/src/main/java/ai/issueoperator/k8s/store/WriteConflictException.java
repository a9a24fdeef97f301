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

import lombok.Getter;

/** A write lost the optimistic concurrency race: the resource changed since it was read. */
@Getter
public class WriteConflictException extends Exception {

    private final IssueRequestKey key;

    public WriteConflictException(IssueRequestKey key, Throwable cause) {
        super("resource " + key + " was modified concurrently", cause);
        this.key = key;
    }
}
