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
package ai.issueoperator.k8s.ticketing;

import ai.issueoperator.k8s.repo.RepoRef;
import java.util.Optional;

/**
 * Authenticated access to a remote issue tracker. Instances are bound to one token and are
 * meant to be created for a single reconcile pass.
 */
public interface TicketingClient {

    /**
     * Looks up the issue tracked by a record.
     *
     * @param knownNumber the issue number recorded in the status, or 0 when unknown. A number
     *     match always wins over a title match.
     * @return the matching issue, or empty when neither the number nor the title matches
     */
    Optional<RemoteIssue> findIssue(RepoRef repo, String title, int knownNumber)
            throws TicketingException;

    RemoteIssue createIssue(RepoRef repo, String title, String body) throws TicketingException;

    /** Sets title and body of an existing issue. Repeating the call with the same values is a no-op. */
    RemoteIssue updateIssue(RepoRef repo, RemoteIssue issue, String body, String title)
            throws TicketingException;

    /** Closes the issue. Closing an already closed issue succeeds. */
    void closeIssue(RepoRef repo, RemoteIssue issue) throws TicketingException;
}
