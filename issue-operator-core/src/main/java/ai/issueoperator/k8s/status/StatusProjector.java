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
package ai.issueoperator.k8s.status;

import ai.issueoperator.k8s.api.crds.IssueRequestCustomResource;
import ai.issueoperator.k8s.api.crds.IssueRequestStatus;
import ai.issueoperator.k8s.repo.RepoRef;
import ai.issueoperator.k8s.store.IssueRequestStore;
import ai.issueoperator.k8s.store.WriteConflictException;
import ai.issueoperator.k8s.ticketing.RemoteIssue;
import ai.issueoperator.k8s.util.SerializationUtil;
import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/** Derives the IssueRequest status from the remote issue and writes it through the status subresource. */
@Slf4j
public class StatusProjector {

    public static final String REASON_ISSUE_OPEN = "IssueIsOpen";
    public static final String REASON_ISSUE_CLOSED = "IssueIsClosed";
    public static final String REASON_PULL_REQUEST_LINKED = "PullRequestLinked";
    public static final String REASON_NO_PULL_REQUEST = "NoPullRequest";

    private static final String TRUE = "True";
    private static final String FALSE = "False";

    private final IssueRequestStore store;
    private final Clock clock;

    public StatusProjector(IssueRequestStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public IssueRequestStatus project(
            IssueRequestCustomResource issueRequest, RepoRef repo, RemoteIssue issue) {
        final IssueRequestStatus previous =
                issueRequest.getStatus() == null ? new IssueRequestStatus() : issueRequest.getStatus();
        final IssueRequestStatus status = SerializationUtil.deepCloneObject(previous);
        final String now = now();

        final List<Condition> conditions = new ArrayList<>();
        conditions.add(
                condition(
                        previous,
                        IssueRequestStatus.CONDITION_ISSUE_OPEN,
                        issue.isOpen(),
                        issue.isOpen() ? REASON_ISSUE_OPEN : REASON_ISSUE_CLOSED,
                        issue.isOpen()
                                ? "Issue #%d is currently open".formatted(issue.getNumber())
                                : "Issue #%d is closed".formatted(issue.getNumber()),
                        now));
        conditions.add(
                condition(
                        previous,
                        IssueRequestStatus.CONDITION_HAS_LINKED_PULL_REQUEST,
                        issue.isLinkedPullRequest(),
                        issue.isLinkedPullRequest()
                                ? REASON_PULL_REQUEST_LINKED
                                : REASON_NO_PULL_REQUEST,
                        issue.isLinkedPullRequest()
                                ? "Issue #%d has an associated pull request"
                                        .formatted(issue.getNumber())
                                : "Issue #%d does not have an associated pull request"
                                        .formatted(issue.getNumber()),
                        now));
        status.setConditions(conditions);

        if (previous.hasIssueNumber()
                && (previous.getIssueNumber() != issue.getNumber()
                        || !repo.toString().equalsIgnoreCase(previous.getIssueRepository()))) {
            log.info(
                    "IssueRequest {} now tracks {}#{} instead of {}#{}",
                    issueRequest.getMetadata().getName(),
                    repo,
                    issue.getNumber(),
                    previous.getIssueRepository(),
                    previous.getIssueNumber());
        }
        status.setIssueNumber(issue.getNumber());
        status.setIssueRepository(repo.toString());
        status.setLastUpdated(now);
        return status;
    }

    /**
     * Projects the remote issue onto the status and persists it.
     *
     * @throws WriteConflictException if the resource changed since it was read; the caller must
     *     read it again before retrying
     */
    public IssueRequestCustomResource apply(
            IssueRequestCustomResource issueRequest, RepoRef repo, RemoteIssue issue)
            throws WriteConflictException {
        final IssueRequestStatus status = project(issueRequest, repo, issue);
        final IssueRequestCustomResource target = SerializationUtil.deepCloneObject(issueRequest);
        target.setStatus(status);
        return store.updateStatus(target);
    }

    /** Persists the tokenRequired flag. No write happens when the flag already has the value. */
    public IssueRequestCustomResource markTokenRequired(
            IssueRequestCustomResource issueRequest, boolean tokenRequired)
            throws WriteConflictException {
        final IssueRequestStatus previous = issueRequest.getStatus();
        if (previous != null && previous.isTokenRequired() == tokenRequired) {
            return issueRequest;
        }
        final IssueRequestStatus status =
                previous == null
                        ? new IssueRequestStatus()
                        : SerializationUtil.deepCloneObject(previous);
        status.setTokenRequired(tokenRequired);
        final IssueRequestCustomResource target = SerializationUtil.deepCloneObject(issueRequest);
        target.setStatus(status);
        return store.updateStatus(target);
    }

    private static Condition condition(
            IssueRequestStatus previous,
            String type,
            boolean value,
            String reason,
            String message,
            String now) {
        final String truth = value ? TRUE : FALSE;
        final String transitionTime =
                previous.findCondition(type)
                        .filter(c -> Objects.equals(c.getStatus(), truth))
                        .map(Condition::getLastTransitionTime)
                        .orElse(now);
        return new ConditionBuilder()
                .withType(type)
                .withStatus(truth)
                .withReason(reason)
                .withMessage(message)
                .withLastTransitionTime(transitionTime)
                .build();
    }

    private String now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
