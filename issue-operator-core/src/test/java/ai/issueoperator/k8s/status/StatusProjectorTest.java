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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.issueoperator.k8s.api.crds.IssueRequestCustomResource;
import ai.issueoperator.k8s.api.crds.IssueRequestStatus;
import ai.issueoperator.k8s.repo.RepoRef;
import ai.issueoperator.k8s.store.WriteConflictException;
import ai.issueoperator.k8s.testing.InMemoryIssueRequestStore;
import ai.issueoperator.k8s.testing.IssueRequests;
import ai.issueoperator.k8s.testing.TestClock;
import ai.issueoperator.k8s.ticketing.RemoteIssue;
import io.fabric8.kubernetes.api.model.Condition;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StatusProjectorTest {

    private static final RepoRef REPO = new RepoRef("acme", "widgets");

    private InMemoryIssueRequestStore store;
    private TestClock clock;
    private StatusProjector projector;
    private IssueRequestCustomResource issueRequest;

    @BeforeEach
    void setup() {
        store = new InMemoryIssueRequestStore();
        clock = new TestClock(Instant.parse("2024-05-01T10:00:00.123Z"));
        projector = new StatusProjector(store, clock);
        issueRequest =
                store.create(
                        IssueRequests.issueRequest(
                                "default", "r1", "https://github.com/acme/widgets", "t", ""));
    }

    private static RemoteIssue issue(boolean open, boolean pullRequest) {
        return RemoteIssue.builder()
                .number(7)
                .title("t")
                .body("")
                .state(open ? RemoteIssue.State.OPEN : RemoteIssue.State.CLOSED)
                .linkedPullRequest(pullRequest)
                .build();
    }

    private static Condition condition(IssueRequestStatus status, String type) {
        return status.findCondition(type).orElseThrow();
    }

    @Test
    void testProjectOpenIssue() {
        final IssueRequestStatus status = projector.project(issueRequest, REPO, issue(true, false));

        assertEquals(7, status.getIssueNumber());
        assertEquals("acme/widgets", status.getIssueRepository());
        assertEquals("2024-05-01T10:00:00Z", status.getLastUpdated());
        assertEquals(2, status.getConditions().size());

        final Condition open = condition(status, IssueRequestStatus.CONDITION_ISSUE_OPEN);
        assertEquals("True", open.getStatus());
        assertEquals(StatusProjector.REASON_ISSUE_OPEN, open.getReason());
        assertEquals("Issue #7 is currently open", open.getMessage());
        assertEquals("2024-05-01T10:00:00Z", open.getLastTransitionTime());

        final Condition pr =
                condition(status, IssueRequestStatus.CONDITION_HAS_LINKED_PULL_REQUEST);
        assertEquals("False", pr.getStatus());
        assertEquals(StatusProjector.REASON_NO_PULL_REQUEST, pr.getReason());
        assertEquals("Issue #7 does not have an associated pull request", pr.getMessage());
    }

    @Test
    void testTransitionTimeOnlyMovesOnFlip() throws Exception {
        final IssueRequestCustomResource first =
                projector.apply(issueRequest, REPO, issue(true, false));

        clock.advance(Duration.ofMinutes(10));
        final IssueRequestStatus status = projector.project(first, REPO, issue(false, false));

        assertEquals("2024-05-01T10:10:00Z", status.getLastUpdated());
        final Condition open = condition(status, IssueRequestStatus.CONDITION_ISSUE_OPEN);
        assertEquals("False", open.getStatus());
        assertEquals(StatusProjector.REASON_ISSUE_CLOSED, open.getReason());
        assertEquals("Issue #7 is closed", open.getMessage());
        assertEquals("2024-05-01T10:10:00Z", open.getLastTransitionTime());
        assertEquals(
                "2024-05-01T10:00:00Z",
                condition(status, IssueRequestStatus.CONDITION_HAS_LINKED_PULL_REQUEST)
                        .getLastTransitionTime());
    }

    @Test
    void testTokenRequiredIsKept() throws Exception {
        final IssueRequestCustomResource flagged =
                projector.markTokenRequired(issueRequest, true);
        final IssueRequestStatus status = projector.project(flagged, REPO, issue(true, true));
        assertTrue(status.isTokenRequired());
        assertEquals(
                StatusProjector.REASON_PULL_REQUEST_LINKED,
                condition(status, IssueRequestStatus.CONDITION_HAS_LINKED_PULL_REQUEST)
                        .getReason());
    }

    @Test
    void testMarkTokenRequiredSkipsUnchangedValue() throws Exception {
        assertSame(issueRequest, projector.markTokenRequired(issueRequest, false));
        assertEquals(0, store.getStatusWrites());

        final IssueRequestCustomResource flagged =
                projector.markTokenRequired(issueRequest, true);
        assertTrue(flagged.getStatus().isTokenRequired());
        assertSame(flagged, projector.markTokenRequired(flagged, true));
        assertEquals(1, store.getStatusWrites());
    }

    @Test
    void testApplyOnStaleResourceConflicts() throws Exception {
        projector.markTokenRequired(issueRequest, true);
        assertThrows(
                WriteConflictException.class,
                () -> projector.apply(issueRequest, REPO, issue(true, false)));
    }
}
