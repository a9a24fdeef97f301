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
package ai.issueoperator.k8s.reconcile;

import ai.issueoperator.k8s.api.crds.IssueRequestCustomResource;
import ai.issueoperator.k8s.api.crds.IssueRequestSpec;
import ai.issueoperator.k8s.api.crds.IssueRequestStatus;
import ai.issueoperator.k8s.finalizer.FinalizationGuard;
import ai.issueoperator.k8s.repo.MalformedRepoRefException;
import ai.issueoperator.k8s.repo.RepoRef;
import ai.issueoperator.k8s.repo.RepoRefParser;
import ai.issueoperator.k8s.secrets.SecretProvisioner;
import ai.issueoperator.k8s.secrets.TokenLookup;
import ai.issueoperator.k8s.status.StatusProjector;
import ai.issueoperator.k8s.store.IssueRequestKey;
import ai.issueoperator.k8s.store.IssueRequestStore;
import ai.issueoperator.k8s.store.WriteConflictException;
import ai.issueoperator.k8s.ticketing.RemoteIssue;
import ai.issueoperator.k8s.ticketing.TicketingClient;
import ai.issueoperator.k8s.ticketing.TicketingClientFactory;
import ai.issueoperator.k8s.ticketing.TicketingException;
import ai.issueoperator.k8s.ticketing.UnauthorizedException;
import ai.issueoperator.k8s.validation.IssueRequestValidator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one IssueRequest towards its desired state.
 *
 * <p>A pass fetches the resource, then either tears it down (deletion requested) or syncs it:
 * finalizer, token, remote issue, status. The finalizer is always in place before any remote
 * call, so every remote issue created here gets a teardown before its resource can disappear.
 * A pass never throws; failures are reported through the returned {@link ReconcileOutcome}.
 */
@Slf4j
public class ReconcileLoop {

    private final IssueRequestStore store;
    private final FinalizationGuard guard;
    private final SecretProvisioner secrets;
    private final StatusProjector statusProjector;
    private final TicketingClientFactory ticketingClients;
    private final ReconcileSettings settings;

    public ReconcileLoop(
            IssueRequestStore store,
            FinalizationGuard guard,
            SecretProvisioner secrets,
            StatusProjector statusProjector,
            TicketingClientFactory ticketingClients,
            ReconcileSettings settings) {
        this.store = store;
        this.guard = guard;
        this.secrets = secrets;
        this.statusProjector = statusProjector;
        this.ticketingClients = ticketingClients;
        this.settings = settings;
    }

    public ReconcileOutcome reconcile(IssueRequestKey key) {
        log.info("Reconciling IssueRequest {}", key);
        ReconcileOutcome outcome;
        try {
            final IssueRequestCustomResource issueRequest = store.get(key);
            if (issueRequest == null) {
                log.info("IssueRequest {} no longer exists", key);
                outcome = ReconcileOutcome.done();
            } else if (issueRequest.isMarkedForDeletion()) {
                outcome = teardown(key, issueRequest);
            } else {
                outcome = sync(key, issueRequest);
            }
        } catch (RuntimeException e) {
            log.error("Error reconciling IssueRequest {}: {}", key, e.getMessage(), e);
            outcome = ReconcileOutcome.failed(e);
        }
        log.info("Reconciled IssueRequest {}: {}", key, outcome);
        return outcome;
    }

    private ReconcileOutcome teardown(
            IssueRequestKey key, IssueRequestCustomResource issueRequest) {
        log.info("IssueRequest {} is being deleted, closing its issue", key);
        final IssueRequestSpec spec = specOf(issueRequest);
        final int knownNumber = knownIssueNumber(issueRequest);
        RepoRef repo = recordedRepo(key, issueRequest);
        if (repo == null) {
            try {
                repo = RepoRefParser.parse(spec.getRepoURL());
            } catch (MalformedRepoRefException e) {
                if (knownNumber > 0) {
                    log.error(
                            "IssueRequest {}: {}, cannot close issue #{} until the repository"
                                    + " is fixed",
                            key,
                            e.getMessage(),
                            knownNumber);
                    return ReconcileOutcome.fatal(e);
                }
                log.warn("IssueRequest {}: {}, skipping issue cleanup", key, e.getMessage());
                return erase(key, issueRequest);
            }
        }

        final TokenLookup token = secrets.readToken(issueRequest);
        if (token.isPresent()) {
            final TicketingClient client = ticketingClients.create(token.token());
            try {
                final Optional<RemoteIssue> issue =
                        client.findIssue(repo, spec.getTitle(), knownNumber);
                if (issue.isPresent() && issue.get().isOpen()) {
                    client.closeIssue(repo, issue.get());
                } else {
                    log.info("IssueRequest {}: no open issue left in {}", key, repo);
                }
            } catch (UnauthorizedException e) {
                log.warn("IssueRequest {}: token rejected: {}", key, e.getMessage());
                return ReconcileOutcome.retryAfter(settings.getTokenPollInterval());
            } catch (TicketingException e) {
                log.error("IssueRequest {}: cannot close issue: {}", key, e.getMessage(), e);
                return ReconcileOutcome.failed(e);
            }
        } else if (knownNumber > 0) {
            log.info(
                    "IssueRequest {}: waiting for a token to close issue {}#{}",
                    key,
                    repo,
                    knownNumber);
            return ReconcileOutcome.retryAfter(settings.getTokenPollInterval());
        } else {
            log.info("IssueRequest {}: never synced, nothing to close", key);
        }
        return erase(key, issueRequest);
    }

    private ReconcileOutcome erase(IssueRequestKey key, IssueRequestCustomResource issueRequest) {
        store.delete(key);
        guard.remove(issueRequest);
        return ReconcileOutcome.done();
    }

    private ReconcileOutcome sync(IssueRequestKey key, IssueRequestCustomResource issueRequest) {
        IssueRequestCustomResource current;
        try {
            current = guard.ensure(issueRequest);
        } catch (RuntimeException e) {
            log.error("IssueRequest {}: cannot add finalizer: {}", key, e.getMessage(), e);
            return ReconcileOutcome.requeue();
        }
        if (current == null) {
            log.info("IssueRequest {} disappeared while adding the finalizer", key);
            return ReconcileOutcome.done();
        }

        final TokenLookup token = secrets.readToken(current);
        try {
            switch (token.state()) {
                case NOT_FOUND -> {
                    secrets.ensureHolder(current);
                    statusProjector.markTokenRequired(current, true);
                    log.info(
                            "IssueRequest {}: created secret {}, waiting for a token",
                            key,
                            secrets.secretName(current));
                    return ReconcileOutcome.requeue();
                }
                case EMPTY -> {
                    statusProjector.markTokenRequired(current, true);
                    log.info(
                            "IssueRequest {}: secret {} has no token yet",
                            key,
                            secrets.secretName(current));
                    return ReconcileOutcome.retryAfter(settings.getTokenPollInterval());
                }
                default -> current = statusProjector.markTokenRequired(current, false);
            }
        } catch (WriteConflictException e) {
            log.info("IssueRequest {}: conflict writing status, retrying", key);
            return ReconcileOutcome.retryAfter(settings.getConflictRetryDelay());
        }

        final IssueRequestSpec spec = specOf(current);
        final RepoRef repo;
        try {
            repo = RepoRefParser.parse(spec.getRepoURL());
        } catch (MalformedRepoRefException e) {
            log.error("IssueRequest {}: {}, fix the resource to resume", key, e.getMessage());
            return ReconcileOutcome.fatal(e);
        }
        final List<String> violations = IssueRequestValidator.validate(spec);
        if (!violations.isEmpty()) {
            log.warn("IssueRequest {} did not pass admission checks: {}", key, violations);
        }

        final String title = spec.getTitle();
        final String body = spec.getDescription() == null ? "" : spec.getDescription();
        final TicketingClient client = ticketingClients.create(token.token());
        final RemoteIssue issue;
        try {
            int knownNumber = knownIssueNumber(current);
            final RepoRef previousRepo = recordedRepo(key, current);
            if (knownNumber > 0 && previousRepo != null && !previousRepo.sameRepository(repo)) {
                // the issue number belongs to the old repository
                closeMovedIssue(key, client, previousRepo, title, knownNumber);
                knownNumber = 0;
            }
            final Optional<RemoteIssue> existing = client.findIssue(repo, title, knownNumber);
            if (existing.isEmpty()) {
                issue = client.createIssue(repo, title, body);
            } else {
                issue = client.updateIssue(repo, existing.get(), body, title);
            }
        } catch (UnauthorizedException e) {
            log.warn("IssueRequest {}: token rejected: {}", key, e.getMessage());
            return ReconcileOutcome.retryAfter(settings.getTokenPollInterval());
        } catch (TicketingException e) {
            log.error("IssueRequest {}: cannot sync issue: {}", key, e.getMessage(), e);
            return ReconcileOutcome.failed(e);
        }

        try {
            statusProjector.apply(current, repo, issue);
        } catch (WriteConflictException e) {
            log.info("IssueRequest {}: conflict writing status, retrying", key);
            return ReconcileOutcome.retryAfter(settings.getConflictRetryDelay());
        }
        return ReconcileOutcome.done();
    }

    private void closeMovedIssue(
            IssueRequestKey key,
            TicketingClient client,
            RepoRef previousRepo,
            String title,
            int number)
            throws TicketingException {
        final Optional<RemoteIssue> previous = client.findIssue(previousRepo, title, number);
        if (previous.isPresent()
                && previous.get().getNumber() == number
                && previous.get().isOpen()) {
            log.info(
                    "IssueRequest {} moved away from {}, closing issue #{}",
                    key,
                    previousRepo,
                    number);
            client.closeIssue(previousRepo, previous.get());
        }
    }

    /**
     * Repository holding the issue recorded in the status, or null when the status does not
     * record one.
     */
    private static RepoRef recordedRepo(
            IssueRequestKey key, IssueRequestCustomResource issueRequest) {
        final IssueRequestStatus status = issueRequest.getStatus();
        if (status == null || !status.hasIssueNumber() || status.getIssueRepository() == null) {
            return null;
        }
        try {
            return RepoRefParser.parse(status.getIssueRepository());
        } catch (MalformedRepoRefException e) {
            log.warn("IssueRequest {}: ignoring recorded repository: {}", key, e.getMessage());
            return null;
        }
    }

    private static IssueRequestSpec specOf(IssueRequestCustomResource issueRequest) {
        return issueRequest.getSpec() == null ? new IssueRequestSpec() : issueRequest.getSpec();
    }

    private static int knownIssueNumber(IssueRequestCustomResource issueRequest) {
        final IssueRequestStatus status = issueRequest.getStatus();
        return status != null && status.hasIssueNumber() ? status.getIssueNumber() : 0;
    }
}
