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

import ai.issueoperator.k8s.CRDConstants;
import ai.issueoperator.k8s.ResolvedOperatorConfiguration;
import ai.issueoperator.k8s.api.crds.IssueRequestCustomResource;
import ai.issueoperator.k8s.finalizer.FinalizationGuard;
import ai.issueoperator.k8s.reconcile.ReconcileLoop;
import ai.issueoperator.k8s.reconcile.ReconcileOutcome;
import ai.issueoperator.k8s.reconcile.ReconcileSettings;
import ai.issueoperator.k8s.secrets.SecretProvisioner;
import ai.issueoperator.k8s.status.StatusProjector;
import ai.issueoperator.k8s.store.IssueRequestKey;
import ai.issueoperator.k8s.store.IssueRequestStore;
import ai.issueoperator.k8s.store.KubernetesCredentialStore;
import ai.issueoperator.k8s.store.KubernetesIssueRequestStore;
import ai.issueoperator.k8s.ticketing.github.GitHubTicketingClientFactory;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.javaoperatorsdk.operator.api.reconciler.Cleaner;
import io.javaoperatorsdk.operator.api.reconciler.Constants;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import jakarta.inject.Inject;
import java.time.Clock;
import lombok.extern.jbosslog.JBossLog;

/**
 * Bridges the operator runtime to {@link ReconcileLoop}.
 *
 * <p>Both entry points run the same pass; the loop reads the latest version of the resource and
 * decides between sync and teardown on its own. The operator runtime uses the same finalizer
 * name as the loop so that deletions are dispatched to {@link #cleanup}, but it never removes
 * the finalizer itself.
 */
@ControllerConfiguration(
        namespaces = Constants.WATCH_ALL_NAMESPACES,
        name = "issue-request-controller",
        finalizerName = CRDConstants.ISSUE_REQUEST_FINALIZER,
        retry = InfiniteRetry.class)
@JBossLog
public class IssueRequestController
        implements Reconciler<IssueRequestCustomResource>, Cleaner<IssueRequestCustomResource> {

    private final ReconcileLoop loop;
    private final ReconcileSettings settings;

    @Inject
    public IssueRequestController(
            KubernetesClient client, ResolvedOperatorConfiguration configuration) {
        this(createLoop(client, configuration), configuration.getSettings());
    }

    IssueRequestController(ReconcileLoop loop, ReconcileSettings settings) {
        this.loop = loop;
        this.settings = settings;
    }

    private static ReconcileLoop createLoop(
            KubernetesClient client, ResolvedOperatorConfiguration configuration) {
        final ReconcileSettings settings = configuration.getSettings();
        final IssueRequestStore store = new KubernetesIssueRequestStore(client);
        return new ReconcileLoop(
                store,
                new FinalizationGuard(store, settings.getFinalizer()),
                new SecretProvisioner(
                        new KubernetesCredentialStore(client),
                        settings.getSecretSuffix(),
                        settings.getSecretTokenKey()),
                new StatusProjector(store, Clock.systemUTC()),
                new GitHubTicketingClientFactory(configuration.getGithubApiUrl()),
                settings);
    }

    @Override
    public UpdateControl<IssueRequestCustomResource> reconcile(
            IssueRequestCustomResource resource, Context<IssueRequestCustomResource> context) {
        final IssueRequestKey key = IssueRequestKey.of(resource);
        final ReconcileOutcome outcome = loop.reconcile(key);
        final UpdateControl<IssueRequestCustomResource> control = UpdateControl.noUpdate();
        return switch (outcome.kind()) {
            case DONE -> control;
            case REQUEUE -> control.rescheduleAfter(settings.getRequeueDelay());
            case RETRY_AFTER -> control.rescheduleAfter(outcome.delay());
            case FAILED -> throw new ReconcileFailedException(key, outcome.error());
            case FATAL -> {
                log.errorf(
                        "IssueRequest %s cannot be reconciled until it is changed: %s",
                        key, outcome.error().getMessage());
                yield control;
            }
        };
    }

    @Override
    public DeleteControl cleanup(
            IssueRequestCustomResource resource, Context<IssueRequestCustomResource> context) {
        final IssueRequestKey key = IssueRequestKey.of(resource);
        final ReconcileOutcome outcome = loop.reconcile(key);
        final DeleteControl control = DeleteControl.noFinalizerRemoval();
        return switch (outcome.kind()) {
            case DONE, FATAL -> control;
            case REQUEUE -> control.rescheduleAfter(settings.getRequeueDelay());
            case RETRY_AFTER -> control.rescheduleAfter(outcome.delay());
            case FAILED -> throw new ReconcileFailedException(key, outcome.error());
        };
    }
}
