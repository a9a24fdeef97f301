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

import java.time.Duration;

/** What the scheduler should do after a reconcile pass. */
public record ReconcileOutcome(Kind kind, Duration delay, Throwable error) {

    public enum Kind {
        /** Nothing to do until the next change. */
        DONE,
        /** Run again right away. */
        REQUEUE,
        /** Run again after {@link #delay()}. */
        RETRY_AFTER,
        /** Transient failure, retry with the scheduler's backoff. */
        FAILED,
        /** Permanent failure, only a change to the resource can fix it. */
        FATAL
    }

    public static ReconcileOutcome done() {
        return new ReconcileOutcome(Kind.DONE, null, null);
    }

    public static ReconcileOutcome requeue() {
        return new ReconcileOutcome(Kind.REQUEUE, null, null);
    }

    public static ReconcileOutcome retryAfter(Duration delay) {
        return new ReconcileOutcome(Kind.RETRY_AFTER, delay, null);
    }

    public static ReconcileOutcome failed(Throwable error) {
        return new ReconcileOutcome(Kind.FAILED, null, error);
    }

    public static ReconcileOutcome fatal(Throwable error) {
        return new ReconcileOutcome(Kind.FATAL, null, error);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case RETRY_AFTER -> kind + "(" + delay + ")";
            case FAILED, FATAL -> kind + "(" + error + ")";
            default -> kind.toString();
        };
    }
}
