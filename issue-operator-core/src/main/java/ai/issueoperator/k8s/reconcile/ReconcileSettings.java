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

import ai.issueoperator.k8s.CRDConstants;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReconcileSettings {

    /** Wait between checks of a token secret that is still empty. */
    @Builder.Default Duration tokenPollInterval = Duration.ofSeconds(60);

    /** Wait before retrying after losing a status write race. */
    @Builder.Default Duration conflictRetryDelay = Duration.ofSeconds(5);

    @Builder.Default Duration requeueDelay = Duration.ZERO;

    @Builder.Default String secretSuffix = CRDConstants.DEFAULT_TOKEN_SECRET_SUFFIX;

    @Builder.Default String secretTokenKey = CRDConstants.DEFAULT_TOKEN_SECRET_KEY;

    @Builder.Default String finalizer = CRDConstants.ISSUE_REQUEST_FINALIZER;

    public static ReconcileSettings defaults() {
        return ReconcileSettings.builder().build();
    }
}
