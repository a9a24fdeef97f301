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
package ai.issueoperator.k8s;

import ai.issueoperator.k8s.reconcile.ReconcileSettings;
import jakarta.inject.Singleton;
import lombok.Getter;
import lombok.extern.jbosslog.JBossLog;

@Singleton
@JBossLog
public class ResolvedOperatorConfiguration {

    public ResolvedOperatorConfiguration(OperatorConfiguration configuration) {
        this.githubApiUrl = configuration.githubApiUrl();
        this.settings =
                ReconcileSettings.builder()
                        .tokenPollInterval(configuration.tokenPollInterval())
                        .conflictRetryDelay(configuration.conflictRetryDelay())
                        .requeueDelay(configuration.requeueDelay())
                        .secretSuffix(configuration.secretSuffix())
                        .secretTokenKey(configuration.secretTokenKey())
                        .build();
        log.infof("Using GitHub API at %s, settings: %s", githubApiUrl, settings);
    }

    @Getter private String githubApiUrl;

    @Getter private ReconcileSettings settings;
}
