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

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;

@ConfigMapping(prefix = "issue-operator")
public interface OperatorConfiguration {

    @WithDefault("https://api.github.com")
    String githubApiUrl();

    @WithDefault("60s")
    Duration tokenPollInterval();

    @WithDefault("5s")
    Duration conflictRetryDelay();

    @WithDefault("0s")
    Duration requeueDelay();

    @WithDefault(CRDConstants.DEFAULT_TOKEN_SECRET_SUFFIX)
    String secretSuffix();

    @WithDefault(CRDConstants.DEFAULT_TOKEN_SECRET_KEY)
    String secretTokenKey();
}
