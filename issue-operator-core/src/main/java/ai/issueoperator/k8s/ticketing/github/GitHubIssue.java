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
package ai.issueoperator.k8s.ticketing.github;

import ai.issueoperator.k8s.ticketing.RemoteIssue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Subset of the GitHub REST issue payload. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitHubIssue {

    private int number;
    private String title;
    private String body;
    private String state;

    @JsonProperty("pull_request")
    private Map<String, Object> pullRequest;

    RemoteIssue toRemoteIssue() {
        return RemoteIssue.builder()
                .number(number)
                .title(title)
                .body(body)
                .state("open".equals(state) ? RemoteIssue.State.OPEN : RemoteIssue.State.CLOSED)
                .linkedPullRequest(pullRequest != null)
                .build();
    }
}
