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
package ai.issueoperator.k8s.api.crds;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import io.fabric8.kubernetes.api.model.Condition;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class IssueRequestStatus {

    public static final String CONDITION_ISSUE_OPEN = "IssueOpen";
    public static final String CONDITION_HAS_LINKED_PULL_REQUEST = "HasLinkedPullRequest";

    @JsonPropertyDescription("Observed state of the remote issue.")
    List<Condition> conditions = new ArrayList<>();

    @JsonPropertyDescription("Number of the remote issue, unset until the issue is created or found.")
    Integer issueNumber;

    @JsonPropertyDescription("Repository the remote issue lives in, as owner/repo.")
    String issueRepository;

    @JsonPropertyDescription("Last time the remote issue was synchronized.")
    String lastUpdated;

    @JsonPropertyDescription("Whether the token secret is still waiting for a value.")
    boolean tokenRequired;

    public Optional<Condition> findCondition(String type) {
        if (conditions == null) {
            return Optional.empty();
        }
        return conditions.stream().filter(c -> type.equals(c.getType())).findFirst();
    }

    public boolean hasIssueNumber() {
        return issueNumber != null && issueNumber > 0;
    }
}
