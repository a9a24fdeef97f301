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
package ai.issueoperator.k8s.repo;

import java.util.Arrays;
import java.util.List;

/** Extracts the owner and repository name from a GitHub repository URL. */
public class RepoRefParser {

    private static final List<String> PREFIXES =
            List.of("https://github.com/", "http://github.com/", "github.com/");

    private RepoRefParser() {}

    public static RepoRef parse(String repoURL) throws MalformedRepoRefException {
        if (repoURL == null) {
            throw new MalformedRepoRefException(null);
        }
        String path = repoURL.trim();
        for (String prefix : PREFIXES) {
            if (path.startsWith(prefix)) {
                path = path.substring(prefix.length());
                break;
            }
        }
        final List<String> segments =
                Arrays.stream(path.split("/")).filter(s -> !s.isBlank()).toList();
        if (segments.size() < 2) {
            throw new MalformedRepoRefException(repoURL);
        }
        String repo = segments.get(1);
        if (repo.endsWith(".git")) {
            repo = repo.substring(0, repo.length() - ".git".length());
        }
        if (repo.isEmpty()) {
            throw new MalformedRepoRefException(repoURL);
        }
        return new RepoRef(segments.get(0), repo);
    }
}
