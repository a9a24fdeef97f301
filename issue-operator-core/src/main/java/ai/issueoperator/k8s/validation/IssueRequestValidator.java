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
package ai.issueoperator.k8s.validation;

import ai.issueoperator.k8s.CRDConstants;
import ai.issueoperator.k8s.api.crds.IssueRequestSpec;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Static checks applied to an IssueRequest before it is admitted. The reconcile loop does not
 * rely on them: resources written directly to the store can bypass admission.
 */
public class IssueRequestValidator {

    private static final Pattern REPO_PATH = Pattern.compile("^/[^/]+/[^/]+$");

    private IssueRequestValidator() {}

    /** @return human readable violations, empty when the spec is valid */
    public static List<String> validate(IssueRequestSpec spec) {
        final List<String> errors = new ArrayList<>();
        if (spec == null) {
            errors.add("spec: must be set");
            return errors;
        }
        if (spec.getTitle() == null || spec.getTitle().isEmpty()) {
            errors.add("spec.title: title must not be empty");
        }
        if (spec.getDescription() != null
                && spec.getDescription().length() > CRDConstants.MAX_DESCRIPTION_LENGTH) {
            errors.add(
                    "spec.description: description must not be longer than %d characters"
                            .formatted(CRDConstants.MAX_DESCRIPTION_LENGTH));
        }
        final String repoError = validateRepoURL(spec.getRepoURL());
        if (repoError != null) {
            errors.add("spec.repoURL: " + repoError);
        }
        return errors;
    }

    private static String validateRepoURL(String repoURL) {
        if (repoURL == null || repoURL.isEmpty()) {
            return "repository url must not be empty";
        }
        final URI uri;
        try {
            uri = new URI(repoURL);
        } catch (URISyntaxException e) {
            return "invalid url format";
        }
        if (!"https".equals(uri.getScheme())) {
            return "repository url should start with https";
        }
        if (!CRDConstants.GITHUB_HOST.equals(uri.getHost())) {
            return "the host name of the repository should be " + CRDConstants.GITHUB_HOST;
        }
        if (uri.getPath() == null || !REPO_PATH.matcher(uri.getPath()).matches()) {
            return "repository url must be in the format 'https://github.com/{owner}/{repo}'";
        }
        return null;
    }
}
