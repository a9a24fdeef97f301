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

public class CRDConstants {

    public static final String COMMON_LABEL_APP = "app";
    public static final String COMMON_LABEL_APP_VALUE = "issue-operator";
    public static final String SECRET_LABEL_ISSUE_REQUEST = "issueoperator.ai/issue-request";

    // Blocks the final removal of an IssueRequest until the remote issue has been closed.
    public static final String ISSUE_REQUEST_FINALIZER = "finalizer.issuerequest.issueoperator.ai";

    public static final String DEFAULT_TOKEN_SECRET_SUFFIX = "-token-secret";
    public static final String DEFAULT_TOKEN_SECRET_KEY = "token";

    public static final int MAX_DESCRIPTION_LENGTH = 256;

    public static final String GITHUB_HOST = "github.com";

    private CRDConstants() {}
}
