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

import ai.issueoperator.k8s.ticketing.TicketingClient;
import ai.issueoperator.k8s.ticketing.TicketingClientFactory;
import java.net.http.HttpClient;
import java.time.Duration;

/** Builds a fresh {@link GitHubTicketingClient} for each token; only the HTTP client is shared. */
public class GitHubTicketingClientFactory implements TicketingClientFactory {

    private final HttpClient httpClient;
    private final String apiUrl;

    public GitHubTicketingClientFactory(String apiUrl) {
        this(
                HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(30))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                apiUrl);
    }

    public GitHubTicketingClientFactory(HttpClient httpClient, String apiUrl) {
        this.httpClient = httpClient;
        this.apiUrl = apiUrl;
    }

    @Override
    public TicketingClient create(String token) {
        return new GitHubTicketingClient(httpClient, apiUrl, token);
    }
}
