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

import ai.issueoperator.k8s.repo.RepoRef;
import ai.issueoperator.k8s.ticketing.RemoteIssue;
import ai.issueoperator.k8s.ticketing.RemoteRejectedException;
import ai.issueoperator.k8s.ticketing.RemoteUnavailableException;
import ai.issueoperator.k8s.ticketing.TicketingClient;
import ai.issueoperator.k8s.ticketing.TicketingException;
import ai.issueoperator.k8s.ticketing.UnauthorizedException;
import ai.issueoperator.k8s.util.SerializationUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TicketingClient} over the GitHub REST API.
 *
 * <p>The token is sent as a bearer token on every request. An empty token is accepted at
 * construction time, but every call made with it fails with {@link UnauthorizedException}.
 */
@Slf4j
public class GitHubTicketingClient implements TicketingClient {

    public static final String DEFAULT_API_URL = "https://api.github.com";

    private static final String API_VERSION = "2022-11-28";
    private static final int PAGE_SIZE = 100;
    private static final int HTTP_UNPROCESSABLE_ENTITY = 422;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"next\"");
    private static final TypeReference<List<GitHubIssue>> ISSUE_LIST = new TypeReference<>() {};

    private final HttpClient httpClient;
    private final String apiUrl;
    private final String token;

    public GitHubTicketingClient(HttpClient httpClient, String apiUrl, String token) {
        this.httpClient = httpClient;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.token = token;
    }

    @Override
    public Optional<RemoteIssue> findIssue(RepoRef repo, String title, int knownNumber)
            throws TicketingException {
        GitHubIssue titleMatch = null;
        String url =
                "%s/repos/%s/%s/issues?state=all&per_page=%d"
                        .formatted(apiUrl, repo.owner(), repo.repo(), PAGE_SIZE);
        while (url != null) {
            final HttpResponse<String> response = send(newRequest(url).GET().build());
            final List<GitHubIssue> page = parse(response, ISSUE_LIST);
            for (GitHubIssue issue : page) {
                if (knownNumber > 0 && issue.getNumber() == knownNumber) {
                    return Optional.of(issue.toRemoteIssue());
                }
                if (titleMatch == null && title != null && title.equals(issue.getTitle())) {
                    if (knownNumber <= 0) {
                        return Optional.of(issue.toRemoteIssue());
                    }
                    titleMatch = issue;
                }
            }
            url = nextPage(response);
        }
        return Optional.ofNullable(titleMatch).map(GitHubIssue::toRemoteIssue);
    }

    @Override
    public RemoteIssue createIssue(RepoRef repo, String title, String body)
            throws TicketingException {
        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", title);
        payload.put("body", body);
        final HttpRequest request =
                newRequest("%s/repos/%s/%s/issues".formatted(apiUrl, repo.owner(), repo.repo()))
                        .POST(HttpRequest.BodyPublishers.ofString(
                                SerializationUtil.writeAsJson(payload)))
                        .build();
        final RemoteIssue created = parse(send(request), GitHubIssue.class).toRemoteIssue();
        log.info("Created issue {}#{}", repo, created.getNumber());
        return created;
    }

    @Override
    public RemoteIssue updateIssue(RepoRef repo, RemoteIssue issue, String body, String title)
            throws TicketingException {
        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", title);
        payload.put("body", body);
        final RemoteIssue updated = patchIssue(repo, issue.getNumber(), payload);
        log.info("Updated issue {}#{}", repo, updated.getNumber());
        return updated;
    }

    @Override
    public void closeIssue(RepoRef repo, RemoteIssue issue) throws TicketingException {
        try {
            patchIssue(repo, issue.getNumber(), Map.of("state", "closed"));
            log.info("Closed issue {}#{}", repo, issue.getNumber());
        } catch (RemoteRejectedException e) {
            if (e.getStatusCode() != HTTP_UNPROCESSABLE_ENTITY) {
                throw e;
            }
            log.info("Issue {}#{} was already closed: {}", repo, issue.getNumber(), e.getMessage());
        }
    }

    private RemoteIssue patchIssue(RepoRef repo, int number, Map<String, Object> payload)
            throws TicketingException {
        final HttpRequest request =
                newRequest(
                                "%s/repos/%s/%s/issues/%d"
                                        .formatted(apiUrl, repo.owner(), repo.repo(), number))
                        .method(
                                "PATCH",
                                HttpRequest.BodyPublishers.ofString(
                                        SerializationUtil.writeAsJson(payload)))
                        .build();
        return parse(send(request), GitHubIssue.class).toRemoteIssue();
    }

    private HttpRequest.Builder newRequest(String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Accept", "application/vnd.github+json")
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + token)
                .header("X-GitHub-Api-Version", API_VERSION);
    }

    private HttpResponse<String> send(HttpRequest request) throws TicketingException {
        if (token == null || token.isEmpty()) {
            throw new UnauthorizedException("no token available for " + request.uri());
        }
        final HttpResponse<String> response;
        try {
            if (log.isDebugEnabled()) {
                log.debug("sending request: {} {}", request.method(), request.uri());
            }
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteUnavailableException("interrupted calling " + request.uri(), e);
        } catch (IOException e) {
            throw new RemoteUnavailableException(
                    "cannot reach %s: %s".formatted(request.uri(), e.getMessage()), e);
        }
        final int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return response;
        }
        final String message =
                "%s %s failed with status %d: %s"
                        .formatted(request.method(), request.uri(), status, response.body());
        if (status == HttpURLConnection.HTTP_UNAUTHORIZED) {
            throw new UnauthorizedException(message);
        }
        if ((status == HttpURLConnection.HTTP_FORBIDDEN && isRateLimited(response))
                || status == HTTP_TOO_MANY_REQUESTS) {
            throw new RemoteRejectedException(status, "rate limit exceeded, " + message);
        }
        if (status >= 400 && status < 500) {
            throw new RemoteRejectedException(status, message);
        }
        throw new RemoteUnavailableException(message);
    }

    private static boolean isRateLimited(HttpResponse<?> response) {
        return response.headers()
                .firstValue("X-RateLimit-Remaining")
                .map("0"::equals)
                .orElse(false);
    }

    private static String nextPage(HttpResponse<?> response) {
        final Optional<String> link = response.headers().firstValue("Link");
        if (link.isEmpty()) {
            return null;
        }
        final Matcher matcher = NEXT_LINK.matcher(link.get());
        return matcher.find() ? matcher.group(1) : null;
    }

    private static <T> T parse(HttpResponse<String> response, Class<T> type)
            throws RemoteUnavailableException {
        try {
            return SerializationUtil.readJson(response.body(), type);
        } catch (Exception e) {
            // body is not the expected JSON, e.g. an HTML error page from a proxy
            throw new RemoteUnavailableException(
                    "unexpected response from " + response.uri() + ": " + e.getMessage(), e);
        }
    }

    private static <T> T parse(HttpResponse<String> response, TypeReference<T> type)
            throws RemoteUnavailableException {
        try {
            return SerializationUtil.readJson(response.body(), type);
        } catch (Exception e) {
            throw new RemoteUnavailableException(
                    "unexpected response from " + response.uri() + ": " + e.getMessage(), e);
        }
    }
}
