package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * {@link GitHubClient} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * Rate limit headers are read from every response and a warning is logged when the quota
 * runs low. Non-2xx responses become a {@link GitHubApiException} carrying the status and
 * body; this client makes exactly one attempt per call and leaves retrying to
 * {@link BranchMerger}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	static final String DEFAULT_API_BASE = "https://api.github.com";

	private static final String USER_AGENT = "pr-autoupdate";

	private static final String API_VERSION = "2022-11-28";

	private final HttpClient httpClient;

	private final String token;

	private final String apiBase;

	private final URI graphQLEndpoint;

	public GitHubHttpClient(String token) {
		this(token, DEFAULT_API_BASE, DEFAULT_API_BASE + "/graphql");
	}

	public GitHubHttpClient(String token, String apiBase, String graphQLEndpoint) {
		this.token = token;
		this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
		this.graphQLEndpoint = URI.create(graphQLEndpoint);
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public String get(String path) {
		return send(restRequest(resolve(path)).GET().build()).body();
	}

	@Override
	public String getWithQuery(String path, String queryString) {
		if (queryString == null || queryString.isEmpty()) {
			return get(path);
		}
		return get(resolve(path) + "?" + queryString);
	}

	@Override
	public GitHubResponse post(String path, String body) {
		HttpRequest request = restRequest(resolve(path)).header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();
		return send(request);
	}

	@Override
	public String postGraphQL(String body) {
		HttpRequest request = HttpRequest.newBuilder(graphQLEndpoint)
			.header("Authorization", "Bearer " + token)
			.header("Content-Type", "application/json")
			.header("User-Agent", USER_AGENT)
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();
		return send(request).body();
	}

	private String resolve(String path) {
		return path.startsWith("http") ? path : apiBase + path;
	}

	private HttpRequest.Builder restRequest(String url) {
		return HttpRequest.newBuilder(URI.create(url))
			.header("Authorization", "token " + token)
			.header("Accept", "application/vnd.github+json")
			.header("X-GitHub-Api-Version", API_VERSION)
			.header("User-Agent", USER_AGENT);
	}

	private GitHubResponse send(HttpRequest request) {
		String target = request.method() + " " + request.uri();
		long start = System.currentTimeMillis();
		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException e) {
			logger.error("{} failed: {}", target, e.getMessage());
			throw new GitHubApiException(target + " failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException(target + " interrupted", e);
		}

		RateLimitInfo rateLimit = readRateLimit(response);
		int statusCode = response.statusCode();
		String body = response.body() != null ? response.body() : "";
		logger.debug("{} -> {} in {}ms ({} bytes)", target, statusCode, System.currentTimeMillis() - start,
				body.length());

		if (statusCode >= 200 && statusCode < 300) {
			return new GitHubResponse(statusCode, body);
		}
		throw new GitHubApiException(describeFailure(statusCode, body, request.uri(), rateLimit), statusCode, body,
				rateLimit);
	}

	private static @Nullable RateLimitInfo readRateLimit(HttpResponse<?> response) {
		OptionalLong remaining = header(response, "X-RateLimit-Remaining");
		if (remaining.isEmpty()) {
			return null;
		}
		RateLimitInfo rateLimit = new RateLimitInfo((int) header(response, "X-RateLimit-Limit").orElse(-1),
				(int) remaining.getAsLong(), header(response, "X-RateLimit-Reset").orElse(-1),
				(int) header(response, "X-RateLimit-Used").orElse(-1));
		if (rateLimit.isRunningLow()) {
			logger.warn("Rate limit low: {}/{} remaining, resets in {}s", rateLimit.remaining(), rateLimit.limit(),
					rateLimit.untilReset(Instant.now()).toSeconds());
		}
		return rateLimit;
	}

	private static OptionalLong header(HttpResponse<?> response, String name) {
		return response.headers().firstValue(name).map(value -> {
			try {
				return OptionalLong.of(Long.parseLong(value.trim()));
			}
			catch (NumberFormatException e) {
				return OptionalLong.empty();
			}
		}).orElse(OptionalLong.empty());
	}

	static String describeFailure(int statusCode, String body, URI uri, @Nullable RateLimitInfo rateLimit) {
		if (statusCode == 401) {
			return "Unauthorized: bad credentials. Check GITHUB_TOKEN.";
		}
		if (statusCode == 429 || (statusCode == 403 && rateLimit != null && rateLimit.remaining() == 0)) {
			long reset = rateLimit != null ? rateLimit.reset() : -1;
			return "Rate limit exceeded (" + statusCode + "), resets at epoch " + reset;
		}
		if (statusCode == 403) {
			return "Forbidden: the token may not be allowed to write to " + uri.getPath() + ": " + body;
		}
		if (statusCode == 404) {
			return "Not found: " + uri.getPath();
		}
		if (statusCode == 409) {
			return "Conflict: " + body;
		}
		return "GitHub API error " + statusCode + " for " + uri.getPath();
	}

	/**
	 * Failed GitHub API call.
	 *
	 * <p>
	 * Carries the HTTP status, the raw body and the rate limit headers of the failed
	 * response so that callers can tell authorization failures, exhausted quotas and
	 * merge conflicts apart. A status of {@code -1} means no response was received.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		private final @Nullable RateLimitInfo rateLimit;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			this(message, statusCode, responseBody, null);
		}

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
				@Nullable RateLimitInfo rateLimit) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimit = rateLimit;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.rateLimit = null;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public @Nullable RateLimitInfo getRateLimit() {
			return rateLimit;
		}

		/**
		 * 429, or 403 with an exhausted quota.
		 */
		public boolean isRateLimitError() {
			return statusCode == 429 || (statusCode == 403 && rateLimit != null && rateLimit.remaining() == 0);
		}

		/**
		 * 401, or a 403 that is not a rate limit error.
		 */
		public boolean isAuthorizationError() {
			return statusCode == 401 || (statusCode == 403 && !isRateLimitError());
		}

	}

}
