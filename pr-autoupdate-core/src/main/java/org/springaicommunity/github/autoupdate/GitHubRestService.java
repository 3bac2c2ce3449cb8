package org.springaicommunity.github.autoupdate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed records at the service boundary.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	static final int PAGE_SIZE = 100;

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public PullRequestPage listOpenPullRequests(String owner, String repo, String base,
			@Nullable String cursor) {
		int page = 1;
		if (cursor != null && !cursor.isEmpty()) {
			try {
				page = Integer.parseInt(cursor);
			}
			catch (NumberFormatException e) {
				logger.warn("Invalid cursor format, using page 1: {}", cursor);
			}
		}

		String query = String.format("base=%s&state=open&sort=updated&direction=desc&per_page=%d&page=%d",
				encode(base), PAGE_SIZE, page);
		JsonNode items = readTree(httpClient.getWithQuery(repoPath(owner, repo) + "/pulls", query));

		List<PullRequestSummary> pulls = new ArrayList<>();
		if (items.isArray()) {
			for (JsonNode item : items) {
				PullRequestSummary pull = RestPullRequestConverter.convert(item);
				if (pull != null) {
					pulls.add(pull);
				}
			}
		}

		// A short page is the last one
		boolean hasMore = items.size() >= PAGE_SIZE;
		String nextCursor = hasMore ? String.valueOf(page + 1) : null;
		logger.debug("Listed page {} of open pull requests for {}/{} on '{}': {} item(s)", page, owner, repo, base,
				items.size());

		return new PullRequestPage(pulls, nextCursor, hasMore);
	}

	@Override
	public ComparisonResult compareCommits(String owner, String repo, String basehead) {
		JsonNode node = readTree(httpClient.get(repoPath(owner, repo) + "/compare/" + encode(basehead)));
		return new ComparisonResult(node.path("status").asText(""), node.path("ahead_by").asInt(0),
				node.path("behind_by").asInt(0));
	}

	@Override
	public BranchInfo getBranch(String owner, String repo, String branch) {
		JsonNode node = readTree(httpClient.get(repoPath(owner, repo) + "/branches/" + encode(branch)));
		return new BranchInfo(node.path("name").asText(branch), node.path("protected").asBoolean(false));
	}

	@Override
	public MergeResult merge(MergeRequest request) {
		String body;
		try {
			body = objectMapper
				.writeValueAsString(new MergeBody(request.base(), request.head(), request.commitMessage()));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize merge request", e);
		}

		GitHubResponse response = httpClient.post(repoPath(request.owner(), request.repo()) + "/merges", body);
		String sha = null;
		if (response.hasBody()) {
			JsonNode node = readTree(response.body());
			sha = node.path("sha").isTextual() ? node.path("sha").asText() : null;
		}
		return new MergeResult(response.statusCode(), sha);
	}

	private JsonNode readTree(String json) {
		try {
			return objectMapper.readTree(json);
		}
		catch (JsonProcessingException e) {
			throw new GitHubHttpClient.GitHubApiException("Failed to parse GitHub response: " + e.getMessage(), e);
		}
	}

	private static String repoPath(String owner, String repo) {
		return "/repos/" + owner + "/" + repo;
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	/**
	 * JSON body of the merges endpoint. Serialized in snake_case, null message omitted.
	 */
	record MergeBody(String base, String head, @Nullable String commitMessage) {
	}

}
