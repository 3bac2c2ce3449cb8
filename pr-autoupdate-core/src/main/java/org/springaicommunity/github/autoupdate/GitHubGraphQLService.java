package org.springaicommunity.github.autoupdate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for GitHub GraphQL API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed records at the service boundary,
 * encapsulating all JSON parsing logic here.
 */
public class GitHubGraphQLService implements GraphQLService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubGraphQLService.class);

	static final String OPEN_PULL_REQUESTS_QUERY = """
			query($owner: String!, $repo: String!, $base: String!, $cursor: String) {
			    repository(owner: $owner, name: $repo) {
			        pullRequests(
			            baseRefName: $base
			            states: [OPEN]
			            first: 100
			            after: $cursor
			            orderBy: {field: UPDATED_AT, direction: DESC}
			        ) {
			            pageInfo {
			                hasNextPage
			                endCursor
			            }
			            nodes {
			                number
			                state
			                merged
			                mergeable
			                isDraft
			                labels(first: 10) {
			                    nodes {
			                        name
			                    }
			                }
			                baseRef {
			                    name
			                    target {
			                        ... on Commit {
			                            oid
			                        }
			                    }
			                }
			                headRef {
			                    name
			                    target {
			                        ... on Commit {
			                            oid
			                        }
			                    }
			                }
			                headRepository {
			                    name
			                    owner {
			                        login
			                    }
			                }
			            }
			        }
			    }
			}
			""";

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubGraphQLService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public PullRequestPage listOpenPullRequests(String owner, String repo, String base,
			@Nullable String cursor) {
		Map<String, Object> variables = new HashMap<>();
		variables.put("owner", owner);
		variables.put("repo", repo);
		variables.put("base", base);
		variables.put("cursor", cursor);

		JsonNode response = executeGraphQL(OPEN_PULL_REQUESTS_QUERY, variables);
		JsonNode pullRequests = response.path("data").path("repository").path("pullRequests");

		JsonNode pageInfo = pullRequests.path("pageInfo");
		boolean hasMore = pageInfo.path("hasNextPage").asBoolean(false);
		String nextCursor = hasMore ? pageInfo.path("endCursor").asText(null) : null;

		List<PullRequestSummary> pulls = new ArrayList<>();
		JsonNode nodes = pullRequests.path("nodes");
		if (nodes.isArray()) {
			for (JsonNode node : nodes) {
				PullRequestSummary pull = GraphQLPullRequestConverter.convert(node, owner);
				if (pull != null) {
					pulls.add(pull);
				}
			}
		}

		return new PullRequestPage(pulls, nextCursor, hasMore && nextCursor != null);
	}

	// ========== Internal GraphQL Execution ==========

	private JsonNode executeGraphQL(String query, Map<String, Object> variables) {
		String requestBody;
		try {
			Map<String, Object> body = new HashMap<>();
			body.put("query", query);
			body.put("variables", variables);
			requestBody = objectMapper.writeValueAsString(body);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize GraphQL request", e);
		}

		String response = httpClient.postGraphQL(requestBody);

		JsonNode result;
		try {
			result = objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			throw new GitHubHttpClient.GitHubApiException("Failed to parse GraphQL response: " + e.getMessage(), e);
		}

		JsonNode errors = result.path("errors");
		if (errors.isArray() && !errors.isEmpty()) {
			JsonNode first = errors.get(0);
			String message = first.path("message").asText("unknown error");
			if (result.path("data").path("repository").isObject()) {
				logger.warn("GraphQL query returned partial data with errors: {}", message);
			}
			else {
				throw new GitHubHttpClient.GitHubApiException("GraphQL query failed: " + message,
						statusForErrorType(first.path("type").asText("")), response);
			}
		}
		return result;
	}

	/**
	 * GraphQL errors arrive with HTTP 200; map the error types that have a REST
	 * counterpart onto that status so callers can classify them the same way.
	 */
	private static int statusForErrorType(String type) {
		return switch (type) {
			case "RATE_LIMITED" -> 429;
			case "FORBIDDEN" -> 403;
			case "NOT_FOUND" -> 404;
			default -> 200;
		};
	}

}
