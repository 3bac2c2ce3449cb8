package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub GraphQL API operations.
 *
 * <p>
 * Extracted to enable mocking in tests.
 */
public interface GraphQLService {

	/**
	 * List one page of open pull requests targeting a base branch, most recently updated
	 * first. Nodes without a head ref are left out of the page.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param base Base branch name
	 * @param cursor End cursor of the previous page, or null for the first page
	 * @return the page of pull requests
	 * @throws GitHubHttpClient.GitHubApiException if the query fails
	 */
	PullRequestPage listOpenPullRequests(String owner, String repo, String base,
			@Nullable String cursor);

}
