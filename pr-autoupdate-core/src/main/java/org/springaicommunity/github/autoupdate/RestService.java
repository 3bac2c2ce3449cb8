package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub REST API operations.
 *
 * <p>
 * Returns strongly-typed records instead of raw JSON. Failures surface as
 * {@link GitHubHttpClient.GitHubApiException}; nothing here retries.
 */
public interface RestService {

	/**
	 * List one page of open pull requests targeting a base branch, most recently updated
	 * first.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param base Base branch name
	 * @param cursor Page number as string, or null for the first page
	 * @return the page of pull requests
	 */
	PullRequestPage listOpenPullRequests(String owner, String repo, String base,
			@Nullable String cursor);

	/**
	 * Compare two refs.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param basehead comparison range in {@code base...head} form
	 * @return how far the refs have diverged
	 */
	ComparisonResult compareCommits(String owner, String repo, String basehead);

	/**
	 * Get a branch.
	 * @param owner Repository owner
	 * @param repo Repository name
	 * @param branch Branch name
	 * @return the branch with its protection status
	 */
	BranchInfo getBranch(String owner, String repo, String branch);

	/**
	 * Merge one branch into another.
	 * @param request the merge parameters
	 * @return the merge outcome
	 */
	MergeResult merge(MergeRequest request);

}
