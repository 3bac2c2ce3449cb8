package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;

import java.util.stream.Stream;

/**
 * Lists the open pull requests that target a branch.
 *
 * <p>
 * Implementations return a lazy stream that fetches pages on demand, in most recently
 * updated first order. The stream can be consumed once. A failing page request ends the
 * stream; pull requests already returned stay valid.
 */
public interface PullRequestEnumerator {

	/**
	 * List open pull requests whose base branch is the branch named by {@code ref}.
	 * @param ref full ref of the base branch, e.g. {@code refs/heads/main}
	 * @param repoName repository name
	 * @param ownerLogin login of the repository owner
	 * @param ownerName display name of the repository owner, preferred over the login
	 * when present
	 * @return the pull requests, empty when {@code ref} is not a branch or the repository
	 * cannot be identified
	 */
	Stream<PullRequestSummary> openPullRequests(String ref, String repoName, @Nullable String ownerLogin,
			@Nullable String ownerName);

}
