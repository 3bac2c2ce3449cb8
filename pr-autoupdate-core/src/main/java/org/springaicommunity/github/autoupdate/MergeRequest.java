package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;

/**
 * Parameters of a {@code POST /repos/{owner}/{repo}/merges} call that brings a pull
 * request's head branch up to date.
 *
 * <p>
 * The merge runs against the head repository with {@code base} set to the pull request's
 * head branch and {@code head} set to its base branch: the base branch is merged into the
 * pull request branch, not the other way round.
 *
 * @param owner owner of the head repository
 * @param repo name of the head repository
 * @param base branch receiving the merge (the pull request's head ref)
 * @param head branch being merged in (the pull request's base ref)
 * @param commitMessage merge commit message, null for the GitHub default
 */
public record MergeRequest(String owner, String repo, String base, String head, @Nullable String commitMessage) {

	/**
	 * Build the merge request that updates the given pull request's branch.
	 * @param pull the pull request, which must have a head repository
	 * @param commitMessage configured merge message, null or empty for the default
	 * @return the merge request
	 * @throws IllegalArgumentException if the head repository is unknown
	 */
	public static MergeRequest forPullRequest(PullRequestSummary pull, @Nullable String commitMessage) {
		PullRequestSummary.Repository repository = pull.head().repo();
		if (repository == null) {
			throw new IllegalArgumentException("Pull request #" + pull.number() + " has no head repository");
		}
		String message = commitMessage != null && !commitMessage.isEmpty() ? commitMessage : null;
		return new MergeRequest(repository.ownerLogin(), repository.name(), pull.head().ref(), pull.base().ref(),
				message);
	}

}
