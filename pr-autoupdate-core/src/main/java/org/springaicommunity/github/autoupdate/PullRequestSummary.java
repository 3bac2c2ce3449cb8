package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;

import java.util.Set;

/**
 * Canonical representation of an open pull request, built from either the REST listing or
 * the GraphQL query.
 *
 * <p>
 * Instances are immutable and live for a single decision and merge cycle.
 *
 * @param number the pull request number, unique within the repository
 * @param state whether the pull request is open or closed
 * @param merged whether the pull request has been merged
 * @param draft whether the pull request is a draft
 * @param labels label names on the pull request
 * @param base the branch the pull request targets
 * @param head the branch containing the proposed changes
 * @param autoMerge auto-merge settings, null when auto-merge is not enabled
 */
public record PullRequestSummary(int number, PullRequestState state, boolean merged, boolean draft, Set<String> labels,
		Base base, Head head, @Nullable AutoMerge autoMerge) {

	public PullRequestSummary {
		labels = Set.copyOf(labels);
	}

	public boolean isOpen() {
		return state == PullRequestState.OPEN;
	}

	/**
	 * Format a branch label the way the GitHub API does: {@code owner:ref} when the owner
	 * is known, the bare ref otherwise.
	 * @param owner repository owner login, may be null
	 * @param ref branch name
	 * @return the branch label
	 */
	public static String label(@Nullable String owner, String ref) {
		return owner != null ? owner + ":" + ref : ref;
	}

	/**
	 * The base (target) branch.
	 *
	 * @param ref branch name
	 * @param label {@code owner:ref}
	 * @param sha commit the branch points at
	 */
	public record Base(String ref, String label, String sha) {
	}

	/**
	 * The head (source) branch.
	 *
	 * @param ref branch name
	 * @param label {@code owner:ref}, or the bare ref when the repository is unknown
	 * @param sha commit the branch points at
	 * @param repo the repository holding the branch, null when the fork was deleted
	 */
	public record Head(String ref, String label, String sha, @Nullable Repository repo) {
	}

	/**
	 * Repository identity.
	 *
	 * @param name repository name
	 * @param ownerLogin login of the owning user or organization
	 */
	public record Repository(String name, String ownerLogin) {
	}

	/**
	 * Auto-merge settings of a pull request. Only presence is used when deciding.
	 *
	 * @param mergeMethod the merge method configured for auto-merge
	 */
	public record AutoMerge(@Nullable String mergeMethod) {
	}

}
