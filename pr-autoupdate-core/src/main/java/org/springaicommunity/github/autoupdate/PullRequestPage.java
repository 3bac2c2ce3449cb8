package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of open pull requests targeting a base branch.
 *
 * <p>
 * {@code nextCursor} is opaque to callers: a page number for the REST API, an
 * {@code endCursor} for GraphQL.
 *
 * @param pullRequests the pull requests on this page, in API order
 * @param nextCursor cursor of the following page, null on the last page
 * @param hasMore whether another page should be requested
 */
public record PullRequestPage(List<PullRequestSummary> pullRequests, @Nullable String nextCursor,
		boolean hasMore) {

	public PullRequestPage {
		pullRequests = List.copyOf(pullRequests);
	}

	static PullRequestPage empty() {
		return new PullRequestPage(List.of(), null, false);
	}

}
