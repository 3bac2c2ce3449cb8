package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;

/**
 * Lists open pull requests through the paged REST endpoint
 * {@code GET /repos/{owner}/{repo}/pulls}.
 */
public class RestPullRequestEnumerator extends AbstractPullRequestEnumerator {

	private final RestService restService;

	public RestPullRequestEnumerator(RestService restService) {
		this.restService = restService;
	}

	@Override
	protected PullRequestPage fetchPage(String owner, String repo, String baseBranch,
			@Nullable String cursor) {
		return restService.listOpenPullRequests(owner, repo, baseBranch, cursor);
	}

	@Override
	protected String sourceName() {
		return "REST API";
	}

}
