package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;

/**
 * Lists open pull requests through the cursor-paginated GraphQL
 * {@code repository.pullRequests} connection.
 */
public class GraphQLPullRequestEnumerator extends AbstractPullRequestEnumerator {

	private final GraphQLService graphQLService;

	public GraphQLPullRequestEnumerator(GraphQLService graphQLService) {
		this.graphQLService = graphQLService;
	}

	@Override
	protected PullRequestPage fetchPage(String owner, String repo, String baseBranch,
			@Nullable String cursor) {
		return graphQLService.listOpenPullRequests(owner, repo, baseBranch, cursor);
	}

	@Override
	protected String sourceName() {
		return "GraphQL API";
	}

}
