package org.springaicommunity.github.autoupdate;

/**
 * Transport used by {@link RestService} and {@link GraphQLService}. Implementations
 * authenticate every call and raise {@link GitHubHttpClient.GitHubApiException} for
 * non-2xx responses. Tests substitute a mock.
 */
public interface GitHubClient {

	/**
	 * GET a REST resource.
	 * @param path path below the API base, such as {@code /repos/octo/widgets/branches/main},
	 * or an absolute URL
	 * @return the response body
	 */
	String get(String path);

	/**
	 * GET a REST resource with an already encoded query string.
	 * @param path path below the API base
	 * @param queryString query without the leading {@code ?}
	 * @return the response body
	 */
	String getWithQuery(String path, String queryString);

	/**
	 * POST a JSON body. The status code is part of the result because the merges
	 * endpoint answers 201 for a merge commit and 204 when there was nothing to merge.
	 * @param path path below the API base
	 * @param body JSON request body
	 * @return status and body of the 2xx response
	 */
	GitHubResponse post(String path, String body);

	/**
	 * POST a query document to the GraphQL endpoint.
	 * @param body JSON with {@code query} and {@code variables}
	 * @return the response body, which may still carry an {@code errors} array
	 */
	String postGraphQL(String body);

}
