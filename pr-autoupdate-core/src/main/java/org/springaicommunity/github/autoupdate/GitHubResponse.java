package org.springaicommunity.github.autoupdate;

/**
 * A successful (2xx) response from the GitHub REST API.
 *
 * @param statusCode the HTTP status code
 * @param body the response body, empty for 204 No Content
 */
public record GitHubResponse(int statusCode, String body) {

	public boolean hasBody() {
		return !body.isBlank();
	}

}
