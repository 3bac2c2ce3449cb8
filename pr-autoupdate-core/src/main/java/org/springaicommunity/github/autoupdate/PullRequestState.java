package org.springaicommunity.github.autoupdate;

import java.util.Locale;

/**
 * State of a pull request as reported by either GitHub API.
 */
public enum PullRequestState {

	OPEN, CLOSED;

	/**
	 * Parse a state from the REST ({@code "open"}) or GraphQL ({@code "OPEN"},
	 * {@code "MERGED"}) representation. Anything that is not open is closed.
	 * @param value the raw state value
	 * @return the parsed state
	 */
	public static PullRequestState fromApi(String value) {
		return "open".equals(value.toLowerCase(Locale.ROOT)) ? OPEN : CLOSED;
	}

}
