package org.springaicommunity.github.autoupdate;

import java.util.Locale;

/**
 * Additional criterion a pull request has to meet before its branch is updated
 * ({@code PR_FILTER}).
 */
public enum PullRequestFilter {

	/** No additional criterion. */
	ALL("all"),
	/** The pull request carries one of the configured {@code PR_LABELS}. */
	LABELLED("labelled"),
	/** The base branch is protected. */
	PROTECTED("protected"),
	/** Auto-merge is enabled on the pull request. */
	AUTO_MERGE("auto_merge");

	private final String value;

	PullRequestFilter(String value) {
		this.value = value;
	}

	public String value() {
		return value;
	}

	public static PullRequestFilter from(String raw) {
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		for (PullRequestFilter filter : values()) {
			if (filter.value.equals(normalized)) {
				return filter;
			}
		}
		throw new IllegalArgumentException(
				"Unsupported PR filter '" + raw + "': must be 'all', 'labelled', 'protected' or 'auto_merge'");
	}

}
