package org.springaicommunity.github.autoupdate;

import java.util.Locale;

/**
 * Restricts updates by the draft status of a pull request ({@code PR_READY_STATE}).
 */
public enum ReadyStateFilter {

	ALL("all"), DRAFT("draft"), READY_FOR_REVIEW("ready_for_review");

	private final String value;

	ReadyStateFilter(String value) {
		this.value = value;
	}

	public String value() {
		return value;
	}

	public static ReadyStateFilter from(String raw) {
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		for (ReadyStateFilter filter : values()) {
			if (filter.value.equals(normalized)) {
				return filter;
			}
		}
		throw new IllegalArgumentException(
				"Unsupported PR ready state '" + raw + "': must be 'all', 'draft' or 'ready_for_review'");
	}

}
