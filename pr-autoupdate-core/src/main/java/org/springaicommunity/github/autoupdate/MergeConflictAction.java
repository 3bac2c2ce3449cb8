package org.springaicommunity.github.autoupdate;

import java.util.Locale;

/**
 * What to do when merging the base branch into a pull request branch conflicts
 * ({@code MERGE_CONFLICT_ACTION}).
 */
public enum MergeConflictAction {

	/** Fail the run. */
	FAIL,
	/** Skip the pull request and carry on. */
	IGNORE;

	public static MergeConflictAction from(String raw) {
		return switch (raw.trim().toLowerCase(Locale.ROOT)) {
			case "fail", "" -> FAIL;
			case "ignore" -> IGNORE;
			default -> throw new IllegalArgumentException(
					"Unsupported merge conflict action '" + raw + "': must be 'fail' or 'ignore'");
		};
	}

}
