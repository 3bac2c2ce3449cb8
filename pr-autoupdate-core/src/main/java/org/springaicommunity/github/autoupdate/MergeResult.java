package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;

/**
 * Successful outcome of a merge call.
 *
 * @param statusCode 201 when a merge commit was created, 204 when nothing had to be merged
 * @param sha the new branch head, null when nothing was merged
 */
public record MergeResult(int statusCode, @Nullable String sha) {

	public boolean alreadyUpToDate() {
		return statusCode == 204;
	}

}
