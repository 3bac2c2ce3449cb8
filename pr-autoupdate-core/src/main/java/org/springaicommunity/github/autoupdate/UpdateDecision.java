package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of evaluating a pull request against the update guards.
 *
 * @param skipReason why the pull request is not updated, null when it is eligible
 * @param message human-readable explanation
 */
public record UpdateDecision(@Nullable SkipReason skipReason, String message) {

	private static final UpdateDecision ELIGIBLE = new UpdateDecision(null,
			"All checks pass and PR branch is behind base branch.");

	public static UpdateDecision eligible() {
		return ELIGIBLE;
	}

	public static UpdateDecision skip(SkipReason reason, String message) {
		return new UpdateDecision(reason, message);
	}

	public boolean isEligible() {
		return skipReason == null;
	}

	/**
	 * Reasons a pull request branch is left alone.
	 */
	public enum SkipReason {

		MERGED, NOT_OPEN, FORK_DELETED, COMPARISON_FAILED, UP_TO_DATE, EXCLUDED_LABEL, READY_STATE, NO_CONFIGURED_LABELS,
		NO_LABELS, LABEL_MISMATCH, PROTECTION_LOOKUP_FAILED, NOT_PROTECTED, AUTO_MERGE_DISABLED

	}

}
