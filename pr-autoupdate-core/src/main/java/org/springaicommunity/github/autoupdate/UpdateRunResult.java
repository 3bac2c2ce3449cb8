package org.springaicommunity.github.autoupdate;

/**
 * Outcome of handling one event.
 *
 * @param updatedCount number of pull request branches that were updated
 * @param failed whether any pull request ended in a fatal merge state
 */
public record UpdateRunResult(int updatedCount, boolean failed) {

	private static final UpdateRunResult NOTHING = new UpdateRunResult(0, false);

	/**
	 * Result of a run that did not look at any pull request.
	 */
	public static UpdateRunResult nothing() {
		return NOTHING;
	}

}
