package org.springaicommunity.github.autoupdate;

/**
 * States of a merge attempt sequence. {@link #ATTEMPTING} is the only non-terminal state.
 */
public enum MergeState {

	/** A merge call is about to be issued. */
	ATTEMPTING(false),
	/** The branch was updated or was already up to date. */
	SUCCEEDED(false),
	/** A merge conflict occurred and conflicts are configured to be ignored. */
	CONFLICT_SKIPPED(false),
	/** The token cannot write to the fork holding the head branch. */
	AUTH_DENIED(false),
	/** A merge conflict occurred and conflicts are configured to fail the run. */
	CONFLICT_FATAL(true),
	/** Every retry failed. */
	RETRY_EXHAUSTED(true);

	private final boolean fatal;

	MergeState(boolean fatal) {
		this.fatal = fatal;
	}

	public boolean isTerminal() {
		return this != ATTEMPTING;
	}

	public boolean isFatal() {
		return fatal;
	}

}
