package org.springaicommunity.github.autoupdate;

/**
 * Thrown when updating a pull request branch ends in a fatal state: an unignored merge
 * conflict, or a failure that persisted through every retry.
 */
public class BranchUpdateException extends RuntimeException {

	private final MergeState state;

	private final int pullRequestNumber;

	public BranchUpdateException(MergeState state, int pullRequestNumber, String message, Throwable cause) {
		super(message, cause);
		this.state = state;
		this.pullRequestNumber = pullRequestNumber;
	}

	public MergeState getState() {
		return state;
	}

	public int getPullRequestNumber() {
		return pullRequestNumber;
	}

}
