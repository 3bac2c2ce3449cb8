package org.springaicommunity.github.autoupdate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges a pull request's base branch into its head branch, retrying failed attempts.
 *
 * <p>
 * Each call runs the state machine described by {@link MergeState}, starting in
 * {@link MergeState#ATTEMPTING}:
 * <ul>
 * <li>201 or 204 from the merges endpoint: {@link MergeState#SUCCEEDED}</li>
 * <li>403 against a repository not owned by the event's owner:
 * {@link MergeState#AUTH_DENIED}, no retry</li>
 * <li>merge conflict: {@link MergeState#CONFLICT_SKIPPED} or
 * {@link MergeState#CONFLICT_FATAL} depending on the {@link MergeConflictAction}, no
 * retry</li>
 * <li>anything else: back to {@link MergeState#ATTEMPTING} after the retry delay, or
 * {@link MergeState#RETRY_EXHAUSTED} once the retries are used up</li>
 * </ul>
 * The {@code conflicted} output is written once, when a terminal state is reached. Fatal
 * states are reported by throwing {@link BranchUpdateException}.
 *
 * <pre>
 * {@code
 * BranchMerger merger = BranchMerger.builder()
 *     .restService(restService)
 *     .outputWriter(outputWriter)
 *     .retryCount(5)
 *     .retrySleepMs(300)
 *     .build();
 * }
 * </pre>
 */
public final class BranchMerger {

	private static final Logger logger = LoggerFactory.getLogger(BranchMerger.class);

	private static final String MERGE_CONFLICT_MESSAGE = "Merge conflict";

	private final RestService restService;

	private final OutputWriter outputWriter;

	private final int retryCount;

	private final long retrySleepMs;

	private final MergeConflictAction conflictAction;

	private final boolean dryRun;

	private final Sleeper sleeper;

	private BranchMerger(Builder builder) {
		this.restService = builder.restService;
		this.outputWriter = builder.outputWriter;
		this.retryCount = builder.retryCount;
		this.retrySleepMs = builder.retrySleepMs;
		this.conflictAction = builder.conflictAction;
		this.dryRun = builder.dryRun;
		this.sleeper = builder.sleeper;
	}

	/**
	 * Create a new builder for BranchMerger.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Bring the head branch described by {@code request} up to date.
	 * @param sourceEventOwner owner of the repository the triggering event came from
	 * @param prNumber pull request number, for logging
	 * @param request the merge to perform
	 * @return the non-fatal terminal state reached
	 * @throws BranchUpdateException when the terminal state is fatal
	 */
	public MergeState merge(String sourceEventOwner, int prNumber, MergeRequest request) {
		if (dryRun) {
			logger.warn("Would have merged ref '{}' into ref '{}' on pull request #{} but DRY_RUN was enabled.",
					request.head(), request.base(), prNumber);
			return MergeState.SUCCEEDED;
		}

		int retries = 0;
		while (true) {
			logger.info("Attempting branch update for pull request #{}...", prNumber);
			MergeResult result;
			try {
				result = restService.merge(request);
			}
			catch (RuntimeException failure) {
				MergeState next = classify(failure, sourceEventOwner, request, retries);
				if (!next.isTerminal()) {
					logger.warn("Branch update of pull request #{} failed: {}. Will retry in {}ms, retry #{} of {}.",
							prNumber, failure.getMessage(), retrySleepMs, retries + 1, retryCount);
					retries++;
					pause(prNumber, failure);
					continue;
				}
				return terminate(next, prNumber, retries, failure);
			}

			if (result.alreadyUpToDate()) {
				logger.info("Branch update not required for pull request #{}, branch is already up-to-date.",
						prNumber);
			}
			else {
				logger.info("Branch update successful for pull request #{}, new branch HEAD: {}.", prNumber,
						result.sha());
			}
			return finish(MergeState.SUCCEEDED, false);
		}
	}

	private MergeState terminate(MergeState state, int prNumber, int retries, RuntimeException failure) {
		boolean conflicted = state == MergeState.CONFLICT_SKIPPED || state == MergeState.CONFLICT_FATAL;
		String message;
		switch (state) {
			case AUTH_DENIED -> {
				message = "Could not update pull request #" + prNumber + " due to an authorisation error";
				logger.error("{}. This is probably because this pull request is from a fork and the current token "
						+ "does not have write access to the forked repository. Error was: {}", message,
						failure.getMessage());
			}
			case CONFLICT_SKIPPED -> {
				message = "Merge conflict detected on pull request #" + prNumber;
				logger.info("{}, skipping update.", message);
			}
			case CONFLICT_FATAL -> {
				message = "Merge conflict updating pull request #" + prNumber;
				logger.error("Merge conflict error trying to update branch of pull request #{}", prNumber);
			}
			default -> {
				message = "Failed to update pull request #" + prNumber + " after " + (retries + 1) + " attempt(s): "
						+ failure.getMessage();
				logger.error("Caught error trying to update branch of pull request #{}: {}", prNumber,
						failure.getMessage());
			}
		}
		finish(state, conflicted);
		if (state.isFatal()) {
			throw new BranchUpdateException(state, prNumber, message, failure);
		}
		return state;
	}

	private MergeState classify(RuntimeException failure, String sourceEventOwner, MergeRequest request,
			int retries) {
		if (failure instanceof GitHubHttpClient.GitHubApiException apiException) {
			// A 403 on somebody else's fork means the token cannot push there
			if (apiException.getStatusCode() == 403 && !sourceEventOwner.equals(request.owner())) {
				return MergeState.AUTH_DENIED;
			}
			if (isMergeConflict(apiException)) {
				return conflictAction == MergeConflictAction.IGNORE ? MergeState.CONFLICT_SKIPPED
						: MergeState.CONFLICT_FATAL;
			}
		}
		return retries < retryCount ? MergeState.ATTEMPTING : MergeState.RETRY_EXHAUSTED;
	}

	private static boolean isMergeConflict(GitHubHttpClient.GitHubApiException e) {
		String body = e.getResponseBody();
		return e.getStatusCode() == 409 && body != null && body.contains(MERGE_CONFLICT_MESSAGE);
	}

	private MergeState finish(MergeState state, boolean conflicted) {
		outputWriter.setOutput(OutputWriter.CONFLICTED, conflicted);
		return state;
	}

	private void pause(int prNumber, RuntimeException failure) {
		try {
			sleeper.sleep(retrySleepMs);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new BranchUpdateException(MergeState.RETRY_EXHAUSTED, prNumber,
					"Interrupted while waiting to retry pull request #" + prNumber, failure);
		}
	}

	/**
	 * Waits between attempts. Replaced in tests to avoid real delays.
	 */
	@FunctionalInterface
	interface Sleeper {

		void sleep(long millis) throws InterruptedException;

	}

	/**
	 * Builder for {@link BranchMerger}.
	 *
	 * <p>
	 * Defaults: 5 retries, 300ms between attempts, fail on merge conflicts, no dry run.
	 */
	public static final class Builder {

		private RestService restService;

		private OutputWriter outputWriter;

		private int retryCount = AutoUpdateConfig.DEFAULT_RETRY_COUNT;

		private long retrySleepMs = AutoUpdateConfig.DEFAULT_RETRY_SLEEP_MS;

		private MergeConflictAction conflictAction = MergeConflictAction.FAIL;

		private boolean dryRun = false;

		private Sleeper sleeper = Thread::sleep;

		private Builder() {
		}

		public Builder restService(RestService restService) {
			this.restService = restService;
			return this;
		}

		public Builder outputWriter(OutputWriter outputWriter) {
			this.outputWriter = outputWriter;
			return this;
		}

		/**
		 * Set the number of retries after the first failed attempt.
		 * @param retryCount retries (default: 5)
		 * @return this builder
		 */
		public Builder retryCount(int retryCount) {
			this.retryCount = retryCount;
			return this;
		}

		/**
		 * Set the delay between attempts.
		 * @param retrySleepMs delay in milliseconds (default: 300)
		 * @return this builder
		 */
		public Builder retrySleepMs(long retrySleepMs) {
			this.retrySleepMs = retrySleepMs;
			return this;
		}

		public Builder conflictAction(MergeConflictAction conflictAction) {
			this.conflictAction = conflictAction;
			return this;
		}

		public Builder dryRun(boolean dryRun) {
			this.dryRun = dryRun;
			return this;
		}

		/**
		 * Apply retry, conflict and dry-run settings from the configuration.
		 * @param config the configuration
		 * @return this builder
		 */
		public Builder config(AutoUpdateConfig config) {
			return retryCount(config.retryCount()).retrySleepMs(config.retrySleepMs())
				.conflictAction(config.mergeConflictAction())
				.dryRun(config.dryRun());
		}

		Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Build the BranchMerger.
		 * @return configured BranchMerger
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public BranchMerger build() {
			if (restService == null) {
				throw new IllegalStateException("A RestService is required. Call restService() first.");
			}
			if (outputWriter == null) {
				throw new IllegalStateException("An OutputWriter is required. Call outputWriter() first.");
			}
			if (retryCount < 0) {
				throw new IllegalStateException("retryCount must be non-negative");
			}
			if (retrySleepMs < 0) {
				throw new IllegalStateException("retrySleepMs must be non-negative");
			}
			return new BranchMerger(this);
		}

	}

}
