package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Keeps the branches of open pull requests up to date with their base branch.
 *
 * <p>
 * Pull requests are enumerated, evaluated and merged one at a time in listing order. A
 * fatal merge outcome on one pull request is logged and recorded, and the run continues
 * with the next one; {@link #hasFailed()} reports whether that happened.
 *
 * <p>
 * Instances are normally obtained from {@link AutoUpdaterBuilder}.
 */
public class AutoUpdater {

	private static final Logger logger = LoggerFactory.getLogger(AutoUpdater.class);

	private final AutoUpdateConfig config;

	private final PullRequestEnumerator enumerator;

	private final UpdateDecisionEngine decisionEngine;

	private final BranchMerger merger;

	private int failures;

	public AutoUpdater(AutoUpdateConfig config, PullRequestEnumerator enumerator, UpdateDecisionEngine decisionEngine,
			BranchMerger merger) {
		this.config = config;
		this.enumerator = enumerator;
		this.decisionEngine = decisionEngine;
		this.merger = merger;
	}

	/**
	 * Update every eligible open pull request that targets the branch named by
	 * {@code ref}.
	 * @param ref full ref of the base branch ({@code refs/heads/...})
	 * @param repoName repository name
	 * @param ownerLogin repository owner login
	 * @param ownerName repository owner name, preferred over the login when present
	 * @return the number of updated pull requests and whether the run failed
	 */
	public UpdateRunResult updatePullRequests(String ref, String repoName, @Nullable String ownerLogin,
			@Nullable String ownerName) {
		String owner = AbstractPullRequestEnumerator.resolveOwner(ownerLogin, ownerName);
		if (owner == null) {
			logger.error("No repository owner given for repository '{}', nothing to update.", repoName);
			return UpdateRunResult.nothing();
		}

		int failuresBefore = failures;
		int updated = 0;
		try (Stream<PullRequestSummary> pulls = enumerator.openPullRequests(ref, repoName, ownerLogin, ownerName)) {
			Iterator<PullRequestSummary> iterator = pulls.iterator();
			while (iterator.hasNext()) {
				if (update(owner, iterator.next())) {
					updated++;
				}
			}
		}

		String baseBranch = AbstractPullRequestEnumerator.branchName(ref);
		logger.info("Auto update complete, {} pull request(s) that point to base branch '{}' were updated.", updated,
				baseBranch != null ? baseBranch : ref);

		return new UpdateRunResult(updated, failures > failuresBefore);
	}

	/**
	 * Evaluate a single pull request and update its branch when it is eligible.
	 * @param sourceEventOwner owner of the repository the triggering event came from
	 * @param pull the pull request
	 * @return true if the branch was updated (or would have been, in dry-run mode)
	 */
	public boolean update(String sourceEventOwner, PullRequestSummary pull) {
		logger.info("Evaluating pull request #{}...", pull.number());

		if (!decisionEngine.needsUpdate(pull)) {
			return false;
		}

		logger.info("Updating branch '{}' on pull request #{} with changes from ref '{}'.", pull.head().ref(),
				pull.number(), pull.base().ref());

		MergeRequest request;
		try {
			request = MergeRequest.forPullRequest(pull, config.mergeMessage());
		}
		catch (IllegalArgumentException e) {
			logger.error("Could not determine repository for pull request #{}, skipping and continuing with "
					+ "remaining pull requests", pull.number());
			return false;
		}

		try {
			return merger.merge(sourceEventOwner, pull.number(), request) == MergeState.SUCCEEDED;
		}
		catch (BranchUpdateException e) {
			logger.error("Caught error running merge for pull request #{} ({}), skipping and continuing with "
					+ "remaining pull requests: {}", pull.number(), e.getState(), e.getMessage());
			failures++;
			return false;
		}
	}

	/**
	 * Whether any pull request handled by this updater ended in a fatal merge state.
	 */
	public boolean hasFailed() {
		return failures > 0;
	}

}
