package org.springaicommunity.github.autoupdate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.autoupdate.UpdateDecision.SkipReason;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a pull request branch has to be brought up to date with its base.
 *
 * <p>
 * Guards run in a fixed order and the first one that does not pass decides:
 * <ol>
 * <li>not merged</li>
 * <li>open</li>
 * <li>head repository still exists</li>
 * <li>head is behind base (one compare call)</li>
 * <li>no excluded label</li>
 * <li>ready-state filter</li>
 * <li>PR filter (labels, base branch protection, auto-merge)</li>
 * </ol>
 * A failing compare or branch lookup skips the pull request; it never aborts the run.
 */
public class UpdateDecisionEngine {

	private static final Logger logger = LoggerFactory.getLogger(UpdateDecisionEngine.class);

	private final RestService restService;

	private final AutoUpdateConfig config;

	private final List<Guard> guards;

	public UpdateDecisionEngine(RestService restService, AutoUpdateConfig config) {
		this.restService = restService;
		this.config = config;
		this.guards = List.of(this::checkNotMerged, this::checkOpen, this::checkHeadRepository,
				this::checkBehindBase, this::checkExcludedLabels, this::checkReadyState, this::checkPullRequestFilter);
	}

	/**
	 * Whether the pull request branch should be updated.
	 * @param pull the pull request
	 * @return true when every guard passes
	 */
	public boolean needsUpdate(PullRequestSummary pull) {
		return evaluate(pull).isEligible();
	}

	/**
	 * Run the guards and report the first one that did not pass.
	 * @param pull the pull request
	 * @return the decision with its reason
	 */
	public UpdateDecision evaluate(PullRequestSummary pull) {
		for (Guard guard : guards) {
			UpdateDecision decision = guard.check(pull);
			if (!decision.isEligible()) {
				logger.info("Skipping pull request #{}: {}", pull.number(), decision.message());
				return decision;
			}
		}
		UpdateDecision eligible = UpdateDecision.eligible();
		logger.info("Pull request #{}: {}", pull.number(), eligible.message());
		return eligible;
	}

	private UpdateDecision checkNotMerged(PullRequestSummary pull) {
		if (pull.merged()) {
			return UpdateDecision.skip(SkipReason.MERGED, "already merged.");
		}
		return UpdateDecision.eligible();
	}

	private UpdateDecision checkOpen(PullRequestSummary pull) {
		if (!pull.isOpen()) {
			return UpdateDecision.skip(SkipReason.NOT_OPEN,
					"no longer open (current state: " + pull.state().name().toLowerCase(Locale.ROOT) + ").");
		}
		return UpdateDecision.eligible();
	}

	private UpdateDecision checkHeadRepository(PullRequestSummary pull) {
		if (pull.head().repo() == null) {
			return UpdateDecision.skip(SkipReason.FORK_DELETED, "fork appears to have been deleted.");
		}
		return UpdateDecision.eligible();
	}

	private UpdateDecision checkBehindBase(PullRequestSummary pull) {
		PullRequestSummary.Repository repository = pull.head().repo();
		if (repository == null) {
			return UpdateDecision.skip(SkipReason.FORK_DELETED, "fork appears to have been deleted.");
		}

		// Reversed on purpose: {head}...{base} tells how far head is behind base, i.e.
		// what merging base into head would bring in.
		String basehead = pull.head().label() + "..." + pull.base().label();
		ComparisonResult comparison;
		try {
			comparison = restService.compareCommits(repository.ownerLogin(), repository.name(), basehead);
		}
		catch (RuntimeException e) {
			logger.error("Caught error trying to compare base with head for pull request #{}: {}", pull.number(),
					e.getMessage());
			return UpdateDecision.skip(SkipReason.COMPARISON_FAILED, "could not compare base with head.");
		}

		if (comparison.behindBy() == 0) {
			return UpdateDecision.skip(SkipReason.UP_TO_DATE, "up-to-date with base branch.");
		}
		logger.debug("Pull request #{} is {} commit(s) behind '{}'", pull.number(), comparison.behindBy(),
				pull.base().ref());
		return UpdateDecision.eligible();
	}

	private UpdateDecision checkExcludedLabels(PullRequestSummary pull) {
		for (String excluded : config.excludedLabels()) {
			if (pull.labels().contains(excluded)) {
				return UpdateDecision.skip(SkipReason.EXCLUDED_LABEL, "has excluded label '" + excluded + "'.");
			}
		}
		return UpdateDecision.eligible();
	}

	private UpdateDecision checkReadyState(PullRequestSummary pull) {
		ReadyStateFilter readyState = config.readyState();
		if (readyState == ReadyStateFilter.DRAFT && !pull.draft()) {
			return UpdateDecision.skip(SkipReason.READY_STATE, "PR_READY_STATE=draft and pull request is not draft.");
		}
		if (readyState == ReadyStateFilter.READY_FOR_REVIEW && pull.draft()) {
			return UpdateDecision.skip(SkipReason.READY_STATE,
					"PR_READY_STATE=ready_for_review and pull request is draft.");
		}
		return UpdateDecision.eligible();
	}

	private UpdateDecision checkPullRequestFilter(PullRequestSummary pull) {
		logger.debug("PR_FILTER={}, checking if pull request #{} needs to be updated.", config.prFilter().value(),
				pull.number());
		return switch (config.prFilter()) {
			case ALL -> UpdateDecision.eligible();
			case LABELLED -> checkLabelled(pull);
			case PROTECTED -> checkProtected(pull);
			case AUTO_MERGE -> checkAutoMerge(pull);
		};
	}

	private UpdateDecision checkLabelled(PullRequestSummary pull) {
		List<String> allowed = config.prLabels();
		if (allowed.isEmpty()) {
			logger.warn("PR_FILTER=labelled but PR_LABELS is empty or not defined.");
			return UpdateDecision.skip(SkipReason.NO_CONFIGURED_LABELS, "no labels were defined in PR_LABELS.");
		}
		Set<String> labels = pull.labels();
		if (labels.isEmpty()) {
			return UpdateDecision.skip(SkipReason.NO_LABELS, "it has no labels.");
		}
		for (String label : allowed) {
			if (labels.contains(label)) {
				logger.info("Pull request #{} has label '{}' and PR branch is behind base branch.", pull.number(),
						label);
				return UpdateDecision.eligible();
			}
		}
		return UpdateDecision.skip(SkipReason.LABEL_MISMATCH,
				"does not match any of the defined labels (" + String.join(", ", allowed) + ").");
	}

	private UpdateDecision checkProtected(PullRequestSummary pull) {
		PullRequestSummary.Repository repository = pull.head().repo();
		if (repository == null) {
			return UpdateDecision.skip(SkipReason.FORK_DELETED, "fork appears to have been deleted.");
		}
		BranchInfo branch;
		try {
			branch = restService.getBranch(repository.ownerLogin(), repository.name(), pull.base().ref());
		}
		catch (RuntimeException e) {
			logger.error("Caught error looking up branch '{}' for pull request #{}: {}", pull.base().ref(),
					pull.number(), e.getMessage());
			return UpdateDecision.skip(SkipReason.PROTECTION_LOOKUP_FAILED,
					"could not determine whether the base branch is protected.");
		}
		if (!branch.protectedBranch()) {
			return UpdateDecision.skip(SkipReason.NOT_PROTECTED, "not against a protected branch.");
		}
		return UpdateDecision.eligible();
	}

	private UpdateDecision checkAutoMerge(PullRequestSummary pull) {
		if (pull.autoMerge() == null) {
			return UpdateDecision.skip(SkipReason.AUTO_MERGE_DISABLED, "auto_merge is not enabled.");
		}
		return UpdateDecision.eligible();
	}

	@FunctionalInterface
	private interface Guard {

		UpdateDecision check(PullRequestSummary pull);

	}

}
