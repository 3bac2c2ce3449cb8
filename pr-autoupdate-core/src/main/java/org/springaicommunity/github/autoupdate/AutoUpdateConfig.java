package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Immutable runtime configuration, constructed once per process by {@link ConfigLoader}
 * and passed to every component that needs it.
 *
 * @param token GitHub token used for all API calls
 * @param dryRun log intended merges without performing them
 * @param retryCount number of retries after a failed merge attempt (non-negative)
 * @param retrySleepMs delay between merge attempts in milliseconds (non-negative)
 * @param mergeMessage commit message for merge commits, null for the GitHub default
 * @param excludedLabels pull requests carrying any of these labels are never updated
 * @param readyState draft status filter
 * @param prFilter additional eligibility criterion
 * @param prLabels allow-list used when {@code prFilter} is {@link PullRequestFilter#LABELLED}
 * @param useGraphQL enumerate pull requests through the GraphQL API
 * @param mergeConflictAction behavior on merge conflicts
 * @param githubRef ref the workflow runs on (used for scheduled runs)
 * @param githubRepository {@code owner/name} of the repository (used for scheduled runs)
 * @param eventName name of the triggering event
 * @param eventPath path of the JSON file holding the event payload
 * @param outputPath file that step outputs are appended to, null to only log them
 * @param apiUrl base URL of the REST API
 * @param graphQLUrl GraphQL endpoint
 */
public record AutoUpdateConfig(String token, boolean dryRun, int retryCount, long retrySleepMs,
		@Nullable String mergeMessage, List<String> excludedLabels, ReadyStateFilter readyState,
		PullRequestFilter prFilter, List<String> prLabels, boolean useGraphQL, MergeConflictAction mergeConflictAction,
		@Nullable String githubRef, @Nullable String githubRepository, @Nullable String eventName,
		@Nullable String eventPath, @Nullable String outputPath, String apiUrl, String graphQLUrl) {

	static final int DEFAULT_RETRY_COUNT = 5;

	static final long DEFAULT_RETRY_SLEEP_MS = 300;

	public AutoUpdateConfig {
		if (retryCount < 0) {
			throw new IllegalArgumentException("retryCount must be non-negative: " + retryCount);
		}
		if (retrySleepMs < 0) {
			throw new IllegalArgumentException("retrySleepMs must be non-negative: " + retrySleepMs);
		}
		excludedLabels = List.copyOf(excludedLabels);
		prLabels = List.copyOf(prLabels);
		if (mergeMessage != null && mergeMessage.isEmpty()) {
			mergeMessage = null;
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Create a builder pre-populated with this configuration's values.
	 * @return new Builder instance
	 */
	public Builder toBuilder() {
		return new Builder().token(token)
			.dryRun(dryRun)
			.retryCount(retryCount)
			.retrySleepMs(retrySleepMs)
			.mergeMessage(mergeMessage)
			.excludedLabels(excludedLabels)
			.readyState(readyState)
			.prFilter(prFilter)
			.prLabels(prLabels)
			.useGraphQL(useGraphQL)
			.mergeConflictAction(mergeConflictAction)
			.githubRef(githubRef)
			.githubRepository(githubRepository)
			.eventName(eventName)
			.eventPath(eventPath)
			.outputPath(outputPath)
			.apiUrl(apiUrl)
			.graphQLUrl(graphQLUrl);
	}

	/**
	 * Builder for {@link AutoUpdateConfig}.
	 *
	 * <p>
	 * Defaults: 5 retries, 300ms between attempts, no filters, REST enumeration, fail on
	 * merge conflicts, public github.com endpoints.
	 */
	public static final class Builder {

		private String token = "";

		private boolean dryRun = false;

		private int retryCount = DEFAULT_RETRY_COUNT;

		private long retrySleepMs = DEFAULT_RETRY_SLEEP_MS;

		private @Nullable String mergeMessage;

		private List<String> excludedLabels = List.of();

		private ReadyStateFilter readyState = ReadyStateFilter.ALL;

		private PullRequestFilter prFilter = PullRequestFilter.ALL;

		private List<String> prLabels = List.of();

		private boolean useGraphQL = false;

		private MergeConflictAction mergeConflictAction = MergeConflictAction.FAIL;

		private @Nullable String githubRef;

		private @Nullable String githubRepository;

		private @Nullable String eventName;

		private @Nullable String eventPath;

		private @Nullable String outputPath;

		private String apiUrl = GitHubHttpClient.DEFAULT_API_BASE;

		private String graphQLUrl = GitHubHttpClient.DEFAULT_API_BASE + "/graphql";

		private Builder() {
		}

		public Builder token(String token) {
			this.token = token;
			return this;
		}

		public Builder dryRun(boolean dryRun) {
			this.dryRun = dryRun;
			return this;
		}

		public Builder retryCount(int retryCount) {
			this.retryCount = retryCount;
			return this;
		}

		public Builder retrySleepMs(long retrySleepMs) {
			this.retrySleepMs = retrySleepMs;
			return this;
		}

		public Builder mergeMessage(@Nullable String mergeMessage) {
			this.mergeMessage = mergeMessage;
			return this;
		}

		public Builder excludedLabels(List<String> excludedLabels) {
			this.excludedLabels = excludedLabels;
			return this;
		}

		public Builder readyState(ReadyStateFilter readyState) {
			this.readyState = readyState;
			return this;
		}

		public Builder prFilter(PullRequestFilter prFilter) {
			this.prFilter = prFilter;
			return this;
		}

		public Builder prLabels(List<String> prLabels) {
			this.prLabels = prLabels;
			return this;
		}

		public Builder useGraphQL(boolean useGraphQL) {
			this.useGraphQL = useGraphQL;
			return this;
		}

		public Builder mergeConflictAction(MergeConflictAction mergeConflictAction) {
			this.mergeConflictAction = mergeConflictAction;
			return this;
		}

		public Builder githubRef(@Nullable String githubRef) {
			this.githubRef = githubRef;
			return this;
		}

		public Builder githubRepository(@Nullable String githubRepository) {
			this.githubRepository = githubRepository;
			return this;
		}

		public Builder eventName(@Nullable String eventName) {
			this.eventName = eventName;
			return this;
		}

		public Builder eventPath(@Nullable String eventPath) {
			this.eventPath = eventPath;
			return this;
		}

		public Builder outputPath(@Nullable String outputPath) {
			this.outputPath = outputPath;
			return this;
		}

		public Builder apiUrl(String apiUrl) {
			this.apiUrl = apiUrl;
			return this;
		}

		public Builder graphQLUrl(String graphQLUrl) {
			this.graphQLUrl = graphQLUrl;
			return this;
		}

		public AutoUpdateConfig build() {
			return new AutoUpdateConfig(token, dryRun, retryCount, retrySleepMs, mergeMessage, excludedLabels,
					readyState, prFilter, prLabels, useGraphQL, mergeConflictAction, githubRef, githubRepository,
					eventName, eventPath, outputPath, apiUrl, graphQLUrl);
		}

	}

}
