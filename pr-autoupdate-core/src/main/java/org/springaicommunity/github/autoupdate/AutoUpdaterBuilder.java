package org.springaicommunity.github.autoupdate;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Wires the auto-updater components together.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Configuration from the process environment, then .env files
 * EventRouter router = AutoUpdaterBuilder.create()
 *     .config(new ConfigLoader().load())
 *     .buildEventRouter();
 * UpdateRunResult result = router.route("push", Path.of(System.getenv("GITHUB_EVENT_PATH")));
 *
 * // For testing with mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * AutoUpdater updater = AutoUpdaterBuilder.create()
 *     .config(AutoUpdateConfig.builder().build())
 *     .httpClient(mockClient)
 *     .outputWriter((name, value) -> { })
 *     .build();
 * }
 * </pre>
 */
public class AutoUpdaterBuilder {

	private static final Logger logger = LoggerFactory.getLogger(AutoUpdaterBuilder.class);

	private AutoUpdateConfig config;

	private ObjectMapper objectMapper;

	private GitHubClient httpClient;

	private OutputWriter outputWriter;

	private AutoUpdaterBuilder() {
		this.config = AutoUpdateConfig.builder().build();
	}

	/**
	 * Create a new builder instance.
	 * @return new AutoUpdaterBuilder
	 */
	public static AutoUpdaterBuilder create() {
		return new AutoUpdaterBuilder();
	}

	/**
	 * Set the configuration.
	 * @param config configuration (null to use defaults)
	 * @return this builder
	 */
	public AutoUpdaterBuilder config(@Nullable AutoUpdateConfig config) {
		if (config != null) {
			this.config = config;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public AutoUpdaterBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks.
	 *
	 * <p>
	 * When a custom client is provided, the token is not required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public AutoUpdaterBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set where step outputs go.
	 * @param outputWriter custom OutputWriter (null to write to the configured output
	 * file)
	 * @return this builder
	 */
	public AutoUpdaterBuilder outputWriter(@Nullable OutputWriter outputWriter) {
		this.outputWriter = outputWriter;
		return this;
	}

	/**
	 * Build an AutoUpdater using the GraphQL or REST enumerator as configured.
	 * @return configured AutoUpdater
	 */
	public AutoUpdater build() {
		validateToken();
		return buildComponents().updater;
	}

	/**
	 * Build an EventRouter around a new AutoUpdater.
	 * @return configured EventRouter
	 */
	public EventRouter buildEventRouter() {
		validateToken();
		Components components = buildComponents();
		return new EventRouter(components.updater, config, components.objectMapper);
	}

	private void validateToken() {
		// Skip token validation if a custom httpClient is provided
		if (httpClient != null) {
			return;
		}
		if (config.token().isBlank()) {
			throw new IllegalStateException("GitHub token is required. Set GITHUB_TOKEN or pass a configuration "
					+ "with a token.");
		}
	}

	private Components buildComponents() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		GitHubClient client = this.httpClient != null ? this.httpClient
				: new GitHubHttpClient(config.token(), config.apiUrl(), config.graphQLUrl());
		String outputPath = config.outputPath();
		OutputWriter output = this.outputWriter != null ? this.outputWriter
				: new GitHubOutputWriter(outputPath != null ? Path.of(outputPath) : null);

		if (config.useGraphQL() && config.prFilter() == PullRequestFilter.AUTO_MERGE) {
			logger.warn("PR_FILTER=auto_merge cannot be evaluated with USE_GRAPHQL_API=true: the GraphQL listing "
					+ "does not report auto-merge, so every pull request will be skipped.");
		}

		GitHubRestService restService = new GitHubRestService(client, mapper);
		PullRequestEnumerator enumerator = config.useGraphQL()
				? new GraphQLPullRequestEnumerator(new GitHubGraphQLService(client, mapper))
				: new RestPullRequestEnumerator(restService);
		UpdateDecisionEngine decisionEngine = new UpdateDecisionEngine(restService, config);
		BranchMerger merger = BranchMerger.builder()
			.restService(restService)
			.outputWriter(output)
			.config(config)
			.build();

		return new Components(mapper, new AutoUpdater(config, enumerator, decisionEngine, merger));
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(ObjectMapper objectMapper, AutoUpdater updater) {
	}

}
