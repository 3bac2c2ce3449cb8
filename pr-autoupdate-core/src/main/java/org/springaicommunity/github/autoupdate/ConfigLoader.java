package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builds an {@link AutoUpdateConfig} from environment variables.
 *
 * <p>
 * Variables are looked up through {@link EnvironmentSupport} unless another lookup
 * function is given.
 */
public class ConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

	static final String ENV_GITHUB_TOKEN = "GITHUB_TOKEN";

	static final String ENV_DRY_RUN = "DRY_RUN";

	static final String ENV_RETRY_COUNT = "RETRY_COUNT";

	static final String ENV_RETRY_SLEEP = "RETRY_SLEEP";

	static final String ENV_MERGE_MSG = "MERGE_MSG";

	static final String ENV_EXCLUDED_LABELS = "EXCLUDED_LABELS";

	static final String ENV_PR_READY_STATE = "PR_READY_STATE";

	static final String ENV_PR_FILTER = "PR_FILTER";

	static final String ENV_PR_LABELS = "PR_LABELS";

	static final String ENV_USE_GRAPHQL_API = "USE_GRAPHQL_API";

	static final String ENV_MERGE_CONFLICT_ACTION = "MERGE_CONFLICT_ACTION";

	static final String ENV_GITHUB_REF = "GITHUB_REF";

	static final String ENV_GITHUB_REPOSITORY = "GITHUB_REPOSITORY";

	static final String ENV_GITHUB_EVENT_NAME = "GITHUB_EVENT_NAME";

	static final String ENV_GITHUB_EVENT_PATH = "GITHUB_EVENT_PATH";

	static final String ENV_GITHUB_OUTPUT = "GITHUB_OUTPUT";

	static final String ENV_GITHUB_API_URL = "GITHUB_API_URL";

	static final String ENV_GITHUB_GRAPHQL_URL = "GITHUB_GRAPHQL_URL";

	private final Function<String, @Nullable String> environment;

	public ConfigLoader() {
		this(EnvironmentSupport.load()::get);
	}

	public ConfigLoader(Function<String, @Nullable String> environment) {
		this.environment = Objects.requireNonNull(environment, "environment");
	}

	/**
	 * Read the configuration.
	 * @return the loaded configuration
	 * @throws ConfigurationException if a value is present but invalid
	 */
	public AutoUpdateConfig load() {
		AutoUpdateConfig.Builder builder = AutoUpdateConfig.builder()
			.token(valueOrDefault(ENV_GITHUB_TOKEN, ""))
			.dryRun(booleanValue(ENV_DRY_RUN))
			.retryCount((int) nonNegative(ENV_RETRY_COUNT, AutoUpdateConfig.DEFAULT_RETRY_COUNT, Integer.MAX_VALUE))
			.retrySleepMs(nonNegative(ENV_RETRY_SLEEP, AutoUpdateConfig.DEFAULT_RETRY_SLEEP_MS, Long.MAX_VALUE))
			.mergeMessage(value(ENV_MERGE_MSG))
			.excludedLabels(listValue(ENV_EXCLUDED_LABELS))
			.readyState(enumValue(ENV_PR_READY_STATE, ReadyStateFilter.ALL, ReadyStateFilter::from))
			.prFilter(enumValue(ENV_PR_FILTER, PullRequestFilter.ALL, PullRequestFilter::from))
			.prLabels(listValue(ENV_PR_LABELS))
			.useGraphQL(booleanValue(ENV_USE_GRAPHQL_API))
			.mergeConflictAction(
					enumValue(ENV_MERGE_CONFLICT_ACTION, MergeConflictAction.FAIL, MergeConflictAction::from))
			.githubRef(value(ENV_GITHUB_REF))
			.githubRepository(value(ENV_GITHUB_REPOSITORY))
			.eventName(value(ENV_GITHUB_EVENT_NAME))
			.eventPath(value(ENV_GITHUB_EVENT_PATH))
			.outputPath(value(ENV_GITHUB_OUTPUT));

		String apiUrl = value(ENV_GITHUB_API_URL);
		if (apiUrl != null) {
			builder.apiUrl(apiUrl);
		}
		String graphQLUrl = value(ENV_GITHUB_GRAPHQL_URL);
		if (graphQLUrl != null) {
			builder.graphQLUrl(graphQLUrl);
		}
		else if (apiUrl != null) {
			builder.graphQLUrl(apiUrl + "/graphql");
		}

		AutoUpdateConfig config = builder.build();
		logger.debug("Loaded configuration: dryRun={}, retryCount={}, retrySleep={}ms, prFilter={}, readyState={}, "
				+ "graphQL={}, mergeConflictAction={}", config.dryRun(), config.retryCount(), config.retrySleepMs(),
				config.prFilter().value(), config.readyState().value(), config.useGraphQL(),
				config.mergeConflictAction());
		return config;
	}

	private @Nullable String value(String name) {
		String raw = environment.apply(name);
		if (raw == null || raw.isBlank()) {
			return null;
		}
		return raw.trim();
	}

	private String valueOrDefault(String name, String defaultValue) {
		String raw = value(name);
		return raw != null ? raw : defaultValue;
	}

	private boolean booleanValue(String name) {
		return "true".equalsIgnoreCase(value(name));
	}

	private long nonNegative(String name, long defaultValue, long max) {
		String raw = value(name);
		if (raw == null) {
			return defaultValue;
		}
		try {
			long parsed = Long.parseLong(raw);
			if (parsed < 0) {
				throw new ConfigurationException(name + " must be zero or greater: " + raw);
			}
			if (parsed > max) {
				throw new ConfigurationException(name + " must be at most " + max + ": " + raw);
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new ConfigurationException("Invalid " + name + " '" + raw + "': must be an integer", e);
		}
	}

	private List<String> listValue(String name) {
		String raw = value(name);
		if (raw == null) {
			return List.of();
		}
		return Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
	}

	private <E extends Enum<E>> E enumValue(String name, E defaultValue, Function<String, E> parser) {
		String raw = value(name);
		if (raw == null) {
			return defaultValue;
		}
		try {
			return parser.apply(raw);
		}
		catch (IllegalArgumentException e) {
			throw new ConfigurationException(name + ": " + e.getMessage(), e);
		}
	}

}
