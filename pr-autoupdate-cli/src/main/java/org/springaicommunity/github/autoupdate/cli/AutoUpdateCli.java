package org.springaicommunity.github.autoupdate.cli;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.autoupdate.AutoUpdateConfig;
import org.springaicommunity.github.autoupdate.AutoUpdaterBuilder;
import org.springaicommunity.github.autoupdate.ConfigLoader;
import org.springaicommunity.github.autoupdate.ConfigurationException;
import org.springaicommunity.github.autoupdate.EventRouter;
import org.springaicommunity.github.autoupdate.GitHubClient;
import org.springaicommunity.github.autoupdate.UpdateRunResult;

import java.nio.file.Path;

/**
 * PR Auto-Update CLI Application
 *
 * Plain Java command-line application that keeps pull request branches up to date with
 * their base branch. Meant to run as a workflow step: the event name and payload come
 * from GITHUB_EVENT_NAME and GITHUB_EVENT_PATH unless given on the command line.
 *
 * <p>
 * {@code mvn package} builds the runnable jar
 * {@code pr-autoupdate-cli/target/pr-autoupdate-cli.jar}.
 *
 * <pre>
 * java -jar pr-autoupdate-cli.jar
 * java -jar pr-autoupdate-cli.jar --dry-run
 * java -jar pr-autoupdate-cli.jar --event-name push --event-path event.json --graphql
 * </pre>
 */
public class AutoUpdateCli {

	private static final Logger logger = LoggerFactory.getLogger(AutoUpdateCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILED = 1;

	static final int EXIT_INVALID = 2;

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != EXIT_OK) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Auto update failed: {}", e.getMessage(), e);
			System.exit(EXIT_FAILED);
		}
	}

	public static int run(String[] args) {
		return run(args, new ConfigLoader(), null);
	}

	static int run(String[] args, ConfigLoader configLoader, @Nullable GitHubClient httpClient) {
		ArgumentParser argumentParser = new ArgumentParser();

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		AutoUpdateConfig config;
		try {
			ParsedArguments parsed = argumentParser.parse(args);
			config = argumentParser.apply(configLoader.load(), parsed);
		}
		catch (IllegalArgumentException | ConfigurationException e) {
			logger.error("{}", e.getMessage());
			logger.error("Run with --help for usage.");
			return EXIT_INVALID;
		}

		logConfiguration(config);

		EventRouter router;
		try {
			router = AutoUpdaterBuilder.create().config(config).httpClient(httpClient).buildEventRouter();
		}
		catch (IllegalStateException e) {
			logger.error("{}", e.getMessage());
			return EXIT_INVALID;
		}

		String eventPath = config.eventPath();
		UpdateRunResult result;
		try {
			result = router.route(config.eventName(), eventPath != null ? Path.of(eventPath) : null);
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			return EXIT_FAILED;
		}

		logger.info("Updated {} pull request(s)", result.updatedCount());
		if (result.failed()) {
			logger.error("At least one pull request could not be updated, see the errors above.");
			return EXIT_FAILED;
		}
		return EXIT_OK;
	}

	private static void logConfiguration(AutoUpdateConfig config) {
		logger.info("Configuration:");
		logger.info("  Event: {}", config.eventName());
		logger.info("  Event payload: {}", config.eventPath());
		logger.info("  Dry run: {}", config.dryRun());
		logger.info("  API: {}", config.useGraphQL() ? "GraphQL" : "REST");
		logger.info("  PR filter: {}", config.prFilter().value());
		logger.info("  PR ready state: {}", config.readyState().value());
		logger.info("  PR labels: {}", config.prLabels());
		logger.info("  Excluded labels: {}", config.excludedLabels());
		logger.info("  Merge conflict action: {}", config.mergeConflictAction());
		logger.info("  Retries: {} ({}ms apart)", config.retryCount(), config.retrySleepMs());
	}

}
