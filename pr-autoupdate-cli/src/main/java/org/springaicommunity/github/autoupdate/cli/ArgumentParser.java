package org.springaicommunity.github.autoupdate.cli;

import org.springaicommunity.github.autoupdate.AutoUpdateConfig;

/**
 * Command-line argument parser for the auto-updater. Options override the values read
 * from the environment.
 */
public class ArgumentParser {

	/**
	 * Parse command-line arguments.
	 * @param args Command-line arguments
	 * @return Parsed arguments
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedArguments parse(String[] args) {
		ParsedArguments parsed = new ParsedArguments();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-h", "--help":
					// answered by isHelpRequested before parsing
					break;

				case "-e", "--event-name":
					parsed.eventName = getRequiredValue(args, i, "event-name");
					i++; // Skip next argument since we consumed it
					break;

				case "-p", "--event-path":
					parsed.eventPath = getRequiredValue(args, i, "event-path");
					i++; // Skip next argument since we consumed it
					break;

				case "-d", "--dry-run":
					parsed.dryRun = true;
					break;

				case "--graphql":
					parsed.useGraphQL = true;
					break;

				default:
					throw new IllegalArgumentException("Unknown option: " + arg);
			}
		}

		return parsed;
	}

	/**
	 * Check if help was requested without fully parsing.
	 * @param args Command-line arguments
	 * @return true if help flag is present
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Apply parsed options on top of a configuration.
	 * @param config configuration read from the environment
	 * @param parsed parsed options
	 * @return the combined configuration
	 */
	public AutoUpdateConfig apply(AutoUpdateConfig config, ParsedArguments parsed) {
		AutoUpdateConfig.Builder builder = config.toBuilder();
		if (parsed.eventName != null) {
			builder.eventName(parsed.eventName);
		}
		if (parsed.eventPath != null) {
			builder.eventPath(parsed.eventPath);
		}
		if (parsed.dryRun) {
			builder.dryRun(true);
		}
		if (parsed.useGraphQL) {
			builder.useGraphQL(true);
		}
		return builder.build();
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: java -jar pr-autoupdate-cli.jar [OPTIONS]\n");
		help.append("\n");
		help.append("Merge the base branch into open pull request branches that have fallen behind.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help               Show this help message\n");
		help.append("    -e, --event-name NAME    Triggering event (default: GITHUB_EVENT_NAME)\n");
		help.append("    -p, --event-path FILE    Event payload JSON (default: GITHUB_EVENT_PATH)\n");
		help.append("    -d, --dry-run            Log the merges that would be made without making them\n");
		help.append("    --graphql                List pull requests through the GraphQL API\n");
		help.append("\n");
		help.append("SUPPORTED EVENTS:\n");
		help.append("    push, pull_request, pull_request_target, workflow_run, workflow_dispatch, schedule\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN             GitHub token (required)\n");
		help.append("    DRY_RUN                  true to enable dry-run mode\n");
		help.append("    RETRY_COUNT              Merge retries after a failure (default: 5)\n");
		help.append("    RETRY_SLEEP              Milliseconds between merge attempts (default: 300)\n");
		help.append("    MERGE_MSG                Commit message for merge commits\n");
		help.append("    EXCLUDED_LABELS          Comma-separated labels that block updates\n");
		help.append("    PR_READY_STATE           all, draft or ready_for_review (default: all)\n");
		help.append("    PR_FILTER                all, labelled, protected or auto_merge (default: all)\n");
		help.append("    PR_LABELS                Comma-separated labels used with PR_FILTER=labelled\n");
		help.append("    USE_GRAPHQL_API          true to list pull requests through GraphQL\n");
		help.append("    MERGE_CONFLICT_ACTION    fail or ignore (default: fail)\n");
		help.append("    GITHUB_OUTPUT            File that receives the 'conflicted' output\n");
		help.append("\n");
		help.append("    Values may also be placed in a .env file in the working directory.\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0    Run completed\n");
		help.append("    1    A pull request could not be updated, or the run failed\n");
		help.append("    2    Invalid arguments or configuration\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length || args[currentIndex + 1].startsWith("-")) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

}
