package org.springaicommunity.github.autoupdate.cli;

import org.jspecify.annotations.Nullable;

/**
 * Parsed command-line options. Unset options leave the environment configuration in
 * place.
 */
public class ParsedArguments {

	public @Nullable String eventName;

	public @Nullable String eventPath;

	public boolean dryRun = false;

	public boolean useGraphQL = false;

}
