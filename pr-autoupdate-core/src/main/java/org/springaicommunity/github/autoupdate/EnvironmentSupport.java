package org.springaicommunity.github.autoupdate;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvBuilder;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Resolves configuration variables from the process environment, falling back to
 * {@code .env} files for local runs.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>Process environment variable</li>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 *
 * <p>
 * When {@code GITHUB_ACTIONS=true} the {@code .env} files are not read at all, so a stray
 * file in a checked-out repository cannot change the step's configuration.
 */
public final class EnvironmentSupport {

	private static final Logger logger = LoggerFactory.getLogger(EnvironmentSupport.class);

	static final String ACTIONS_FLAG = "GITHUB_ACTIONS";

	private final Function<String, @Nullable String> processEnvironment;

	private final Map<String, String> fileValues;

	EnvironmentSupport(Function<String, @Nullable String> processEnvironment, Map<String, String> fileValues) {
		this.processEnvironment = processEnvironment;
		this.fileValues = Map.copyOf(fileValues);
	}

	/**
	 * Load the environment of the current process.
	 * @return the environment
	 */
	public static EnvironmentSupport load() {
		if ("true".equalsIgnoreCase(System.getenv(ACTIONS_FLAG))) {
			logger.debug("Running inside GitHub Actions, ignoring .env files");
			return new EnvironmentSupport(System::getenv, Map.of());
		}

		Map<String, String> values = new HashMap<>(readDotenv(null));
		String home = System.getProperty("user.home");
		if (home != null) {
			readDotenv(home).forEach(values::putIfAbsent);
		}
		if (!values.isEmpty()) {
			logger.debug("Loaded {} value(s) from .env files", values.size());
		}
		return new EnvironmentSupport(System::getenv, values);
	}

	/**
	 * Read the variables declared in the {@code .env} file of a directory.
	 * @param directory the directory, null for the working directory
	 * @return the declared variables, empty when there is no readable file
	 */
	static Map<String, String> readDotenv(@Nullable String directory) {
		DotenvBuilder configuration = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed();
		if (directory != null) {
			configuration.directory(directory);
		}
		Map<String, String> values = new HashMap<>();
		for (DotenvEntry entry : configuration.load().entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
			values.put(entry.getKey(), entry.getValue());
		}
		return values;
	}

	/**
	 * Get a variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	public @Nullable String get(String name) {
		String value = processEnvironment.apply(name);
		return value != null ? value : fileValues.get(name);
	}

}
