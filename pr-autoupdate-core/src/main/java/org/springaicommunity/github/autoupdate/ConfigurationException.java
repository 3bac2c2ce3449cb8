package org.springaicommunity.github.autoupdate;

/**
 * Thrown when the environment holds an invalid configuration value.
 */
public class ConfigurationException extends RuntimeException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}

}
