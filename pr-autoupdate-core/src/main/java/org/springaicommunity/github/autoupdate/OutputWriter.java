package org.springaicommunity.github.autoupdate;

/**
 * Publishes named step outputs.
 */
@FunctionalInterface
public interface OutputWriter {

	/**
	 * Whether the final outcome of a merge attempt sequence was a merge conflict.
	 */
	String CONFLICTED = "conflicted";

	void setOutput(String name, String value);

	default void setOutput(String name, boolean value) {
		setOutput(name, String.valueOf(value));
	}

}
