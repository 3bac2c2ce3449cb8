package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends {@code name=value} lines to the file named by {@code GITHUB_OUTPUT}. Without an
 * output file the values are only logged.
 */
public class GitHubOutputWriter implements OutputWriter {

	private static final Logger logger = LoggerFactory.getLogger(GitHubOutputWriter.class);

	private final @Nullable Path outputFile;

	public GitHubOutputWriter(@Nullable Path outputFile) {
		this.outputFile = outputFile;
	}

	@Override
	public void setOutput(String name, String value) {
		if (value.contains("\n")) {
			throw new IllegalArgumentException("Multi-line output values are not supported: " + name);
		}
		if (outputFile == null) {
			logger.info("Output {}={}", name, value);
			return;
		}
		try {
			Files.writeString(outputFile, name + "=" + value + System.lineSeparator(), StandardCharsets.UTF_8,
					StandardOpenOption.CREATE, StandardOpenOption.APPEND);
			logger.debug("Wrote output {}={} to {}", name, value, outputFile);
		}
		catch (IOException e) {
			logger.error("Failed to write output {} to {}: {}", name, outputFile, e.getMessage());
			throw new UncheckedIOException("Failed to write output " + name, e);
		}
	}

}
