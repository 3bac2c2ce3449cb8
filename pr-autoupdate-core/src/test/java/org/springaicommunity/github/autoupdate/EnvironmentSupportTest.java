package org.springaicommunity.github.autoupdate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EnvironmentSupport Tests")
class EnvironmentSupportTest {

	@Test
	@DisplayName("Should prefer the process environment over .env values")
	void shouldPreferProcessEnvironment() {
		Map<String, String> process = Map.of("RETRY_COUNT", "1");
		EnvironmentSupport environment = new EnvironmentSupport(process::get,
				Map.of("RETRY_COUNT", "9", "PR_FILTER", "labelled"));

		assertThat(environment.get("RETRY_COUNT")).isEqualTo("1");
		assertThat(environment.get("PR_FILTER")).isEqualTo("labelled");
		assertThat(environment.get("MERGE_MSG")).isNull();
	}

	@Test
	@DisplayName("Should read only the variables declared in the .env file")
	void shouldReadDeclaredVariables(@TempDir Path tempDir) throws Exception {
		Files.writeString(tempDir.resolve(".env"), "DRY_RUN=true\nPR_LABELS=autoupdate,deps\n");

		Map<String, String> values = EnvironmentSupport.readDotenv(tempDir.toString());

		assertThat(values).containsOnly(entry("DRY_RUN", "true"), entry("PR_LABELS", "autoupdate,deps"));
	}

	@Test
	@DisplayName("Should return nothing when the directory has no .env file")
	void shouldIgnoreMissingFile(@TempDir Path tempDir) {
		assertThat(EnvironmentSupport.readDotenv(tempDir.toString())).isEmpty();
	}

}
