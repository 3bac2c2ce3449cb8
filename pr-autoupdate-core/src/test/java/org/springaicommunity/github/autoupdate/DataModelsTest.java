package org.springaicommunity.github.autoupdate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.github.autoupdate.TestPullRequests.pullRequest;

@DisplayName("Data Model Tests")
class DataModelsTest {

	@Nested
	@DisplayName("MergeRequest")
	class MergeRequestTest {

		@Test
		@DisplayName("Should merge the base branch into the head branch of the head repository")
		void shouldSwapBaseAndHead() {
			PullRequestSummary pull = pullRequest(9).fork("contributor", "widgets-fork").headRef("fix").build();

			MergeRequest request = MergeRequest.forPullRequest(pull, "Update branch");

			assertThat(request.owner()).isEqualTo("contributor");
			assertThat(request.repo()).isEqualTo("widgets-fork");
			assertThat(request.base()).isEqualTo("fix");
			assertThat(request.head()).isEqualTo("main");
			assertThat(request.commitMessage()).isEqualTo("Update branch");
		}

		@Test
		@DisplayName("Should leave an empty commit message to GitHub")
		void shouldDropEmptyMessage() {
			assertThat(MergeRequest.forPullRequest(pullRequest(1).build(), "").commitMessage()).isNull();
		}

		@Test
		@DisplayName("Should reject pull requests without a head repository")
		void shouldRejectDeletedFork() {
			assertThatThrownBy(() -> MergeRequest.forPullRequest(pullRequest(1).deletedFork().build(), null))
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("AutoUpdateConfig")
	class AutoUpdateConfigTest {

		@Test
		@DisplayName("Should copy list values")
		void shouldCopyLists() {
			List<String> labels = new ArrayList<>(List.of("wip"));
			AutoUpdateConfig config = AutoUpdateConfig.builder().excludedLabels(labels).build();

			labels.add("blocked");

			assertThat(config.excludedLabels()).containsExactly("wip");
		}

		@Test
		@DisplayName("Should round-trip through toBuilder")
		void shouldRoundTripThroughBuilder() {
			AutoUpdateConfig config = AutoUpdateConfig.builder()
				.token("t")
				.prFilter(PullRequestFilter.PROTECTED)
				.retryCount(1)
				.githubRepository("octo/widgets")
				.build();

			assertThat(config.toBuilder().build()).isEqualTo(config);
			assertThat(config.toBuilder().dryRun(true).build().dryRun()).isTrue();
		}

		@Test
		@DisplayName("Should reject negative retry settings")
		void shouldRejectNegativeRetries() {
			assertThatThrownBy(() -> AutoUpdateConfig.builder().retryCount(-1).build())
				.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> AutoUpdateConfig.builder().retrySleepMs(-1).build())
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Enums")
	class EnumsTest {

		@ParameterizedTest
		@ValueSource(strings = { "open", "OPEN", "Open" })
		@DisplayName("Should read open states from either API")
		void shouldReadOpenState(String value) {
			assertThat(PullRequestState.fromApi(value)).isEqualTo(PullRequestState.OPEN);
		}

		@Test
		@DisplayName("Should treat every other state as closed")
		void shouldReadClosedState() {
			assertThat(PullRequestState.fromApi("MERGED")).isEqualTo(PullRequestState.CLOSED);
			assertThat(PullRequestState.fromApi("closed")).isEqualTo(PullRequestState.CLOSED);
		}

		@Test
		@DisplayName("Should expose the configuration values of the filters")
		void shouldExposeValues() {
			assertThat(PullRequestFilter.AUTO_MERGE.value()).isEqualTo("auto_merge");
			assertThat(ReadyStateFilter.READY_FOR_REVIEW.value()).isEqualTo("ready_for_review");
			assertThat(MergeConflictAction.from("ignore")).isEqualTo(MergeConflictAction.IGNORE);
		}

		@Test
		@DisplayName("Should classify merge states")
		void shouldClassifyMergeStates() {
			assertThat(MergeState.CONFLICT_FATAL.isFatal()).isTrue();
			assertThat(MergeState.RETRY_EXHAUSTED.isFatal()).isTrue();
			assertThat(MergeState.CONFLICT_SKIPPED.isFatal()).isFalse();
			assertThat(MergeState.AUTH_DENIED.isTerminal()).isTrue();
			assertThat(MergeState.ATTEMPTING.isTerminal()).isFalse();
		}

	}

	@Test
	@DisplayName("Should format labels with and without an owner")
	void shouldFormatLabels() {
		assertThat(PullRequestSummary.label("octo", "main")).isEqualTo("octo:main");
		assertThat(PullRequestSummary.label(null, "main")).isEqualTo("main");
	}

	@Nested
	@DisplayName("RateLimitInfo")
	class RateLimitInfoTest {

		@Test
		@DisplayName("Should flag a quota below the watermark")
		void shouldFlagLowQuota() {
			assertThat(new RateLimitInfo(5000, 99, 0, 4901).isRunningLow()).isTrue();
			assertThat(new RateLimitInfo(5000, 100, 0, 4900).isRunningLow()).isFalse();
		}

		@Test
		@DisplayName("Should never report a negative time until reset")
		void shouldClampResetToZero() {
			Instant now = Instant.ofEpochSecond(1_000);

			assertThat(new RateLimitInfo(5000, 0, 1_060, 5000).untilReset(now)).isEqualTo(Duration.ofSeconds(60));
			assertThat(new RateLimitInfo(5000, 0, 900, 5000).untilReset(now)).isEqualTo(Duration.ZERO);
		}

	}

}
