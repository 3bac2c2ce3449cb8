package org.springaicommunity.github.autoupdate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springaicommunity.github.autoupdate.TestPullRequests.pullRequest;

@DisplayName("AutoUpdater Tests")
@ExtendWith(MockitoExtension.class)
class AutoUpdaterTest {

	@Mock
	private PullRequestEnumerator enumerator;

	@Mock
	private UpdateDecisionEngine decisionEngine;

	@Mock
	private BranchMerger merger;

	private AutoUpdater updater;

	@BeforeEach
	void setUp() {
		AutoUpdateConfig config = AutoUpdateConfig.builder().mergeMessage("Sync with base").build();
		updater = new AutoUpdater(config, enumerator, decisionEngine, merger);
	}

	@Test
	@DisplayName("Should count only pull requests that were updated")
	void shouldCountUpdatedPullRequests() {
		PullRequestSummary first = pullRequest(1).build();
		PullRequestSummary second = pullRequest(2).build();
		PullRequestSummary third = pullRequest(3).build();
		when(enumerator.openPullRequests("refs/heads/main", "widgets", "octo", null))
			.thenReturn(Stream.of(first, second, third));
		when(decisionEngine.needsUpdate(first)).thenReturn(true);
		when(decisionEngine.needsUpdate(second)).thenReturn(false);
		when(decisionEngine.needsUpdate(third)).thenReturn(true);
		when(merger.merge(eq("octo"), eq(1), any())).thenReturn(MergeState.SUCCEEDED);
		when(merger.merge(eq("octo"), eq(3), any())).thenReturn(MergeState.CONFLICT_SKIPPED);

		UpdateRunResult result = updater.updatePullRequests("refs/heads/main", "widgets", "octo", null);

		assertThat(result).isEqualTo(new UpdateRunResult(1, false));
		verify(merger, never()).merge(anyString(), eq(2), any());
	}

	@Test
	@DisplayName("Should process pull requests one at a time in listing order")
	void shouldProcessInOrder() {
		PullRequestSummary first = pullRequest(1).build();
		PullRequestSummary second = pullRequest(2).build();
		when(enumerator.openPullRequests(anyString(), anyString(), any(), any())).thenReturn(Stream.of(first, second));
		when(decisionEngine.needsUpdate(any())).thenReturn(true);
		when(merger.merge(anyString(), anyInt(), any())).thenReturn(MergeState.SUCCEEDED);

		updater.updatePullRequests("refs/heads/main", "widgets", "octo", null);

		InOrder inOrder = inOrder(decisionEngine, merger);
		inOrder.verify(decisionEngine).needsUpdate(first);
		inOrder.verify(merger).merge(eq("octo"), eq(1), any());
		inOrder.verify(decisionEngine).needsUpdate(second);
		inOrder.verify(merger).merge(eq("octo"), eq(2), any());
	}

	@Test
	@DisplayName("Should return without updating when no repository owner is known")
	void shouldReturnWhenOwnerMissing() {
		lenient().when(enumerator.openPullRequests(anyString(), anyString(), any(), any()))
			.thenReturn(Stream.of(pullRequest(1).build(), pullRequest(2).build()));

		UpdateRunResult result = assertTimeoutPreemptively(Duration.ofSeconds(5),
				() -> updater.updatePullRequests("refs/heads/main", "widgets", null, " "));

		assertThat(result).isEqualTo(UpdateRunResult.nothing());
		verifyNoInteractions(decisionEngine, merger);
	}

	@Test
	@DisplayName("Should use the owner name as the event owner when present")
	void shouldUseOwnerNameAsEventOwner() {
		PullRequestSummary pull = pullRequest(1).build();
		when(enumerator.openPullRequests("refs/heads/main", "widgets", "octo", "Octo"))
			.thenReturn(Stream.of(pull));
		when(decisionEngine.needsUpdate(pull)).thenReturn(true);
		when(merger.merge(anyString(), anyInt(), any())).thenReturn(MergeState.SUCCEEDED);

		updater.updatePullRequests("refs/heads/main", "widgets", "octo", "Octo");

		verify(merger).merge(eq("Octo"), eq(1), any());
	}

	@Test
	@DisplayName("Should build the merge request from the pull request and merge message")
	void shouldBuildMergeRequest() {
		PullRequestSummary pull = pullRequest(5).fork("contributor", "widgets-fork").headRef("fix").build();
		when(decisionEngine.needsUpdate(pull)).thenReturn(true);
		when(merger.merge(anyString(), anyInt(), any())).thenReturn(MergeState.SUCCEEDED);

		boolean updated = updater.update("octo", pull);

		assertThat(updated).isTrue();
		verify(merger).merge("octo", 5,
				new MergeRequest("contributor", "widgets-fork", "fix", "main", "Sync with base"));
	}

	@Test
	@DisplayName("Should keep going after a fatal merge and report the run as failed")
	void shouldContinueAfterFatalMerge() {
		PullRequestSummary first = pullRequest(1).build();
		PullRequestSummary second = pullRequest(2).build();
		PullRequestSummary third = pullRequest(3).build();
		when(enumerator.openPullRequests(anyString(), anyString(), any(), any()))
			.thenReturn(Stream.of(first, second, third));
		when(decisionEngine.needsUpdate(any())).thenReturn(true);
		when(merger.merge(eq("octo"), eq(1), any())).thenReturn(MergeState.SUCCEEDED);
		when(merger.merge(eq("octo"), eq(2), any())).thenThrow(new BranchUpdateException(MergeState.CONFLICT_FATAL, 2,
				"Merge conflict updating pull request #2", new RuntimeException("Merge conflict")));
		when(merger.merge(eq("octo"), eq(3), any())).thenReturn(MergeState.SUCCEEDED);

		UpdateRunResult result = updater.updatePullRequests("refs/heads/main", "widgets", "octo", null);

		assertThat(result.updatedCount()).isEqualTo(2);
		assertThat(result.failed()).isTrue();
		assertThat(updater.hasFailed()).isTrue();
	}

	@Test
	@DisplayName("Should report zero updates when nothing is listed")
	void shouldReportNothingForEmptyListing() {
		when(enumerator.openPullRequests(anyString(), anyString(), any(), any())).thenReturn(Stream.empty());

		UpdateRunResult result = updater.updatePullRequests("refs/tags/v1", "widgets", "octo", null);

		assertThat(result).isEqualTo(UpdateRunResult.nothing());
		verifyNoInteractions(decisionEngine, merger);
	}

}
