package org.springaicommunity.github.autoupdate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("EventRouter Tests")
@ExtendWith(MockitoExtension.class)
class EventRouterTest {

	private static final String PUSH_PAYLOAD = """
			{
			  "ref": "refs/heads/main",
			  "repository": {"name": "widgets", "owner": {"login": "octo", "name": "Octo"}}
			}
			""";

	@Mock
	private AutoUpdater updater;

	private ObjectMapper objectMapper;

	private EventRouter router;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		router = new EventRouter(updater, AutoUpdateConfig.builder().build(), objectMapper);
	}

	private JsonNode json(String json) throws Exception {
		return objectMapper.readTree(json);
	}

	@Nested
	@DisplayName("Branch events")
	class BranchEventTest {

		@ParameterizedTest
		@ValueSource(strings = { "push", "workflow_dispatch" })
		@DisplayName("Should update pull requests against the pushed branch")
		void shouldRoutePushLikeEvents(String eventName) throws Exception {
			when(updater.updatePullRequests("refs/heads/main", "widgets", "octo", "Octo"))
				.thenReturn(new UpdateRunResult(2, false));

			UpdateRunResult result = router.route(eventName, json(PUSH_PAYLOAD));

			assertThat(result.updatedCount()).isEqualTo(2);
		}

		@Test
		@DisplayName("Should pass a missing owner name as null")
		void shouldPassMissingOwnerNameAsNull() throws Exception {
			when(updater.updatePullRequests(anyString(), anyString(), any(), any())).thenReturn(UpdateRunResult.nothing());

			router.route("push", json("""
					{"ref": "refs/heads/dev", "repository": {"name": "widgets", "owner": {"login": "octo"}}}
					"""));

			verify(updater).updatePullRequests("refs/heads/dev", "widgets", "octo", null);
		}

		@Test
		@DisplayName("Should read the payload from the event file")
		void shouldReadPayloadFromFile(@TempDir Path tempDir) throws Exception {
			Path event = tempDir.resolve("event.json");
			Files.writeString(event, PUSH_PAYLOAD);
			when(updater.updatePullRequests(anyString(), anyString(), any(), any())).thenReturn(UpdateRunResult.nothing());

			router.route("push", event);

			verify(updater).updatePullRequests("refs/heads/main", "widgets", "octo", "Octo");
		}

		@Test
		@DisplayName("Should fail when the event file cannot be read")
		void shouldFailOnUnreadableFile(@TempDir Path tempDir) {
			assertThatThrownBy(() -> router.route("push", tempDir.resolve("missing.json")))
				.isInstanceOf(UncheckedIOException.class);
			verifyNoInteractions(updater);
		}

	}

	@Nested
	@DisplayName("pull_request events")
	class PullRequestEventTest {

		private static final String PAYLOAD = """
				{
				  "action": "synchronize",
				  "pull_request": {
				    "number": 12,
				    "state": "open",
				    "merged": false,
				    "draft": false,
				    "labels": [],
				    "base": {"ref": "main", "label": "octo:main", "sha": "b"},
				    "head": {"ref": "fix", "label": "contributor:fix", "sha": "h",
				             "repo": {"name": "widgets-fork", "owner": {"login": "contributor"}}}
				  }
				}
				""";

		@ParameterizedTest
		@ValueSource(strings = { "pull_request", "pull_request_target" })
		@DisplayName("Should update the single pull request with the head owner as event owner")
		void shouldUpdateSinglePullRequest(String eventName) throws Exception {
			when(updater.update(eq("contributor"), any())).thenReturn(true);

			UpdateRunResult result = router.route(eventName, json(PAYLOAD));

			ArgumentCaptor<PullRequestSummary> pull = ArgumentCaptor.forClass(PullRequestSummary.class);
			verify(updater).update(eq("contributor"), pull.capture());
			assertThat(pull.getValue().number()).isEqualTo(12);
			assertThat(result).isEqualTo(new UpdateRunResult(1, false));
		}

		@Test
		@DisplayName("Should report a failed update of the single pull request")
		void shouldReportFailure() throws Exception {
			when(updater.hasFailed()).thenReturn(false, true);
			when(updater.update(anyString(), any())).thenReturn(false);

			UpdateRunResult result = router.route("pull_request", json(PAYLOAD));

			assertThat(result).isEqualTo(new UpdateRunResult(0, true));
		}

		@Test
		@DisplayName("Should skip pull requests whose head repository is gone")
		void shouldSkipDeletedHeadRepository() throws Exception {
			String payload = PAYLOAD.replace(
					"\"repo\": {\"name\": \"widgets-fork\", \"owner\": {\"login\": \"contributor\"}}", "\"repo\": null");

			UpdateRunResult result = router.route("pull_request", json(payload));

			assertThat(result).isEqualTo(UpdateRunResult.nothing());
			verify(updater, never()).update(anyString(), any());
		}

	}

	@Nested
	@DisplayName("workflow_run events")
	class WorkflowRunEventTest {

		@ParameterizedTest
		@ValueSource(strings = { "push", "pull_request" })
		@DisplayName("Should update pull requests against the head branch of the workflow run")
		void shouldRouteSupportedWorkflowRuns(String triggeringEvent) throws Exception {
			when(updater.updatePullRequests(anyString(), anyString(), any(), any())).thenReturn(UpdateRunResult.nothing());

			router.route("workflow_run", json("""
					{"workflow_run": {"event": "%s", "head_branch": "develop"},
					 "repository": {"name": "widgets", "owner": {"login": "octo"}}}
					""".formatted(triggeringEvent)));

			verify(updater).updatePullRequests("refs/heads/develop", "widgets", "octo", null);
		}

		@Test
		@DisplayName("Should ignore workflow runs triggered by other events")
		void shouldIgnoreOtherTriggers() throws Exception {
			UpdateRunResult result = router.route("workflow_run", json("""
					{"workflow_run": {"event": "schedule", "head_branch": "main"},
					 "repository": {"name": "widgets", "owner": {"login": "octo"}}}
					"""));

			assertThat(result).isEqualTo(UpdateRunResult.nothing());
			verifyNoInteractions(updater);
		}

		@Test
		@DisplayName("Should ignore workflow runs without a head branch")
		void shouldIgnoreMissingHeadBranch() throws Exception {
			router.route("workflow_run", json("""
					{"workflow_run": {"event": "push", "head_branch": null},
					 "repository": {"name": "widgets", "owner": {"login": "octo"}}}
					"""));

			verifyNoInteractions(updater);
		}

	}

	@Nested
	@DisplayName("schedule events")
	class ScheduleEventTest {

		@Test
		@DisplayName("Should use GITHUB_REF and GITHUB_REPOSITORY")
		void shouldUseConfiguredRepository() throws Exception {
			EventRouter scheduled = new EventRouter(updater,
					AutoUpdateConfig.builder().githubRef("refs/heads/main").githubRepository("octo/widgets").build(),
					objectMapper);
			when(updater.updatePullRequests(anyString(), anyString(), any(), any())).thenReturn(UpdateRunResult.nothing());

			scheduled.route("schedule", json("{}"));

			verify(updater).updatePullRequests("refs/heads/main", "widgets", "octo", null);
		}

		@ParameterizedTest
		@ValueSource(strings = { "widgets", "octo/widgets/extra", "/widgets" })
		@DisplayName("Should do nothing when GITHUB_REPOSITORY is malformed")
		void shouldRejectMalformedRepository(String repository) throws Exception {
			EventRouter scheduled = new EventRouter(updater,
					AutoUpdateConfig.builder().githubRef("refs/heads/main").githubRepository(repository).build(),
					objectMapper);

			assertThat(scheduled.route("schedule", json("{}"))).isEqualTo(UpdateRunResult.nothing());
			verifyNoInteractions(updater);
		}

	}

	@Test
	@DisplayName("Should reject unsupported events")
	void shouldRejectUnknownEvents() {
		assertThatThrownBy(() -> router.route("issues", json("{}"))).isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("Unknown event type 'issues'")
			.hasMessageContaining("'schedule'");
		assertThatThrownBy(() -> router.route(null, json("{}"))).isInstanceOf(IllegalArgumentException.class);
	}

}
