package org.springaicommunity.github.autoupdate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Dispatches a workflow event to the {@link AutoUpdater}.
 *
 * <p>
 * Supported events: {@code push}, {@code pull_request}, {@code pull_request_target},
 * {@code workflow_run}, {@code workflow_dispatch} and {@code schedule}. The payload is the
 * JSON document GitHub writes to {@code GITHUB_EVENT_PATH}; scheduled runs ignore it and
 * use {@code GITHUB_REF} and {@code GITHUB_REPOSITORY} instead.
 */
public class EventRouter {

	private static final Logger logger = LoggerFactory.getLogger(EventRouter.class);

	private static final Set<String> WORKFLOW_RUN_EVENTS = Set.of("push", "pull_request");

	private final AutoUpdater updater;

	private final AutoUpdateConfig config;

	private final ObjectMapper objectMapper;

	public EventRouter(AutoUpdater updater, AutoUpdateConfig config, ObjectMapper objectMapper) {
		this.updater = updater;
		this.config = config;
		this.objectMapper = objectMapper;
	}

	/**
	 * Read the payload from a file and route the event.
	 * @param eventName event name
	 * @param eventPath path of the JSON payload, null when there is none
	 * @return the run result
	 * @throws UncheckedIOException if the payload cannot be read
	 */
	public UpdateRunResult route(@Nullable String eventName, @Nullable Path eventPath) {
		JsonNode payload = MissingNode.getInstance();
		if (eventPath != null) {
			try {
				payload = objectMapper.readTree(eventPath.toFile());
			}
			catch (IOException e) {
				logger.error("Failed to read event payload from {}: {}", eventPath, e.getMessage());
				throw new UncheckedIOException("Failed to read event payload from " + eventPath, e);
			}
		}
		return route(eventName, payload);
	}

	/**
	 * Route an event to its handler.
	 * @param eventName event name
	 * @param payload event payload
	 * @return the run result
	 * @throws IllegalArgumentException if the event is not supported
	 */
	public UpdateRunResult route(@Nullable String eventName, JsonNode payload) {
		if (eventName == null) {
			throw unknownEvent(null);
		}
		return switch (eventName) {
			case "pull_request", "pull_request_target" -> handlePullRequest(payload);
			case "push" -> handleRefEvent("push", payload);
			case "workflow_dispatch" -> handleRefEvent("workflow_dispatch", payload);
			case "workflow_run" -> handleWorkflowRun(payload);
			case "schedule" -> handleSchedule();
			default -> throw unknownEvent(eventName);
		};
	}

	private UpdateRunResult handleRefEvent(String eventName, JsonNode payload) {
		String ref = payload.path("ref").asText("");
		logger.info("Handling {} event on ref '{}'", eventName, ref);
		JsonNode repository = payload.path("repository");
		return updater.updatePullRequests(ref, repository.path("name").asText(""),
				text(repository.path("owner"), "login"), text(repository.path("owner"), "name"));
	}

	private UpdateRunResult handlePullRequest(JsonNode payload) {
		logger.info("Handling pull_request event triggered by action '{}'", payload.path("action").asText(""));

		PullRequestSummary pull = RestPullRequestConverter.convert(payload.get("pull_request"));
		if (pull == null) {
			logger.warn("Event payload does not contain a pull request, skipping update");
			return UpdateRunResult.nothing();
		}
		PullRequestSummary.Repository repository = pull.head().repo();
		if (repository == null) {
			logger.warn("Pull request head repository is null, skipping update");
			return UpdateRunResult.nothing();
		}

		boolean failedBefore = updater.hasFailed();
		boolean updated = updater.update(repository.ownerLogin(), pull);
		if (updated) {
			logger.info("Auto update complete, pull request branch was updated with changes from the base branch.");
		}
		else {
			logger.info("Auto update complete, no changes were made.");
		}
		return new UpdateRunResult(updated ? 1 : 0, updater.hasFailed() && !failedBefore);
	}

	private UpdateRunResult handleWorkflowRun(JsonNode payload) {
		JsonNode workflowRun = payload.path("workflow_run");
		String event = workflowRun.path("event").asText("");
		if (!WORKFLOW_RUN_EVENTS.contains(event)) {
			logger.error("workflow_run events triggered via {} workflows are not supported.", event);
			return UpdateRunResult.nothing();
		}

		String branch = text(workflowRun, "head_branch");
		if (branch == null) {
			logger.warn("Event was not on a branch, skipping.");
			return UpdateRunResult.nothing();
		}

		logger.info("Handling workflow_run event triggered by '{}' on '{}'", event, branch);
		JsonNode repository = payload.path("repository");
		return updater.updatePullRequests(AbstractPullRequestEnumerator.BRANCH_REF_PREFIX + branch,
				repository.path("name").asText(""), text(repository.path("owner"), "login"),
				text(repository.path("owner"), "name"));
	}

	private UpdateRunResult handleSchedule() {
		String ref = config.githubRef();
		String ownerAndRepo = config.githubRepository();
		String[] parts = ownerAndRepo != null ? ownerAndRepo.split("/") : new String[0];
		if (ref == null || parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
			logger.error("Cannot parse GITHUB_REPOSITORY value '{}' or GITHUB_REF value '{}'", ownerAndRepo, ref);
			return UpdateRunResult.nothing();
		}

		logger.info("Handling schedule event on '{}'", ref);
		return updater.updatePullRequests(ref, parts[1], parts[0], null);
	}

	private static @Nullable String text(JsonNode node, String field) {
		JsonNode value = node.get(field);
		if (value == null || value.isNull()) {
			return null;
		}
		String text = value.asText();
		return text.isEmpty() ? null : text;
	}

	private static IllegalArgumentException unknownEvent(@Nullable String eventName) {
		return new IllegalArgumentException("Unknown event type '" + eventName + "', only 'push', 'pull_request', "
				+ "'pull_request_target', 'workflow_run', 'workflow_dispatch', and 'schedule' are supported.");
	}

}
