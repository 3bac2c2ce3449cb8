package org.springaicommunity.github.autoupdate;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Converts a pull request in REST shape into a {@link PullRequestSummary}.
 *
 * <p>
 * The REST listing ({@code GET /repos/{owner}/{repo}/pulls}) and the {@code pull_request}
 * webhook payload share this shape.
 */
public final class RestPullRequestConverter {

	private static final Logger logger = LoggerFactory.getLogger(RestPullRequestConverter.class);

	private RestPullRequestConverter() {
	}

	/**
	 * Convert one pull request object.
	 * @param node the pull request JSON
	 * @return the summary, or null if the node is not a pull request object
	 */
	public static @Nullable PullRequestSummary convert(@Nullable JsonNode node) {
		if (node == null || node.isMissingNode() || node.isNull()) {
			return null;
		}
		if (!node.path("number").canConvertToInt()) {
			logger.warn("Ignoring pull request without a number");
			return null;
		}

		JsonNode base = node.path("base");
		JsonNode head = node.path("head");
		String baseRef = base.path("ref").asText("");
		String headRef = head.path("ref").asText("");

		return new PullRequestSummary(node.path("number").asInt(),
				PullRequestState.fromApi(node.path("state").asText("")), node.path("merged").asBoolean(false),
				node.path("draft").asBoolean(false), parseLabels(node.path("labels")),
				new PullRequestSummary.Base(baseRef, base.path("label").asText(baseRef), base.path("sha").asText("")),
				new PullRequestSummary.Head(headRef, head.path("label").asText(headRef), head.path("sha").asText(""),
						parseRepository(head.path("repo"))),
				parseAutoMerge(node.path("auto_merge")));
	}

	private static Set<String> parseLabels(JsonNode nodes) {
		Set<String> labels = new LinkedHashSet<>();
		if (nodes.isArray()) {
			for (JsonNode label : nodes) {
				JsonNode name = label.path("name");
				if (name.isTextual()) {
					labels.add(name.asText());
				}
				else {
					logger.debug("Label name is undefined, continuing.");
				}
			}
		}
		return labels;
	}

	private static PullRequestSummary.@Nullable Repository parseRepository(JsonNode node) {
		if (node.isMissingNode() || node.isNull()) {
			return null;
		}
		return new PullRequestSummary.Repository(node.path("name").asText(""),
				node.path("owner").path("login").asText(""));
	}

	private static PullRequestSummary.@Nullable AutoMerge parseAutoMerge(JsonNode node) {
		if (node.isMissingNode() || node.isNull()) {
			return null;
		}
		JsonNode method = node.path("merge_method");
		return new PullRequestSummary.AutoMerge(method.isTextual() ? method.asText() : null);
	}

}
