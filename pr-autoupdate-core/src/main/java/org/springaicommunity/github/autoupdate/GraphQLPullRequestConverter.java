package org.springaicommunity.github.autoupdate;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Converts a {@code PullRequest} node of the GraphQL listing query into a
 * {@link PullRequestSummary}.
 *
 * <p>
 * The GraphQL API reports branch labels differently from REST, so they are rebuilt here:
 * the base label uses the owner the listing was requested for, the head label uses the
 * head repository's owner or falls back to the bare ref when the repository is gone. Auto
 * merge settings are not part of the query, so {@code autoMerge} is always null.
 */
public final class GraphQLPullRequestConverter {

	private static final Logger logger = LoggerFactory.getLogger(GraphQLPullRequestConverter.class);

	private GraphQLPullRequestConverter() {
	}

	/**
	 * Convert one pull request node.
	 * @param node the GraphQL node
	 * @param owner the repository owner the listing was requested for
	 * @return the summary, or null when the node has no head ref (deleted fork)
	 */
	public static @Nullable PullRequestSummary convert(JsonNode node, String owner) {
		int number = node.path("number").asInt();
		JsonNode headRef = node.path("headRef");
		if (headRef.isMissingNode() || headRef.isNull()) {
			logger.warn("PR #{} has null headRef (fork may have been deleted), skipping", number);
			return null;
		}

		JsonNode baseRef = node.path("baseRef");
		String baseName = baseRef.path("name").asText("");
		String headName = headRef.path("name").asText("");
		PullRequestSummary.Repository repository = parseRepository(node.path("headRepository"));

		return new PullRequestSummary(number, PullRequestState.fromApi(node.path("state").asText("")),
				node.path("merged").asBoolean(false), node.path("isDraft").asBoolean(false),
				parseLabels(node.path("labels").path("nodes")),
				new PullRequestSummary.Base(baseName, PullRequestSummary.label(owner, baseName),
						baseRef.path("target").path("oid").asText("")),
				new PullRequestSummary.Head(headName,
						PullRequestSummary.label(repository != null ? repository.ownerLogin() : null, headName),
						headRef.path("target").path("oid").asText(""), repository),
				null);
	}

	private static Set<String> parseLabels(JsonNode nodes) {
		Set<String> labels = new LinkedHashSet<>();
		if (nodes.isArray()) {
			for (JsonNode label : nodes) {
				JsonNode name = label.path("name");
				if (name.isTextual()) {
					labels.add(name.asText());
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

}
