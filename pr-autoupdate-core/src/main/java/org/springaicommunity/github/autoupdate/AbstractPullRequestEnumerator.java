package org.springaicommunity.github.autoupdate;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Base class for enumerators. Validates the request, resolves the owner and turns a page
 * fetching function into a lazy stream. Subclasses supply {@link #fetchPage}.
 */
public abstract class AbstractPullRequestEnumerator implements PullRequestEnumerator {

	private static final Logger logger = LoggerFactory.getLogger(AbstractPullRequestEnumerator.class);

	static final String BRANCH_REF_PREFIX = "refs/heads/";

	@Override
	public Stream<PullRequestSummary> openPullRequests(String ref, String repoName, @Nullable String ownerLogin,
			@Nullable String ownerName) {
		String baseBranch = branchName(ref);
		if (baseBranch == null) {
			logger.warn("Ref '{}' is not a branch, skipping.", ref);
			return Stream.empty();
		}

		String owner = resolveOwner(ownerLogin, ownerName);
		if (owner == null) {
			logger.error("Invalid repository owner provided");
			return Stream.empty();
		}
		if (repoName.isBlank()) {
			logger.error("Invalid repository name provided");
			return Stream.empty();
		}

		logger.debug("Listing open pull requests for {}/{} on '{}' via {}", owner, repoName, baseBranch,
				sourceName());
		Iterator<PullRequestSummary> pages = new PageIterator(owner, repoName, baseBranch);
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED), false);
	}

	/**
	 * Fetch one page of open pull requests.
	 * @param owner repository owner
	 * @param repo repository name
	 * @param baseBranch base branch name
	 * @param cursor cursor returned with the previous page, null for the first page
	 * @return the page
	 */
	protected abstract PullRequestPage fetchPage(String owner, String repo, String baseBranch,
			@Nullable String cursor);

	/**
	 * Name of the data source for log messages.
	 */
	protected abstract String sourceName();

	/**
	 * Extract the branch name from a {@code refs/heads/} ref.
	 * @param ref the full ref
	 * @return the branch name, or null if the ref is not a branch
	 */
	static @Nullable String branchName(@Nullable String ref) {
		if (ref == null || !ref.startsWith(BRANCH_REF_PREFIX) || ref.length() == BRANCH_REF_PREFIX.length()) {
			return null;
		}
		return ref.substring(BRANCH_REF_PREFIX.length());
	}

	/**
	 * Pick the owner name when present, falling back to the owner login.
	 * @param ownerLogin owner login from the event payload
	 * @param ownerName owner name from the event payload
	 * @return the owner, or null if neither is set
	 */
	static @Nullable String resolveOwner(@Nullable String ownerLogin, @Nullable String ownerName) {
		if (ownerName != null && !ownerName.isBlank()) {
			return ownerName;
		}
		return ownerLogin != null && !ownerLogin.isBlank() ? ownerLogin : null;
	}

	private void logFailure(GitHubHttpClient.GitHubApiException e, String owner, String repo) {
		if (e.isRateLimitError()) {
			logger.error("Rate limit exceeded when calling the {} for {}/{}", sourceName(), owner, repo);
			logger.error("Please wait before retrying or check your rate limit status.");
		}
		else if (e.isAuthorizationError()) {
			logger.error("Authentication error when calling the {}: {}", sourceName(), e.getMessage());
			logger.error("Please check that your GitHub token has the required permissions.");
		}
		else if (e.getStatusCode() > 0) {
			logger.error("{} error (status {}): {}", sourceName(), e.getStatusCode(), e.getMessage());
		}
		else {
			logger.error("Error calling the {}: {}", sourceName(), e.getMessage());
		}
	}

	/**
	 * Fetches the next page when the current one is used up. Any failure ends the
	 * iteration.
	 */
	private final class PageIterator implements Iterator<PullRequestSummary> {

		private final String owner;

		private final String repo;

		private final String baseBranch;

		private Iterator<PullRequestSummary> current = Collections.emptyIterator();

		private @Nullable String cursor;

		private boolean exhausted;

		private int pages;

		PageIterator(String owner, String repo, String baseBranch) {
			this.owner = owner;
			this.repo = repo;
			this.baseBranch = baseBranch;
		}

		@Override
		public boolean hasNext() {
			while (!current.hasNext() && !exhausted) {
				fetchNext();
			}
			return current.hasNext();
		}

		@Override
		public PullRequestSummary next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			return current.next();
		}

		private void fetchNext() {
			try {
				PullRequestPage page = fetchPage(owner, repo, baseBranch, cursor);
				pages++;
				logger.debug("Fetched page {} from the {} ({} pull request(s))", pages, sourceName(),
						page.pullRequests().size());
				current = page.pullRequests().iterator();
				cursor = page.nextCursor();
				exhausted = !page.hasMore() || cursor == null;
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				logFailure(e, owner, repo);
				stop();
			}
			catch (RuntimeException e) {
				logger.error("Unexpected error listing pull requests from the {}: {}", sourceName(), e.getMessage(),
						e);
				stop();
			}
		}

		private void stop() {
			current = Collections.emptyIterator();
			exhausted = true;
		}

	}

}
