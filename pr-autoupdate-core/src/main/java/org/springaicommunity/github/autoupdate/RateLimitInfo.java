package org.springaicommunity.github.autoupdate;

import java.time.Duration;
import java.time.Instant;

/**
 * Quota reported by the {@code X-RateLimit-*} headers of the most recent response.
 * Every merge attempt spends one request, so a large backlog of pull requests can
 * drain the quota of a workflow token.
 *
 * @param limit requests allowed per window
 * @param remaining requests left in the current window
 * @param reset epoch second at which the window resets
 * @param used requests spent in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	static final int LOW_WATERMARK = 100;

	/**
	 * Whether fewer than {@value #LOW_WATERMARK} requests are left.
	 * @return true when the quota is running low
	 */
	public boolean isRunningLow() {
		return remaining < LOW_WATERMARK;
	}

	/**
	 * Time left until the window resets, never negative.
	 * @param now the current instant
	 * @return duration until reset
	 */
	public Duration untilReset(Instant now) {
		Duration left = Duration.between(now, Instant.ofEpochSecond(reset));
		return left.isNegative() ? Duration.ZERO : left;
	}

}
