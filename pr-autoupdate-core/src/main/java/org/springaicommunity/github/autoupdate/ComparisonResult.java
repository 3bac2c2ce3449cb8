package org.springaicommunity.github.autoupdate;

/**
 * Result of comparing two refs with {@code GET /repos/{owner}/{repo}/compare/{basehead}}.
 *
 * @param status comparison status ("ahead", "behind", "diverged", "identical")
 * @param aheadBy commits on the second ref that the first lacks
 * @param behindBy commits on the first ref that the second lacks
 */
public record ComparisonResult(String status, int aheadBy, int behindBy) {
}
