package org.springaicommunity.github.autoupdate;

/**
 * A repository branch and its protection status.
 *
 * @param name branch name
 * @param protectedBranch whether branch protection is enabled
 */
public record BranchInfo(String name, boolean protectedBranch) {
}
