/**
 * Command-line entry point for the pull request auto-updater.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.github.autoupdate.cli;

import org.jspecify.annotations.NullMarked;
