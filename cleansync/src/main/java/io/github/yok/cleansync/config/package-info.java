/**
 * Configuration model package for CleanSync.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} (or equivalent
 * sources), such as the sync options, the remote store selection and the workspace path.
 * </p>
 *
 * <p>
 * This package primarily holds configuration data; execution logic is implemented in {@code core},
 * {@code store} and {@code transform}.
 * </p>
 */
package io.github.yok.cleansync.config;
