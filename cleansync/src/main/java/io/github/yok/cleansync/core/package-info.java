/**
 * Core sync workflow of CleanSync.
 *
 * <p>
 * {@link io.github.yok.cleansync.core.SyncOrchestrator} drives a run; change detection, upload and
 * the audit log are implemented by the other classes of this package.
 * </p>
 */
package io.github.yok.cleansync.core;
