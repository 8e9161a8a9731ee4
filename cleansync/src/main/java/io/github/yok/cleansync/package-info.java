/**
 * Root package of CleanSync.
 *
 * <p>
 * Provides a CLI that incrementally copies CSV files from a remote folder into a "cleaned"
 * sub-folder, normalizing a fixed set of columns and keeping an audit log of every attempt.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.cleansync.config}: configuration models</li>
 * <li>{@code io.github.yok.cleansync.core}: sync workflow, change detection and audit log</li>
 * <li>{@code io.github.yok.cleansync.store}: remote file store back ends</li>
 * <li>{@code io.github.yok.cleansync.transform}: CSV decoding and normalization</li>
 * </ul>
 */
package io.github.yok.cleansync;
