/**
 * Core migration logic.
 *
 * <p>
 * {@link io.github.yok.spectramigrate.core.ReconcilingCopier} moves one entity between two stores,
 * driven by an {@link io.github.yok.spectramigrate.core.EntityDescriptor}.
 * {@link io.github.yok.spectramigrate.core.MigrationRunner} combines it into the phases of a run,
 * and {@link io.github.yok.spectramigrate.core.MigrationVerifier} checks the outcome.
 * </p>
 */
package io.github.yok.spectramigrate.core;
