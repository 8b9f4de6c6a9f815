/**
 * Configuration model package for SpectraMigrate.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml}, such as the source
 * file path, target connection settings and the batch/verification settings of a migration run.
 * Environment variables ({@code SQLITE_DB}, {@code PG_HOST}, ...) are resolved in
 * {@code application.yml} so the defaults are documented in one place.
 * </p>
 */
package io.github.yok.spectramigrate.config;
