/**
 * Utility package for SpectraMigrate.
 *
 * <p>
 * Provides the fatal-error reporter used by the entry point and interactive console input
 * (confirmation and password prompts).
 * </p>
 */
package io.github.yok.spectramigrate.util;
