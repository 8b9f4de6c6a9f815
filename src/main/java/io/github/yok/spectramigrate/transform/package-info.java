/**
 * Column transforms applied between reading a source row and binding it for the target.
 *
 * <p>
 * Transforms are applied identically on insert and update paths. A value a transform rejects
 * skips only its row.
 * </p>
 */
package io.github.yok.spectramigrate.transform;
