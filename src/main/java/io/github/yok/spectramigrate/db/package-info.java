/**
 * Store access package.
 *
 * <p>
 * Wraps the two JDBC connections of a run ({@link io.github.yok.spectramigrate.db.RelationalStore})
 * and isolates engine differences (boolean literals, parameter casts, array and timestamp
 * binding, sequences) behind {@link io.github.yok.spectramigrate.db.StoreDialect}.
 * </p>
 */
package io.github.yok.spectramigrate.db;
