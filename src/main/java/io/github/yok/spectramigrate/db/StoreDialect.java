package io.github.yok.spectramigrate.db;

/**
 * Aggregate interface for store-dialect behavior.
 *
 * <p>
 * Composes focused contracts: connection/session control, SQL grammar, and value binding.
 * </p>
 */
public interface StoreDialect
        extends StoreConnectionOperations, StoreSqlOperations, StoreValueOperations {
}
