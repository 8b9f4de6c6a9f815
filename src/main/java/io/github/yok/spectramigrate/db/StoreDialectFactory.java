package io.github.yok.spectramigrate.db;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link StoreDialect} from a JDBC URL.
 *
 * <ul>
 * <li>{@code jdbc:sqlite:...} → {@link SqliteDialect}</li>
 * <li>{@code jdbc:postgresql:...} → {@link PostgresqlDialect}</li>
 * </ul>
 */
@Slf4j
@Component
public class StoreDialectFactory {

    // Shared by dialects that store arrays as JSON text
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Resolves the dialect for the given JDBC URL.
     *
     * @param jdbcUrl JDBC URL
     * @return matching dialect
     * @throws IllegalArgumentException if the URL names an unsupported engine
     */
    public StoreDialect forUrl(String jdbcUrl) {
        if (jdbcUrl != null && jdbcUrl.startsWith("jdbc:sqlite:")) {
            return new SqliteDialect(objectMapper);
        }
        if (jdbcUrl != null && jdbcUrl.startsWith("jdbc:postgresql:")) {
            return new PostgresqlDialect();
        }
        String msg = "Unsupported JDBC URL: " + jdbcUrl;
        log.error(msg);
        throw new IllegalArgumentException(msg);
    }
}
