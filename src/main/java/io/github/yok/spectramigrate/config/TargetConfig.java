package io.github.yok.spectramigrate.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code target} section in {@code application.yml}.
 *
 * <pre>
 * target:
 *   host: ${PG_HOST:localhost}
 *   port: ${PG_PORT:5432}
 *   user: ${PG_USER:safecast}
 *   database: ${PG_DB:safecast}
 *   password: ${PG_PASSWORD:}
 * </pre>
 *
 * <p>
 * When {@code password} is blank, the entry point asks for it interactively before connecting.
 * </p>
 */
@ConfigurationProperties(prefix = "target")
@Data
public class TargetConfig {

    // PostgreSQL host name
    private String host = "localhost";
    // PostgreSQL port
    private int port = 5432;
    // Database user name
    private String user = "safecast";
    // Database name
    private String database = "safecast";
    // Database password (empty means "prompt")
    @ToString.Exclude
    private String password = "";
    // Fully qualified JDBC driver class name
    private String driverClass = "org.postgresql.Driver";

    /**
     * Builds the JDBC URL from host, port and database.
     *
     * @return {@code jdbc:postgresql://host:port/database}
     */
    public String getJdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }
}
