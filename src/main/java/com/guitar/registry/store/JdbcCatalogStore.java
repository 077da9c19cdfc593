package com.guitar.registry.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link CatalogStore} backed by a relational database through a {@link DataSource}.
 * Each transaction holds one connection with auto-commit disabled at READ COMMITTED isolation.
 * The SQL targets PostgreSQL.
 */
public class JdbcCatalogStore implements CatalogStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcCatalogStore.class);

    private final DataSource dataSource;

    public JdbcCatalogStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource is required");
    }

    @Override
    public CatalogTransaction begin() {
        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            connection.setAutoCommit(false);
            connection.setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
            return new JdbcCatalogTransaction(connection);
        } catch (SQLException e) {
            closeQuietly(connection, e);
            throw new StorageException("Failed to open catalog transaction: " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(Connection connection, SQLException cause) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException closeFailure) {
            cause.addSuppressed(closeFailure);
            log.warn("Failed to close connection after begin failure: {}", closeFailure.getMessage());
        }
    }
}
