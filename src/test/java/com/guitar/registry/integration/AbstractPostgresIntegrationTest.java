package com.guitar.registry.integration;

import com.guitar.registry.api.CatalogIngestor;
import com.guitar.registry.store.CatalogTable;
import com.guitar.registry.store.JdbcCatalogStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Base class for PostgreSQL integration tests using Testcontainers.
 * The schema is created once per container; every test starts from empty tables.
 */
@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
abstract class AbstractPostgresIntegrationTest {

    @SuppressWarnings("resource")
    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withInitScript("db/catalog-schema.sql");

    protected DataSource dataSource;

    @BeforeEach
    void resetCatalog() throws SQLException {
        PGSimpleDataSource ds = new PGSimpleDataSource();
        ds.setUrl(postgres.getJdbcUrl());
        ds.setUser(postgres.getUsername());
        ds.setPassword(postgres.getPassword());
        dataSource = ds;

        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute("TRUNCATE " + CatalogTable.INDIVIDUAL_GUITARS.tableName() + ", "
                    + CatalogTable.SPECIFICATIONS.tableName() + ", "
                    + CatalogTable.MODELS.tableName() + ", "
                    + CatalogTable.PRODUCT_LINES.tableName() + ", "
                    + CatalogTable.MANUFACTURERS.tableName() + " CASCADE");
        }
    }

    protected JdbcCatalogStore createStore() {
        return new JdbcCatalogStore(dataSource);
    }

    protected CatalogIngestor createIngestor() {
        return CatalogIngestor.builder()
                .store(createStore())
                .build();
    }
}
