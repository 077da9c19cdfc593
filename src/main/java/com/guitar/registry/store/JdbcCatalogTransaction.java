package com.guitar.registry.store;

import com.guitar.registry.core.model.ConditionRating;
import com.guitar.registry.core.model.GuitarModel;
import com.guitar.registry.core.model.IndividualGuitar;
import com.guitar.registry.core.model.Manufacturer;
import com.guitar.registry.core.model.ManufacturerStatus;
import com.guitar.registry.core.model.ProductLine;
import com.guitar.registry.core.model.ProductionType;
import com.guitar.registry.core.model.SignificanceLevel;
import com.guitar.registry.core.model.Specification;
import com.guitar.registry.core.model.SpecificationDetails;
import com.guitar.registry.similarity.SerialNumberNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC transaction over a single connection. SQL failures surface as {@link StorageException}.
 */
class JdbcCatalogTransaction implements CatalogTransaction {
    private static final Logger log = LoggerFactory.getLogger(JdbcCatalogTransaction.class);

    private final Connection connection;
    private final Map<String, Savepoint> savepoints = new HashMap<>();
    private int savepointCounter;
    private boolean active = true;

    JdbcCatalogTransaction(Connection connection) {
        this.connection = connection;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    // ── Manufacturers ─────────────────────────────────────────

    @Override
    public Optional<Manufacturer> findManufacturerById(UUID id) {
        return queryOne(CatalogSql.SELECT_MANUFACTURER_BY_ID, this::mapManufacturer, id);
    }

    @Override
    public Optional<Manufacturer> findManufacturerByName(String name) {
        return queryOne(CatalogSql.SELECT_MANUFACTURER_BY_NAME, this::mapManufacturer, name);
    }

    @Override
    public List<Manufacturer> findManufacturerCandidates() {
        return query(CatalogSql.SELECT_MANUFACTURER_CANDIDATES, this::mapManufacturer);
    }

    @Override
    public void insertManufacturer(Manufacturer m) {
        execute(CatalogSql.INSERT_MANUFACTURER, m.id(), m.name(), m.displayName(), m.country(),
                m.foundedYear(), m.website(), m.status().value(), m.notes(), m.createdBy(),
                timestamp(m.createdAt()), timestamp(m.updatedAt()));
    }

    @Override
    public void updateManufacturer(Manufacturer m) {
        expectOneRow(execute(CatalogSql.UPDATE_MANUFACTURER, m.displayName(), m.country(), m.foundedYear(),
                m.website(), m.status().value(), m.notes(), timestamp(m.updatedAt()), m.id()), m.id());
    }

    // ── Product lines ─────────────────────────────────────────

    @Override
    public Optional<ProductLine> findProductLine(UUID manufacturerId, String name) {
        return queryOne(CatalogSql.SELECT_PRODUCT_LINE, rs -> new ProductLine(
                rs.getObject("id", UUID.class),
                rs.getObject("manufacturer_id", UUID.class),
                rs.getString("name"),
                rs.getString("created_by"),
                instant(rs, "created_at")), manufacturerId, name);
    }

    @Override
    public void insertProductLine(ProductLine pl) {
        execute(CatalogSql.INSERT_PRODUCT_LINE, pl.id(), pl.manufacturerId(), pl.name(), pl.createdBy(),
                timestamp(pl.createdAt()));
    }

    // ── Models ────────────────────────────────────────────────

    @Override
    public Optional<GuitarModel> findModelById(UUID id) {
        return queryOne(CatalogSql.SELECT_MODEL_BY_ID, this::mapModel, id);
    }

    @Override
    public Optional<GuitarModel> findModel(UUID manufacturerId, String name, int year) {
        return queryOne(CatalogSql.SELECT_MODEL_BY_IDENTITY, this::mapModel, manufacturerId, year, name);
    }

    @Override
    public List<GuitarModel> findModelsByManufacturer(UUID manufacturerId) {
        return query(CatalogSql.SELECT_MODELS_BY_MANUFACTURER, this::mapModel, manufacturerId);
    }

    @Override
    public void insertModel(GuitarModel m) {
        execute(CatalogSql.INSERT_MODEL, m.id(), m.manufacturerId(), m.productLineId(), m.name(), m.year(),
                m.productionType().value(), m.productionStartDate(), m.productionEndDate(),
                m.estimatedProductionQuantity(), m.msrpOriginal(), m.currency(), m.description(),
                m.createdBy(), timestamp(m.createdAt()), timestamp(m.updatedAt()));
    }

    @Override
    public void updateModel(GuitarModel m) {
        expectOneRow(execute(CatalogSql.UPDATE_MODEL, m.productLineId(), m.productionType().value(),
                m.productionStartDate(), m.productionEndDate(), m.estimatedProductionQuantity(),
                m.msrpOriginal(), m.currency(), m.description(), timestamp(m.updatedAt()), m.id()), m.id());
    }

    // ── Specifications ────────────────────────────────────────

    @Override
    public void insertSpecification(Specification s) {
        SpecificationDetails d = s.details();
        execute(CatalogSql.INSERT_SPECIFICATION, s.id(), s.modelId(), s.individualGuitarId(),
                d.bodyWood(), d.neckWood(), d.fingerboardWood(), d.scaleLengthInches(), d.numFrets(),
                d.nutWidthInches(), d.neckProfile(), d.bridgeType(), d.pickupConfiguration(),
                d.electronicsDescription(), d.hardwareFinish(), d.bodyFinish(), d.weightLbs(),
                d.caseIncluded(), d.caseType(), s.createdBy(), timestamp(s.createdAt()));
    }

    @Override
    public List<Specification> findSpecificationsForModel(UUID modelId) {
        return query(CatalogSql.SELECT_SPECIFICATIONS_BY_MODEL, this::mapSpecification, modelId);
    }

    @Override
    public List<Specification> findSpecificationsForGuitar(UUID individualGuitarId) {
        return query(CatalogSql.SELECT_SPECIFICATIONS_BY_GUITAR, this::mapSpecification, individualGuitarId);
    }

    // ── Individual guitars ────────────────────────────────────

    @Override
    public Optional<IndividualGuitar> findGuitarById(UUID id) {
        return queryOne(CatalogSql.SELECT_GUITAR_BY_ID, this::mapGuitar, id);
    }

    @Override
    public List<IndividualGuitar> findGuitarsBySerialNumber(String normalizedSerial) {
        // serials are compared in normalized form, which SQL cannot index
        return query(CatalogSql.SELECT_GUITARS_WITH_SERIAL, this::mapGuitar).stream()
                .filter(g -> normalizedSerial.equals(SerialNumberNormalizer.normalize(g.serialNumber())))
                .toList();
    }

    @Override
    public List<IndividualGuitar> findGuitarsByModel(UUID modelId) {
        return query(CatalogSql.SELECT_GUITARS_BY_MODEL, this::mapGuitar, modelId);
    }

    @Override
    public List<IndividualGuitar> findGuitarsByFallbackManufacturer(String manufacturerName) {
        return query(CatalogSql.SELECT_GUITARS_BY_FALLBACK_MANUFACTURER, this::mapGuitar, manufacturerName);
    }

    @Override
    public void insertGuitar(IndividualGuitar g) {
        execute(CatalogSql.INSERT_GUITAR, g.id(), g.modelId(), g.manufacturerNameFallback(),
                g.modelNameFallback(), g.yearEstimate(), g.description(), g.nickname(), g.serialNumber(),
                g.productionDate(), g.productionNumber(), g.significanceLevel().value(),
                g.significanceNotes(), g.currentEstimatedValue(), g.lastValuationDate(),
                g.conditionRating() != null ? g.conditionRating().value() : null, g.modifications(),
                g.provenanceNotes(), g.createdBy(), timestamp(g.createdAt()), timestamp(g.updatedAt()));
    }

    @Override
    public void updateGuitar(IndividualGuitar g) {
        expectOneRow(execute(CatalogSql.UPDATE_GUITAR, g.modelId(), g.manufacturerNameFallback(),
                g.modelNameFallback(), g.yearEstimate(), g.description(), g.nickname(), g.serialNumber(),
                g.productionDate(), g.productionNumber(), g.significanceLevel().value(),
                g.significanceNotes(), g.currentEstimatedValue(), g.lastValuationDate(),
                g.conditionRating() != null ? g.conditionRating().value() : null, g.modifications(),
                g.provenanceNotes(), timestamp(g.updatedAt()), g.id()), g.id());
    }

    // ── Transaction control ───────────────────────────────────

    @Override
    public long count(CatalogTable table) {
        return queryOne("SELECT count(*) FROM " + table.tableName(), rs -> rs.getLong(1)).orElse(0L);
    }

    @Override
    public String setSavepoint() {
        ensureActive();
        String name = "sp_" + (++savepointCounter);
        try {
            savepoints.put(name, connection.setSavepoint(name));
            return name;
        } catch (SQLException e) {
            throw new StorageException("Failed to set savepoint " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void rollbackToSavepoint(String savepoint) {
        ensureActive();
        Savepoint sp = savepoints.get(savepoint);
        if (sp == null) {
            throw new StorageException("Unknown savepoint: " + savepoint);
        }
        try {
            connection.rollback(sp);
        } catch (SQLException e) {
            throw new StorageException("Failed to roll back to savepoint " + savepoint + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void releaseSavepoint(String savepoint) {
        ensureActive();
        Savepoint sp = savepoints.remove(savepoint);
        if (sp == null) {
            return;
        }
        try {
            connection.releaseSavepoint(sp);
        } catch (SQLException e) {
            throw new StorageException("Failed to release savepoint " + savepoint + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void commit() {
        ensureActive();
        try {
            connection.commit();
            log.debug("catalog.committed");
        } catch (SQLException e) {
            throw new StorageException("Commit failed: " + e.getMessage(), e);
        } finally {
            finish();
        }
    }

    @Override
    public void rollback() {
        ensureActive();
        try {
            connection.rollback();
            log.debug("catalog.rolledBack");
        } catch (SQLException e) {
            throw new StorageException("Rollback failed: " + e.getMessage(), e);
        } finally {
            finish();
        }
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void close() {
        if (active) {
            rollback();
        }
    }

    private void finish() {
        active = false;
        savepoints.clear();
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close catalog connection: {}", e.getMessage());
        }
    }

    private void ensureActive() {
        if (!active) {
            throw new IllegalStateException("Transaction is no longer active");
        }
    }

    // ── Statement helpers ─────────────────────────────────────

    private int execute(String sql, Object... params) {
        ensureActive();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Statement failed: " + e.getMessage(), e);
        }
    }

    private <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
        ensureActive();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
                return rows;
            }
        } catch (SQLException e) {
            throw new StorageException("Query failed: " + e.getMessage(), e);
        }
    }

    private <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... params) {
        List<T> rows = query(sql, mapper, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static void bind(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            ps.setObject(i + 1, params[i]);
        }
    }

    private static void expectOneRow(int updated, UUID id) {
        if (updated != 1) {
            throw new StorageException("No row with id: " + id);
        }
    }

    private static OffsetDateTime timestamp(Instant instant) {
        return instant != null ? OffsetDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    // ── Row mappers ───────────────────────────────────────────

    private Manufacturer mapManufacturer(ResultSet rs) throws SQLException {
        return Manufacturer.builder()
                .id(rs.getObject("id", UUID.class))
                .name(rs.getString("name"))
                .displayName(rs.getString("display_name"))
                .country(rs.getString("country"))
                .foundedYear(rs.getObject("founded_year", Integer.class))
                .website(rs.getString("website"))
                .status(ManufacturerStatus.fromValue(rs.getString("status")))
                .notes(rs.getString("notes"))
                .createdBy(rs.getString("created_by"))
                .createdAt(instant(rs, "created_at"))
                .updatedAt(instant(rs, "updated_at"))
                .build();
    }

    private GuitarModel mapModel(ResultSet rs) throws SQLException {
        return GuitarModel.builder()
                .id(rs.getObject("id", UUID.class))
                .manufacturerId(rs.getObject("manufacturer_id", UUID.class))
                .productLineId(rs.getObject("product_line_id", UUID.class))
                .name(rs.getString("name"))
                .year(rs.getInt("year"))
                .productionType(ProductionType.fromValue(rs.getString("production_type")))
                .productionStartDate(rs.getObject("production_start_date", LocalDate.class))
                .productionEndDate(rs.getObject("production_end_date", LocalDate.class))
                .estimatedProductionQuantity(rs.getObject("estimated_production_quantity", Integer.class))
                .msrpOriginal(rs.getBigDecimal("msrp_original"))
                .currency(rs.getString("currency"))
                .description(rs.getString("description"))
                .createdBy(rs.getString("created_by"))
                .createdAt(instant(rs, "created_at"))
                .updatedAt(instant(rs, "updated_at"))
                .build();
    }

    private Specification mapSpecification(ResultSet rs) throws SQLException {
        SpecificationDetails details = new SpecificationDetails(
                rs.getString("body_wood"),
                rs.getString("neck_wood"),
                rs.getString("fingerboard_wood"),
                rs.getBigDecimal("scale_length_inches"),
                rs.getObject("num_frets", Integer.class),
                rs.getBigDecimal("nut_width_inches"),
                rs.getString("neck_profile"),
                rs.getString("bridge_type"),
                rs.getString("pickup_configuration"),
                rs.getString("electronics_description"),
                rs.getString("hardware_finish"),
                rs.getString("body_finish"),
                rs.getBigDecimal("weight_lbs"),
                rs.getObject("case_included", Boolean.class),
                rs.getString("case_type"));
        return new Specification(
                rs.getObject("id", UUID.class),
                rs.getObject("model_id", UUID.class),
                rs.getObject("individual_guitar_id", UUID.class),
                details,
                rs.getString("created_by"),
                instant(rs, "created_at"));
    }

    private IndividualGuitar mapGuitar(ResultSet rs) throws SQLException {
        String condition = rs.getString("condition_rating");
        return IndividualGuitar.builder()
                .id(rs.getObject("id", UUID.class))
                .modelId(rs.getObject("model_id", UUID.class))
                .manufacturerNameFallback(rs.getString("manufacturer_name_fallback"))
                .modelNameFallback(rs.getString("model_name_fallback"))
                .yearEstimate(rs.getString("year_estimate"))
                .description(rs.getString("description"))
                .nickname(rs.getString("nickname"))
                .serialNumber(rs.getString("serial_number"))
                .productionDate(rs.getObject("production_date", LocalDate.class))
                .productionNumber(rs.getObject("production_number", Integer.class))
                .significanceLevel(SignificanceLevel.fromValue(rs.getString("significance_level")))
                .significanceNotes(rs.getString("significance_notes"))
                .currentEstimatedValue(rs.getBigDecimal("current_estimated_value"))
                .lastValuationDate(rs.getObject("last_valuation_date", LocalDate.class))
                .conditionRating(condition != null ? ConditionRating.fromValue(condition) : null)
                .modifications(rs.getString("modifications"))
                .provenanceNotes(rs.getString("provenance_notes"))
                .createdBy(rs.getString("created_by"))
                .createdAt(instant(rs, "created_at"))
                .updatedAt(instant(rs, "updated_at"))
                .build();
    }
}
