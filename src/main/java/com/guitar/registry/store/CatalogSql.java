package com.guitar.registry.store;

/**
 * SQL statements used by {@link JdbcCatalogTransaction}. PostgreSQL dialect.
 */
final class CatalogSql {

    private CatalogSql() {
    }

    static final String MANUFACTURER_COLUMNS = """
            id, name, display_name, country, founded_year, website, status, notes,
            created_by, created_at, updated_at""";

    static final String SELECT_MANUFACTURER_BY_ID =
            "SELECT " + MANUFACTURER_COLUMNS + " FROM manufacturers WHERE id = ?";

    static final String SELECT_MANUFACTURER_BY_NAME =
            "SELECT " + MANUFACTURER_COLUMNS + " FROM manufacturers WHERE lower(name) = lower(?) LIMIT 1";

    static final String SELECT_MANUFACTURER_CANDIDATES = "SELECT " + MANUFACTURER_COLUMNS + """
             FROM manufacturers
            WHERE status <> 'defunct'
            ORDER BY created_at, id""";

    static final String INSERT_MANUFACTURER = """
            INSERT INTO manufacturers (id, name, display_name, country, founded_year, website, status,
                                       notes, created_by, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    static final String UPDATE_MANUFACTURER = """
            UPDATE manufacturers
               SET display_name = ?, country = ?, founded_year = ?, website = ?, status = ?,
                   notes = ?, updated_at = ?
             WHERE id = ?""";

    static final String SELECT_PRODUCT_LINE = """
            SELECT id, manufacturer_id, name, created_by, created_at
              FROM product_lines
             WHERE manufacturer_id = ? AND lower(name) = lower(?)
             LIMIT 1""";

    static final String INSERT_PRODUCT_LINE = """
            INSERT INTO product_lines (id, manufacturer_id, name, created_by, created_at)
            VALUES (?, ?, ?, ?, ?)""";

    static final String MODEL_COLUMNS = """
            id, manufacturer_id, product_line_id, name, year, production_type, production_start_date,
            production_end_date, estimated_production_quantity, msrp_original, currency, description,
            created_by, created_at, updated_at""";

    static final String SELECT_MODEL_BY_ID = "SELECT " + MODEL_COLUMNS + " FROM models WHERE id = ?";

    static final String SELECT_MODEL_BY_IDENTITY = "SELECT " + MODEL_COLUMNS + """
             FROM models
            WHERE manufacturer_id = ? AND year = ? AND lower(name) = lower(?)
            LIMIT 1""";

    static final String SELECT_MODELS_BY_MANUFACTURER = "SELECT " + MODEL_COLUMNS + """
             FROM models
            WHERE manufacturer_id = ?
            ORDER BY created_at, id""";

    static final String INSERT_MODEL = """
            INSERT INTO models (id, manufacturer_id, product_line_id, name, year, production_type,
                                production_start_date, production_end_date, estimated_production_quantity,
                                msrp_original, currency, description, created_by, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    static final String UPDATE_MODEL = """
            UPDATE models
               SET product_line_id = ?, production_type = ?, production_start_date = ?,
                   production_end_date = ?, estimated_production_quantity = ?, msrp_original = ?,
                   currency = ?, description = ?, updated_at = ?
             WHERE id = ?""";

    static final String SPECIFICATION_COLUMNS = """
            id, model_id, individual_guitar_id, body_wood, neck_wood, fingerboard_wood,
            scale_length_inches, num_frets, nut_width_inches, neck_profile, bridge_type,
            pickup_configuration, electronics_description, hardware_finish, body_finish, weight_lbs,
            case_included, case_type, created_by, created_at""";

    static final String INSERT_SPECIFICATION = """
            INSERT INTO specifications (id, model_id, individual_guitar_id, body_wood, neck_wood,
                                        fingerboard_wood, scale_length_inches, num_frets, nut_width_inches,
                                        neck_profile, bridge_type, pickup_configuration,
                                        electronics_description, hardware_finish, body_finish, weight_lbs,
                                        case_included, case_type, created_by, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    static final String SELECT_SPECIFICATIONS_BY_MODEL = "SELECT " + SPECIFICATION_COLUMNS + """
             FROM specifications
            WHERE model_id = ?
            ORDER BY created_at, id""";

    static final String SELECT_SPECIFICATIONS_BY_GUITAR = "SELECT " + SPECIFICATION_COLUMNS + """
             FROM specifications
            WHERE individual_guitar_id = ?
            ORDER BY created_at, id""";

    static final String GUITAR_COLUMNS = """
            id, model_id, manufacturer_name_fallback, model_name_fallback, year_estimate, description,
            nickname, serial_number, production_date, production_number, significance_level,
            significance_notes, current_estimated_value, last_valuation_date, condition_rating,
            modifications, provenance_notes, created_by, created_at, updated_at""";

    static final String SELECT_GUITAR_BY_ID =
            "SELECT " + GUITAR_COLUMNS + " FROM individual_guitars WHERE id = ?";

    static final String SELECT_GUITARS_WITH_SERIAL = "SELECT " + GUITAR_COLUMNS + """
             FROM individual_guitars
            WHERE serial_number IS NOT NULL
            ORDER BY created_at, id""";

    static final String SELECT_GUITARS_BY_MODEL = "SELECT " + GUITAR_COLUMNS + """
             FROM individual_guitars
            WHERE model_id = ?
            ORDER BY created_at, id""";

    static final String SELECT_GUITARS_BY_FALLBACK_MANUFACTURER = "SELECT " + GUITAR_COLUMNS + """
             FROM individual_guitars
            WHERE lower(manufacturer_name_fallback) = lower(?)
            ORDER BY created_at, id""";

    static final String INSERT_GUITAR = """
            INSERT INTO individual_guitars (id, model_id, manufacturer_name_fallback, model_name_fallback,
                                            year_estimate, description, nickname, serial_number,
                                            production_date, production_number, significance_level,
                                            significance_notes, current_estimated_value, last_valuation_date,
                                            condition_rating, modifications, provenance_notes, created_by,
                                            created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    static final String UPDATE_GUITAR = """
            UPDATE individual_guitars
               SET model_id = ?, manufacturer_name_fallback = ?, model_name_fallback = ?, year_estimate = ?,
                   description = ?, nickname = ?, serial_number = ?, production_date = ?,
                   production_number = ?, significance_level = ?, significance_notes = ?,
                   current_estimated_value = ?, last_valuation_date = ?, condition_rating = ?,
                   modifications = ?, provenance_notes = ?, updated_at = ?
             WHERE id = ?""";
}
