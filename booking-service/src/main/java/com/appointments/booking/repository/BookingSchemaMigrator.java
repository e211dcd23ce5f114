package com.appointments.booking.repository;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brings the bookings table up to date at startup. Changes are additive: missing columns
 * are added and backfilled, nothing is dropped or rewritten.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BookingSchemaMigrator {

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS bookings (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                nome TEXT NOT NULL,
                cognome TEXT NOT NULL,
                telefono TEXT NOT NULL,
                email TEXT NOT NULL,
                data_ora TEXT,
                data TEXT,
                ora TEXT,
                note TEXT,
                status TEXT DEFAULT 'booked',
                token TEXT,
                created_at TEXT NOT NULL,
                canceled_at TEXT,
                attended INTEGER NOT NULL DEFAULT 0,
                paid INTEGER NOT NULL DEFAULT 0,
                thanked_at TEXT
            )
            """;

    private static final Map<String, String> OPTIONAL_COLUMNS = new LinkedHashMap<>();

    static {
        OPTIONAL_COLUMNS.put("data_ora", "TEXT");
        OPTIONAL_COLUMNS.put("data", "TEXT");
        OPTIONAL_COLUMNS.put("ora", "TEXT");
        OPTIONAL_COLUMNS.put("note", "TEXT");
        OPTIONAL_COLUMNS.put("status", "TEXT DEFAULT 'booked'");
        OPTIONAL_COLUMNS.put("token", "TEXT");
        OPTIONAL_COLUMNS.put("canceled_at", "TEXT");
        OPTIONAL_COLUMNS.put("attended", "INTEGER NOT NULL DEFAULT 0");
        OPTIONAL_COLUMNS.put("paid", "INTEGER NOT NULL DEFAULT 0");
        OPTIONAL_COLUMNS.put("thanked_at", "TEXT");
    }

    private static final List<String> BACKFILLS = List.of(
            "UPDATE bookings SET status = 'booked' WHERE status IS NULL",
            "UPDATE bookings SET note = '' WHERE note IS NULL");

    private static final List<String> INDEXES = List.of(
            "CREATE UNIQUE INDEX IF NOT EXISTS ux_bookings_token ON bookings(token)",
            "CREATE UNIQUE INDEX IF NOT EXISTS ux_bookings_booked_slot ON bookings(data, ora) WHERE status = 'booked'");

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void migrate() {
        jdbcTemplate.execute(CREATE_TABLE);

        Set<String> columns = existingColumns();
        OPTIONAL_COLUMNS.forEach((name, definition) -> {
            if (!columns.contains(name)) {
                log.info("Adding missing column bookings.{}", name);
                jdbcTemplate.execute("ALTER TABLE bookings ADD COLUMN " + name + " " + definition);
            }
        });

        BACKFILLS.forEach(sql -> {
            int updated = jdbcTemplate.update(sql);
            if (updated > 0) {
                log.info("Backfilled {} rows: {}", updated, sql);
            }
        });

        for (String ddl : INDEXES) {
            try {
                jdbcTemplate.execute(ddl);
            } catch (DataAccessException e) {
                // legacy duplicates block the index; inserts still go through the existence check
                log.warn("Could not create index, existing rows conflict: {} ({})", ddl, e.getMessage());
            }
        }

        log.info("Bookings schema ready");
    }

    Set<String> existingColumns() {
        return new HashSet<>(jdbcTemplate.query("PRAGMA table_info(bookings)",
                (rs, rowNum) -> rs.getString("name")));
    }
}
