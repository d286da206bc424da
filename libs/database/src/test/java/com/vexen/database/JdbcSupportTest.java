package com.vexen.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JdbcSupport")
class JdbcSupportTest {

    private PooledDatabase database;
    private JdbcSupport sql;

    @BeforeEach
    void setUp() {
        var settings = new DatabaseSettings("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", true, 1, 2);
        database = PooledDatabase.open(settings,
                new MigrationPlan("sample", "classpath:db/migration/sample", "sample_schema_history"));
        sql = database.sql();
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private void insert(UUID id, String body) {
        sql.update("INSERT INTO sample_notes (id, body, created_at) VALUES (?, ?, ?)", id, body, Instant.now());
    }

    @Test
    @DisplayName("round-trips UUID and Instant parameters")
    void bindsTypes() {
        var id = UUID.randomUUID();
        var createdAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        sql.update("INSERT INTO sample_notes (id, body, created_at) VALUES (?, ?, ?)", id, "note", createdAt);

        var read = sql.queryOne("SELECT created_at FROM sample_notes WHERE id = ?",
                rs -> JdbcSupport.instant(rs, "created_at"), id);

        assertThat(read).contains(createdAt);
    }

    @Test
    @DisplayName("queryOne() is empty when nothing matches")
    void queryOneEmpty() {
        assertThat(sql.queryOne("SELECT body FROM sample_notes WHERE id = ?", rs -> rs.getString(1), UUID.randomUUID()))
                .isEmpty();
    }

    @Test
    @DisplayName("queryOne() rejects more than one row")
    void queryOneTooMany() {
        insert(UUID.randomUUID(), "a");
        insert(UUID.randomUUID(), "b");

        assertThatThrownBy(() -> sql.queryOne("SELECT body FROM sample_notes", rs -> rs.getString(1)))
                .isInstanceOf(DataAccessException.class)
                .hasMessageContaining("at most one row");
    }

    @Test
    @DisplayName("SQL errors surface as DataAccessException")
    void sqlError() {
        assertThatThrownBy(() -> sql.update("INSERT INTO missing_table VALUES (1)"))
                .isInstanceOf(DataAccessException.class)
                .hasCauseInstanceOf(java.sql.SQLException.class);
    }

    @Test
    @DisplayName("inTransaction() commits when the work returns")
    void commits() {
        var id = UUID.randomUUID();

        sql.inTransaction(tx -> {
            tx.update("INSERT INTO sample_notes (id, body, created_at) VALUES (?, ?, ?)", id, "kept", Instant.now());
            return null;
        });

        assertThat(sql.queryOne("SELECT body FROM sample_notes WHERE id = ?", rs -> rs.getString(1), id))
                .contains("kept");
    }

    @Test
    @DisplayName("inTransaction() rolls back when the work throws")
    void rollsBack() {
        var id = UUID.randomUUID();

        assertThatThrownBy(() -> sql.inTransaction(tx -> {
            tx.update("INSERT INTO sample_notes (id, body, created_at) VALUES (?, ?, ?)", id, "lost", Instant.now());
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(sql.queryOne("SELECT body FROM sample_notes WHERE id = ?", rs -> rs.getString(1), id))
                .isEmpty();
    }
}
