package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to the {@code load_state} table, one row per target table.
 */
public class LoadStateRepository {

    static final String TABLE = "load_state";
    private static final String[] COLUMNS =
        {"target_table", "source_file", "source_size", "committed_rows", "status", "updated_at"};

    private static final RowMapper<LoadState> ROW_MAPPER = (rs, n) -> {
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new LoadState(
            rs.getString("target_table"),
            rs.getString("source_file"),
            rs.getLong("source_size"),
            rs.getLong("committed_rows"),
            LoadStatus.valueOf(rs.getString("status")),
            updatedAt == null ? null : updatedAt.toInstant()
        );
    };

    private final JdbcTemplate jdbc;
    private final String upsertSql;

    public LoadStateRepository(JdbcTemplate jdbc, StoreDialect dialect) {
        this.jdbc = jdbc;
        this.upsertSql = dialect.upsertSql(TABLE, COLUMNS, "target_table");
    }

    public void createTable() {
        jdbc.execute("CREATE TABLE IF NOT EXISTS " + TABLE + " ("
            + "target_table VARCHAR(64) NOT NULL PRIMARY KEY, "
            + "source_file VARCHAR(1024), "
            + "source_size BIGINT NOT NULL, "
            + "committed_rows BIGINT NOT NULL, "
            + "status VARCHAR(16) NOT NULL, "
            + "updated_at TIMESTAMP)");
    }

    public Optional<LoadState> find(String targetTable) {
        List<LoadState> rows = jdbc.query("SELECT * FROM " + TABLE + " WHERE target_table = ?", ROW_MAPPER, targetTable);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public void save(LoadState state) {
        jdbc.update(upsertSql,
            state.targetTable(), state.sourceFile(), state.sourceSize(), state.committedRows(),
            state.status().name(), state.updatedAt() == null ? null : Timestamp.from(state.updatedAt()));
    }

    public void delete(String targetTable) {
        jdbc.update("DELETE FROM " + TABLE + " WHERE target_table = ?", targetTable);
    }
}
