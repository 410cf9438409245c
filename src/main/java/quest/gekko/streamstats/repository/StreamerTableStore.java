package quest.gekko.streamstats.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import quest.gekko.streamstats.config.StreamStatsProperties;
import quest.gekko.streamstats.domain.AppendResult;
import quest.gekko.streamstats.domain.PeriodRow;
import quest.gekko.streamstats.util.TableNames;

import java.sql.Types;
import java.util.Collection;
import java.util.List;

import static quest.gekko.streamstats.util.TableNames.quote;

/**
 * One table per streamer, keyed by period label. Each public call runs in a single transaction
 * (one pooled connection); every statement inside it gets its own savepoint so one bad table or
 * row does not abort the rest.
 */
@Repository
@Slf4j
public class StreamerTableStore {
    private static final String DATE = quote("date");
    private static final String AVERAGE_VIEWERS = quote("average_viewers");
    private static final String STREAM_DAYS = quote("stream_days");
    private static final int[] ROW_TYPES = { Types.VARCHAR, Types.INTEGER, Types.INTEGER };

    private final JdbcTemplate jdbc;
    private final TransactionTemplate callTx;
    private final TransactionTemplate statementTx;
    private final String periodColumnType;

    public StreamerTableStore(final JdbcTemplate jdbc,
                              final PlatformTransactionManager transactionManager,
                              final StreamStatsProperties.Store store) {
        this.jdbc = jdbc;
        this.callTx = new TransactionTemplate(transactionManager);
        this.statementTx = new TransactionTemplate(transactionManager);
        this.statementTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        this.periodColumnType = TableNames.requireColumnType(
                store.periodColumnType() == null ? "TEXT" : store.periodColumnType());
    }

    /** Creates a table for every streamer that does not have one yet. Returns how many are ready. */
    public int ensureSchema(Collection<String> streamers) {
        log.info("Checking/creating tables for {} streamers...", streamers.size());
        Integer ready = callTx.execute(status -> {
            int ok = 0;
            for (String streamer : streamers) {
                try {
                    String sql = createTableSql(TableNames.forStreamer(streamer));
                    statementTx.executeWithoutResult(s -> jdbc.execute(sql));
                    ok++;
                } catch (DataAccessException | IllegalArgumentException e) {
                    log.error("Failed to create table for streamer {}: {}", streamer, e.getMessage());
                }
            }
            return ok;
        });
        log.info("All streamer tables ready ({} of {}).", ready, streamers.size());
        return ready == null ? 0 : ready;
    }

    /** Inserts rows whose period label is not stored yet; existing rows are never overwritten. */
    public AppendResult appendRecords(String tableName, List<PeriodRow> rows) {
        if (rows.isEmpty()) return AppendResult.EMPTY;
        String sql = "INSERT INTO " + quote(tableName) + " (" + DATE + ", " + AVERAGE_VIEWERS + ", " + STREAM_DAYS + ")"
                + " VALUES (?, ?, ?) ON CONFLICT DO NOTHING";

        AppendResult result = callTx.execute(status -> {
            int inserted = 0, skipped = 0, failed = 0;
            for (PeriodRow row : rows) {
                try {
                    Object[] args = { row.periodLabel(), row.averageViewers(), row.streamDays() };
                    Integer count = statementTx.execute(s -> jdbc.update(sql, args, ROW_TYPES));
                    if (count != null && count > 0) inserted++; else skipped++;
                } catch (DataAccessException e) {
                    failed++;
                    log.error("Error inserting line {} into {}: {}", row, tableName, e.getMessage());
                }
            }
            return new AppendResult(inserted, skipped, failed);
        });
        log.debug("Appended to {}: {}", tableName, result);
        return result == null ? AppendResult.EMPTY : result;
    }

    public List<PeriodRow> findRecords(String tableName) {
        return jdbc.query(
                "SELECT " + DATE + ", " + AVERAGE_VIEWERS + ", " + STREAM_DAYS + " FROM " + quote(tableName) + " ORDER BY " + DATE,
                (rs, i) -> new PeriodRow(rs.getString(1), rs.getObject(2, Integer.class), rs.getObject(3, Integer.class)));
    }

    private String createTableSql(String tableName) {
        return "CREATE TABLE IF NOT EXISTS " + quote(tableName) + " ("
                + DATE + " " + periodColumnType + " PRIMARY KEY, "
                + AVERAGE_VIEWERS + " INTEGER, "
                + STREAM_DAYS + " INTEGER)";
    }
}
