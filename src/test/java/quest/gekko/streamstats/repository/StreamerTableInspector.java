package quest.gekko.streamstats.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import quest.gekko.streamstats.domain.PeriodRow;
import quest.gekko.streamstats.util.TableNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

import static quest.gekko.streamstats.util.TableNames.quote;

/**
 * Read-back helper for tests: lists streamer tables, samples a random stored row and checks
 * that a given row is present.
 */
public class StreamerTableInspector {
    private final JdbcTemplate jdbc;
    private final Random random;

    public StreamerTableInspector(JdbcTemplate jdbc, Random random) {
        this.jdbc = jdbc;
        this.random = random;
    }

    public List<String> tables() {
        return jdbc.queryForList(
                        "SELECT table_name FROM information_schema.tables WHERE table_name LIKE 'streamer%' ORDER BY table_name",
                        String.class).stream()
                .filter(name -> name.startsWith(TableNames.PREFIX))
                .toList();
    }

    public List<PeriodRow> rows(String table) {
        return jdbc.query("SELECT \"date\", \"average_viewers\", \"stream_days\" FROM " + quote(table) + " ORDER BY \"date\"",
                (rs, i) -> new PeriodRow(rs.getString(1), rs.getObject(2, Integer.class), rs.getObject(3, Integer.class)));
    }

    public int count(String table, String periodLabel) {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM " + quote(table) + " WHERE \"date\" = ?", Integer.class, periodLabel);
        return n == null ? 0 : n;
    }

    public Optional<Map.Entry<String, PeriodRow>> randomRow() {
        List<Map.Entry<String, PeriodRow>> all = new ArrayList<>();
        for (String table : tables()) {
            rows(table).forEach(row -> all.add(Map.entry(table, row)));
        }
        if (all.isEmpty()) return Optional.empty();
        return Optional.of(all.get(random.nextInt(all.size())));
    }

    public boolean contains(String table, PeriodRow row) {
        return rows(table).stream().anyMatch(stored -> Objects.equals(stored, row));
    }
}
