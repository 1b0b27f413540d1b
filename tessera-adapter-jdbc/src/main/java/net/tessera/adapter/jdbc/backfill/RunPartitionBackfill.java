package net.tessera.adapter.jdbc.backfill;

import net.tessera.adapter.jdbc.TxContext;
import net.tessera.core.backfill.BatchResult;
import net.tessera.core.backfill.IndexBackfill;
import net.tessera.core.backfill.SecondaryIndexes;
import net.tessera.core.model.RunTags;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Copies the reserved partition tags of each run into its indexed partition columns. */
public final class RunPartitionBackfill implements IndexBackfill {
    private final DataSource ds;

    public RunPartitionBackfill(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public String indexName() {
        return SecondaryIndexes.RUN_PARTITIONS;
    }

    @Override
    public BatchResult processBatch(long afterRowId, int batchSize) throws Exception {
        Connection c = TxContext.require(ds);
        List<Object[]> rows = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                """
                SELECT r.id,
                       (SELECT t.tag_value FROM run_tags t WHERE t.run_id = r.run_id AND t.tag_key = ?) AS p_key,
                       (SELECT t.tag_value FROM run_tags t WHERE t.run_id = r.run_id AND t.tag_key = ?) AS p_set,
                       r.partition_key, r.partition_set
                  FROM runs r
                 WHERE r.id > ?
                 ORDER BY r.id
                 LIMIT ?
                """
        )) {
            ps.setString(1, RunTags.PARTITION);
            ps.setString(2, RunTags.PARTITION_SET);
            ps.setLong(3, afterRowId);
            ps.setInt(4, batchSize);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new Object[]{rs.getLong(1), rs.getString(2), rs.getString(3),
                            rs.getString(4), rs.getString(5)});
                }
            }
        }
        if (rows.isEmpty()) return BatchResult.empty(afterRowId);

        int updated = 0;
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE runs SET partition_key = ?, partition_set = ? WHERE id = ?")) {
            for (Object[] row : rows) {
                String key = (String) row[1];
                String set = (String) row[2];
                if (Objects.equals(key, row[3]) && Objects.equals(set, row[4])) continue;
                ps.setString(1, key);
                ps.setString(2, set);
                ps.setLong(3, (Long) row[0]);
                ps.addBatch();
                updated++;
            }
            if (updated > 0) ps.executeBatch();
        }
        long last = (Long) rows.get(rows.size() - 1)[0];
        return new BatchResult(last, rows.size(), updated, 0);
    }
}
