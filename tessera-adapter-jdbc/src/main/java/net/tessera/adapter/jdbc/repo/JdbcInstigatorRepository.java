package net.tessera.adapter.jdbc.repo;

import net.tessera.adapter.jdbc.JdbcUtil;
import net.tessera.adapter.jdbc.TxContext;
import net.tessera.adapter.jdbc.mapper.RowMappers;
import net.tessera.core.model.InstigatorState;
import net.tessera.core.model.InstigatorTick;
import net.tessera.core.model.TickData;
import net.tessera.core.serdes.Serdes;
import net.tessera.core.spi.InstigatorRepository;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcInstigatorRepository implements InstigatorRepository {
    private static final String TICK_COLUMNS = "id, instigator_type, tick_body";

    private final DataSource ds;
    private final Serdes serdes;

    public JdbcInstigatorRepository(DataSource ds, Serdes serdes) {
        this.ds = ds;
        this.serdes = serdes;
    }

    private Connection mustConn() {
        return TxContext.require(ds);
    }

    @Override
    public List<InstigatorState> findAll() throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT instigator_type, instigator_body FROM instigators ORDER BY id");
             ResultSet rs = ps.executeQuery()) {
            List<InstigatorState> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toInstigatorState(rs, serdes));
            return out;
        }
    }

    @Override
    public Optional<InstigatorState> find(String originId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT instigator_type, instigator_body FROM instigators WHERE origin_id = ?")) {
            ps.setString(1, originId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(RowMappers.toInstigatorState(rs, serdes));
                return Optional.empty();
            }
        }
    }

    @Override
    public void insert(InstigatorState state, Instant now) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                INSERT INTO instigators (origin_id, instigator_type, status, instigator_body,
                                         create_timestamp, update_timestamp)
                VALUES (?, ?, ?, ?, ?, ?)
                """
        )) {
            ps.setString(1, state.originId());
            ps.setString(2, state.instigatorType().name());
            ps.setString(3, state.status().name());
            ps.setString(4, serdes.serialize(state));
            ps.setLong(5, JdbcUtil.millis(now));
            ps.setLong(6, JdbcUtil.millis(now));
            ps.executeUpdate();
        }
    }

    @Override
    public boolean update(InstigatorState state, Instant now) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                UPDATE instigators
                   SET instigator_type = ?,
                       status = ?,
                       instigator_body = ?,
                       update_timestamp = ?
                 WHERE origin_id = ?
                """
        )) {
            ps.setString(1, state.instigatorType().name());
            ps.setString(2, state.status().name());
            ps.setString(3, serdes.serialize(state));
            ps.setLong(4, JdbcUtil.millis(now));
            ps.setString(5, state.originId());
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public boolean delete(String originId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("DELETE FROM instigators WHERE origin_id = ?")) {
            ps.setString(1, originId);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public long insertTick(TickData tick) throws Exception {
        Connection c = mustConn();
        try (PreparedStatement ps = c.prepareStatement(
                """
                INSERT INTO ticks (origin_id, instigator_type, status, timestamp, end_timestamp, tick_body)
                VALUES (?, ?, ?, ?, ?, ?)
                """
        )) {
            ps.setString(1, tick.originId());
            ps.setString(2, tick.instigatorType().name());
            ps.setString(3, tick.status().name());
            ps.setDouble(4, tick.timestamp());
            JdbcUtil.setDouble(ps, 5, tick.endTimestamp());
            ps.setString(6, serdes.serialize(tick));
            ps.executeUpdate();
        }
        return JdbcUtil.lastInsertId(c);
    }

    @Override
    public boolean updateTick(InstigatorTick tick) throws Exception {
        TickData data = tick.tickData();
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                UPDATE ticks
                   SET status = ?,
                       end_timestamp = ?,
                       tick_body = ?
                 WHERE id = ?
                """
        )) {
            ps.setString(1, data.status().name());
            JdbcUtil.setDouble(ps, 2, data.endTimestamp());
            ps.setString(3, serdes.serialize(data));
            ps.setLong(4, tick.tickId());
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public Optional<InstigatorTick> findTick(long tickId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT " + TICK_COLUMNS + " FROM ticks WHERE id = ?")) {
            ps.setLong(1, tickId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(RowMappers.toInstigatorTick(rs, serdes));
                return Optional.empty();
            }
        }
    }

    @Override
    public List<InstigatorTick> findTicks(String originId, Long beforeTickId, int limit) throws Exception {
        StringBuilder sql = new StringBuilder("SELECT " + TICK_COLUMNS + " FROM ticks WHERE origin_id = ?");
        if (beforeTickId != null) sql.append(" AND id < ?");
        sql.append(" ORDER BY id DESC");
        if (limit > 0) sql.append(" LIMIT ").append(limit);
        try (PreparedStatement ps = mustConn().prepareStatement(sql.toString())) {
            ps.setString(1, originId);
            if (beforeTickId != null) ps.setLong(2, beforeTickId);
            try (ResultSet rs = ps.executeQuery()) {
                List<InstigatorTick> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toInstigatorTick(rs, serdes));
                return out;
            }
        }
    }
}
