package net.tessera.core.spi;

import net.tessera.core.model.InstigatorState;
import net.tessera.core.model.InstigatorTick;
import net.tessera.core.model.TickData;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface InstigatorRepository {
    List<InstigatorState> findAll() throws Exception;

    Optional<InstigatorState> find(String originId) throws Exception;

    void insert(InstigatorState state, Instant now) throws Exception;

    /** Returns false when no state exists for the origin id. */
    boolean update(InstigatorState state, Instant now) throws Exception;

    boolean delete(String originId) throws Exception;

    long insertTick(TickData tick) throws Exception;

    boolean updateTick(InstigatorTick tick) throws Exception;

    Optional<InstigatorTick> findTick(long tickId) throws Exception;

    /** Most recent first; {@code beforeTickId} is an exclusive upper bound, null for the newest page. */
    List<InstigatorTick> findTicks(String originId, Long beforeTickId, int limit) throws Exception;
}
