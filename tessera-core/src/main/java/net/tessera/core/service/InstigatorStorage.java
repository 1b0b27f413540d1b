package net.tessera.core.service;

import net.tessera.core.error.InstigatorNotFoundException;
import net.tessera.core.error.InvariantViolationException;
import net.tessera.core.error.TickNotFoundException;
import net.tessera.core.migration.SchemaMigrator;
import net.tessera.core.model.InstigatorState;
import net.tessera.core.model.InstigatorTick;
import net.tessera.core.model.TickData;
import net.tessera.core.model.TickStatus;
import net.tessera.core.spi.Clock;
import net.tessera.core.spi.InstigatorRepository;
import net.tessera.core.spi.TxRunner;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Schedule and sensor state with the history of their evaluation ticks. */
public final class InstigatorStorage {

    private final InstigatorRepository instigators;
    private final SchemaMigrator migrator;
    private final TxRunner tx;
    private final Clock clock;

    public InstigatorStorage(InstigatorRepository instigators, SchemaMigrator migrator, TxRunner tx, Clock clock) {
        this.instigators = instigators;
        this.migrator = migrator;
        this.tx = tx;
        this.clock = clock;
    }

    public SchemaMigrator migrator() { return migrator; }

    public List<InstigatorState> allInstigatorState() throws Exception {
        return tx.required(instigators::findAll);
    }

    public Optional<InstigatorState> getInstigatorState(String originId) throws Exception {
        return tx.required(() -> instigators.find(originId));
    }

    public InstigatorState addInstigatorState(InstigatorState state) throws Exception {
        return tx.required(() -> {
            migrator.requireWritable();
            if (instigators.find(state.originId()).isPresent()) {
                throw new InvariantViolationException("Instigator " + state.originId() + " already exists");
            }
            instigators.insert(state, clock.now());
            return state;
        });
    }

    /** @throws InstigatorNotFoundException when no state exists for the origin id */
    public InstigatorState updateInstigatorState(InstigatorState state) throws Exception {
        return tx.required(() -> {
            migrator.requireWritable();
            if (!instigators.update(state, clock.now())) throw new InstigatorNotFoundException(state.originId());
            return state;
        });
    }

    public boolean deleteInstigatorState(String originId) throws Exception {
        return tx.required(() -> {
            migrator.requireWritable();
            return instigators.delete(originId);
        });
    }

    public InstigatorTick createTick(TickData tick) throws Exception {
        return tx.required(() -> {
            migrator.requireWritable();
            long id = instigators.insertTick(tick);
            return new InstigatorTick(id, tick);
        });
    }

    /**
     * Persists a tick's new data. Only a {@code STARTED} tick may change, and it keeps its origin and
     * start timestamp.
     */
    public InstigatorTick updateTick(InstigatorTick tick) throws Exception {
        return tx.required(() -> {
            migrator.requireWritable();
            InstigatorTick stored = instigators.findTick(tick.tickId())
                    .orElseThrow(() -> new TickNotFoundException(tick.tickId()));
            checkTransition(stored.tickData(), tick.tickData());
            instigators.updateTick(tick);
            return tick;
        });
    }

    public Optional<InstigatorTick> getTick(long tickId) throws Exception {
        return tx.required(() -> instigators.findTick(tickId));
    }

    /** Most recent first. {@code cursor} is the tick id to page below, null for the newest page. */
    public List<InstigatorTick> getTicks(String originId, Long cursor, int limit) throws Exception {
        return tx.required(() -> instigators.findTicks(originId, cursor, limit));
    }

    public Optional<InstigatorTick> getLatestTick(String originId) throws Exception {
        return getTicks(originId, null, 1).stream().findFirst();
    }

    private static void checkTransition(TickData stored, TickData next) {
        if (stored.equals(next)) return;
        if (stored.status().isTerminal()) {
            throw new InvariantViolationException("Tick of " + stored.originId() + " is already "
                    + stored.status() + " and cannot change");
        }
        if (!Objects.equals(stored.originId(), next.originId()) || stored.timestamp() != next.timestamp()) {
            throw new InvariantViolationException("Tick origin and start timestamp cannot change");
        }
        if (next.status() == TickStatus.STARTED && next.endTimestamp() != null) {
            throw new InvariantViolationException("A started tick has no end timestamp");
        }
    }
}
