package net.tessera.core.model;

import java.util.Objects;

public record InstigatorTick(long tickId, TickData tickData) {
    public InstigatorTick {
        Objects.requireNonNull(tickData, "tickData");
    }

    public String originId() { return tickData.originId(); }

    public TickStatus status() { return tickData.status(); }

    public double timestamp() { return tickData.timestamp(); }

    public Double endTimestamp() { return tickData.endTimestamp(); }

    public InstigatorTick withData(TickData next) {
        return new InstigatorTick(tickId, next);
    }
}
