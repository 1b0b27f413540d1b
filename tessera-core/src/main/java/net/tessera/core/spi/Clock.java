package net.tessera.core.spi;

import java.time.Instant;

public interface Clock {
    Instant now();

    static Clock system() {
        return Instant::now;
    }

    /** Epoch seconds with sub-second precision, the unit of event and tick timestamps. */
    default double epochSeconds() {
        Instant now = now();
        return now.getEpochSecond() + now.getNano() / 1_000_000_000.0;
    }
}
