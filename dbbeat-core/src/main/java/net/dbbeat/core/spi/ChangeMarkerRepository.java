package net.dbbeat.core.spi;

import java.time.Instant;
import java.util.Optional;

/** Singleton "something changed" row (ID = 1). */
public interface ChangeMarkerRepository {
    Optional<Instant> lastUpdate() throws Exception;

    /** Moves the marker to {@code now}, creating the row if it is missing. */
    Instant touch(Instant now) throws Exception;
}
