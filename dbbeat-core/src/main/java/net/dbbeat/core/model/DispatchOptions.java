package net.dbbeat.core.model;

import java.time.Instant;

/** Queue-side options for one invocation. Every field is optional. */
public record DispatchOptions(
        String queue,
        Integer priority,
        Instant expires
) {
    public static final DispatchOptions NONE = new DispatchOptions(null, null, null);
}
