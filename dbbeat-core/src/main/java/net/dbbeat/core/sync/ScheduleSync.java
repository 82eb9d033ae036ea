package net.dbbeat.core.sync;

import net.dbbeat.core.service.JobEntry;
import net.dbbeat.core.spi.ChangeMarkerRepository;
import net.dbbeat.core.spi.PeriodicJobRepository;
import net.dbbeat.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Keeps one scheduler's in-memory table in step with the database.
 *
 * <ul>
 *   <li>change detection: compares the shared change-marker row with the value
 *       cached at the last check;</li>
 *   <li>deferred writes: names of entries whose run statistics changed in
 *       memory are collected and written back in one {@link #flush} pass.</li>
 * </ul>
 *
 * Not thread-safe; owned by the scheduler loop.
 */
public final class ScheduleSync {
    private static final Logger log = LoggerFactory.getLogger(ScheduleSync.class);

    private final ChangeMarkerRepository markers;
    private final PeriodicJobRepository jobs;
    private final TxRunner tx;

    private final Set<String> dirty = new LinkedHashSet<>();
    private Instant baseline;

    public ScheduleSync(ChangeMarkerRepository markers, PeriodicJobRepository jobs, TxRunner tx) {
        this.markers = markers;
        this.jobs = jobs;
        this.tx = tx;
    }

    /**
     * Reads the live marker and moves the cached baseline to it, changed or not.
     * A read failure counts as "unchanged" and is retried on the next call.
     */
    public boolean hasChanged() {
        final Instant live;
        try {
            live = tx.required(() -> markers.lastUpdate().orElse(null));
        } catch (Exception e) {
            log.warn("change marker could not be read, assuming unchanged: {}", e.toString());
            return false;
        }
        boolean changed = live != null && (baseline == null || live.isAfter(baseline));
        if (live != null) baseline = live;
        return changed;
    }

    /** Reads the marker and makes it the new baseline. Called right before a reload. */
    public Instant captureBaseline() throws Exception {
        baseline = tx.required(() -> markers.lastUpdate().orElse(null));
        return baseline;
    }

    public Instant baseline() {
        return baseline;
    }

    public void markDirty(String name) {
        dirty.add(name);
    }

    public boolean isDirty(String name) {
        return dirty.contains(name);
    }

    public int dirtyCount() {
        return dirty.size();
    }

    public Set<String> dirtyNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(dirty));
    }

    /**
     * Writes last-fired/fire-count of every dirty entry. A failed write keeps
     * its name dirty for the next pass and does not stop the others; names no
     * longer in {@code table} are dropped.
     *
     * @return number of rows written
     */
    public int flush(Map<String, JobEntry> table) {
        if (dirty.isEmpty()) return 0;
        log.debug("syncing {} dirty periodic job(s)", dirty.size());

        int saved = 0;
        for (String name : new ArrayList<>(dirty)) {
            JobEntry entry = table.get(name);
            if (entry == null) {
                dirty.remove(name);
                continue;
            }
            try {
                boolean found = tx.required(() ->
                        jobs.saveRunStats(name, entry.lastFiredAt(), entry.totalFireCount()));
                dirty.remove(name);
                if (found) {
                    saved++;
                } else {
                    log.debug("periodic job '{}' no longer exists, dropping its run stats", name);
                }
            } catch (Exception e) {
                log.error("run stats of '{}' not saved, retrying on next sync: {}", name, e.toString());
            }
        }
        return saved;
    }
}
