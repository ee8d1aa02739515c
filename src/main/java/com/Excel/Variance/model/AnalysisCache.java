package com.Excel.Variance.model;

import com.Excel.Variance.dto.DrillDownOutcome;
import com.Excel.Variance.dto.StructureProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Sheet selection of one session and the results derived from it: structure probes, match results and
 * drill-downs. The selection and the cache generation change together, so a loader always computes
 * against the selection its result is stored under.
 */
public class AnalysisCache {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisCache.class);

    private final String sessionId;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, StructureProbe> probes = new HashMap<>();
    private final Map<StatementType, MatchResult> matches = new HashMap<>();
    private final Map<DrillDownKey, DrillDownOutcome> drillDowns = new HashMap<>();

    private SheetSelection selection;

    // bumped on every invalidation so results computed against an old selection are not stored
    private long generation;

    public AnalysisCache(String sessionId) {
        this.sessionId = sessionId;
    }

    public SheetSelection getSelection() {
        lock.readLock().lock();
        try {
            return selection;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replace the selection and drop everything derived from the previous one.
     */
    public void select(SheetSelection selection) {
        lock.writeLock().lock();
        try {
            this.selection = selection;
            clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Probe computed by {@code loader} from the selection current when the lookup started.
     */
    public StructureProbe getProbe(ModelSide side, StatementType type, Function<SheetSelection, StructureProbe> loader) {
        return getOrCompute(probes, side + ":" + type.getKey(), loader);
    }

    /**
     * The loader must fetch the probes it matches through this cache.
     */
    public MatchResult getMatch(StatementType type, Supplier<MatchResult> loader) {
        return getOrCompute(matches, type, current -> loader.get());
    }

    public DrillDownOutcome getDrillDown(DrillDownKey key) {
        lock.readLock().lock();
        try {
            return drillDowns.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void putDrillDown(DrillDownKey key, DrillDownOutcome outcome, long expectedGeneration) {
        lock.writeLock().lock();
        try {
            if (generation == expectedGeneration) {
                drillDowns.put(key, outcome);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long getGeneration() {
        lock.readLock().lock();
        try {
            return generation;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int drillDownCount() {
        lock.readLock().lock();
        try {
            return drillDowns.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void invalidate() {
        lock.writeLock().lock();
        try {
            clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock
    private void clear() {
        generation++;
        logger.debug("Invalidating cache of session {}: {} probes, {} matches, {} drill-downs",
                sessionId, probes.size(), matches.size(), drillDowns.size());
        probes.clear();
        matches.clear();
        drillDowns.clear();
    }

    /**
     * Compute outside the lock; concurrent callers may compute the same value twice, the first store wins.
     */
    private <K, V> V getOrCompute(Map<K, V> map, K key, Function<SheetSelection, V> loader) {
        long startGeneration;
        SheetSelection snapshot;
        lock.readLock().lock();
        try {
            V cached = map.get(key);
            if (cached != null) {
                return cached;
            }
            startGeneration = generation;
            snapshot = selection;
        } finally {
            lock.readLock().unlock();
        }

        V value = loader.apply(snapshot);

        lock.writeLock().lock();
        try {
            if (generation != startGeneration) {
                return value;
            }
            V existing = map.putIfAbsent(key, value);
            return existing != null ? existing : value;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
