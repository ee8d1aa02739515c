package com.Excel.Variance.repository;

import com.Excel.Variance.model.AnalysisSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory session store. Sessions are not persisted and disappear on restart.
 */
@Repository
public class AnalysisSessionRepository {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisSessionRepository.class);

    private final Map<String, AnalysisSession> sessions = new ConcurrentHashMap<>();

    public AnalysisSession save(AnalysisSession session) {
        sessions.put(session.getId(), session);
        return session;
    }

    public Optional<AnalysisSession> findById(String id) {
        return Optional.ofNullable(id).map(sessions::get);
    }

    public boolean deleteById(String id) {
        return sessions.remove(id) != null;
    }

    public int count() {
        return sessions.size();
    }

    /**
     * Remove sessions not accessed since {@code cutoff}; returns their ids.
     */
    public List<String> removeIdleSince(Instant cutoff) {
        List<String> removed = new ArrayList<>();
        sessions.values().removeIf(session -> {
            if (session.getLastAccessed().isBefore(cutoff)) {
                removed.add(session.getId());
                return true;
            }
            return false;
        });
        if (!removed.isEmpty()) {
            logger.info("Removed {} idle sessions", removed.size());
        }
        return removed;
    }
}
