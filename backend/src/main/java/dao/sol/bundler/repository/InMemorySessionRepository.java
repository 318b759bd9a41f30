package dao.sol.bundler.repository;

import dao.sol.bundler.model.SessionSummary;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemorySessionRepository implements SessionRepository {

    // key: sessionId
    private final Map<String, SessionSummary> sessions = new ConcurrentHashMap<>();

    @Override
    public void save(SessionSummary summary) {
        sessions.put(summary.sessionId(), summary);
    }

    @Override
    public List<SessionSummary> findAll() {
        List<SessionSummary> all = new ArrayList<>(sessions.values());
        all.sort(Comparator.comparingLong(SessionSummary::startedAt));
        return all;
    }

    @Override
    public Optional<SessionSummary> findBySessionId(String sessionId) {
        if (sessionId == null) return Optional.empty();
        return Optional.ofNullable(sessions.get(sessionId));
    }
}
