package dao.sol.bundler.repository;

import dao.sol.bundler.model.SessionSummary;

import java.util.List;
import java.util.Optional;

public interface SessionRepository {

    void save(SessionSummary summary);

    List<SessionSummary> findAll();

    Optional<SessionSummary> findBySessionId(String sessionId);
}
