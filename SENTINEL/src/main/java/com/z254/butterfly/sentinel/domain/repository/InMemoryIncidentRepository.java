package com.z254.butterfly.sentinel.domain.repository;

import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.domain.model.IncidentStatus;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory incident store. Incidents live for the lifetime of the process.
 */
@Repository
public class InMemoryIncidentRepository implements IncidentRepository {

    private final Map<String, Incident> store = new ConcurrentHashMap<>();

    @Override
    public Incident save(Incident incident) {
        store.put(incident.getId(), incident);
        return incident;
    }

    @Override
    public Optional<Incident> findById(String id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public List<Incident> findAll() {
        return new ArrayList<>(store.values());
    }

    @Override
    public List<Incident> findByStatusIn(List<IncidentStatus> statuses) {
        return store.values().stream()
                .filter(incident -> statuses.contains(incident.getStatus()))
                .toList();
    }

    @Override
    public void delete(String id) {
        store.remove(id);
    }
}
