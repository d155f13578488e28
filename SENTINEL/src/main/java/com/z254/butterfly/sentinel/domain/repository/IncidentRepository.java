package com.z254.butterfly.sentinel.domain.repository;

import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.domain.model.IncidentStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for incident persistence.
 */
public interface IncidentRepository {

    /**
     * Persist the given incident. Existing incidents are replaced.
     */
    Incident save(Incident incident);

    Optional<Incident> findById(String id);

    List<Incident> findAll();

    /**
     * Incidents currently in one of the given states.
     */
    List<Incident> findByStatusIn(List<IncidentStatus> statuses);

    void delete(String id);
}
