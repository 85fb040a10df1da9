package com.acme.reconcile.service;

import com.acme.reconcile.domain.ReconciliationRunEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for persisted reconciliation runs.
 */
@Repository
public interface ReconciliationRunRepository extends JpaRepository<ReconciliationRunEntity, String> {

    /**
     * Finds runs with a given status, newest first.
     *
     * @param status PENDING, AWAITING_APPROVAL, COMPLETED or FAILED
     */
    List<ReconciliationRunEntity> findByStatusOrderByCreatedAtDesc(String status);
}
