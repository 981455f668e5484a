package com.specforge.orchestrator.repository;

import com.specforge.orchestrator.model.SpecificationRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/** Read access to specifications produced by the intake flow. */
public interface SpecificationRepository extends JpaRepository<SpecificationRecord, UUID> {
}
