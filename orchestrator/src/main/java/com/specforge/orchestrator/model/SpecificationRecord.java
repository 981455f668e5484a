package com.specforge.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A finished project specification written by the intake flow.
 *
 * The orchestrator only reads these rows; it resolves a specification
 * reference to the JSON content stored here.
 *
 * DB table: specifications  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "specifications")
public class SpecificationRecord {

    @Id
    private UUID id;

    @Column(name = "project_name", nullable = false)
    private String projectName;

    // Full specification document as JSON.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(nullable = false)
    private int version = 1;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected SpecificationRecord() {}   // required by JPA

    public SpecificationRecord(UUID id, String projectName, String content) {
        this.id          = id;
        this.projectName = projectName;
        this.content     = content;
    }

    public UUID    getId()          { return id; }
    public String  getProjectName() { return projectName; }
    public String  getContent()     { return content; }
    public int     getVersion()     { return version; }
    public Instant getCreatedAt()   { return createdAt; }
}
