package com.specforge.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One end-to-end generation run for a specification.
 *
 * A Session owns an ordered list of FileResults: one per manifest entry.
 * Only the orchestrator mutates this row; workers write their own
 * FileResult rows.
 *
 * DB table: generation_sessions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "generation_sessions")
public class GenerationSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Full specification as JSON. Never updated after the row is created.
    @Column(name = "specification", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String specificationJson;

    // Id of the stored specification this run was started from (null when inline).
    @Column(name = "specification_ref", updatable = false)
    private String specificationRef;

    @Column(name = "frontend_tech")
    private String frontendTech;

    @Column(name = "backend_tech")
    private String backendTech;

    @Column(name = "database_tech")
    private String databaseTech;

    // Publish target: all three null when the session only generates.
    @Column(name = "publish_owner")
    private String publishOwner;

    @Column(name = "publish_repository")
    private String publishRepository;

    @Column(name = "publish_branch")
    private String publishBranch;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SessionStatus status = SessionStatus.PENDING;

    // Null until the analyzer has produced a manifest.
    @Column(name = "manifest", columnDefinition = "TEXT")
    private String manifestJson;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // JSON array of per-file warnings collected during aggregation.
    @Column(name = "warnings", columnDefinition = "TEXT")
    private String warningsJson;

    @Column(name = "model_used")
    private String modelUsed;

    @Column(name = "files_generated")
    private Integer filesGenerated;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @OneToMany(mappedBy = "session", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("position ASC")
    private List<FileResult> results = new ArrayList<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected GenerationSession() {}   // required by JPA

    public GenerationSession(String specificationJson,
                             String specificationRef,
                             TargetConfig target,
                             PublishTarget publishTarget,
                             String modelUsed) {
        this.specificationJson = specificationJson;
        this.specificationRef  = specificationRef;
        this.frontendTech      = target.frontend();
        this.backendTech       = target.backend();
        this.databaseTech      = target.database();
        if (publishTarget != null) {
            this.publishOwner      = publishTarget.owner();
            this.publishRepository = publishTarget.repository();
            this.publishBranch     = publishTarget.branch();
        }
        this.modelUsed = modelUsed;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()                { return id; }
    public String        getSpecificationJson() { return specificationJson; }
    public String        getSpecificationRef()  { return specificationRef; }
    public SessionStatus getStatus()            { return status; }
    public String        getManifestJson()      { return manifestJson; }
    public String        getErrorMessage()      { return errorMessage; }
    public String        getWarningsJson()      { return warningsJson; }
    public String        getModelUsed()         { return modelUsed; }
    public Integer       getFilesGenerated()    { return filesGenerated; }
    public Instant       getCreatedAt()         { return createdAt; }
    public Instant       getUpdatedAt()         { return updatedAt; }
    public Instant       getCompletedAt()       { return completedAt; }
    public List<FileResult> getResults()        { return results; }

    public TargetConfig getTargetConfig() {
        return new TargetConfig(frontendTech, backendTech, databaseTech);
    }

    /** Null when the session does not publish. */
    public PublishTarget getPublishTarget() {
        if (publishOwner == null || publishRepository == null) return null;
        return new PublishTarget(publishOwner, publishRepository, publishBranch);
    }

    public void setStatus(SessionStatus status)        { this.status = status; }
    public void setManifestJson(String manifestJson)   { this.manifestJson = manifestJson; }
    public void setErrorMessage(String errorMessage)   { this.errorMessage = errorMessage; }
    public void setWarningsJson(String warningsJson)   { this.warningsJson = warningsJson; }
    public void setFilesGenerated(Integer v)           { this.filesGenerated = v; }
}
