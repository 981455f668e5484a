package com.specforge.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Durable state of one manifest entry as it moves through the file pipeline.
 *
 * Keyed by (session_id, path). Each worker writes only its own row, so
 * concurrent workers never contend on the same record.
 *
 * DB table: file_results  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "file_results",
       uniqueConstraints = @UniqueConstraint(columnNames = {"session_id", "path"}))
public class FileResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false)
    private GenerationSession session;

    @Column(nullable = false, length = 1000)
    private String path;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FileCategory category;

    @Column(columnDefinition = "TEXT")
    private String purpose;

    // Index of the entry in the manifest; results are always read in this order.
    @Column(nullable = false)
    private int position;

    @Column(length = 50)
    private String language;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FileState state = FileState.GENERATING;

    // Current best version: the fixed content if a fix was applied.
    @Column(columnDefinition = "TEXT")
    private String content;

    // StaticAnalysisReport as JSON; null until analysis has run.
    @Column(name = "analysis", columnDefinition = "TEXT")
    private String analysisJson;

    @Column(name = "analysis_fallback", nullable = false)
    private boolean analysisFallback = false;

    @Column(name = "fix_applied", nullable = false)
    private boolean fixApplied = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "fix_outcome")
    private FixOutcome fixOutcome;

    @Column(nullable = false)
    private boolean persisted = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "publish_outcome")
    private PublishOutcome publishOutcome;

    @Column(name = "publish_revision")
    private String publishRevision;

    @Column(name = "publish_url", length = 2000)
    private String publishUrl;

    @Column(name = "published_at")
    private Instant publishedAt;

    // JSON array of messages (publish failures, fix failures, generation errors).
    @Column(name = "error_log", columnDefinition = "TEXT")
    private String errorLogJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected FileResult() {}   // required by JPA

    public FileResult(GenerationSession session, ManifestEntry entry, int position) {
        this.session  = session;
        this.path     = entry.path();
        this.category = entry.category();
        this.purpose  = entry.purpose();
        this.position = position;
        this.language = LanguageDetector.detect(entry.path());
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()               { return id; }
    public GenerationSession getSession()       { return session; }
    public String         getPath()             { return path; }
    public FileCategory   getCategory()         { return category; }
    public String         getPurpose()          { return purpose; }
    public int            getPosition()         { return position; }
    public String         getLanguage()         { return language; }
    public FileState      getState()            { return state; }
    public String         getContent()          { return content; }
    public String         getAnalysisJson()     { return analysisJson; }
    public boolean        isAnalysisFallback()  { return analysisFallback; }
    public boolean        isFixApplied()        { return fixApplied; }
    public FixOutcome     getFixOutcome()       { return fixOutcome; }
    public boolean        isPersisted()         { return persisted; }
    public PublishOutcome getPublishOutcome()   { return publishOutcome; }
    public String         getPublishRevision()  { return publishRevision; }
    public String         getPublishUrl()       { return publishUrl; }
    public Instant        getPublishedAt()      { return publishedAt; }
    public String         getErrorLogJson()     { return errorLogJson; }
    public Instant        getCreatedAt()        { return createdAt; }
    public Instant        getUpdatedAt()        { return updatedAt; }

    /**
     * Move the row forward. Backward moves are rejected so a late write from a
     * slow worker can never rewind a file that has already finished.
     */
    public void advanceTo(FileState next) {
        if (next == state) return;
        if (!state.canAdvanceTo(next)) {
            throw new IllegalStateException(
                    "File %s cannot move from %s to %s".formatted(path, state, next));
        }
        this.state = next;
    }

    public void setContent(String content)                 { this.content = content; }
    public void setAnalysisJson(String analysisJson)       { this.analysisJson = analysisJson; }
    public void setAnalysisFallback(boolean v)             { this.analysisFallback = v; }
    public void setFixApplied(boolean v)                   { this.fixApplied = v; }
    public void setFixOutcome(FixOutcome v)                { this.fixOutcome = v; }
    public void setPersisted(boolean v)                    { this.persisted = v; }
    public void setPublishOutcome(PublishOutcome v)        { this.publishOutcome = v; }
    public void setErrorLogJson(String v)                  { this.errorLogJson = v; }

    public void setPublishRecord(PublishRecord record) {
        this.publishRevision = record.revisionId();
        this.publishUrl      = record.url();
        this.publishedAt     = record.publishedAt();
    }

    public PublishRecord getPublishRecord() {
        return publishRevision == null ? null
                : new PublishRecord(publishRevision, publishUrl, publishedAt);
    }
}
