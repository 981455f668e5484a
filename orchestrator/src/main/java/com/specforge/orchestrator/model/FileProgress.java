package com.specforge.orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A worker's in-memory view of the file it is building.
 *
 * Owned by exactly one worker thread; the store copies it into the
 * FileResult row on every persisted transition.
 */
public class FileProgress {

    private final ManifestEntry entry;
    private final int           position;

    private FileState            state = FileState.GENERATING;
    private String               content;
    private StaticAnalysisReport analysis;
    private boolean              analysisFallback;
    private boolean              fixApplied;
    private FixOutcome           fixOutcome;
    private boolean              persisted;
    private PublishOutcome       publishOutcome;
    private PublishRecord        publishRecord;
    private final List<String>   errors = new ArrayList<>();

    public FileProgress(ManifestEntry entry, int position) {
        this.entry    = entry;
        this.position = position;
    }

    public ManifestEntry        entry()            { return entry; }
    public String               path()             { return entry.path(); }
    public int                  position()         { return position; }
    public FileState            state()            { return state; }
    public String               content()          { return content; }
    public StaticAnalysisReport analysis()         { return analysis; }
    public boolean              analysisFallback() { return analysisFallback; }
    public boolean              fixApplied()       { return fixApplied; }
    public FixOutcome           fixOutcome()       { return fixOutcome; }
    public boolean              persisted()        { return persisted; }
    public PublishOutcome       publishOutcome()   { return publishOutcome; }
    public PublishRecord        publishRecord()    { return publishRecord; }
    public List<String>         errors()           { return Collections.unmodifiableList(errors); }

    public void advanceTo(FileState next) {
        if (next == state) return;
        if (!state.canAdvanceTo(next)) {
            throw new IllegalStateException(
                    "File %s cannot move from %s to %s".formatted(entry.path(), state, next));
        }
        this.state = next;
    }

    public void setContent(String content)           { this.content = content; }
    public void setPersisted(boolean persisted)      { this.persisted = persisted; }
    public void setPublishOutcome(PublishOutcome o)  { this.publishOutcome = o; }
    public void setPublishRecord(PublishRecord r)    { this.publishRecord = r; }
    public void addError(String message)             { this.errors.add(message); }

    public void setAnalysis(StaticAnalysisReport analysis, boolean fallback) {
        this.analysis         = analysis;
        this.analysisFallback = fallback;
    }

    public void setFixOutcome(FixOutcome outcome) {
        this.fixOutcome = outcome;
        this.fixApplied = outcome == FixOutcome.APPLIED;
    }
}
