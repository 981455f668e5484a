package com.specforge.orchestrator.pipeline;

import com.specforge.orchestrator.model.FixOutcome;
import com.specforge.orchestrator.model.PublishOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * All worker outcomes for one session, in manifest order, plus the
 * warnings worth surfacing on the session itself.
 */
public record AggregateResult(List<FileOutcome> outcomes) {

    public AggregateResult {
        outcomes = List.copyOf(outcomes);
    }

    public int succeeded() {
        return (int) outcomes.stream().filter(FileOutcome::isDone).count();
    }

    public int errored() {
        return (int) outcomes.stream().filter(FileOutcome::isErrored).count();
    }

    /** True only for a non-empty result in which every file ended ERRORED. */
    public boolean allErrored() {
        return !outcomes.isEmpty() && errored() == outcomes.size();
    }

    public boolean anyCancelled() {
        return outcomes.stream().anyMatch(FileOutcome::cancelled);
    }

    public List<String> warnings() {
        List<String> out = new ArrayList<>();
        for (FileOutcome o : outcomes) {
            if (o.isErrored()) {
                out.add(o.path() + ": " + (o.errors().isEmpty() ? "errored" : o.errors().get(0)));
                continue;
            }
            if (o.analysisFallback()) out.add(o.path() + ": static analysis unavailable, default report used");
            if (o.fixOutcome() == FixOutcome.FAILED) {
                out.add(o.path() + ": fix attempt failed, original content kept");
            }
            if (o.publishOutcome() == PublishOutcome.FAILED) {
                out.add(o.path() + ": publish failed");
            }
        }
        return out;
    }
}
