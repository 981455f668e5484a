package com.specforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Optional;

/**
 * The planned set of files for a Session plus the shared context every
 * file prompt receives (API endpoints and data models).
 *
 * Entry order is the order results are reported in.
 */
public record Manifest(List<ManifestEntry> entries,
                       List<String> apiEndpoints,
                       List<String> dataModels) {

    public Manifest {
        entries      = entries      == null ? List.of() : List.copyOf(entries);
        apiEndpoints = apiEndpoints == null ? List.of() : List.copyOf(apiEndpoints);
        dataModels   = dataModels   == null ? List.of() : List.copyOf(dataModels);
    }

    @JsonIgnore
    public int size() {
        return entries.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int positionOf(String path) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).path().equals(path)) return i;
        }
        return -1;
    }

    public Optional<ManifestEntry> find(String path) {
        int idx = positionOf(path);
        return idx < 0 ? Optional.empty() : Optional.of(entries.get(idx));
    }
}
