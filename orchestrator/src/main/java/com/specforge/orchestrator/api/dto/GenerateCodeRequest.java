package com.specforge.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.specforge.orchestrator.model.PublishTarget;
import com.specforge.orchestrator.model.TargetConfig;
import com.specforge.orchestrator.service.SessionOrchestrator.StartCommand;

/**
 * Request body for POST /code/generate.
 *
 * Either specId (a stored specification) or an inline specification is
 * required; the inline one wins when both are given. repositoryInfo is
 * optional and turns on publishing.
 */
public record GenerateCodeRequest(String specId,
                                  JsonNode specification,
                                  Frameworks frameworks,
                                  RepositoryInfo repositoryInfo) {

    public record Frameworks(String frontend, String backend, String database) {}

    public record RepositoryInfo(String owner, String name, String branch) {}

    public StartCommand toCommand() {
        TargetConfig target = frameworks == null
                ? TargetConfig.unspecified()
                : new TargetConfig(frameworks.frontend(), frameworks.backend(), frameworks.database());
        return new StartCommand(specId, specification, target, publishTarget());
    }

    /** Null unless both owner and repository name are present. */
    private PublishTarget publishTarget() {
        if (repositoryInfo == null
                || isBlank(repositoryInfo.owner()) || isBlank(repositoryInfo.name())) {
            return null;
        }
        return new PublishTarget(repositoryInfo.owner(), repositoryInfo.name(), repositoryInfo.branch());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
