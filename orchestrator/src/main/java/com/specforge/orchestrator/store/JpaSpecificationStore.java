package com.specforge.orchestrator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specforge.orchestrator.repository.SpecificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves specification references against the specifications table.
 */
@Service
public class JpaSpecificationStore implements SpecificationStore {

    private static final Logger log = LoggerFactory.getLogger(JpaSpecificationStore.class);

    private final SpecificationRepository repo;
    private final ObjectMapper            json;

    public JpaSpecificationStore(SpecificationRepository repo, ObjectMapper objectMapper) {
        this.repo = repo;
        this.json = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JsonNode> find(String specificationRef) {
        if (specificationRef == null || specificationRef.isBlank()) return Optional.empty();

        UUID id;
        try {
            id = UUID.fromString(specificationRef.strip());
        } catch (IllegalArgumentException e) {
            log.warn("Specification reference '{}' is not a UUID", specificationRef);
            return Optional.empty();
        }

        return repo.findById(id).flatMap(record -> {
            try {
                JsonNode content = json.readTree(record.getContent());
                return content == null || content.isMissingNode() || content.isEmpty()
                        ? Optional.empty()
                        : Optional.of(content);
            } catch (JsonProcessingException e) {
                log.warn("Specification {} holds invalid JSON: {}", id, e.getOriginalMessage());
                return Optional.empty();
            }
        });
    }
}
