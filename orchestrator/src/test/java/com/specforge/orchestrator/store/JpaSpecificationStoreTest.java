package com.specforge.orchestrator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.specforge.orchestrator.model.SpecificationRecord;
import com.specforge.orchestrator.repository.SpecificationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaSpecificationStoreTest {

    @Mock SpecificationRepository repo;

    JpaSpecificationStore store;

    @BeforeEach
    void setUp() {
        store = new JpaSpecificationStore(repo, new ObjectMapper());
    }

    @Test
    void find_storedJson_returned() {
        UUID id = UUID.randomUUID();
        when(repo.findById(id)).thenReturn(Optional.of(
                new SpecificationRecord(id, "todo", "{\"project_name\":\"todo\"}")));

        assertThat(store.find(id.toString()))
                .hasValueSatisfying(n -> assertThat(n.path("project_name").asText()).isEqualTo("todo"));
    }

    @Test
    void find_notAUuid_emptyWithoutQuery() {
        assertThat(store.find("spec-abc")).isEmpty();
        assertThat(store.find("  ")).isEmpty();
        verifyNoInteractions(repo);
    }

    @Test
    void find_invalidOrEmptyContent_empty() {
        UUID broken = UUID.randomUUID();
        UUID empty  = UUID.randomUUID();
        when(repo.findById(broken)).thenReturn(Optional.of(new SpecificationRecord(broken, "x", "{not json")));
        when(repo.findById(empty)).thenReturn(Optional.of(new SpecificationRecord(empty, "y", "{}")));

        assertThat(store.find(broken.toString())).isEmpty();
        assertThat(store.find(empty.toString())).isEmpty();
    }
}
