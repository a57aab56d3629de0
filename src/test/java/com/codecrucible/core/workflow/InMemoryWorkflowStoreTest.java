package com.codecrucible.core.workflow;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWorkflowStoreTest {

    private final InMemoryWorkflowStore store = new InMemoryWorkflowStore();

    private static WorkflowEntry entry(List<String> features) {
        return new WorkflowEntry("add two numbers", "python", features, Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void testCreateAssignsIdAndStoresSnapshot() throws Exception {
        WorkflowEntry entry = entry(List.of());

        String id = store.create(entry);

        assertEquals(id, entry.getId());
        entry.setGeneratedCode("changed after create");
        assertEquals("", store.findById(id).orElseThrow().getGeneratedCode());
    }

    @Test
    void testUpdateOverwritesStoredState() throws Exception {
        WorkflowEntry entry = entry(List.of());
        String id = store.create(entry);

        entry.setGeneratedCode("def f(): pass");
        entry.incrementIterations();
        store.update(entry);

        WorkflowEntry stored = store.findById(id).orElseThrow();
        assertEquals("def f(): pass", stored.getGeneratedCode());
        assertEquals(1, stored.getIterationCount());
        assertEquals(WorkflowStatus.PROCESSING, stored.getStatus());
    }

    @Test
    void testUpdateOfUnknownEntryFails() {
        assertThrows(WorkflowStore.PersistenceException.class, () -> store.update(entry(List.of())));
    }

    @Test
    void testFeaturesImplementedCannotExceedFeatureList() {
        WorkflowEntry entry = entry(List.of("logging"));

        entry.incrementFeaturesImplemented();

        assertThrows(IllegalStateException.class, entry::incrementFeaturesImplemented);
        assertEquals(1, entry.getFeaturesImplemented());
    }

    @Test
    void testTerminalPhaseRejectsTransitions() {
        WorkflowEntry entry = entry(List.of());
        entry.transitionTo(WorkflowPhase.GENERATING);
        entry.markCompleted(Instant.now(), 1.0);

        assertEquals(WorkflowStatus.COMPLETED, entry.getStatus());
        assertThrows(IllegalStateException.class, () -> entry.transitionTo(WorkflowPhase.FIXING));
    }

    @Test
    void testFindMissing() {
        assertTrue(store.findById("nope").isEmpty());
    }
}
