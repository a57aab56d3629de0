package com.codecrucible.core.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryWorkflowStore implements WorkflowStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkflowStore.class);

    private final Map<String, WorkflowEntry> entries = new ConcurrentHashMap<>();

    @Override
    public String create(WorkflowEntry entry) throws PersistenceException {
        if (entry.getId() != null) {
            throw new PersistenceException("Entry already has id " + entry.getId());
        }
        String id = UUID.randomUUID().toString();
        entry.assignId(id);
        entries.put(id, entry.copy());
        log.debug("[WorkflowStore] Created entry {}", id);
        return id;
    }

    @Override
    public void update(WorkflowEntry entry) throws PersistenceException {
        String id = entry.getId();
        if (id == null || !entries.containsKey(id)) {
            throw new PersistenceException("Unknown workflow entry: " + id);
        }
        entries.put(id, entry.copy());
    }

    @Override
    public Optional<WorkflowEntry> findById(String id) {
        WorkflowEntry entry = entries.get(id);
        return entry != null ? Optional.of(entry.copy()) : Optional.empty();
    }
}
