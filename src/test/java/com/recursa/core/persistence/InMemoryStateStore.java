package com.recursa.core.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link StateStore} for tests. Documents go through {@link StateDocumentMapper}
 * so every load sees exactly what a real store would return. Writes can be
 * made to fail after a given number of successful ones to simulate a crash.
 */
public class InMemoryStateStore implements StateStore {

    private final StateDocumentMapper mapper = new StateDocumentMapper();
    private final Map<String, String> documents = new ConcurrentHashMap<>();
    private int persistCount;
    private int failAfter = -1;

    @Override
    public synchronized void persist(String taskId, PersistedTaskState state) {
        if (failAfter >= 0 && persistCount >= failAfter) {
            throw new StateStoreException("Simulated write failure for task " + taskId);
        }
        documents.put(taskId, mapper.write(state));
        persistCount++;
    }

    @Override
    public Optional<PersistedTaskState> load(String taskId) {
        return Optional.ofNullable(documents.get(taskId)).map(mapper::read);
    }

    @Override
    public List<String> listTaskIds() {
        var ids = new ArrayList<>(documents.keySet());
        ids.sort(String::compareTo);
        return ids;
    }

    @Override
    public void delete(String taskId) {
        documents.remove(taskId);
    }

    /** Every persist after the next {@code successfulWrites} ones throws. */
    public synchronized void failAfter(int successfulWrites) {
        this.failAfter = persistCount + successfulWrites;
    }

    public synchronized void healthy() {
        this.failAfter = -1;
    }

    public synchronized int persistCount() {
        return persistCount;
    }
}
