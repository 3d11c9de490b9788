package com.recursa.core.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Durable task-state persistence keyed by task id.
 * <p>
 * Implementations must make {@link #persist} atomic with respect to a crash: a
 * reader after a crash sees either the previous document or the new one, never
 * a mix. Writes for one task id are serialized.
 */
public interface StateStore {

    /**
     * Atomically replaces the stored state for a task.
     *
     * @throws StateStoreException if the write fails; the previous state remains readable
     */
    void persist(String taskId, PersistedTaskState state);

    /**
     * Loads the latest state for a task.
     *
     * @throws StateStoreException if stored state exists but cannot be read
     */
    Optional<PersistedTaskState> load(String taskId);

    /** Lists the ids of all stored tasks. */
    List<String> listTaskIds();

    /** Removes all stored state for a task. */
    void delete(String taskId);
}
