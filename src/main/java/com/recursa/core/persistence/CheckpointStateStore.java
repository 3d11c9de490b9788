package com.recursa.core.persistence;

import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link StateStore} backed by a LangGraph4j {@link BaseCheckpointSaver}.
 * <p>
 * Each task id maps to a checkpoint thread; every persist puts one checkpoint
 * whose state holds the serialized document, and load reads the thread's latest
 * checkpoint. With a {@link org.bsc.langgraph4j.checkpoint.MemorySaver} this is
 * the in-memory store used for development and tests; state is lost on restart.
 */
public class CheckpointStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStateStore.class);

    static final String DOCUMENT_KEY = "document";
    private static final String NODE_ID = "recursa";

    private final BaseCheckpointSaver saver;
    private final StateDocumentMapper mapper;
    private final Set<String> knownTaskIds = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<String, Object> taskLocks = new ConcurrentHashMap<>();

    public CheckpointStateStore(BaseCheckpointSaver saver) {
        this.saver = Objects.requireNonNull(saver, "saver must not be null");
        this.mapper = new StateDocumentMapper();
    }

    @Override
    public void persist(String taskId, PersistedTaskState state) {
        String json = mapper.write(state);
        var checkpoint = Checkpoint.builder()
                .id(UUID.randomUUID().toString())
                .state(Map.<String, Object>of(DOCUMENT_KEY, json))
                .nodeId(NODE_ID)
                .nextNodeId(NODE_ID)
                .build();
        synchronized (lockFor(taskId)) {
            try {
                saver.put(configFor(taskId), checkpoint);
            } catch (Exception e) {
                throw new StateStoreException("Failed to put checkpoint for task " + taskId, e);
            }
            knownTaskIds.add(taskId);
        }
        log.debug("Saved checkpoint '{}' (v{}) for task '{}'", checkpoint.getId(), state.version(), taskId);
    }

    @Override
    public Optional<PersistedTaskState> load(String taskId) {
        synchronized (lockFor(taskId)) {
            return saver.get(configFor(taskId))
                    .map(cp -> cp.getState().get(DOCUMENT_KEY))
                    .map(document -> mapper.read(String.valueOf(document)));
        }
    }

    @Override
    public List<String> listTaskIds() {
        var taskIds = new ArrayList<>(knownTaskIds);
        taskIds.sort(String::compareTo);
        return taskIds;
    }

    @Override
    public void delete(String taskId) {
        synchronized (lockFor(taskId)) {
            try {
                saver.release(configFor(taskId));
            } catch (Exception e) {
                throw new StateStoreException("Failed to release checkpoints of task " + taskId, e);
            }
            knownTaskIds.remove(taskId);
        }
    }

    private RunnableConfig configFor(String taskId) {
        return RunnableConfig.builder().threadId(taskId).build();
    }

    private Object lockFor(String taskId) {
        return taskLocks.computeIfAbsent(taskId, k -> new Object());
    }
}
