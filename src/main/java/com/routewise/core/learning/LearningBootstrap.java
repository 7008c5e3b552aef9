package com.routewise.core.learning;

import com.routewise.core.model.ExecutionRecord;
import com.routewise.core.recording.ExecutionRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rebuilds the learning weights from persisted records once the context is up,
 * so a restarted router keeps what it learned.
 */
@Component
public class LearningBootstrap implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(LearningBootstrap.class);

    private final ExecutionRecordStore recordStore;
    private final LearningStore learningStore;
    private final LearningProperties properties;

    public LearningBootstrap(ExecutionRecordStore recordStore, LearningStore learningStore,
                             LearningProperties properties) {
        this.recordStore = recordStore;
        this.learningStore = learningStore;
        this.properties = properties;
    }

    @Override
    public void afterSingletonsInstantiated() {
        if (!properties.isReplayOnStartup()) {
            log.debug("Learning replay disabled");
            return;
        }
        int replayed = replay();
        if (replayed > 0) {
            log.info("Replayed {} execution records into the learning store", replayed);
        }
    }

    /**
     * Feeds every stored record to the learning store, oldest first.
     */
    public int replay() {
        List<ExecutionRecord> records = recordStore.all();
        records.forEach(learningStore::ingest);
        return records.size();
    }
}
