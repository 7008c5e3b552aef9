package com.routewise.core.recording;

import com.routewise.core.model.ExecutionRecord;

import java.util.List;

/**
 * Append-only persistence for {@link ExecutionRecord}s. Query results are
 * ordered oldest first.
 */
public interface ExecutionRecordStore {

    void append(ExecutionRecord record);

    /** The latest {@code limit} records of one request chain. */
    List<ExecutionRecord> forChain(String chainId, int limit);

    /** The latest {@code limit} records overall. */
    List<ExecutionRecord> recent(int limit);

    /** Every stored record, in insertion order. */
    List<ExecutionRecord> all();

    long count();
}
