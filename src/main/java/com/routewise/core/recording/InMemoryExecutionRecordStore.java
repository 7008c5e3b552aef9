package com.routewise.core.recording;

import com.routewise.core.model.ExecutionRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-memory record store. State is lost on restart.
 */
public class InMemoryExecutionRecordStore implements ExecutionRecordStore {

    private final int capacity;
    private final Deque<ExecutionRecord> records = new ArrayDeque<>();

    public InMemoryExecutionRecordStore(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public synchronized void append(ExecutionRecord record) {
        records.addLast(record);
        while (records.size() > capacity) {
            records.removeFirst();
        }
    }

    @Override
    public synchronized List<ExecutionRecord> forChain(String chainId, int limit) {
        var matched = new ArrayList<ExecutionRecord>();
        Iterator<ExecutionRecord> newestFirst = records.descendingIterator();
        while (newestFirst.hasNext() && matched.size() < limit) {
            ExecutionRecord record = newestFirst.next();
            if (record.request().chainId().equals(chainId)) {
                matched.add(0, record);
            }
        }
        return matched;
    }

    @Override
    public synchronized List<ExecutionRecord> recent(int limit) {
        var all = new ArrayList<>(records);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    @Override
    public synchronized List<ExecutionRecord> all() {
        return List.copyOf(records);
    }

    @Override
    public synchronized long count() {
        return records.size();
    }
}
