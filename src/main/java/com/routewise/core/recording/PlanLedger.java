package com.routewise.core.recording;

import com.routewise.core.model.Request;
import com.routewise.core.model.SelectionPlan;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers the plans handed out by the selector, with the requests they were
 * made for, so execution reports can be checked against them. Bounded: the
 * oldest plans are forgotten first.
 */
@Component
public class PlanLedger {

    /** A plan together with the request it was selected for. */
    public record IssuedPlan(Request request, SelectionPlan plan) {}

    private final Map<String, IssuedPlan> issued;

    public PlanLedger(RecordingProperties properties) {
        int capacity = Math.max(1, properties.getLedgerCapacity());
        this.issued = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, IssuedPlan> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized void register(Request request, SelectionPlan plan) {
        issued.put(plan.planId(), new IssuedPlan(request, plan));
    }

    public synchronized Optional<IssuedPlan> find(String planId) {
        return Optional.ofNullable(planId).map(issued::get);
    }

    /**
     * True when {@code plan} is exactly the plan issued for {@code request}.
     */
    public synchronized boolean isIssued(Request request, SelectionPlan plan) {
        IssuedPlan known = issued.get(plan.planId());
        return known != null
                && known.plan().equals(plan)
                && known.request().requestId().equals(request.requestId());
    }
}
