package com.purchasingpower.orchestrator.workflow;

import com.purchasingpower.orchestrator.model.QueryContext;
import com.purchasingpower.orchestrator.model.dto.WorkflowEvent;
import com.purchasingpower.orchestrator.workflow.event.WorkflowEventEmitter;
import com.purchasingpower.orchestrator.workflow.state.PhaseFailure;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime objects of one in-flight request.
 *
 * Everything here is safe to touch from the workflow thread, phase threads and specialist
 * threads of the same request at once. Nothing is shared with other requests.
 */
@Slf4j
public class RequestScope {

    private final QueryContext context;
    private final WorkflowEventEmitter emitter;
    private final Clock clock;
    private final Instant startedAt;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final Set<String> domainsInvoked = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Set<String> toolsInvoked = Collections.synchronizedSet(new LinkedHashSet<>());
    private final List<PhaseFailure> failures = new CopyOnWriteArrayList<>();
    private final Map<String, Long> phaseDurations = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Set<Phase> abandonedPhases = EnumSet.noneOf(Phase.class);

    public RequestScope(QueryContext context, WorkflowEventEmitter emitter, Clock clock) {
        this.context = context;
        this.emitter = emitter;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public QueryContext getContext() {
        return context;
    }

    public String getRequestId() {
        return context.getRequestId();
    }

    public WorkflowEventEmitter getEmitter() {
        return emitter;
    }

    /**
     * Publishes an event on behalf of a phase body. Events of a phase that was already given up
     * (timed out or cancelled) are dropped, so a body still running after its deadline cannot
     * add fragments or a second outcome to the stream.
     *
     * @return true when the event was published
     */
    public boolean emit(Phase phase, WorkflowEvent event) {
        synchronized (abandonedPhases) {
            if (abandonedPhases.contains(phase)) {
                log.debug("Dropping {} event of abandoned phase {} for {}", event.getType(), phase.getNodeName(),
                        getRequestId());
                return false;
            }
            return emitter.emit(event);
        }
    }

    /**
     * Gives up on a phase. Must happen before its body is interrupted.
     */
    public void abandon(Phase phase) {
        synchronized (abandonedPhases) {
            abandonedPhases.add(phase);
        }
    }

    public boolean isAbandoned(Phase phase) {
        synchronized (abandonedPhases) {
            return abandonedPhases.contains(phase);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Marks the request cancelled and interrupts every tracked unit of work.
     *
     * @return true for the call that actually cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        int interrupted = 0;
        for (Future<?> future : inFlight) {
            if (future.cancel(true)) {
                interrupted++;
            }
        }
        log.info("🛑 Request {} cancelled ({} units interrupted)", getRequestId(), interrupted);
        return true;
    }

    /**
     * Registers a unit of work so cancellation reaches it. A unit tracked after cancel is
     * cancelled immediately.
     */
    public void track(Future<?> future) {
        inFlight.add(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    public void untrack(Future<?> future) {
        inFlight.remove(future);
    }

    public void domainInvoked(String domain) {
        domainsInvoked.add(domain);
    }

    public void toolsInvoked(List<String> tools) {
        toolsInvoked.addAll(tools);
    }

    public void recordFailure(PhaseFailure failure) {
        failures.add(failure);
    }

    public void recordPhaseDuration(Phase phase, long millis) {
        phaseDurations.put(phase.getNodeName(), millis);
    }

    public List<String> getDomainsInvoked() {
        synchronized (domainsInvoked) {
            return new ArrayList<>(domainsInvoked);
        }
    }

    public List<String> getToolsInvoked() {
        synchronized (toolsInvoked) {
            return new ArrayList<>(toolsInvoked);
        }
    }

    public List<PhaseFailure> getFailures() {
        return List.copyOf(failures);
    }

    public Map<String, Long> getPhaseDurations() {
        synchronized (phaseDurations) {
            return new LinkedHashMap<>(phaseDurations);
        }
    }

    public long elapsedMs() {
        return Duration.between(startedAt, clock.instant()).toMillis();
    }

    public Instant getStartedAt() {
        return startedAt;
    }
}
