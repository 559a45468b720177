package com.purchasingpower.orchestrator.workflow;

import com.purchasingpower.orchestrator.exception.RequestNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight requests by id.
 */
@Slf4j
@Component
public class RequestScopeRegistry {

    private final Map<String, RequestScope> scopes = new ConcurrentHashMap<>();

    public void open(RequestScope scope) {
        RequestScope previous = scopes.putIfAbsent(scope.getRequestId(), scope);
        if (previous != null) {
            throw new IllegalStateException("Request " + scope.getRequestId() + " is already in flight");
        }
        log.debug("Opened scope for request {}", scope.getRequestId());
    }

    public Optional<RequestScope> find(String requestId) {
        return Optional.ofNullable(scopes.get(requestId));
    }

    public RequestScope require(String requestId) {
        return find(requestId).orElseThrow(() -> new RequestNotFoundException(requestId));
    }

    public void close(String requestId) {
        if (scopes.remove(requestId) != null) {
            log.debug("Closed scope for request {}", requestId);
        }
    }

    public int activeCount() {
        return scopes.size();
    }
}
