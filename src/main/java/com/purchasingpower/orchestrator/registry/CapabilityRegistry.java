package com.purchasingpower.orchestrator.registry;

import com.google.common.base.Preconditions;
import com.purchasingpower.orchestrator.exception.UnknownCapabilityException;
import com.purchasingpower.orchestrator.model.UserContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Catalog of tool capabilities.
 *
 * Reads go against an immutable snapshot and never lock. Registration and removal are
 * serialized, build a new snapshot and publish it atomically, so a hot reload never
 * disturbs requests that already looked a capability up.
 */
@Slf4j
@Component
public class CapabilityRegistry {

    private final AtomicReference<Map<String, RegisteredCapability>> snapshot =
            new AtomicReference<>(Map.of());
    private final AtomicLong revisions = new AtomicLong();
    private final Object mutationLock = new Object();

    public CapabilityRegistry(List<Tool> tools) {
        for (Tool tool : tools) {
            register(tool);
        }
        log.info("🛠️ Capability registry initialized with {} tools: {}", tools.size(), names());
    }

    /**
     * Registers a tool, replacing any previous capability with the same name.
     */
    public RegisteredCapability register(Tool tool) {
        Preconditions.checkNotNull(tool, "tool");
        ToolSchema schema = Preconditions.checkNotNull(tool.getSchema(), "schema of %s", tool.getName());
        Preconditions.checkArgument(schema.getName().equals(tool.getName()),
                "Schema name %s does not match tool name %s", schema.getName(), tool.getName());

        synchronized (mutationLock) {
            RegisteredCapability entry = new RegisteredCapability(schema, tool, revisions.incrementAndGet());
            Map<String, RegisteredCapability> next = new LinkedHashMap<>(snapshot.get());
            RegisteredCapability previous = next.put(tool.getName(), entry);
            snapshot.set(Collections.unmodifiableMap(next));
            if (previous != null) {
                log.info("🔄 Capability {} replaced (revision {} -> {})",
                        tool.getName(), previous.revision(), entry.revision());
            } else {
                log.debug("Capability {} registered (revision {})", tool.getName(), entry.revision());
            }
            return entry;
        }
    }

    public boolean unregister(String name) {
        synchronized (mutationLock) {
            Map<String, RegisteredCapability> current = snapshot.get();
            if (!current.containsKey(name)) {
                return false;
            }
            Map<String, RegisteredCapability> next = new LinkedHashMap<>(current);
            next.remove(name);
            snapshot.set(Collections.unmodifiableMap(next));
            log.info("🗑️ Capability {} unregistered", name);
            return true;
        }
    }

    public Optional<RegisteredCapability> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.get().get(name));
    }

    public RegisteredCapability require(String name) {
        return lookup(name).orElseThrow(() -> new UnknownCapabilityException(name));
    }

    /**
     * Whether the capability exists and the caller may use it.
     */
    public boolean isEligible(String name, UserContext userContext) {
        return lookup(name)
                .map(entry -> userContext.canAccess(entry.schema().getAccessLevel()))
                .orElse(false);
    }

    public Collection<RegisteredCapability> list() {
        return snapshot.get().values();
    }

    public List<String> names() {
        return snapshot.get().keySet().stream().collect(Collectors.toList());
    }
}
