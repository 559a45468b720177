package com.purchasingpower.orchestrator.registry;

/**
 * Registry entry: schema plus executable handle.
 *
 * @param revision increases every time a capability with this name is (re)registered;
 *                 an in-flight request keeps using the revision it looked up
 */
public record RegisteredCapability(ToolSchema schema, Tool handle, long revision) {

    public String name() {
        return schema.getName();
    }
}
