package com.cra.atlas;

import com.cra.atlas.AtlasManifest.ActionDefinition;
import com.cra.atlas.AtlasManifest.CapabilityDefinition;
import com.cra.atlas.AtlasManifest.PolicyDefinition;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the atlases one request may see. Later loads or
 * reloads in the registry do not affect an existing view.
 */
public final class AtlasView {

    private final List<AtlasManifest> atlases;
    private final Map<String, ActionDefinition> actions;
    private final Map<String, CapabilityDefinition> capabilities;

    public AtlasView(List<AtlasManifest> atlases) {
        this.atlases = List.copyOf(atlases);
        Map<String, ActionDefinition> actionIndex = new LinkedHashMap<>();
        Map<String, CapabilityDefinition> capabilityIndex = new LinkedHashMap<>();
        for (AtlasManifest atlas : this.atlases) {
            atlas.actions().forEach(a -> actionIndex.putIfAbsent(a.actionId(), a));
            atlas.capabilities().forEach(c -> capabilityIndex.putIfAbsent(c.capabilityId(), c));
        }
        this.actions = Map.copyOf(actionIndex);
        this.capabilities = Map.copyOf(capabilityIndex);
    }

    public static AtlasView empty() {
        return new AtlasView(List.of());
    }

    public List<AtlasManifest> atlases() {
        return atlases;
    }

    public List<String> atlasIds() {
        return atlases.stream().map(AtlasManifest::atlasId).toList();
    }

    /** Actions in atlas load order, first definition wins on id collisions. */
    public List<ActionDefinition> actions() {
        Set<String> seen = new LinkedHashSet<>();
        return atlases.stream()
            .flatMap(a -> a.actions().stream())
            .filter(a -> seen.add(a.actionId()))
            .toList();
    }

    public List<PolicyDefinition> policies() {
        return atlases.stream().flatMap(a -> a.policies().stream()).toList();
    }

    public Optional<ActionDefinition> action(String actionId) {
        return Optional.ofNullable(actions.get(actionId));
    }

    public Optional<CapabilityDefinition> capability(String capabilityId) {
        return Optional.ofNullable(capabilities.get(capabilityId));
    }

    /** True when the id names either an action or a capability of this view. */
    public boolean knows(String id) {
        return actions.containsKey(id) || capabilities.containsKey(id);
    }

    /**
     * Expands a requested id into the concrete actions it stands for:
     * a capability yields its member actions, an action yields itself.
     */
    public List<String> expand(String id) {
        CapabilityDefinition capability = capabilities.get(id);
        if (capability != null) {
            return capability.actions();
        }
        return List.of(id);
    }

    public boolean isEmpty() {
        return atlases.isEmpty();
    }
}
