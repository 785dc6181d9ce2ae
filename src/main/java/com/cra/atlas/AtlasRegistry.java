package com.cra.atlas;

import com.cra.atlas.AtlasManifest.ActionDefinition;
import com.cra.atlas.AtlasManifest.CapabilityDefinition;
import com.cra.atlas.AtlasManifest.ContextPackDefinition;
import com.cra.atlas.AtlasManifest.PolicyDefinition;
import com.cra.error.AlreadyExistsException;
import com.cra.error.NotFoundException;
import com.cra.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loaded atlas manifests keyed by atlas id, kept in load order.
 * Redefinition of an id is rejected; {@link #reload} is the explicit replace.
 */
public class AtlasRegistry {

    private static final Logger log = LoggerFactory.getLogger(AtlasRegistry.class);

    private final Map<String, AtlasManifest> atlases = Collections.synchronizedMap(new LinkedHashMap<>());

    public AtlasManifest load(AtlasManifest manifest) {
        validate(manifest);
        synchronized (atlases) {
            if (atlases.containsKey(manifest.atlasId())) {
                throw new AlreadyExistsException("atlas", manifest.atlasId());
            }
            atlases.put(manifest.atlasId(), manifest);
        }
        log.info("Loaded atlas {} v{} actions={} policies={} packs={}",
            manifest.atlasId(), manifest.version(), manifest.actions().size(),
            manifest.policies().size(), manifest.contextPacks().size());
        return manifest;
    }

    public AtlasManifest reload(AtlasManifest manifest) {
        validate(manifest);
        AtlasManifest previous;
        synchronized (atlases) {
            if (!atlases.containsKey(manifest.atlasId())) {
                throw new NotFoundException("atlas", manifest.atlasId());
            }
            previous = atlases.put(manifest.atlasId(), manifest);
        }
        log.info("Reloaded atlas {} v{} -> v{}", manifest.atlasId(), previous.version(), manifest.version());
        return manifest;
    }

    /**
     * Removes an atlas. Views taken before the call keep seeing it.
     *
     * @throws NotFoundException if no such atlas is loaded
     */
    public AtlasManifest unload(String atlasId) {
        AtlasManifest removed = atlasId == null ? null : atlases.remove(atlasId);
        if (removed == null) {
            throw new NotFoundException("atlas", atlasId);
        }
        log.info("Unloaded atlas {} v{}", atlasId, removed.version());
        return removed;
    }

    public Optional<AtlasManifest> get(String atlasId) {
        return Optional.ofNullable(atlases.get(atlasId));
    }

    public AtlasManifest require(String atlasId) {
        return get(atlasId).orElseThrow(() -> new NotFoundException("atlas", atlasId));
    }

    /** Live, read-only view of loaded atlas ids; iterate it as often as needed. */
    public Collection<String> list() {
        return Collections.unmodifiableSet(atlases.keySet());
    }

    public int size() {
        return atlases.size();
    }

    /**
     * Snapshot of the named atlases, or of every loaded atlas when {@code atlasIds}
     * is empty.
     *
     * @throws NotFoundException if any named atlas is not loaded
     */
    public AtlasView view(List<String> atlasIds) {
        synchronized (atlases) {
            if (atlasIds == null || atlasIds.isEmpty()) {
                return new AtlasView(new ArrayList<>(atlases.values()));
            }
            List<AtlasManifest> selected = new ArrayList<>();
            for (String id : atlasIds) {
                selected.add(require(id));
            }
            return new AtlasView(selected);
        }
    }

    static void validate(AtlasManifest manifest) {
        if (manifest == null) {
            throw new ValidationException("atlas manifest is required");
        }
        List<String> violations = new ArrayList<>();
        requireText(manifest.atlasId(), "atlas_id", violations);
        requireText(manifest.name(), "name", violations);
        requireText(manifest.version(), "version", violations);

        Set<String> actionIds = new HashSet<>();
        for (ActionDefinition action : manifest.actions()) {
            if (isBlank(action.actionId())) {
                violations.add("action with blank action_id");
            } else if (!actionIds.add(action.actionId())) {
                violations.add("duplicate action_id: " + action.actionId());
            }
        }

        Set<String> capabilityIds = new HashSet<>();
        for (CapabilityDefinition capability : manifest.capabilities()) {
            if (isBlank(capability.capabilityId())) {
                violations.add("capability with blank capability_id");
                continue;
            }
            if (!capabilityIds.add(capability.capabilityId())) {
                violations.add("duplicate capability_id: " + capability.capabilityId());
            }
            for (String actionId : capability.actions()) {
                if (!actionIds.contains(actionId)) {
                    violations.add("capability " + capability.capabilityId()
                        + " references unknown action: " + actionId);
                }
            }
        }

        Set<String> policyIds = new HashSet<>();
        for (PolicyDefinition policy : manifest.policies()) {
            if (isBlank(policy.policyId())) {
                violations.add("policy with blank policy_id");
                continue;
            }
            if (!policyIds.add(policy.policyId())) {
                violations.add("duplicate policy_id: " + policy.policyId());
            }
            if (policy.type() == null) {
                violations.add("policy " + policy.policyId() + " has no type");
            }
        }

        Set<String> packIds = new HashSet<>();
        for (ContextPackDefinition pack : manifest.contextPacks()) {
            if (isBlank(pack.packId())) {
                violations.add("context pack with blank pack_id");
            } else if (!packIds.add(pack.packId())) {
                violations.add("duplicate pack_id: " + pack.packId());
            }
        }

        if (!violations.isEmpty()) {
            throw new ValidationException("invalid atlas " + manifest.atlasId(), violations);
        }
    }

    private static void requireText(String value, String field, List<String> violations) {
        if (isBlank(value)) {
            violations.add(field + " is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
