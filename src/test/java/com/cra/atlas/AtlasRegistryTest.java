package com.cra.atlas;

import com.cra.TestAtlases;
import com.cra.atlas.AtlasManifest.CapabilityDefinition;
import com.cra.error.AlreadyExistsException;
import com.cra.error.NotFoundException;
import com.cra.error.ValidationException;
import com.cra.protocol.ProtocolCodec;
import com.cra.protocol.RiskTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AtlasRegistryTest {

    private AtlasRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new AtlasRegistry();
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        void load_makesAtlasRetrievable() {
            registry.load(TestAtlases.devTools());
            assertTrue(registry.get(TestAtlases.DEV_TOOLS).isPresent());
            assertEquals("1.0.0", registry.require(TestAtlases.DEV_TOOLS).version());
        }

        @Test
        void load_sameIdTwice_isRedefinition() {
            registry.load(TestAtlases.devTools());
            assertThrows(AlreadyExistsException.class, () -> registry.load(TestAtlases.devTools()));
            assertEquals(1, registry.size());
        }

        @Test
        void reload_replacesExisting() {
            registry.load(TestAtlases.devTools());
            registry.reload(TestAtlases.devTools(TestAtlases.DEV_TOOLS, "2.0.0"));
            assertEquals("2.0.0", registry.require(TestAtlases.DEV_TOOLS).version());
        }

        @Test
        void reload_unknownId_isNotFound() {
            assertThrows(NotFoundException.class, () -> registry.reload(TestAtlases.devTools()));
        }

        @Test
        void unload_removesAtlas_butEarlierViewsKeepIt() {
            registry.load(TestAtlases.devTools());
            AtlasView before = registry.view(List.of());

            assertEquals("1.0.0", registry.unload(TestAtlases.DEV_TOOLS).version());

            assertEquals(0, registry.size());
            assertTrue(registry.view(List.of()).isEmpty());
            assertTrue(before.action("file.read").isPresent());
            assertThrows(NotFoundException.class, () -> registry.unload(TestAtlases.DEV_TOOLS));
        }

        @Test
        void require_unknownId_isNotFound() {
            assertThrows(NotFoundException.class, () -> registry.require("missing"));
            assertTrue(registry.get("missing").isEmpty());
        }

        @Test
        void manifestJson_isParsedByCodec() {
            String json = "{\"atlas_version\":\"1.0\",\"atlas_id\":\"mini\",\"version\":\"0.1\",\"name\":\"Mini\","
                + "\"actions\":[{\"action_id\":\"a.run\",\"name\":\"Run\",\"risk_tier\":\"medium\"}],"
                + "\"policies\":[{\"policy_id\":\"p\",\"type\":\"rate_limit\",\"actions\":[\"a.*\"],"
                + "\"parameters\":{\"max_calls\":3,\"window_seconds\":10}}]}";
            AtlasManifest manifest = new ProtocolCodec().fromJson(json, AtlasManifest.class);
            registry.load(manifest);
            assertEquals(RiskTier.MEDIUM, manifest.actions().get(0).riskTier());
            assertEquals(3, manifest.policies().get(0).parameters().maxCalls());
            assertTrue(manifest.contextPacks().isEmpty());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void blankId_isRejected() {
            AtlasManifest manifest = new AtlasManifest("1.0", " ", "1", "n", null, null, null, null, null, null);
            ValidationException ex = assertThrows(ValidationException.class, () -> registry.load(manifest));
            assertTrue(ex.getViolations().contains("atlas_id is required"));
        }

        @Test
        void duplicateActionIds_areRejected() {
            AtlasManifest manifest = new AtlasManifest("1.0", "dup", "1", "n", null, null,
                List.of(TestAtlases.action("x", RiskTier.LOW), TestAtlases.action("x", RiskTier.HIGH)),
                null, null, null);
            ValidationException ex = assertThrows(ValidationException.class, () -> registry.load(manifest));
            assertTrue(ex.getViolations().contains("duplicate action_id: x"));
        }

        @Test
        void capabilityReferencingUnknownAction_isRejected() {
            AtlasManifest manifest = new AtlasManifest("1.0", "cap", "1", "n", null, null,
                List.of(TestAtlases.action("x", RiskTier.LOW)),
                List.of(new CapabilityDefinition("c", "C", List.of("x", "y"))), null, null);
            assertThrows(ValidationException.class, () -> registry.load(manifest));
            assertEquals(0, registry.size());
        }
    }

    @Nested
    @DisplayName("Listing and views")
    class Views {

        @Test
        void list_isRestartableLiveView() {
            Collection<String> ids = registry.list();
            assertTrue(ids.isEmpty());
            registry.load(TestAtlases.devTools("a", "1"));
            registry.load(TestAtlases.devTools("b", "1"));
            assertEquals(List.of("a", "b"), new ArrayList<>(ids));
            assertEquals(List.of("a", "b"), new ArrayList<>(ids));
            assertThrows(UnsupportedOperationException.class, () -> ids.remove("a"));
        }

        @Test
        void view_emptyIds_coversAllAtlases() {
            registry.load(TestAtlases.devTools("a", "1"));
            registry.load(TestAtlases.devTools("b", "1"));
            assertEquals(List.of("a", "b"), registry.view(List.of()).atlasIds());
        }

        @Test
        void view_unknownId_isNotFound() {
            registry.load(TestAtlases.devTools());
            assertThrows(NotFoundException.class, () -> registry.view(List.of("nope")));
        }

        @Test
        void view_isSnapshot() {
            registry.load(TestAtlases.devTools());
            AtlasView view = registry.view(List.of(TestAtlases.DEV_TOOLS));
            registry.reload(TestAtlases.devTools(TestAtlases.DEV_TOOLS, "9.9.9"));
            assertEquals("1.0.0", view.atlases().get(0).version());
        }

        @Test
        void view_expandsCapabilities() {
            registry.load(TestAtlases.devTools());
            AtlasView view = registry.view(List.of());
            assertEquals(List.of("file.read", "file.write"), view.expand("files"));
            assertEquals(List.of("shell.exec"), view.expand("shell.exec"));
            assertTrue(view.knows("files"));
            assertFalse(view.knows("network.call"));
        }
    }
}
