package com.cra.context;

import com.cra.TestAtlases;
import com.cra.atlas.AtlasManifest;
import com.cra.atlas.PackCondition;
import com.cra.protocol.RiskTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContextRegistryTest {

    private ContextRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ContextRegistry();
        AtlasManifest atlas = TestAtlases.devTools();
        atlas.contextPacks().forEach(p -> registry.addContext(LoadedContext.fromPack(atlas.atlasId(), p)));
    }

    @Nested
    @DisplayName("Keyword matching")
    class KeywordMatching {

        @Test
        void traceGoal_ranksTraceGuideFirst() {
            List<MatchResult> matches = registry.query("hash trace event hashing", List.of());
            assertFalse(matches.isEmpty());
            assertEquals("trace-guide", matches.get(0).packId());
            assertTrue(matches.get(0).score() >= 3);
        }

        @Test
        void tokens_splitOnPunctuationAndIgnoreCase() {
            List<MatchResult> matches = registry.query("READ/write the-File", List.of());
            assertEquals(1, matches.size());
            assertEquals("file-guide", matches.get(0).packId());
            assertEquals(3, matches.get(0).score());
        }

        @Test
        void hints_contributeTokens() {
            List<MatchResult> matches = registry.query("do something", List.of("file"));
            assertEquals(List.of("file-guide"), matches.stream().map(MatchResult::packId).toList());
        }

        @Test
        void noKeywordOverlap_isEmptyNotError() {
            assertTrue(registry.query("unrelated goal", List.of()).isEmpty());
        }

        @Test
        void emptyRegistry_returnsEmpty() {
            assertTrue(new ContextRegistry().query("hash trace event hashing", List.of()).isEmpty());
        }

        @Test
        void ordering_priorityThenScoreThenPackId() {
            ContextRegistry local = new ContextRegistry();
            local.addContext(LoadedContext.inline("b", "B", 1, List.of("alpha", "beta")));
            local.addContext(LoadedContext.inline("a", "A", 1, List.of("alpha", "beta")));
            local.addContext(LoadedContext.inline("c", "C", 1, List.of("alpha")));
            local.addContext(LoadedContext.inline("z", "Z", 9, List.of("alpha")));
            List<String> ids = local.query("alpha beta", List.of()).stream().map(MatchResult::packId).toList();
            assertEquals(List.of("z", "a", "b", "c"), ids);
        }
    }

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        void riskCondition_excludesLowRiskRequests() {
            EvaluationContext low = new EvaluationContext("run shell command", List.of(), Optional.of(RiskTier.LOW),
                List.of(), List.of());
            assertTrue(registry.query(low).isEmpty());

            EvaluationContext high = new EvaluationContext("run shell command", List.of(), Optional.of(RiskTier.HIGH),
                List.of(), List.of());
            assertEquals("shell-guide", registry.query(high).get(0).packId());
        }

        @Test
        void fileCondition_matchesGlobOnPathOrFileName() {
            ContextCondition javaFiles = ContextConditions.anyFileMatches(List.of("**/*.java"));
            assertTrue(javaFiles.test(new EvaluationContext("g", null, null, null, List.of("src/main/App.java"))));
            assertFalse(javaFiles.test(new EvaluationContext("g", null, null, null, List.of("README.md"))));

            ContextCondition readme = ContextConditions.anyFileMatches(List.of("README.*"));
            assertTrue(readme.test(new EvaluationContext("g", null, null, null, List.of("docs/README.md"))));
        }

        @Test
        void everyNonEmptyClause_mustHold() {
            ContextCondition condition = ContextConditions.from(new PackCondition(
                List.of(RiskTier.HIGH), List.of("shell.exec"), List.of(), List.of("ops"))).orElseThrow();
            assertTrue(condition.test(new EvaluationContext("g", List.of("OPS"), Optional.of(RiskTier.HIGH),
                List.of("shell.exec"), List.of())));
            assertFalse(condition.test(new EvaluationContext("g", List.of("ops"), Optional.of(RiskTier.HIGH),
                List.of("file.read"), List.of())));
        }

        @Test
        void emptyCondition_isNoCondition() {
            assertTrue(ContextConditions.from(new PackCondition(null, null, null, null)).isEmpty());
        }
    }

    @Nested
    @DisplayName("Mutation")
    class Mutation {

        @Test
        void addContext_lastWriteWinsPerPackId() {
            registry.addContext(LoadedContext.inline("trace-guide", "replacement", 1, List.of("replacement")));
            assertTrue(registry.query("hash trace", List.of()).isEmpty());
            assertEquals("replacement", registry.query("replacement", List.of()).get(0).entry().content());
        }

        @Test
        void removeSource_dropsOnlyThatAtlasPacks() {
            registry.addContext(LoadedContext.inline("notes", "n", 1, List.of("trace")));
            assertEquals(3, registry.removeSource(TestAtlases.DEV_TOOLS));
            assertEquals(List.of("notes"),
                registry.query("trace", List.of()).stream().map(MatchResult::packId).toList());
        }
    }
}
