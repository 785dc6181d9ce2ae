package com.cra.context;

import com.cra.atlas.PackCondition;
import com.cra.protocol.RiskTier;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds {@link ContextCondition} predicates from the declarative
 * {@link PackCondition} carried in atlas manifests.
 */
public final class ContextConditions {

    private ContextConditions() {
    }

    public static Optional<ContextCondition> from(PackCondition condition) {
        if (condition == null || condition.isEmpty()) {
            return Optional.empty();
        }
        ContextCondition result = ContextCondition.always();
        if (!condition.riskTiers().isEmpty()) {
            result = result.and(riskTierIn(Set.copyOf(condition.riskTiers())));
        }
        if (!condition.capabilities().isEmpty()) {
            result = result.and(anyCapability(Set.copyOf(condition.capabilities())));
        }
        if (!condition.filePatterns().isEmpty()) {
            result = result.and(anyFileMatches(condition.filePatterns()));
        }
        if (!condition.contextHints().isEmpty()) {
            result = result.and(anyHint(condition.contextHints()));
        }
        return Optional.of(result);
    }

    public static ContextCondition riskTierIn(Set<RiskTier> tiers) {
        return ctx -> ctx.riskTier().map(tiers::contains).orElse(false);
    }

    public static ContextCondition anyCapability(Set<String> capabilities) {
        return ctx -> ctx.capabilities().stream().anyMatch(capabilities::contains);
    }

    public static ContextCondition anyHint(List<String> hints) {
        Set<String> wanted = hints.stream()
            .map(h -> h.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        return ctx -> ctx.contextHints().stream()
            .map(h -> h.toLowerCase(Locale.ROOT))
            .anyMatch(wanted::contains);
    }

    public static ContextCondition anyFileMatches(List<String> globs) {
        List<PathMatcher> matchers = globs.stream()
            .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
            .toList();
        return ctx -> ctx.files().stream().anyMatch(file -> matchesAny(matchers, file));
    }

    private static boolean matchesAny(List<PathMatcher> matchers, String file) {
        Path path;
        try {
            path = Path.of(file);
        } catch (InvalidPathException ex) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(path) || (path.getFileName() != null && matcher.matches(path.getFileName()))) {
                return true;
            }
        }
        return false;
    }
}
