package com.cra.context;

import com.cra.atlas.AtlasManifest.ContextPackDefinition;

import java.util.List;
import java.util.Optional;

/**
 * A context entry ready for matching. {@code source} is the contributing
 * atlas id, or {@value #INLINE} for entries added directly.
 */
public record LoadedContext(
    String packId,
    String source,
    String content,
    String contentType,
    int priority,
    List<String> keywords,
    Optional<ContextCondition> condition
) {

    public static final String INLINE = "inline";

    public LoadedContext {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        condition = condition == null ? Optional.empty() : condition;
    }

    public static LoadedContext inline(String packId, String content, int priority, List<String> keywords) {
        return new LoadedContext(packId, INLINE, content, "text/markdown", priority, keywords, Optional.empty());
    }

    public static LoadedContext fromPack(String atlasId, ContextPackDefinition pack) {
        return new LoadedContext(
            pack.packId(),
            atlasId,
            pack.content(),
            pack.contentType(),
            pack.priority(),
            pack.keywords(),
            ContextConditions.from(pack.condition())
        );
    }

    public boolean isEligible(EvaluationContext context) {
        return condition.map(c -> c.test(context)).orElse(true);
    }
}
