package com.cra.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Keyword index over loaded context entries.
 *
 * Matching is deterministic: an entry's score is the number of its keywords
 * found among the lower-cased tokens of the goal and hints. Entries with a
 * zero score, or whose condition rejects the request, are not returned.
 * Results are ordered by priority desc, score desc, then pack id.
 */
public class ContextRegistry {

    private static final Logger log = LoggerFactory.getLogger(ContextRegistry.class);

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{Alnum}_]+");

    static final Comparator<MatchResult> RANKING = Comparator
        .comparingInt((MatchResult m) -> m.entry().priority()).reversed()
        .thenComparing(Comparator.comparingInt(MatchResult::score).reversed())
        .thenComparing(MatchResult::packId);

    private final Map<String, LoadedContext> entries = new ConcurrentHashMap<>();

    /** Adds or replaces the entry with the same pack id. */
    public void addContext(LoadedContext entry) {
        LoadedContext previous = entries.put(entry.packId(), entry);
        if (previous != null && !previous.source().equals(entry.source())) {
            log.warn("Context pack {} from {} replaced by {}", entry.packId(), previous.source(), entry.source());
        }
    }

    public int removeSource(String source) {
        List<String> removed = new ArrayList<>();
        entries.values().removeIf(e -> {
            if (e.source().equals(source)) {
                removed.add(e.packId());
                return true;
            }
            return false;
        });
        log.debug("Removed {} context packs from {}", removed.size(), source);
        return removed.size();
    }

    public int size() {
        return entries.size();
    }

    public List<MatchResult> query(String goal, List<String> hints) {
        return query(EvaluationContext.of(goal, hints));
    }

    public List<MatchResult> query(EvaluationContext context) {
        Set<String> tokens = tokenize(context.goal(), context.contextHints());
        List<MatchResult> matches = new ArrayList<>();
        for (LoadedContext entry : entries.values()) {
            if (!entry.isEligible(context)) {
                continue;
            }
            int score = score(entry, tokens);
            if (score > 0) {
                matches.add(new MatchResult(entry.packId(), score, entry));
            }
        }
        matches.sort(RANKING);
        return matches;
    }

    static Set<String> tokenize(String goal, List<String> hints) {
        Set<String> tokens = new HashSet<>();
        addTokens(goal, tokens);
        if (hints != null) {
            hints.forEach(h -> addTokens(h, tokens));
        }
        return tokens;
    }

    private static void addTokens(String text, Set<String> tokens) {
        if (text == null || text.isBlank()) {
            return;
        }
        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
    }

    private static int score(LoadedContext entry, Set<String> tokens) {
        int score = 0;
        for (String keyword : entry.keywords()) {
            if (tokens.contains(keyword.toLowerCase(Locale.ROOT))) {
                score++;
            }
        }
        return score;
    }
}
