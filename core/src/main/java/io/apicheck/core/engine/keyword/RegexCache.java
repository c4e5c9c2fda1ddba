package io.apicheck.core.engine.keyword;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Compiled schema regular expressions, keyed by source. Malformed sources map to empty. */
final class RegexCache {

    private static final Logger LOG = LoggerFactory.getLogger(RegexCache.class);

    private final Map<String, Optional<Pattern>> patterns = new ConcurrentHashMap<>();

    Optional<Pattern> compile(String regex) {
        return patterns.computeIfAbsent(regex, RegexCache::tryCompile);
    }

    private static Optional<Pattern> tryCompile(String regex) {
        try {
            return Optional.of(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            LOG.debug("Malformed schema regex '{}': {}", regex, e.getDescription());
            return Optional.empty();
        }
    }
}
