package com.ward.core.issue.algorithm;

import com.ward.core.session.Resource;
import com.ward.core.span.UrlPaths;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the same endpoint being requested once per item instead of once per batch.
 */
public final class NPlusOneAnalysis {

    private static final Pattern UUID = Pattern.compile(
            "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}", Pattern.CASE_INSENSITIVE);
    private static final Pattern OBJECT_ID = Pattern.compile("[0-9a-f]{24}", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMERIC_SEGMENT = Pattern.compile("/\\d+");

    private static final Pattern TRAILING_ID = Pattern.compile(
            "/(\\d+|[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}|[0-9a-f]{24})$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ID_PARAM = Pattern.compile("[?&]id=", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENTITY = Pattern.compile("/(?:api/)?(\\w+)/\\*$");

    private static final double BATCH_COST_FACTOR = 1.5;

    private NPlusOneAnalysis() {
    }

    /**
     * Groups data-fetching resources by URL pattern and reports the groups of at least {@code minCount}.
     *
     * @return patterns, largest total duration first
     */
    public static List<NPlusOnePattern> detectNPlusOne(List<Resource> resources, NPlusOneOptions options) {
        Function<Resource, String> extractor = options.patternExtractor() != null
                ? options.patternExtractor()
                : NPlusOneAnalysis::extractPattern;

        Map<String, List<Resource>> byPattern = new LinkedHashMap<>();
        for (Resource resource : resources) {
            if (options.resourceTypes().contains(resource.type())) {
                byPattern.computeIfAbsent(extractor.apply(resource), key -> new ArrayList<>()).add(resource);
            }
        }

        List<NPlusOnePattern> patterns = new ArrayList<>();
        byPattern.forEach((pattern, group) -> {
            if (group.size() < options.minCount()) {
                return;
            }
            double total = group.stream().mapToDouble(Resource::duration).sum();
            patterns.add(new NPlusOnePattern(pattern, group, group.size(), total, total / group.size(),
                    commonInitiator(group)));
        });

        patterns.sort(Comparator.comparingDouble(NPlusOnePattern::totalDuration).reversed());
        return patterns;
    }

    public static List<NPlusOnePattern> detectNPlusOne(List<Resource> resources) {
        return detectNPlusOne(resources, NPlusOneOptions.DEFAULTS);
    }

    /**
     * Default pattern: the URL path with ids replaced by {@code *}, prefixed by the host for remote URLs.
     */
    public static String extractPattern(Resource resource) {
        String url = resource.urlOrName();
        return UrlPaths.parse(url)
                .map(parsed -> {
                    String path = normalizeIds(parsed.path());
                    return parsed.isLocal() ? path : parsed.host() + path;
                })
                .orElseGet(() -> normalizeIds(url));
    }

    static String normalizeIds(String path) {
        String normalized = UUID.matcher(path).replaceAll("*");
        normalized = OBJECT_ID.matcher(normalized).replaceAll("*");
        return NUMERIC_SEGMENT.matcher(normalized).replaceAll("/*");
    }

    private static String commonInitiator(List<Resource> group) {
        String first = group.get(0).initiator();
        if (first == null) {
            return null;
        }
        boolean shared = group.stream().allMatch(resource -> Objects.equals(first, resource.initiator()));
        return shared ? first : null;
    }

    /**
     * Time saved if every pattern were collapsed into one batched request.
     */
    public static double calculateNPlusOneSavings(List<NPlusOnePattern> patterns) {
        return patterns.stream()
                .mapToDouble(p -> Math.max(0, p.totalDuration() - p.avgDuration() * BATCH_COST_FACTOR))
                .sum();
    }

    /**
     * True when the resource fetches a single record by id, in the path or an {@code id} parameter.
     */
    public static boolean isIndividualFetch(Resource resource) {
        String url = resource.urlOrName();
        return TRAILING_ID.matcher(url).find() || ID_PARAM.matcher(url).find();
    }

    /**
     * Entity name of a pattern such as {@code /api/users/*}.
     */
    public static Optional<String> getEntityType(String pattern) {
        Matcher matcher = ENTITY.matcher(pattern);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
