package com.ward.core.issue.detector;

import com.ward.core.issue.CodeExample;
import com.ward.core.issue.IssueCategory;
import com.ward.core.issue.IssueDefinition;
import com.ward.core.issue.IssueDetector;
import com.ward.core.issue.IssueImpact;
import com.ward.core.issue.IssueMatch;
import com.ward.core.issue.IssueSeverity;
import com.ward.core.issue.IssueSuggestion;
import com.ward.core.session.PageSession;
import com.ward.core.session.Resource;
import com.ward.core.session.ResourceType;
import com.ward.core.span.SpanAttributes;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Server-side GET fetches that hit the network on every request.
 */
public class UncachedFetchDetector implements IssueDetector {

    public static final String ID = "cache:fetch-no-config";

    static final double MIN_DURATION_MS = 30;
    static final double CRITICAL_TOTAL_MS = 500;
    static final int WARNING_COUNT = 5;
    private static final int LISTED_URLS = 3;

    private static final String DOCS_URL = "https://nextjs.org/docs/app/building-your-application/caching#fetch";

    private static final IssueDefinition DEFINITION = new IssueDefinition(
            ID, "Uncached fetch in Server Component", IssueCategory.CACHING, IssueSeverity.WARNING, DOCS_URL);

    private static final Set<ResourceType> FETCH_TYPES =
            Set.of(ResourceType.FETCH, ResourceType.API, ResourceType.EXTERNAL);

    private static final List<String> INTERNAL_PATTERNS = List.of(
            "localhost", "127.0.0.1", "_next", "__next", "webpack", "turbopack", "favicon",
            ".ico", ".png", ".jpg", ".svg", ".woff", ".css", ".js");

    private static final List<String> MUTATING_PREFIXES = List.of("post ", "put ", "delete ", "patch ");

    private static final String BEFORE = """
            // hits the API on every request
            const rates = await fetch('https://api.example.com/rates');""";

    private static final String AFTER = """
            // revalidate at most once an hour
            const rates = await fetch('https://api.example.com/rates', {
              next: { revalidate: 3600 },
            });

            // or tag it and invalidate with revalidateTag('rates')
            const rates = await fetch('https://api.example.com/rates', {
              next: { tags: ['rates'] },
            });""";

    @Override
    public IssueDefinition definition() {
        return DEFINITION;
    }

    @Override
    public Optional<IssueMatch> detect(PageSession session) {
        List<Resource> uncached = session.resources().stream()
                .filter(Resource::isServer)
                .filter(resource -> FETCH_TYPES.contains(resource.type()))
                .filter(resource -> !resource.cached())
                .filter(resource -> resource.duration() > MIN_DURATION_MS)
                .filter(resource -> !isInternalRequest(resource))
                .filter(UncachedFetchDetector::looksIdempotent)
                .toList();
        if (uncached.isEmpty()) {
            return Optional.empty();
        }

        double totalTime = uncached.stream().mapToDouble(Resource::duration).sum();
        IssueSeverity severity;
        if (totalTime > CRITICAL_TOTAL_MS) {
            severity = IssueSeverity.CRITICAL;
        } else if (uncached.size() > WARNING_COUNT) {
            severity = IssueSeverity.WARNING;
        } else {
            severity = IssueSeverity.INFO;
        }

        return Optional.of(new IssueMatch(
                ID,
                severity,
                uncached,
                IssueImpact.of(totalTime, session),
                Map.of("count", uncached.size(), "avgDuration", totalTime / uncached.size())));
    }

    @Override
    public IssueSuggestion suggest(IssueMatch match) {
        Integer count = match.contextValue("count", Integer.class);
        int requests = count != null ? count : match.resources().size();
        long totalMs = Math.round(match.impact().timeMs());

        String examples = match.resources().stream()
                .limit(LISTED_URLS)
                .map(ResourceLabels::url)
                .collect(Collectors.joining(", "));
        String andMore = requests > LISTED_URLS ? " and " + (requests - LISTED_URLS) + " more" : "";

        return IssueSuggestion.builder()
                .summary(requests + " fetch request(s) not cached")
                .explanation("No cache configuration on: " + examples + andMore + ".\n\n"
                        + "Server-side fetch() is not cached unless asked to be. Data that does not change per "
                        + "request can be revalidated on a timer or by tag.\n\n"
                        + "A cache hit would skip the " + totalMs + "ms spent waiting on these requests.")
                .codeExample(new CodeExample(BEFORE, AFTER, "typescript"))
                .docsUrl(DOCS_URL)
                .estimatedImprovement("~" + totalMs + "ms faster on cache hits")
                .build();
    }

    static boolean isInternalRequest(Resource resource) {
        String url = resource.urlOrName().toLowerCase(Locale.ROOT);
        return INTERNAL_PATTERNS.stream().anyMatch(url::contains);
    }

    static boolean looksIdempotent(Resource resource) {
        Object method = SpanAttributes.firstPresent(resource.attributes(),
                SpanAttributes.HTTP_REQUEST_METHOD, SpanAttributes.HTTP_METHOD);
        if (SpanAttributes.isTruthy(method) && !"GET".equals(method)) {
            return false;
        }
        String name = resource.name().toLowerCase(Locale.ROOT);
        return MUTATING_PREFIXES.stream().noneMatch(name::contains);
    }
}
