package com.ward.core.session;

import com.ward.core.span.SpanOrigin;
import lombok.Builder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read-side queries over built sessions: filtering, critical path, errors and slow resources.
 */
public final class ResourceQueries {

    private ResourceQueries() {
    }

    /**
     * Criteria for {@link #filterResources}. Null or empty fields do not filter.
     */
    @Builder
    public record ResourceFilter(
            String search,
            Set<ResourceType> types,
            Set<SpanOrigin> origins,
            Double minDuration,
            boolean showErrorsOnly
    ) {
        public static final ResourceFilter NONE = ResourceFilter.builder().build();
    }

    public static List<Resource> filterResources(List<Resource> resources, ResourceFilter filter) {
        String search = filter.search() == null || filter.search().isEmpty()
                ? null
                : filter.search().toLowerCase(Locale.ROOT);

        return resources.stream()
                .filter(resource -> search == null
                        || resource.name().toLowerCase(Locale.ROOT).contains(search)
                        || resource.url().toLowerCase(Locale.ROOT).contains(search))
                .filter(resource -> filter.types() == null || filter.types().isEmpty()
                        || filter.types().contains(resource.type()))
                .filter(resource -> filter.origins() == null || filter.origins().isEmpty()
                        || filter.origins().contains(resource.origin()))
                .filter(resource -> filter.minDuration() == null || resource.duration() >= filter.minDuration())
                .filter(resource -> !filter.showErrorsOnly() || resource.isError())
                .toList();
    }

    /**
     * Follows the slowest resource at each level, starting from the roots.
     *
     * @return resource ids from root to leaf
     */
    public static List<String> findCriticalPath(List<Resource> rootResources) {
        List<String> path = new ArrayList<>();
        Resource current = slowest(rootResources);
        while (current != null) {
            path.add(current.id());
            current = slowest(current.children());
        }
        return path;
    }

    /**
     * Failed resources across sessions, most recent first.
     */
    public static List<Resource> errors(Collection<PageSession> sessions) {
        return sessions.stream()
                .flatMap(session -> session.resources().stream())
                .filter(ResourceQueries::isFailed)
                .sorted(Comparator.comparingDouble(Resource::startTime).reversed())
                .toList();
    }

    /**
     * Resources at least {@code thresholdMs} long across sessions, slowest first.
     */
    public static List<Resource> slowResources(Collection<PageSession> sessions, double thresholdMs) {
        return sessions.stream()
                .flatMap(session -> session.resources().stream())
                .filter(resource -> resource.duration() >= thresholdMs)
                .sorted(Comparator.comparingDouble(Resource::duration).reversed())
                .toList();
    }

    static boolean isFailed(Resource resource) {
        return resource.isError() || (resource.statusCode() != null && resource.statusCode() >= 400);
    }

    private static Resource slowest(List<Resource> resources) {
        Resource slowest = null;
        for (Resource resource : resources) {
            if (slowest == null || resource.duration() > slowest.duration()) {
                slowest = resource;
            }
        }
        return slowest;
    }
}
