package com.ward.core.session;

import com.ward.core.span.SpanOrigin;
import com.ward.core.span.SpanStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceQueriesTest {

    private static Resource resource(String id, ResourceType type, SpanOrigin origin, double start, double end) {
        return Resource.builder()
                .id(id)
                .sessionId("nav_1")
                .type(type)
                .origin(origin)
                .name("resource " + id)
                .url("https://api.example.com/" + id)
                .startTime(start)
                .endTime(end)
                .duration(end - start)
                .status(SpanStatus.OK)
                .build();
    }

    private final Resource users = resource("users", ResourceType.API, SpanOrigin.SERVER, 0, 120);
    private final Resource db = resource("db", ResourceType.DATABASE, SpanOrigin.SERVER, 10, 30);
    private final Resource failed = resource("orders", ResourceType.FETCH, SpanOrigin.CLIENT, 200, 900).toBuilder()
            .statusCode(503)
            .build();
    private final List<Resource> all = List.of(users, db, failed);

    @Test
    @DisplayName("Filters by search text, type, origin and duration")
    void filtersResources() {
        assertThat(ResourceQueries.filterResources(all, ResourceQueries.ResourceFilter.NONE)).hasSize(3);
        assertThat(ResourceQueries.filterResources(all,
                ResourceQueries.ResourceFilter.builder().search("USERS").build()))
                .containsExactly(users);
        assertThat(ResourceQueries.filterResources(all,
                ResourceQueries.ResourceFilter.builder().types(Set.of(ResourceType.DATABASE)).build()))
                .containsExactly(db);
        assertThat(ResourceQueries.filterResources(all,
                ResourceQueries.ResourceFilter.builder().origins(Set.of(SpanOrigin.CLIENT)).build()))
                .containsExactly(failed);
        assertThat(ResourceQueries.filterResources(all,
                ResourceQueries.ResourceFilter.builder().minDuration(100.0).build()))
                .containsExactly(users, failed);
    }

    @Test
    @DisplayName("Critical path follows the slowest child at each level")
    void criticalPath() {
        Resource slowChild = resource("slow", ResourceType.FETCH, SpanOrigin.SERVER, 10, 90);
        Resource fastChild = resource("fast", ResourceType.FETCH, SpanOrigin.SERVER, 10, 20);
        Resource root = users.toBuilder().children(List.of(fastChild, slowChild)).build();

        assertThat(ResourceQueries.findCriticalPath(List.of(db, root))).containsExactly("users", "slow");
        assertThat(ResourceQueries.findCriticalPath(List.of())).isEmpty();
    }

    @Test
    @DisplayName("Errors include error status and HTTP 4xx/5xx, slow resources are sorted by duration")
    void errorsAndSlowResources() {
        Resource errored = db.toBuilder().status(SpanStatus.ERROR).build();
        PageSession session = PageSession.builder()
                .id("nav_1")
                .resources(List.of(users, errored, failed))
                .rootResources(List.of(users, errored, failed))
                .stats(SessionStats.of(List.of(users, errored, failed)))
                .timing(PageTiming.builder().navigationStart(0).build())
                .build();

        assertThat(ResourceQueries.errors(List.of(session))).containsExactly(failed, errored);
        assertThat(ResourceQueries.slowResources(List.of(session), 100)).containsExactly(failed, users);
    }
}
