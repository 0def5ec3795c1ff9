package com.ward.core.issue.algorithm;

import com.ward.core.session.Resource;
import com.ward.core.session.ResourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.ward.core.issue.IssueFixtures.server;
import static com.ward.core.issue.IssueFixtures.withInitiator;
import static org.assertj.core.api.Assertions.assertThat;

class NPlusOneAnalysisTest {

    private static List<Resource> userFetches(int count) {
        List<Resource> resources = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            double start = i * 50;
            resources.add(withInitiator(
                    server("u" + i, ResourceType.API, "/api/users/" + i, start, start + 40), "list.tsx:10"));
        }
        return resources;
    }

    @Test
    @DisplayName("Requests differing only by id collapse into one pattern")
    void detectsUserFetchPattern() {
        List<NPlusOnePattern> patterns = NPlusOneAnalysis.detectNPlusOne(userFetches(3));

        assertThat(patterns).hasSize(1);
        NPlusOnePattern pattern = patterns.get(0);
        assertThat(pattern.pattern()).isEqualTo("/api/users/*");
        assertThat(pattern.count()).isEqualTo(3);
        assertThat(pattern.totalDuration()).isEqualTo(120.0);
        assertThat(pattern.avgDuration()).isEqualTo(40.0);
        assertThat(pattern.initiator()).isEqualTo("list.tsx:10");
        assertThat(NPlusOneAnalysis.calculateNPlusOneSavings(patterns)).isEqualTo(60.0);
    }

    @Test
    @DisplayName("One below the minimum count is not reported, the minimum count is")
    void minCountThreshold() {
        NPlusOneOptions options = NPlusOneOptions.DEFAULTS.withMinCount(4);

        assertThat(NPlusOneAnalysis.detectNPlusOne(userFetches(3), options)).isEmpty();
        assertThat(NPlusOneAnalysis.detectNPlusOne(userFetches(4), options)).hasSize(1);
    }

    @Test
    @DisplayName("Mixed initiators leave the pattern without an initiator")
    void mixedInitiators() {
        List<Resource> resources = new ArrayList<>(userFetches(2));
        resources.add(server("u3", ResourceType.API, "/api/users/3", 200, 240));

        assertThat(NPlusOneAnalysis.detectNPlusOne(resources).get(0).initiator()).isNull();
    }

    @Test
    @DisplayName("Non data-fetching resources are ignored")
    void ignoresRenderResources() {
        List<Resource> renders = List.of(
                server("r1", ResourceType.RENDER, "/items/1", 0, 10),
                server("r2", ResourceType.RENDER, "/items/2", 10, 20),
                server("r3", ResourceType.RENDER, "/items/3", 20, 30));

        assertThat(NPlusOneAnalysis.detectNPlusOne(renders)).isEmpty();
    }

    @Test
    @DisplayName("Patterns normalize UUIDs, object ids and numeric segments and keep remote hosts")
    void extractsPatterns() {
        assertThat(NPlusOneAnalysis.normalizeIds("/orders/3f2b8c1e-9a4d-4e6f-8b7a-1c2d3e4f5a6b/items"))
                .isEqualTo("/orders/*/items");
        assertThat(NPlusOneAnalysis.normalizeIds("/posts/507f1f77bcf86cd799439011")).isEqualTo("/posts/*");
        assertThat(NPlusOneAnalysis.extractPattern(
                server("x", ResourceType.EXTERNAL, "https://api.example.com/items/5?full=1", 0, 1)))
                .isEqualTo("api.example.com/items/*");
    }

    @Test
    @DisplayName("Object ids collapse before numeric segments, so a digit-leading id becomes one wildcard")
    void objectIdsBeforeNumericSegments() {
        assertThat(NPlusOneAnalysis.normalizeIds("/users/64a7f1c2e4b0a1b2c3d4e5f6/orders/12"))
                .isEqualTo("/users/*/orders/*");
        assertThat(NPlusOneAnalysis.extractPattern(
                server("y", ResourceType.FETCH, "http://localhost:3000/api/carts/9b1deb4d3b7d4bad9bdd2b0d", 0, 1)))
                .isEqualTo("/api/carts/*");
    }

    @Test
    @DisplayName("Individual fetches and entity types are recognized")
    void individualFetchAndEntity() {
        assertThat(NPlusOneAnalysis.isIndividualFetch(server("a", ResourceType.API, "/api/users/42", 0, 1))).isTrue();
        assertThat(NPlusOneAnalysis.isIndividualFetch(server("b", ResourceType.API, "/api/users?id=42", 0, 1))).isTrue();
        assertThat(NPlusOneAnalysis.isIndividualFetch(server("c", ResourceType.API, "/api/users", 0, 1))).isFalse();

        assertThat(NPlusOneAnalysis.getEntityType("/api/users/*")).contains("users");
        assertThat(NPlusOneAnalysis.getEntityType("/health")).isEmpty();
    }
}
