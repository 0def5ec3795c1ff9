package com.ward.core.issue.detector;

import com.ward.core.issue.CodeExample;
import com.ward.core.issue.IssueCategory;
import com.ward.core.issue.IssueDefinition;
import com.ward.core.issue.IssueDetector;
import com.ward.core.issue.IssueImpact;
import com.ward.core.issue.IssueMatch;
import com.ward.core.issue.IssueSeverity;
import com.ward.core.issue.IssueSuggestion;
import com.ward.core.issue.algorithm.NPlusOneAnalysis;
import com.ward.core.issue.algorithm.NPlusOneOptions;
import com.ward.core.issue.algorithm.NPlusOnePattern;
import com.ward.core.session.PageSession;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The same endpoint requested once per item, where one batched request would do.
 */
public class NPlusOneDetector implements IssueDetector {

    public static final String ID = "rsc:n-plus-1";

    static final int MIN_COUNT = 3;
    static final int CRITICAL_COUNT = 10;

    private static final IssueDefinition DEFINITION = new IssueDefinition(
            ID, "N+1 query pattern", IssueCategory.DATA_FETCHING, IssueSeverity.CRITICAL, null);

    private static final String BEFORE = """
            const orders = await loadOrders();
            const customers = await Promise.all(
              orders.map(order => loadCustomer(order.customerId)) // one request per order
            );""";

    private static final String AFTER = """
            const orders = await loadOrders();
            const ids = [...new Set(orders.map(order => order.customerId))];
            const customers = await loadCustomers(ids); // one request in total
            const byId = new Map(customers.map(c => [c.id, c]));""";

    @Override
    public IssueDefinition definition() {
        return DEFINITION;
    }

    @Override
    public Optional<IssueMatch> detect(PageSession session) {
        List<NPlusOnePattern> patterns = NPlusOneAnalysis.detectNPlusOne(
                session.resources(), NPlusOneOptions.DEFAULTS.withMinCount(MIN_COUNT));
        if (patterns.isEmpty()) {
            return Optional.empty();
        }

        NPlusOnePattern worst = patterns.get(0);
        Map<String, Object> context = new HashMap<>();
        context.put("pattern", worst.pattern());
        context.put("count", worst.count());
        context.put("avgDuration", worst.avgDuration());
        context.put("initiator", worst.initiator());
        context.put("entityType", NPlusOneAnalysis.getEntityType(worst.pattern()).orElse(null));
        context.put("allPatterns", patterns);

        IssueSeverity severity = worst.count() > CRITICAL_COUNT ? IssueSeverity.CRITICAL : IssueSeverity.WARNING;
        return Optional.of(new IssueMatch(
                ID, severity, worst.resources(), IssueImpact.of(worst.totalDuration(), session), context));
    }

    @Override
    public IssueSuggestion suggest(IssueMatch match) {
        String pattern = match.contextValue("pattern", String.class);
        Integer count = match.contextValue("count", Integer.class);
        Double avgDuration = match.contextValue("avgDuration", Double.class);
        String initiator = match.contextValue("initiator", String.class);

        int requests = count != null ? count : match.resources().size();
        long avgMs = Math.round(avgDuration != null ? avgDuration : 0);
        long totalMs = Math.round(match.impact().timeMs());
        String location = initiator != null ? " from " + initiator : "";

        return IssueSuggestion.builder()
                .summary(requests + " requests to " + pattern)
                .explanation(requests + " separate requests" + location + " fetch items one at a time.\n\n"
                        + "Each takes about " + avgMs + "ms, " + totalMs + "ms in total. This usually comes from "
                        + "fetching inside a loop or inside a component rendered per list item. "
                        + "Fetching all items in one request removes most of that time.")
                .codeExample(new CodeExample(BEFORE, AFTER, "typescript"))
                .estimatedImprovement("~" + (totalMs - avgMs) + "ms faster (" + requests + " requests -> 1)")
                .build();
    }
}
