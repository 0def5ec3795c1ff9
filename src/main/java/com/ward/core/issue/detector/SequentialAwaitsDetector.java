package com.ward.core.issue.detector;

import com.ward.core.issue.CodeExample;
import com.ward.core.issue.IssueCategory;
import com.ward.core.issue.IssueDefinition;
import com.ward.core.issue.IssueDetector;
import com.ward.core.issue.IssueImpact;
import com.ward.core.issue.IssueMatch;
import com.ward.core.issue.IssueSeverity;
import com.ward.core.issue.IssueSuggestion;
import com.ward.core.issue.algorithm.WaterfallAnalysis;
import com.ward.core.issue.algorithm.WaterfallChain;
import com.ward.core.session.PageSession;
import com.ward.core.session.Resource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Independent fetches from one source file that are awaited one after another.
 */
public class SequentialAwaitsDetector implements IssueDetector {

    public static final String ID = "rsc:waterfall-sequential-awaits";

    static final double MIN_WASTED_MS = 30;
    static final double CRITICAL_WASTED_MS = 150;
    private static final int LISTED_FETCHES = 4;

    private static final IssueDefinition DEFINITION = new IssueDefinition(
            ID, "Sequential awaits in Server Component", IssueCategory.WATERFALL, IssueSeverity.WARNING, null);

    private static final String BEFORE = """
            const profile = await loadProfile(id);
            const orders = await loadOrders(id);
            const invoices = await loadInvoices(id);""";

    private static final String AFTER = """
            const [profile, orders, invoices] = await Promise.all([
              loadProfile(id),
              loadOrders(id),
              loadInvoices(id),
            ]);""";

    @Override
    public IssueDefinition definition() {
        return DEFINITION;
    }

    @Override
    public Optional<IssueMatch> detect(PageSession session) {
        List<Resource> serverResources = session.resources().stream()
                .filter(Resource::isServer)
                .toList();

        List<WaterfallChain> waterfalls = WaterfallAnalysis.detectSequentialByInitiator(serverResources);
        if (waterfalls.isEmpty()) {
            return Optional.empty();
        }

        WaterfallChain worst = waterfalls.get(0);
        if (worst.wastedTime() < MIN_WASTED_MS) {
            return Optional.empty();
        }

        Map<String, Object> context = new HashMap<>();
        context.put("initiator", worst.resources().get(0).initiator());
        context.put("chainLength", worst.resources().size());
        context.put("allWaterfalls", waterfalls);

        IssueSeverity severity = worst.wastedTime() > CRITICAL_WASTED_MS ? IssueSeverity.CRITICAL : IssueSeverity.WARNING;
        return Optional.of(new IssueMatch(
                ID, severity, worst.resources(), IssueImpact.of(worst.wastedTime(), session), context));
    }

    @Override
    public IssueSuggestion suggest(IssueMatch match) {
        String initiator = match.contextValue("initiator", String.class);
        Integer chainLength = match.contextValue("chainLength", Integer.class);
        long timeMs = Math.round(match.impact().timeMs());
        int count = match.resources().size();

        String location = initiator != null ? " in " + initiator : "";
        String fetchList = match.resources().stream()
                .limit(LISTED_FETCHES)
                .map(ResourceLabels::fetchName)
                .collect(Collectors.joining(", "));
        String andMore = count > LISTED_FETCHES ? " and " + (count - LISTED_FETCHES) + " more" : "";

        return IssueSuggestion.builder()
                .summary((chainLength != null ? chainLength : count) + " sequential fetches" + location)
                .explanation("These fetches wait for each other: " + fetchList + andMore + ".\n\n"
                        + "None of them uses another's result, so starting them together with Promise.all "
                        + "would save about " + timeMs + "ms.")
                .codeExample(new CodeExample(BEFORE, AFTER, "typescript"))
                .estimatedImprovement("~" + timeMs + "ms faster")
                .build();
    }
}
