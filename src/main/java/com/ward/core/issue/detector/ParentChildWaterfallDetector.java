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

import java.util.Map;
import java.util.Optional;

/**
 * A server-side parent (typically a layout) whose data fetch holds back a child fetch.
 */
public class ParentChildWaterfallDetector implements IssueDetector {

    public static final String ID = "rsc:waterfall-parent-child";

    static final double MIN_WASTED_MS = 50;
    static final double CRITICAL_WASTED_MS = 200;

    private static final String DOCS_URL =
            "https://nextjs.org/docs/app/building-your-application/data-fetching/fetching#parallel-and-sequential-data-fetching";

    private static final IssueDefinition DEFINITION = new IssueDefinition(
            ID, "Layout fetch blocks page render", IssueCategory.WATERFALL, IssueSeverity.CRITICAL, DOCS_URL);

    private static final String BEFORE = """
            // app/dashboard/layout.tsx
            export default async function Layout({ children }) {
              const account = await loadAccount(); // page waits for this
              return <Shell account={account}>{children}</Shell>;
            }

            // app/dashboard/page.tsx
            export default async function Page() {
              const reports = await loadReports();
              return <Reports reports={reports} />;
            }""";

    private static final String AFTER = """
            // app/dashboard/layout.tsx
            export default function Layout({ children }) {
              return (
                <Shell>
                  <Suspense fallback={<AccountPlaceholder />}>
                    <AccountMenu />
                  </Suspense>
                  {children}
                </Shell>
              );
            }

            // app/dashboard/account-menu.tsx
            async function AccountMenu() {
              const account = await loadAccount(); // streams in on its own
              return <Menu account={account} />;
            }""";

    @Override
    public IssueDefinition definition() {
        return DEFINITION;
    }

    @Override
    public Optional<IssueMatch> detect(PageSession session) {
        Optional<WaterfallChain> waterfall = WaterfallAnalysis.detectParentChildWaterfall(session.rootResources());
        if (waterfall.isEmpty() || waterfall.get().wastedTime() < MIN_WASTED_MS) {
            return Optional.empty();
        }

        WaterfallChain chain = waterfall.get();
        Resource parent = chain.resources().get(0);
        Resource child = chain.resources().get(1);
        if (!parent.isServer() || !child.isServer()) {
            return Optional.empty();
        }

        IssueSeverity severity = chain.wastedTime() > CRITICAL_WASTED_MS ? IssueSeverity.CRITICAL : IssueSeverity.WARNING;
        return Optional.of(new IssueMatch(
                ID,
                severity,
                chain.resources(),
                IssueImpact.of(chain.wastedTime(), session),
                Map.of("parentResource", parent, "childResource", child, "depth", chain.depth())));
    }

    @Override
    public IssueSuggestion suggest(IssueMatch match) {
        Resource parent = match.contextValue("parentResource", Resource.class);
        Resource child = match.contextValue("childResource", Resource.class);
        long timeMs = Math.round(match.impact().timeMs());

        String parentName = parent != null ? ResourceLabels.name(parent) : "parent";
        String childName = child != null ? ResourceLabels.name(child) : "child";

        return IssueSuggestion.builder()
                .summary("Data fetch in layout blocks " + childName)
                .explanation("\"" + parentName + "\" has to finish before \"" + childName + "\" can start, "
                        + "adding about " + timeMs + "ms to every page rendered under it.\n\n"
                        + "A layout that awaits data delays rendering of the page it wraps. Move the fetch into "
                        + "a component behind a Suspense boundary, or start both fetches together at page level.")
                .codeExample(new CodeExample(BEFORE, AFTER, "typescript"))
                .docsUrl(DOCS_URL)
                .estimatedImprovement("~" + timeMs + "ms faster page loads")
                .build();
    }
}
