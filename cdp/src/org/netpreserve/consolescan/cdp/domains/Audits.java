package org.netpreserve.consolescan.cdp.domains;

import java.util.function.Consumer;

public interface Audits {
    void enable();

    void onIssueAdded(Consumer<IssueAdded> handler);

    record IssueAdded(InspectorIssue issue) {
    }

    record InspectorIssue(String code, InspectorIssueDetails details) {
    }

    /**
     * Only the details we act on. Other issue kinds deserialize with this field null.
     */
    record InspectorIssueDetails(ContentSecurityPolicyIssueDetails contentSecurityPolicyIssueDetails) {
    }

    record ContentSecurityPolicyIssueDetails(String blockedURL, String violatedDirective, boolean isReportOnly,
                                             String contentSecurityPolicyViolationType,
                                             SourceCodeLocation sourceCodeLocation) {
    }

    record SourceCodeLocation(String url, int lineNumber, int columnNumber) {
    }
}
