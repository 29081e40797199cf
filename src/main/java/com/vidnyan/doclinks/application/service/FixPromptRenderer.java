package com.vidnyan.doclinks.application.service;

import com.vidnyan.doclinks.domain.fix.FixContext;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders a fix context as a Markdown prompt for a human or an agent.
 */
@Component
public class FixPromptRenderer {

    public String render(FixContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Fix ").append(context.issueType().wireName()).append(" reference\n\n");
        sb.append("**Document:** `").append(context.docPath()).append("` line ").append(context.line()).append('\n');
        if (context.docSection() != null) {
            sb.append("**Section:** ").append(context.docSection()).append('\n');
        }
        sb.append("**Reference:** `").append(context.ref()).append("`\n");
        sb.append("**Problem:** ").append(context.reason()).append("\n\n");

        switch (context.issueType()) {
            case STALE -> {
                if (context.currentCode() != null) {
                    sb.append("The referenced code has changed. Current source:\n\n");
                    sb.append("```java\n").append(context.currentCode()).append("\n```\n\n");
                }
                sb.append("Update the documentation so it describes the code as it is now.\n");
            }
            case BROKEN -> {
                appendCandidates(sb, "Possible targets:", context.candidates());
                sb.append("Point the reference at an existing file or symbol, or remove it.\n");
            }
            case AMBIGUOUS -> {
                appendCandidates(sb, "Matching definitions:", context.candidates());
                sb.append("Qualify the reference (e.g. with its package) so it names exactly one definition.\n");
            }
        }
        return sb.toString();
    }

    private static void appendCandidates(StringBuilder sb, String title, List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            sb.append("No candidates found.\n\n");
            return;
        }
        sb.append(title).append('\n');
        candidates.forEach(c -> sb.append("- `").append(c).append("`\n"));
        sb.append('\n');
    }
}
