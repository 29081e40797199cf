package com.vidnyan.doclinks.application.service;

import com.vidnyan.doclinks.domain.fix.FixContext;
import com.vidnyan.doclinks.domain.fix.IssueType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FixPromptRendererTest {

    private final FixPromptRenderer renderer = new FixPromptRenderer();

    @Test
    void render_StaleIssueIncludesCurrentCode() {
        FixContext context = new FixContext("docs/guide.md", "AuthService.authenticate", 12, IssueType.STALE,
                "referenced method changed since the link was resolved", "Login",
                "public boolean authenticate(String token) {\n    return true;\n}", null);

        String prompt = renderer.render(context);

        assertTrue(prompt.startsWith("## Fix stale reference"));
        assertTrue(prompt.contains("`docs/guide.md` line 12"));
        assertTrue(prompt.contains("**Section:** Login"));
        assertTrue(prompt.contains("```java\npublic boolean authenticate(String token) {"));
    }

    @Test
    void render_BrokenIssueListsCandidates() {
        FixContext context = new FixContext("docs/guide.md", "Helpr", 3, IssueType.BROKEN, "symbol not found",
                null, null, List.of("src/Helper.java", "src/Helper.java::Helper"));

        String prompt = renderer.render(context);

        assertFalse(prompt.contains("**Section:**"));
        assertTrue(prompt.contains("Possible targets:\n- `src/Helper.java`\n- `src/Helper.java::Helper`\n"));
    }

    @Test
    void render_IssueWithoutCandidatesSaysSo() {
        FixContext context = new FixContext("docs/guide.md", "Nope", 3, IssueType.BROKEN, "symbol not found",
                null, null, List.of());

        assertTrue(renderer.render(context).contains("No candidates found."));
    }

    @Test
    void render_AmbiguousIssueAsksForQualification() {
        FixContext context = new FixContext("docs/guide.md", "Helper", 3, IssueType.AMBIGUOUS,
                "ambiguous: found in 2 locations", "API", null, List.of("a/Helper.java:3", "b/Helper.java:3"));

        String prompt = renderer.render(context);

        assertTrue(prompt.contains("Matching definitions:"));
        assertTrue(prompt.contains("Qualify the reference"));
    }
}
