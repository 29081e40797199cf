package com.vidnyan.doclinks.adapter.out.markdown;

import com.vidnyan.doclinks.application.port.out.SectionLocator;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.ast.Node;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Finds the ATX heading ({@code # ...}) governing a line of a Markdown file.
 * Headings are taken from the parsed document, so {@code #} lines inside code never count.
 */
@Slf4j
@Component
public class MarkdownSectionLocator implements SectionLocator {

    @Override
    public Optional<String> sectionFor(Path docFile, int line) {
        Document document;
        try {
            document = MarkdownDocuments.parse(docFile);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", docFile, e.getMessage());
            return Optional.empty();
        }

        String heading = null;
        for (Node node : document.getDescendants()) {
            if (node instanceof Heading h && h.isAtxHeading()) {
                if (MarkdownDocuments.lineOf(h) > line) {
                    break;
                }
                String text = h.getText().toString().strip();
                if (!text.isEmpty()) {
                    heading = text;
                }
            }
        }
        return Optional.ofNullable(heading);
    }
}
