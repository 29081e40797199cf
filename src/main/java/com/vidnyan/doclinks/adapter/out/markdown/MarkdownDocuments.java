package com.vidnyan.doclinks.adapter.out.markdown;

import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.sequence.BasedSequence;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Parses Markdown files into flexmark documents and maps nodes back to 1-based lines.
 */
final class MarkdownDocuments {

    private static final Parser PARSER = Parser.builder().build();

    private MarkdownDocuments() {
    }

    static Document parse(Path docFile) throws IOException {
        return PARSER.parse(Files.readString(docFile, StandardCharsets.UTF_8));
    }

    static int lineOf(Node node) {
        return node.getStartLineNumber() + 1;
    }

    static int lineOf(Node node, BasedSequence chars) {
        return node.getDocument().getLineNumber(chars.getStartOffset()) + 1;
    }

    /**
     * First word of the block's info string, lower-cased; empty when the fence has none.
     */
    static String language(FencedCodeBlock block) {
        String info = block.getInfo().toString().strip();
        if (info.isEmpty()) {
            return "";
        }
        return info.split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
    }
}
