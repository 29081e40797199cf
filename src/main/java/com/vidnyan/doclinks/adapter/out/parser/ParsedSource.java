package com.vidnyan.doclinks.adapter.out.parser;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;

import java.nio.file.Path;
import java.util.List;

/**
 * A successfully parsed source file together with its raw text.
 */
public record ParsedSource(Path file, String content, CompilationUnit unit) {

    /**
     * Exact source lines covered by the nodes, each node's slice separated by a blank line.
     */
    public String slice(List<? extends Node> nodes) {
        String[] lines = content.split("\\R", -1);
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes) {
            if (node.getRange().isEmpty()) {
                continue;
            }
            int begin = node.getRange().get().begin.line;
            int end = Math.min(node.getRange().get().end.line, lines.length);
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            for (int i = begin; i <= end; i++) {
                sb.append(lines[i - 1]);
                if (i < end) {
                    sb.append('\n');
                }
            }
        }
        return sb.toString();
    }
}
