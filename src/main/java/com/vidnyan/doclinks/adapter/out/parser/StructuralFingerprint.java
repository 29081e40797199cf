package com.vidnyan.doclinks.adapter.out.parser;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.metamodel.BaseNodeMetaModel;
import com.github.javaparser.metamodel.PropertyMetaModel;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;

/**
 * Hash of a syntax tree's shape.
 * <p>
 * Every node is rendered as its type name followed by all of its properties, child nodes
 * recursively and plain values (identifiers, literals, operators, modifiers) verbatim.
 * Positions, tokens and comments are not properties of the tree and never take part,
 * so reformatting and comment edits keep the hash while any change to parameters,
 * statements or nesting alters it.
 */
public final class StructuralFingerprint {

    private static final String COMMENT_PROPERTY = "comment";

    private StructuralFingerprint() {
    }

    public static String of(List<? extends Node> nodes) {
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes) {
            appendNode(node, sb);
            sb.append('\n');
        }
        return sha256(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * The position-free rendering that gets hashed.
     */
    static String canonical(Node node) {
        StringBuilder sb = new StringBuilder();
        appendNode(node, sb);
        return sb.toString();
    }

    public static String sha256(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void appendNode(Node node, StringBuilder out) {
        BaseNodeMetaModel meta = node.getMetaModel();
        out.append('(').append(meta.getTypeName());
        for (PropertyMetaModel property : meta.getAllPropertyMetaModels()) {
            if (COMMENT_PROPERTY.equals(property.getName())) {
                continue;
            }
            out.append(' ').append(property.getName()).append('=');
            appendValue(property.getValue(node), out);
        }
        out.append(')');
    }

    private static void appendValue(Object value, StringBuilder out) {
        if (value == null) {
            out.append('_');
        } else if (value instanceof Node child) {
            appendNode(child, out);
        } else if (value instanceof NodeList<?> list) {
            out.append('[');
            for (Node child : list) {
                appendNode(child, out);
            }
            out.append(']');
        } else if (value instanceof Collection<?> values) {
            out.append('{');
            for (Object v : values) {
                appendValue(v, out);
                out.append(',');
            }
            out.append('}');
        } else if (value instanceof Enum<?> e) {
            out.append(e.name());
        } else {
            // quoted so that identifiers and literals can't run into each other
            out.append('"')
                    .append(value.toString().replace("\\", "\\\\").replace("\"", "\\\""))
                    .append('"');
        }
    }
}
