package com.vidnyan.doclinks.adapter.out.parser;

import com.github.javaparser.ast.Node;
import com.vidnyan.doclinks.domain.model.SymbolKind;

import java.util.List;

/**
 * A symbol found in one compilation unit.
 *
 * @param shape  nodes whose structure defines the fingerprint
 * @param extent nodes whose line ranges make up the symbol's source text
 */
record DeclaredSymbol(
    String name,
    SymbolKind kind,
    int line,
    String signature,
    List<Node> shape,
    List<Node> extent
) {
}
