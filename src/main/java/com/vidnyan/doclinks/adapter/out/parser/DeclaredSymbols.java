package com.vidnyan.doclinks.adapter.out.parser;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.vidnyan.doclinks.domain.model.SymbolKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Enumerates the symbols a compilation unit defines. Only syntax is consulted:
 * top-level types, their directly declared methods, their upper-case static fields
 * and their enum constants. Nested types and inherited members are not visited.
 */
final class DeclaredSymbols {

    private DeclaredSymbols() {
    }

    static List<DeclaredSymbol> of(CompilationUnit unit) {
        List<DeclaredSymbol> symbols = new ArrayList<>();
        for (TypeDeclaration<?> type : unit.getTypes()) {
            collectType(type, symbols);
        }
        return symbols;
    }

    static Optional<DeclaredSymbol> find(CompilationUnit unit, String name) {
        return of(unit).stream()
                .filter(s -> s.name().equals(name))
                .findFirst();
    }

    private static void collectType(TypeDeclaration<?> type, List<DeclaredSymbol> out) {
        DeclarationShape shape = DeclarationShape.of(type);
        String typeName = type.getNameAsString();

        out.add(new DeclaredSymbol(
                typeName,
                SymbolKind.CLASS,
                beginLine(type),
                shape.keyword() + " " + typeName,
                List.of(type),
                List.of(type)));

        // Overloads share a name, so they share one entry
        Map<String, List<MethodDeclaration>> methodsByName = new LinkedHashMap<>();
        for (MethodDeclaration md : type.getMethods()) {
            methodsByName.computeIfAbsent(md.getNameAsString(), k -> new ArrayList<>()).add(md);
        }
        methodsByName.forEach((name, overloads) -> out.add(methodSymbol(typeName, name, overloads)));

        for (FieldDeclaration field : type.getFields()) {
            if (!field.isStatic() && !shape.implicitlyStaticFields()) {
                continue;
            }
            for (VariableDeclarator var : field.getVariables()) {
                String name = var.getNameAsString();
                if (!isConstantName(name)) {
                    continue;
                }
                List<Node> fingerprinted = new ArrayList<>(field.getModifiers());
                fingerprinted.addAll(field.getAnnotations());
                fingerprinted.add(var);
                out.add(new DeclaredSymbol(
                        typeName + "." + name,
                        SymbolKind.CONSTANT,
                        beginLine(field),
                        var.getTypeAsString() + " " + name,
                        fingerprinted,
                        List.of(field)));
            }
        }

        if (type instanceof EnumDeclaration enumDecl) {
            for (EnumConstantDeclaration constant : enumDecl.getEntries()) {
                out.add(new DeclaredSymbol(
                        typeName + "." + constant.getNameAsString(),
                        SymbolKind.CONSTANT,
                        beginLine(constant),
                        typeName + " " + constant.getNameAsString(),
                        List.of(constant),
                        List.of(constant)));
            }
        }
    }

    private static DeclaredSymbol methodSymbol(String typeName, String name, List<MethodDeclaration> overloads) {
        boolean allStatic = overloads.stream().allMatch(MethodDeclaration::isStatic);
        String signature = overloads.stream()
                .map(md -> md.getDeclarationAsString(false, false, true))
                .collect(Collectors.joining(" | "));
        List<Node> nodes = List.copyOf(overloads);
        return new DeclaredSymbol(
                typeName + "." + name,
                allStatic ? SymbolKind.FUNCTION : SymbolKind.METHOD,
                beginLine(overloads.get(0)),
                signature,
                nodes,
                nodes);
    }

    /**
     * Upper-case naming convention: at least one letter and no lower-case letters.
     */
    static boolean isConstantName(String name) {
        return name.chars().anyMatch(Character::isLetter)
                && name.equals(name.toUpperCase(Locale.ROOT));
    }

    private static int beginLine(Node node) {
        return node.getBegin().map(p -> p.line).orElse(0);
    }
}
