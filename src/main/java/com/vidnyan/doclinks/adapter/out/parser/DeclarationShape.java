package com.vidnyan.doclinks.adapter.out.parser;

import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;

/**
 * The flavours of top-level type declaration. All of them index as {@code class} symbols.
 */
enum DeclarationShape {
    CLASS("class"),
    INTERFACE("interface"),
    ENUM("enum"),
    RECORD("record"),
    ANNOTATION("@interface");

    private final String keyword;

    DeclarationShape(String keyword) {
        this.keyword = keyword;
    }

    String keyword() {
        return keyword;
    }

    /**
     * Members of interfaces and annotations are implicitly static.
     */
    boolean implicitlyStaticFields() {
        return this == INTERFACE || this == ANNOTATION;
    }

    static DeclarationShape of(TypeDeclaration<?> type) {
        if (type instanceof ClassOrInterfaceDeclaration cid) {
            return cid.isInterface() ? INTERFACE : CLASS;
        }
        if (type instanceof EnumDeclaration) {
            return ENUM;
        }
        if (type instanceof RecordDeclaration) {
            return RECORD;
        }
        if (type instanceof AnnotationDeclaration) {
            return ANNOTATION;
        }
        throw new IllegalArgumentException("Unsupported type declaration: " + type.getClass().getSimpleName());
    }
}
