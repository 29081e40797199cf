package com.vidnyan.doclinks.domain.model;

/**
 * One raw reference occurrence in a document. Line numbers are 1-based.
 */
public record ExtractedRef(
    String text,
    RefKind kind,
    int line
) {
}
