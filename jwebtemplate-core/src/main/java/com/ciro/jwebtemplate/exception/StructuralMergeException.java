package com.ciro.jwebtemplate.exception;

/**
 * The skeleton (or the content document) lacks an element the merge step needs,
 * such as {@code <main>}, the head {@code <title>} or an element referenced by id.
 */
public class StructuralMergeException extends WebTemplateException {
    public StructuralMergeException(String message) {
        super(message);
    }
}
