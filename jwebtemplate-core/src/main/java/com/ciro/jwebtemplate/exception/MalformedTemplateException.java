package com.ciro.jwebtemplate.exception;

/**
 * An inline code marker ({@code <% ... %>}) was opened but never closed.
 */
public class MalformedTemplateException extends WebTemplateException {
    public MalformedTemplateException(String message) {
        super(message);
    }
}
