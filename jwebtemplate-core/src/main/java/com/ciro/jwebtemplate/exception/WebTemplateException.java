package com.ciro.jwebtemplate.exception;

/**
 * Root of every failure raised while loading, expanding or composing a template.
 */
public class WebTemplateException extends RuntimeException {
    public WebTemplateException(String message) {
        super(message);
    }

    public WebTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
