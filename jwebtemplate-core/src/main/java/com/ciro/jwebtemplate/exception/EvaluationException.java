package com.ciro.jwebtemplate.exception;

public class EvaluationException extends WebTemplateException {
    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
