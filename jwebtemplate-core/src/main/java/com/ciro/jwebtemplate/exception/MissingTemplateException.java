package com.ciro.jwebtemplate.exception;

public class MissingTemplateException extends WebTemplateException {
    private final String templateName;

    public MissingTemplateException(String templateName) {
        super("Template not found: " + templateName);
        this.templateName = templateName;
    }

    public MissingTemplateException(String templateName, Throwable cause) {
        super("Template not found: " + templateName, cause);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
