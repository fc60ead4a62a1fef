package com.ciro.jwebtemplate.exception;

import com.ciro.jwebtemplate.template.TemplateContext;

/**
 * Wraps whatever went wrong during one render call. Raised exactly once, at the top of
 * {@link com.ciro.jwebtemplate.WebTemplateRenderer#renderTemplate}.
 */
public class TemplateException extends WebTemplateException {
    private final String templateName;
    private final transient TemplateContext context;

    public TemplateException(String templateName, TemplateContext context, Throwable cause) {
        super("Exception in template " + templateName + ": " + cause.getMessage(), cause);
        this.templateName = templateName;
        this.context = context;
    }

    public String getTemplateName() {
        return templateName;
    }

    public TemplateContext getContext() {
        return context;
    }
}
