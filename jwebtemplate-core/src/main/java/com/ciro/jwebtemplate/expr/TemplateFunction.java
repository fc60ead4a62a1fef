package com.ciro.jwebtemplate.expr;

import java.util.List;

/**
 * A callable value that can be bound into a {@link com.ciro.jwebtemplate.template.TemplateContext}
 * and invoked from template expressions as {@code name(arg, ...)}.
 */
@FunctionalInterface
public interface TemplateFunction {
    Object call(List<Object> args);
}
