package com.ciro.jwebtemplate.spi;

import com.ciro.jwebtemplate.template.TemplateContext;

/**
 * Evaluates the source found inside {@code <% %>} markers and control attributes
 * ({@code cond}, {@code over}, {@code from}, {@code onrender}).
 * <p>
 * Implementations may throw any unchecked exception; the engine lets it propagate untouched.
 */
public interface ExpressionEvaluator {

    Object evaluate(String source, TemplateContext context);
}
