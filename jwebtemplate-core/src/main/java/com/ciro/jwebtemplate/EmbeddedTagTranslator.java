package com.ciro.jwebtemplate;

import java.util.Map;

/**
 * Turns a custom raw tag into markup. The tag's body reaches the translator untouched, so it can
 * hold another language (Markdown, a diagram DSL, ...).
 *
 * <pre>{@code
 * Map.of("plain-text", (source, attrs) -> new EmbeddedTagResult(new TextNode(source)))
 * }</pre>
 */
@FunctionalInterface
public interface EmbeddedTagTranslator {

    /**
     * @param innerSource the raw body of the tag
     * @param attributes  the tag's attributes, in source order
     * @return the replacement, or a result without a node to drop the tag
     */
    EmbeddedTagResult translate(String innerSource, Map<String, String> attributes);
}
