package com.ciro.jwebtemplate;

import org.jsoup.nodes.Node;

/**
 * Replacement produced by an {@link EmbeddedTagTranslator}.
 *
 * @param node   the replacement node, {@code null} to remove the tag
 * @param rescan when set, a text replacement gets its {@code <%= %>} markers substituted and an
 *               element replacement is expanded like any other template content
 */
public record EmbeddedTagResult(Node node, boolean rescan) {

    public EmbeddedTagResult(Node node) {
        this(node, true);
    }

    public static EmbeddedTagResult none() {
        return new EmbeddedTagResult(null, false);
    }
}
