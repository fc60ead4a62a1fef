package com.ciro.jwebtemplate.template;

import org.jsoup.nodes.DataNode;

/**
 * An embedded {@code <% ... %>} block found in template text.
 * <p>
 * The node keeps its full source as data, so an unexpanded tree serializes back to what was parsed.
 */
public class InlineCodeNode extends DataNode {

    public enum Kind {
        /** {@code <%= expr %>}: escaped text output. */
        OUTPUT,
        /** {@code <%=HTML expr %>}: unescaped markup output. */
        HTML,
        /** {@code <% stmt %>}: evaluated for side effects, emits nothing. */
        STATEMENT
    }

    public static final String OPEN = "<%";
    public static final String CLOSE = "%>";

    public InlineCodeNode(String source) {
        super(source);
        if (!source.startsWith(OPEN) || !source.endsWith(CLOSE) || source.length() < OPEN.length() + CLOSE.length()) {
            throw new IllegalArgumentException("Not an inline code block: " + source);
        }
    }

    public static InlineCodeNode ofCode(String body) {
        return new InlineCodeNode(OPEN + body + CLOSE);
    }

    /** The full {@code <% ... %>} text. */
    public String source() {
        return getWholeData();
    }

    private String body() {
        String s = source();
        return s.substring(OPEN.length(), s.length() - CLOSE.length());
    }

    public Kind kind() {
        String b = body();
        if (b.startsWith("=HTML") && b.length() > 5) return Kind.HTML;
        if (b.startsWith("=")) return Kind.OUTPUT;
        return Kind.STATEMENT;
    }

    /** Expression or statement source without the markers and output prefix. */
    public String code() {
        String b = body();
        switch (kind()) {
            case HTML:
                return b.substring(5);
            case OUTPUT:
                return b.substring(1);
            default:
                return b;
        }
    }

    @Override
    public InlineCodeNode clone() {
        return (InlineCodeNode) super.clone();
    }
}
