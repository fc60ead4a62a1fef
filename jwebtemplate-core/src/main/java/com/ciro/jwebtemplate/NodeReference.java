package com.ciro.jwebtemplate;

import com.ciro.jwebtemplate.expr.TemplateValues;
import org.jsoup.nodes.Element;

import java.util.Map;

/**
 * The element an {@code onrender} handler runs against, bound as {@code this}.
 * <pre>{@code <form onrender="this.populateFrom(data.user)"> ... </form>}</pre>
 */
public class NodeReference {
    private final Element element;
    private final FormPopulator populator;

    public NodeReference(Element element, FormPopulator populator) {
        this.element = element;
        this.populator = populator;
    }

    /**
     * Binds each top-level key of {@code value} as a form field of the same name. Does nothing
     * unless the element is a {@code <form>}.
     */
    public NodeReference populateFrom(Object value) {
        if (!"form".equals(element.normalName())) {
            return this;
        }
        for (Map.Entry<Object, Object> e : TemplateValues.entries(value)) {
            populator.populate(element, e.getValue(), TemplateValues.toText(e.getKey()));
        }
        return this;
    }

    public Element getElement() {
        return element;
    }

    public String tagName() {
        return element.tagName();
    }

    public String getAttribute(String name) {
        return element.hasAttr(name) ? element.attr(name) : null;
    }

    public NodeReference setAttribute(String name, Object value) {
        element.attr(name, TemplateValues.toText(value));
        return this;
    }

    public boolean hasAttribute(String name) {
        return element.hasAttr(name);
    }

    public NodeReference removeAttribute(String name) {
        element.removeAttr(name);
        return this;
    }

    public NodeReference addClass(String className) {
        element.addClass(className);
        return this;
    }

    public NodeReference removeClass(String className) {
        element.removeClass(className);
        return this;
    }

    public boolean hasClass(String className) {
        return element.hasClass(className);
    }

    public String getText() {
        return element.text();
    }

    public NodeReference setText(Object text) {
        element.text(TemplateValues.toText(text));
        return this;
    }

    @Override
    public String toString() {
        return element.outerHtml();
    }
}
