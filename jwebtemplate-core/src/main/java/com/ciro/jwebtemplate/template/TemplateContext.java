package com.ciro.jwebtemplate.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scoped variable bindings used while expanding a template.
 * <p>
 * Lookups resolve locally first and then walk the parent chain. Writes always land in the
 * local bindings, never in an ancestor. Children are created per loop iteration, per partial
 * and per {@code onrender} evaluation and are dropped when that step completes.
 */
public class TemplateContext {
    private final Map<String, Object> localVars;
    private final TemplateContext parent;

    public TemplateContext() {
        this(null, new LinkedHashMap<>());
    }

    public TemplateContext(Map<String, ?> initial) {
        this(null, new LinkedHashMap<>(initial));
    }

    private TemplateContext(TemplateContext parent, Map<String, Object> locals) {
        this.localVars = locals;
        this.parent = parent;
    }

    public TemplateContext createChild() {
        return new TemplateContext(this, new LinkedHashMap<>());
    }

    public TemplateContext createChild(Map<String, ?> locals) {
        return new TemplateContext(this, new LinkedHashMap<>(locals));
    }

    /** Value bound to {@code name} here or in the nearest ancestor, or {@code null}. */
    public Object get(String name) {
        for (TemplateContext c = this; c != null; c = c.parent) {
            if (c.localVars.containsKey(name)) {
                return c.localVars.get(name);
            }
        }
        return null;
    }

    public boolean has(String name) {
        for (TemplateContext c = this; c != null; c = c.parent) {
            if (c.localVars.containsKey(name)) return true;
        }
        return false;
    }

    public boolean hasLocal(String name) {
        return localVars.containsKey(name);
    }

    public TemplateContext set(String name, Object value) {
        localVars.put(name, value);
        return this;
    }

    public TemplateContext parent() {
        return parent;
    }

    public Map<String, Object> locals() {
        return Collections.unmodifiableMap(localVars);
    }

    @Override
    public String toString() {
        return "TemplateContext" + localVars.keySet() + (parent == null ? "" : " -> " + parent);
    }
}
