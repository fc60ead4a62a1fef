package com.ciro.jwebtemplate.loader;

import com.ciro.jwebtemplate.exception.MissingTemplateException;
import com.ciro.jwebtemplate.spi.TemplateLoader;

import java.util.Map;

/** In-memory templates keyed by name. Handy for tests and generated markup. */
public class MapTemplateLoader implements TemplateLoader {
    private final Map<String, String> templates;

    public MapTemplateLoader(Map<String, String> templates) {
        this.templates = Map.copyOf(templates);
    }

    @Override
    public String loadTemplateHtml(String name) {
        String html = name == null ? null : templates.get(name);
        if (html == null) {
            throw new MissingTemplateException(String.valueOf(name));
        }
        return html;
    }
}
