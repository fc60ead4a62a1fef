package com.ciro.jwebtemplate.spi;

import com.ciro.jwebtemplate.loader.ClasspathTemplateLoader;
import com.ciro.jwebtemplate.loader.DirectoryTemplateLoader;
import com.ciro.jwebtemplate.loader.MapTemplateLoader;

import java.nio.file.Path;
import java.util.Map;

/**
 * Resolves a template name to its raw markup.
 * Implementations are read-only and may be shared by concurrent renders.
 */
public interface TemplateLoader {

    /**
     * @throws com.ciro.jwebtemplate.exception.MissingTemplateException when {@code name} is unknown
     */
    String loadTemplateHtml(String name);

    static TemplateLoader forDirectory(Path directory) {
        return new DirectoryTemplateLoader(directory);
    }

    static TemplateLoader forClasspath(String prefix) {
        return new ClasspathTemplateLoader(prefix);
    }

    static TemplateLoader ofMap(Map<String, String> templates) {
        return new MapTemplateLoader(templates);
    }
}
