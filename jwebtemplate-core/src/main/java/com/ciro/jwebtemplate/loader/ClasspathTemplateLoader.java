package com.ciro.jwebtemplate.loader;

import com.ciro.jwebtemplate.exception.MissingTemplateException;
import com.ciro.jwebtemplate.exception.WebTemplateException;
import com.ciro.jwebtemplate.spi.TemplateLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/** Reads templates from classpath resources under a prefix, e.g. {@code templates/}. */
public class ClasspathTemplateLoader implements TemplateLoader {
    private static final Logger log = LoggerFactory.getLogger(ClasspathTemplateLoader.class);

    private final String prefix;
    private final ClassLoader classLoader;

    public ClasspathTemplateLoader(String prefix) {
        this(prefix, Thread.currentThread().getContextClassLoader());
    }

    public ClasspathTemplateLoader(String prefix, ClassLoader classLoader) {
        String p = prefix == null ? "" : prefix;
        while (p.startsWith("/")) p = p.substring(1);
        if (!p.isEmpty() && !p.endsWith("/")) p = p + "/";
        this.prefix = p;
        this.classLoader = classLoader != null ? classLoader : ClasspathTemplateLoader.class.getClassLoader();
    }

    @Override
    public String loadTemplateHtml(String name) {
        if (name == null || name.isBlank() || name.contains("..")) {
            throw new MissingTemplateException(String.valueOf(name));
        }
        String resource = prefix + name;
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new MissingTemplateException(name);
            }
            String html = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            log.debug("Loaded template {} from classpath:{}", name, resource);
            return html;
        } catch (IOException e) {
            throw new WebTemplateException("Could not read classpath template " + resource, e);
        }
    }

    @Override
    public String toString() {
        return "ClasspathTemplateLoader[" + prefix + "]";
    }
}
