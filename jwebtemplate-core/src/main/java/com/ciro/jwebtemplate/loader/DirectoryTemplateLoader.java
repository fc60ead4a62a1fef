package com.ciro.jwebtemplate.loader;

import com.ciro.jwebtemplate.exception.MissingTemplateException;
import com.ciro.jwebtemplate.exception.WebTemplateException;
import com.ciro.jwebtemplate.spi.TemplateLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/** Reads templates as UTF-8 files below a base directory. */
public class DirectoryTemplateLoader implements TemplateLoader {
    private static final Logger log = LoggerFactory.getLogger(DirectoryTemplateLoader.class);

    private final Path baseDirectory;

    public DirectoryTemplateLoader(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    public Path baseDirectory() {
        return baseDirectory;
    }

    @Override
    public String loadTemplateHtml(String name) {
        if (name == null || name.isBlank()) {
            throw new MissingTemplateException(String.valueOf(name));
        }
        Path file = baseDirectory.resolve(name).normalize();
        if (!file.startsWith(baseDirectory)) {
            // ../ outside the template root
            throw new MissingTemplateException(name);
        }
        if (!Files.isRegularFile(file)) {
            throw new MissingTemplateException(name);
        }
        try {
            String html = Files.readString(file, StandardCharsets.UTF_8);
            log.debug("Loaded template {} from {}", name, file);
            return html;
        } catch (NoSuchFileException e) {
            throw new MissingTemplateException(name, e);
        } catch (IOException e) {
            throw new WebTemplateException("Could not read template " + name + " from " + file, e);
        }
    }

    @Override
    public String toString() {
        return "DirectoryTemplateLoader[" + baseDirectory + "]";
    }
}
