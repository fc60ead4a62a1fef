package com.ciro.jwebtemplate.loader;

import com.ciro.jwebtemplate.exception.MissingTemplateException;
import com.ciro.jwebtemplate.spi.TemplateLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void directoryLoaderReadsUtf8Files() throws IOException {
        Files.createDirectories(tempDir.resolve("partials"));
        Files.writeString(tempDir.resolve("partials/card.html"), "<p>café</p>", StandardCharsets.UTF_8);

        TemplateLoader loader = TemplateLoader.forDirectory(tempDir);

        assertThat(loader.loadTemplateHtml("partials/card.html")).isEqualTo("<p>café</p>");
    }

    @Test
    void directoryLoaderRejectsMissingAndEscapingNames() throws IOException {
        Path templates = Files.createDirectories(tempDir.resolve("templates"));
        Files.writeString(tempDir.resolve("secret.html"), "nope");

        TemplateLoader loader = TemplateLoader.forDirectory(templates);

        assertThatThrownBy(() -> loader.loadTemplateHtml("absent.html"))
                .isInstanceOf(MissingTemplateException.class)
                .satisfies(e -> assertThat(((MissingTemplateException) e).getTemplateName()).isEqualTo("absent.html"));
        assertThatThrownBy(() -> loader.loadTemplateHtml("../secret.html"))
                .isInstanceOf(MissingTemplateException.class);
    }

    @Test
    void classpathLoaderUsesPrefix() {
        TemplateLoader loader = TemplateLoader.forClasspath("templates");

        assertThat(loader.loadTemplateHtml("greeting.html")).contains("<%= name %>");
        assertThatThrownBy(() -> loader.loadTemplateHtml("absent.html"))
                .isInstanceOf(MissingTemplateException.class);
    }

    @Test
    void mapLoader() {
        TemplateLoader loader = TemplateLoader.ofMap(Map.of("a.html", "<main/>"));

        assertThat(loader.loadTemplateHtml("a.html")).isEqualTo("<main/>");
        assertThatThrownBy(() -> loader.loadTemplateHtml("b.html")).isInstanceOf(MissingTemplateException.class);
    }

    @Test
    void cachingLoaderReadsEachNameOnce() {
        AtomicInteger reads = new AtomicInteger();
        TemplateLoader counting = name -> {
            reads.incrementAndGet();
            if (name.equals("missing.html")) throw new MissingTemplateException(name);
            return "<p>" + name + "</p>";
        };
        CachingTemplateLoader loader = new CachingTemplateLoader(counting, Duration.ofMinutes(5));

        assertThat(loader.loadTemplateHtml("a.html")).isEqualTo("<p>a.html</p>");
        assertThat(loader.loadTemplateHtml("a.html")).isEqualTo("<p>a.html</p>");
        assertThat(reads).hasValue(1);

        assertThatThrownBy(() -> loader.loadTemplateHtml("missing.html")).isInstanceOf(MissingTemplateException.class);
        assertThatThrownBy(() -> loader.loadTemplateHtml("missing.html")).isInstanceOf(MissingTemplateException.class);
        assertThat(reads).hasValue(3);

        loader.invalidate("a.html");
        loader.loadTemplateHtml("a.html");
        assertThat(reads).hasValue(4);
    }
}
