package com.ciro.jwebtemplate.standalone;

import com.ciro.jwebtemplate.WebTemplateRenderer;
import com.ciro.jwebtemplate.template.TemplateContext;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders {@code {directory}{name}{extension}} for a request on {@code {urlPrefix}{name}}.
 * Names with path separators and files that do not exist go to the next handler.
 */
public class TemplateDirectoryHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(TemplateDirectoryHandler.class);

    static final String CACHE_CONTROL = "max-age=600";

    private final WebTemplateRenderer renderer;
    private final Path templateRoot;
    private final String directory;
    private final String extension;
    private final String skeleton;
    private final HttpHandler next;

    public TemplateDirectoryHandler(WebTemplateRenderer renderer, ServerSettings settings, HttpHandler next) {
        this.renderer = renderer;
        this.templateRoot = Path.of(settings.getTemplateDirectory()).toAbsolutePath().normalize();
        this.directory = settings.effectiveDirectory();
        this.extension = settings.getExtension();
        this.skeleton = settings.getSkeleton();
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            // rendering reads files
            exchange.dispatch(this);
            return;
        }

        String name = exchange.getRelativePath();
        while (name.startsWith("/")) name = name.substring(1);

        if (name.isEmpty() || name.contains("/") || name.contains("\\")) {
            next.handleRequest(exchange);
            return;
        }
        String templateName = directory + name + extension;
        if (!Files.isRegularFile(templateRoot.resolve(templateName).normalize())) {
            next.handleRequest(exchange);
            return;
        }
        if (!Methods.GET.equals(exchange.getRequestMethod()) && !Methods.HEAD.equals(exchange.getRequestMethod())) {
            exchange.setStatusCode(StatusCodes.METHOD_NOT_ALLOWED);
            exchange.getResponseHeaders().put(Headers.ALLOW, "GET, HEAD");
            exchange.endExchange();
            return;
        }

        String html;
        try {
            html = renderer.renderToString(templateName, contentContext(exchange), new TemplateContext(), skeleton);
        } catch (RuntimeException e) {
            log.error("Request {} failed", exchange.getRequestPath(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=UTF-8");
            exchange.getResponseSender().send("500 Internal Server Error\n" + e.getMessage());
            return;
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/html; charset=UTF-8");
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, CACHE_CONTROL);
        exchange.getResponseSender().send(html);
    }

    private static TemplateContext contentContext(HttpServerExchange exchange) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("currentPath", exchange.getRequestPath());
        Map<String, Object> query = new LinkedHashMap<>();
        exchange.getQueryParameters().forEach((k, v) -> query.put(k, v.peekFirst()));
        meta.put("query", query);
        return new TemplateContext(Map.of("meta", meta));
    }
}
