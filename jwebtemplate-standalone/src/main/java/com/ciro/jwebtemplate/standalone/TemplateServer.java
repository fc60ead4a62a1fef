package com.ciro.jwebtemplate.standalone;

import com.ciro.jwebtemplate.WebTemplateRenderer;
import com.ciro.jwebtemplate.loader.CachingTemplateLoader;
import com.ciro.jwebtemplate.spi.TemplateLoader;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.PathHandler;
import io.undertow.server.handlers.ResponseCodeHandler;
import io.undertow.server.handlers.encoding.ContentEncodingRepository;
import io.undertow.server.handlers.encoding.EncodingHandler;
import io.undertow.server.handlers.encoding.GzipEncodingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;

/** Serves a directory of templates over HTTP with Undertow. */
public class TemplateServer {
    private static final Logger log = LoggerFactory.getLogger(TemplateServer.class);

    private final ServerSettings settings;
    private final Function<TemplateLoader, WebTemplateRenderer> rendererFactory;
    private Undertow server;

    public TemplateServer(ServerSettings settings) {
        this(settings, WebTemplateRenderer::new);
    }

    /**
     * @param rendererFactory builds the renderer for the server's loader; pass a subclass factory to
     *                        add default functions or post-processing
     */
    public TemplateServer(ServerSettings settings, Function<TemplateLoader, WebTemplateRenderer> rendererFactory) {
        this.settings = settings;
        this.rendererFactory = rendererFactory;
    }

    public synchronized void start() {
        if (server != null) return;

        TemplateLoader loader = TemplateLoader.forDirectory(Path.of(settings.getTemplateDirectory()));
        if (settings.getCacheTtlSeconds() > 0) {
            loader = new CachingTemplateLoader(loader, Duration.ofSeconds(settings.getCacheTtlSeconds()));
        }
        WebTemplateRenderer renderer = rendererFactory.apply(loader);

        PathHandler routes = new PathHandler(ResponseCodeHandler.HANDLE_404);
        routes.addPrefixPath(settings.getUrlPrefix(),
                new TemplateDirectoryHandler(renderer, settings, ResponseCodeHandler.HANDLE_404));

        HttpHandler root = routes;
        if (settings.isGzip()) {
            root = new EncodingHandler(routes, new ContentEncodingRepository()
                    .addEncodingHandler("gzip", new GzipEncodingProvider(), 50));
        }

        server = Undertow.builder()
                .addHttpListener(settings.getPort(), settings.getHost())
                .setHandler(root)
                .build();
        server.start();
        log.info("Serving {} at http://{}:{}{}", Path.of(settings.getTemplateDirectory()).toAbsolutePath(),
                settings.getHost(), getPort(), settings.getUrlPrefix());
    }

    public synchronized void stop() {
        if (server == null) return;
        server.stop();
        server = null;
        log.info("Template server stopped");
    }

    /** Bound port; differs from the configured one when that was 0. */
    public synchronized int getPort() {
        if (server == null) return settings.getPort();
        InetSocketAddress address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        return address.getPort();
    }
}
