package com.ciro.jwebtemplate;

import com.ciro.jwebtemplate.exception.StructuralMergeException;
import com.ciro.jwebtemplate.exception.TemplateException;
import com.ciro.jwebtemplate.spi.TemplateLoader;
import com.ciro.jwebtemplate.template.TemplateContext;
import com.ciro.jwebtemplate.template.TemplateParser;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a content template into a skeleton page.
 * <p>
 * Both documents are expanded against their own context. The content's top-level {@code <main>}
 * then replaces the skeleton's, its {@code <title>} fills the head title and every other top-level
 * element with an {@code id} replaces the skeleton element with that id. Leftover
 * {@code <document-fragment>} wrappers are unwrapped.
 *
 * <pre>{@code
 * WebTemplateRenderer renderer = new WebTemplateRenderer(TemplateLoader.forDirectory(Path.of("templates")));
 * Document page = renderer.renderTemplate("home.html", new TemplateContext(Map.of("user", user)));
 * }</pre>
 *
 * Subclasses may override {@link #addDefaultFunctions} and {@link #postProcess}.
 */
public class WebTemplateRenderer {
    private static final Logger log = LoggerFactory.getLogger(WebTemplateRenderer.class);

    private final TemplateLoader loader;
    private final RendererOptions options;
    private final TemplateParser parser;
    private final TemplateExpander expander;

    public WebTemplateRenderer(TemplateLoader loader) {
        this(loader, Map.of(), RendererOptions.defaults());
    }

    public WebTemplateRenderer(TemplateLoader loader, Map<String, EmbeddedTagTranslator> embeddedTagTranslators) {
        this(loader, embeddedTagTranslators, RendererOptions.defaults());
    }

    public WebTemplateRenderer(TemplateLoader loader,
                               Map<String, EmbeddedTagTranslator> embeddedTagTranslators,
                               RendererOptions options) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.options = Objects.requireNonNull(options, "options");
        this.parser = new TemplateParser(embeddedTagTranslators.keySet());
        this.expander = new TemplateExpander(parser, loader, options.getEvaluator(), embeddedTagTranslators,
                options.getObjectMapper(), new FormPopulator(), options.isDebugComments());
    }

    public Document renderTemplate(String templateName) {
        return renderTemplate(templateName, new TemplateContext(), new TemplateContext(), null);
    }

    public Document renderTemplate(String templateName, TemplateContext context) {
        return renderTemplate(templateName, context, new TemplateContext(), null);
    }

    public Document renderTemplate(String templateName, TemplateContext context, TemplateContext skeletonContext) {
        return renderTemplate(templateName, context, skeletonContext, null);
    }

    public final Document renderTemplate(String templateName,
                                         TemplateContext context,
                                         TemplateContext skeletonContext,
                                         String skeletonName) {
        TemplateContext contentScope = context != null ? context : new TemplateContext();
        TemplateContext skeletonScope = skeletonContext != null ? skeletonContext : new TemplateContext();
        String skeletonFile = skeletonName == null || skeletonName.isBlank() ? options.getDefaultSkeleton() : skeletonName;

        log.debug("Rendering {} inside {}", templateName, skeletonFile);
        try {
            addDefaultFunctions(contentScope);
            addDefaultFunctions(skeletonScope);

            Document skeleton = parser.parseDocument(loader.loadTemplateHtml(skeletonFile));
            Element content = parser.parseWrapped(loader.loadTemplateHtml(templateName));

            expander.expand(skeleton, skeletonScope);
            resolveRelativeLinks(skeleton);

            expander.expand(content, contentScope);

            merge(skeleton, content);

            if (options.isDebugComments()) {
                skeleton.prependChild(new Comment(" " + templateName + " inside " + skeletonFile + " "));
            }
            postProcess(skeleton);

            log.debug("Rendered {}", templateName);
            return skeleton;
        } catch (Exception e) {
            log.warn("Template {} failed to render: {}", templateName, e.getMessage());
            throw new TemplateException(templateName, contentScope, e);
        }
    }

    public String renderToString(String templateName, TemplateContext context) {
        return renderTemplate(templateName, context).outerHtml();
    }

    public String renderToString(String templateName,
                                 TemplateContext context,
                                 TemplateContext skeletonContext,
                                 String skeletonName) {
        return renderTemplate(templateName, context, skeletonContext, skeletonName).outerHtml();
    }

    /**
     * Binds the helper functions plus empty {@code meta} and {@code data} objects, so templates can
     * read {@code data.x} without checking for {@code data} first.
     */
    protected void addDefaultFunctions(TemplateContext context) {
        DefaultFunctions.register(context);
        if (context.get("meta") == null) context.set("meta", new LinkedHashMap<String, Object>());
        if (context.get("data") == null) context.set("data", new LinkedHashMap<String, Object>());
    }

    /** Hook run on the composed document before it is returned. Does nothing by default. */
    protected void postProcess(Document document) {
    }

    public TemplateLoader getLoader() {
        return loader;
    }

    public RendererOptions getOptions() {
        return options;
    }

    // ------------------------------------------------------------------

    /** Hrefs that are not valid URIs, and blocks whose base is not one, are left as written. */
    private static void resolveRelativeLinks(Document skeleton) {
        for (Element base : skeleton.select("[data-relative-to]")) {
            URI relativeTo = parseUri(base.attr("data-relative-to"));
            if (relativeTo == null) continue;
            for (Element a : base.select("a[href]")) {
                URI href = parseUri(a.attr("href"));
                if (href != null) {
                    a.attr("href", relativeTo.resolve(href).toString());
                }
            }
        }
    }

    private static URI parseUri(String value) {
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            log.debug("Leaving unparseable link {} unresolved: {}", value, e.getMessage());
            return null;
        }
    }

    private static void merge(Document skeleton, Element content) {
        Element main = topLevel(content, "main");
        if (main == null) {
            throw new StructuralMergeException("Template has no top-level <main>");
        }
        if (main.hasAttr("body-class")) {
            Element body = require(skeleton.selectFirst("body"), "<body>");
            for (String cls : main.attr("body-class").trim().split("\\s+")) {
                if (!cls.isEmpty()) body.addClass(cls);
            }
            main.removeAttr("body-class");
        }

        require(skeleton.selectFirst("main"), "<main>").replaceWith(main);

        Element title = topLevel(content, "title");
        if (title != null) {
            Element target = require(skeleton.selectFirst("html > head > title"), "<html><head><title>");
            target.empty();
            target.appendChildren(new ArrayList<>(title.childNodes()));
        }

        for (Element item : new ArrayList<>(content.children())) {
            if (!item.hasAttr("id")) continue;
            Element target = skeleton.getElementById(item.id());
            if (target == null) {
                throw new StructuralMergeException("Skeleton has no element with id \"" + item.id() + "\"");
            }
            target.replaceWith(item);
        }

        for (Element fragment : skeleton.select("document-fragment")) {
            fragment.unwrap();
        }
    }

    private static Element topLevel(Element root, String tag) {
        for (Element child : root.children()) {
            if (child.normalName().equals(tag)) return child;
        }
        return null;
    }

    private static Element require(Element el, String what) {
        if (el == null) {
            throw new StructuralMergeException("Skeleton has no " + what);
        }
        return el;
    }
}
