package com.ciro.jwebtemplate;

import com.ciro.jwebtemplate.exception.EvaluationException;
import com.ciro.jwebtemplate.exception.MalformedTemplateException;
import com.ciro.jwebtemplate.expr.TemplateValues;
import com.ciro.jwebtemplate.json.ObjectMapperFactory;
import com.ciro.jwebtemplate.spi.ExpressionEvaluator;
import com.ciro.jwebtemplate.spi.TemplateLoader;
import com.ciro.jwebtemplate.template.InlineCodeNode;
import com.ciro.jwebtemplate.template.TemplateContext;
import com.ciro.jwebtemplate.template.TemplateParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.function.Function;

/**
 * Rewrites one element tree in place against a {@link TemplateContext}.
 * <p>
 * Control elements ({@code if-true}, {@code or-else}, {@code for-each}, {@code render-template},
 * {@code hidden-form-data}) are replaced by their expanded children. Inline code is evaluated,
 * {@code script} bodies get JSON-encoded values and embedded-tag translators run on their tags.
 */
public class TemplateExpander {
    private static final Logger log = LoggerFactory.getLogger(TemplateExpander.class);

    private static final String OUTPUT_MARKER = "<%=";
    private static final String ONRENDER = "onrender";

    private final TemplateParser parser;
    private final TemplateLoader loader;
    private final ExpressionEvaluator evaluator;
    private final Map<String, EmbeddedTagTranslator> translators;
    private final ObjectMapper mapper;
    private final ObjectWriter scriptWriter;
    private final FormPopulator populator;
    private final boolean debugComments;

    public TemplateExpander(TemplateParser parser,
                            TemplateLoader loader,
                            ExpressionEvaluator evaluator,
                            Map<String, EmbeddedTagTranslator> translators,
                            ObjectMapper mapper,
                            FormPopulator populator,
                            boolean debugComments) {
        this.parser = parser;
        this.loader = loader;
        this.evaluator = evaluator;
        Map<String, EmbeddedTagTranslator> byName = new LinkedHashMap<>();
        translators.forEach((k, v) -> byName.put(k.toLowerCase(Locale.ROOT), v));
        this.translators = Map.copyOf(byName);
        this.mapper = mapper;
        this.scriptWriter = ObjectMapperFactory.scriptSafeWriter(mapper);
        this.populator = populator;
        this.debugComments = debugComments;
    }

    public void expand(Element root, TemplateContext context) {
        substituteAttributes(root, context);

        // outcome of the last if-true / for-each among these siblings, read by or-else
        boolean priorOutcome = false;

        for (Node child : new ArrayList<>(root.childNodes())) {
            if (child instanceof InlineCodeNode code) {
                expandInlineCode(code, context);
                continue;
            }
            if (!(child instanceof Element el)) {
                continue;
            }
            switch (el.normalName()) {
                case "if-true": {
                    boolean got = TemplateValues.isTruthy(evaluate(el.attr("cond"), context));
                    if (got) {
                        expandAndUnwrap(el, context);
                    } else {
                        el.remove();
                    }
                    priorOutcome = got;
                    break;
                }
                case "or-else":
                    if (!priorOutcome) {
                        expandAndUnwrap(el, context);
                    } else {
                        el.remove();
                    }
                    break;
                case "for-each":
                    priorOutcome = expandLoop(el, context);
                    break;
                case "render-template":
                    includePartial(el, context);
                    break;
                case "hidden-form-data":
                    expandHiddenFormData(el, context);
                    break;
                case "script":
                    substituteScript(el, context);
                    break;
                default:
                    EmbeddedTagTranslator translator = translators.get(el.normalName());
                    if (translator != null) {
                        translate(el, translator, context);
                    } else {
                        expand(el, context);
                    }
            }
        }

        if (root.hasAttr(ONRENDER)) {
            TemplateContext handlerScope = context.createChild();
            handlerScope.set("this", new NodeReference(root, populator));
            evaluate(root.attr(ONRENDER), handlerScope);
            root.removeAttr(ONRENDER);
        }
    }

    // ------------------------------------------------------------------
    // attributes and text markers
    // ------------------------------------------------------------------

    private void substituteAttributes(Element el, TemplateContext context) {
        for (Attribute attr : new ArrayList<>(el.attributes().asList())) {
            if (attr.getKey().equals(ONRENDER) || !attr.getValue().contains(OUTPUT_MARKER)) {
                continue;
            }
            String value = substituteMarkers(attr.getValue(), context, this::toText,
                    "attribute " + attr.getKey() + " of <" + el.tagName() + ">");
            el.attr(attr.getKey(), value);
        }
    }

    /** Replaces each {@code <%= expr %>} in {@code text}, left to right. */
    String substituteMarkers(String text, TemplateContext context, Function<Object, String> render, String where) {
        int idx = text.indexOf(OUTPUT_MARKER);
        if (idx < 0) return text;

        StringBuilder out = new StringBuilder(text.length());
        int pos = 0;
        while (idx >= 0) {
            int end = text.indexOf(InlineCodeNode.CLOSE, idx + OUTPUT_MARKER.length());
            if (end < 0) {
                throw new MalformedTemplateException("Unterminated <%= in " + where);
            }
            out.append(text, pos, idx);
            String code = text.substring(idx + OUTPUT_MARKER.length(), end);
            out.append(render.apply(evaluate(code, context)));
            pos = end + InlineCodeNode.CLOSE.length();
            idx = text.indexOf(OUTPUT_MARKER, pos);
        }
        out.append(text, pos, text.length());
        return out.toString();
    }

    private void substituteScript(Element script, TemplateContext context) {
        String source = script.data();
        if (!source.contains(OUTPUT_MARKER)) return;
        String code = substituteMarkers(source, context, v -> TemplateValues.toScriptJson(v, scriptWriter), "<script>");
        script.empty();
        script.appendChild(new DataNode(code));
    }

    private void expandInlineCode(InlineCodeNode code, TemplateContext context) {
        switch (code.kind()) {
            case OUTPUT:
                code.replaceWith(new TextNode(toText(evaluate(code.code(), context))));
                break;
            case HTML:
                for (Node n : toNodes(evaluate(code.code(), context))) {
                    code.before(n);
                }
                code.remove();
                break;
            default:
                evaluate(code.code(), context);
                code.remove();
        }
    }

    private List<Node> toNodes(Object value) {
        Node node = null;
        if (value instanceof NodeReference ref) node = ref.getElement();
        else if (value instanceof Node n) node = n;
        if (node != null) {
            // attached nodes are copied so the tree they came from stays intact
            return List.of(node.parent() == null ? node : node.clone());
        }
        return parser.parseFragment(toText(value));
    }

    // ------------------------------------------------------------------
    // control elements
    // ------------------------------------------------------------------

    private void expandAndUnwrap(Element el, TemplateContext context) {
        expand(el, context);
        el.unwrap();
    }

    private boolean expandLoop(Element loop, TemplateContext context) {
        List<Entry<Object, Object>> items = TemplateValues.entries(evaluate(loop.attr("over"), context));
        if (items.isEmpty()) {
            loop.remove();
            return false;
        }
        String as = loop.attr("as");
        String index = loop.attr("index");
        for (Entry<Object, Object> item : items) {
            TemplateContext iteration = context.createChild();
            if (!as.isEmpty()) iteration.set(as, item.getValue());
            if (!index.isEmpty()) iteration.set(index, item.getKey());

            Element copy = loop.clone();
            expand(copy, iteration);
            for (Node n : new ArrayList<>(copy.childNodes())) {
                loop.before(n);
            }
        }
        loop.remove();
        return true;
    }

    private void includePartial(Element include, TemplateContext context) {
        String file = include.attr("file");
        log.debug("Including partial {}", file);
        Element partial = parser.parseWrapped(loader.loadTemplateHtml(file));

        TemplateContext scope = context.createChild();
        if (include.hasAttr("data")) {
            scope.set("data", readJson(include.attr("data"), file));
        }
        expand(partial, scope);

        if (debugComments) include.before(new Comment(" " + file + " "));
        for (Node n : new ArrayList<>(partial.childNodes())) {
            include.before(n);
        }
        if (debugComments) include.before(new Comment(" end " + file + " "));
        include.remove();
    }

    private Object readJson(String json, String file) {
        try {
            return mapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new EvaluationException("Invalid JSON in data attribute of render-template " + file, e);
        }
    }

    private void expandHiddenFormData(Element el, TemplateContext context) {
        Object from = evaluate(el.attr("from"), context);
        Element scratch = new Element("form");
        populator.populate(scratch, from, el.attr("name"));
        for (Node n : new ArrayList<>(scratch.childNodes())) {
            el.before(n);
        }
        el.remove();
    }

    private void translate(Element el, EmbeddedTagTranslator translator, TemplateContext context) {
        Map<String, String> attrs = new LinkedHashMap<>();
        for (Attribute a : el.attributes()) {
            attrs.put(a.getKey(), a.getValue());
        }
        EmbeddedTagResult result = translator.translate(el.data(), attrs);
        if (result == null || result.node() == null) {
            el.remove();
            return;
        }
        Node replacement = result.node();
        el.replaceWith(replacement);
        if (!result.rescan()) return;

        if (replacement instanceof TextNode text) {
            text.text(substituteMarkers(text.getWholeText(), context, this::toText,
                    "output of <" + el.tagName() + ">"));
        } else if (replacement instanceof Element replacedBy) {
            expand(replacedBy, context);
        }
    }

    private String toText(Object value) {
        return TemplateValues.toText(value, mapper);
    }

    private Object evaluate(String source, TemplateContext context) {
        return evaluator.evaluate(source, context);
    }
}
