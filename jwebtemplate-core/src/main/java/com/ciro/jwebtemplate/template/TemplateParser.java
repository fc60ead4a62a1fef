package com.ciro.jwebtemplate.template;

import com.ciro.jwebtemplate.exception.MalformedTemplateException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns template source into a jsoup tree.
 * <p>
 * Templates are parsed with jsoup's XML parser so that elements stay where the author put them
 * ({@code main}, {@code title} and custom tags are not relocated the way the HTML tree builder
 * would). HTML5 void tags are closed before parsing and the resulting document prints with HTML
 * syntax.
 * <p>
 * Raw tags ({@code script}, {@code style} and every embedded-tag translator name) keep their content
 * verbatim as a single {@link DataNode}. Inline {@code <% %>} blocks in text become
 * {@link InlineCodeNode}s.
 */
public class TemplateParser {

    /** Synthetic element a content template is wrapped in. */
    public static final String WRAPPER_TAG = "root";

    private static final Pattern HTML5_VOID_FIX = Pattern.compile(
            "<(area|base|br|col|embed|hr|img|input|link|meta|param|source|track|wbr)(?=[\\s/>])"
                    + "((?:[^>\"']|\"[^\"]*\"|'[^']*')*?)(?<!/)>",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern INLINE_CODE = Pattern.compile("<%(.*?)%>", Pattern.DOTALL);

    private final Set<String> rawTagNames;
    private final Pattern rawTagPattern;

    public TemplateParser() {
        this(List.of());
    }

    public TemplateParser(Collection<String> extraRawTags) {
        Set<String> names = new LinkedHashSet<>();
        names.add("script");
        names.add("style");
        for (String n : extraRawTags) {
            names.add(n.toLowerCase(Locale.ROOT));
        }
        this.rawTagNames = Set.copyOf(names);
        String alternatives = names.stream().map(Pattern::quote).collect(Collectors.joining("|"));
        this.rawTagPattern = Pattern.compile(
                "<(" + alternatives + ")(\\s[^>]*?)?(?<!/)>(.*?)</\\1\\s*>",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    public boolean isRawTag(String tagName) {
        return rawTagNames.contains(tagName.toLowerCase(Locale.ROOT));
    }

    /** Parses a complete document (a skeleton) as-is. */
    public Document parseDocument(String source) {
        return parse(source, true);
    }

    private Document parse(String source, boolean inlineCode) {
        Document doc = Jsoup.parse(prepare(source), "", Parser.xmlParser());
        doc.outputSettings().prettyPrint(false).syntax(Document.OutputSettings.Syntax.html);
        collapseRawContent(doc);
        if (inlineCode) {
            splitInlineCode(doc);
        }
        return doc;
    }

    /**
     * Parses a template body wrapped in a synthetic {@code <root>} element and returns that element.
     * Its children are the template's top-level nodes.
     */
    public Element parseWrapped(String source) {
        return wrap(source, true);
    }

    private Element wrap(String source, boolean inlineCode) {
        Document doc = parse("<" + WRAPPER_TAG + ">" + source + "</" + WRAPPER_TAG + ">", inlineCode);
        Element root = doc.selectFirst(WRAPPER_TAG);
        if (root == null) {
            throw new MalformedTemplateException("Template could not be wrapped in <" + WRAPPER_TAG + ">");
        }
        return root;
    }

    /**
     * Parses markup into detached sibling nodes. The markup is output, not a template: any
     * {@code <% %>} text in it stays literal text.
     */
    public List<Node> parseFragment(String source) {
        Element root = wrap(source, false);
        List<Node> nodes = new ArrayList<>(root.childNodes());
        for (Node n : nodes) {
            n.remove();
        }
        return nodes;
    }

    // ------------------------------------------------------------------

    private String prepare(String source) {
        String text = source == null ? "" : source;

        // raw tag bodies are escaped so the XML tokenizer reads them as plain text
        Matcher raw = rawTagPattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (raw.find()) {
            String open = "<" + raw.group(1) + (raw.group(2) == null ? "" : raw.group(2)) + ">";
            String replacement = open + escape(raw.group(3)) + "</" + raw.group(1) + ">";
            raw.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        raw.appendTail(sb);
        text = sb.toString();

        // inline code survives in text and attribute values as entity-escaped markup
        Matcher code = INLINE_CODE.matcher(text);
        sb = new StringBuilder();
        while (code.find()) {
            code.appendReplacement(sb, Matcher.quoteReplacement(escape(code.group())));
        }
        code.appendTail(sb);

        return HTML5_VOID_FIX.matcher(sb.toString()).replaceAll("<$1$2/>");
    }

    private static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private void collapseRawContent(Document doc) {
        for (Element el : doc.getAllElements()) {
            if (!isRawTag(el.tagName()) || el.childNodeSize() == 0) continue;
            String data = el.wholeText();
            el.empty();
            if (!data.isEmpty()) {
                el.appendChild(new DataNode(data));
            }
        }
    }

    private static void splitInlineCode(Node node) {
        List<Node> children = new ArrayList<>(node.childNodes());
        for (Node child : children) {
            if (child instanceof TextNode text) {
                splitText(text);
            } else if (child instanceof Element) {
                splitInlineCode(child);
            }
        }
    }

    private static void splitText(TextNode text) {
        String whole = text.getWholeText();
        if (!whole.contains(InlineCodeNode.OPEN)) return;

        List<Node> pieces = new ArrayList<>();
        int pos = 0;
        while (pos < whole.length()) {
            int start = whole.indexOf(InlineCodeNode.OPEN, pos);
            if (start < 0) {
                pieces.add(new TextNode(whole.substring(pos)));
                break;
            }
            int end = whole.indexOf(InlineCodeNode.CLOSE, start + InlineCodeNode.OPEN.length());
            if (end < 0) {
                throw new MalformedTemplateException("Unterminated <% in template text: "
                        + abbreviate(whole.substring(start)));
            }
            if (start > pos) {
                pieces.add(new TextNode(whole.substring(pos, start)));
            }
            pieces.add(new InlineCodeNode(whole.substring(start, end + InlineCodeNode.CLOSE.length())));
            pos = end + InlineCodeNode.CLOSE.length();
        }
        for (Node piece : pieces) {
            text.before(piece);
        }
        text.remove();
    }

    static String abbreviate(String s) {
        return s.length() <= 40 ? s : s.substring(0, 40) + "...";
    }
}
