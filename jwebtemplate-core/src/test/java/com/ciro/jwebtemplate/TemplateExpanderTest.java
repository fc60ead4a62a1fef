package com.ciro.jwebtemplate;

import com.ciro.jwebtemplate.exception.MalformedTemplateException;
import com.ciro.jwebtemplate.exception.MissingTemplateException;
import com.ciro.jwebtemplate.expr.SimpleExpressionEvaluator;
import com.ciro.jwebtemplate.json.ObjectMapperFactory;
import com.ciro.jwebtemplate.spi.TemplateLoader;
import com.ciro.jwebtemplate.template.InlineCodeNode;
import com.ciro.jwebtemplate.template.TemplateContext;
import com.ciro.jwebtemplate.template.TemplateParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateExpanderTest {

    private static final Map<String, String> PARTIALS = Map.of(
            "card.html", "<div class=\"card\"><%= data.x %>-<%= name %></div>",
            "check.html", "<if-true cond=\"data.x == 1\">one</if-true><or-else>other</or-else>");

    private final Map<String, EmbeddedTagTranslator> translators = Map.of(
            "bracket", (source, attrs) -> new EmbeddedTagResult(new TextNode("[" + source + "]")),
            "verbatim", (source, attrs) -> new EmbeddedTagResult(new TextNode(source), false),
            "drop", (source, attrs) -> EmbeddedTagResult.none(),
            "badge", (source, attrs) -> {
                Element span = new Element("span").attr("class", attrs.get("kind"));
                span.appendChild(InlineCodeNode.ofCode("= name"));
                return new EmbeddedTagResult(span);
            });

    private TemplateParser parser;
    private TemplateContext ctx;

    @BeforeEach
    void setUp() {
        parser = new TemplateParser(translators.keySet());
        ctx = new TemplateContext();
        ctx.set("name", "bob");
        ctx.set("items", List.of("a", "b"));
        ctx.set("empty", List.of());
    }

    private TemplateExpander expander(boolean debugComments) {
        return expander(debugComments, ObjectMapperFactory.create());
    }

    private TemplateExpander expander(boolean debugComments, ObjectMapper mapper) {
        return new TemplateExpander(parser, TemplateLoader.ofMap(PARTIALS), new SimpleExpressionEvaluator(),
                translators, mapper, new FormPopulator(), debugComments);
    }

    private Element expand(String source) {
        Element root = parser.parseWrapped(source);
        expander(false).expand(root, ctx);
        return root;
    }

    @Test
    void attributesWithoutMarkersAreUntouched() {
        Element root = expand("<a href=\"/plain?q=1&amp;r=2\" title=\"100% <b>\">x</a>");

        assertThat(root.selectFirst("a").attr("href")).isEqualTo("/plain?q=1&r=2");
        assertThat(root.selectFirst("a").attr("title")).isEqualTo("100% <b>");
    }

    @Test
    void attributeMarkersAreSubstitutedLeftToRight() {
        ctx.set("id", 7);
        Element root = expand("<a href=\"/u/<%= id %>?n=<%= name %>\">x</a>");

        assertThat(root.selectFirst("a").attr("href")).isEqualTo("/u/7?n=bob");
    }

    @Test
    void unterminatedAttributeMarkerIsMalformed() {
        assertThatThrownBy(() -> expand("<a title=\"<%= name\">x</a>"))
                .isInstanceOf(MalformedTemplateException.class);
    }

    @Test
    void ifTrueSuppressesOrElse() {
        assertThat(expand("<if-true cond=\"name == 'bob'\">yes</if-true><or-else>no</or-else>").html())
                .isEqualTo("yes");
        assertThat(expand("<if-true cond=\"name == 'ann'\">yes</if-true><or-else>no</or-else>").html())
                .isEqualTo("no");
    }

    @Test
    void nestedConditionsDoNotLeakOutcome() {
        Element root = expand("<if-true cond=\"true\"><if-true cond=\"false\">x</if-true></if-true><or-else>else</or-else>");

        assertThat(root.html()).isEmpty();
    }

    @Test
    void forEachBindsItemAndIndex() {
        Element root = expand("<ul><for-each over=\"items\" as=\"item\" index=\"i\"><li><%= i %>:<%= item %></li></for-each></ul>");

        assertThat(root.select("li").eachText()).containsExactly("0:a", "1:b");
        assertThat(root.select("for-each")).isEmpty();
    }

    @Test
    void forEachOverMapUsesKeys() {
        Map<String, Object> prices = new LinkedHashMap<>();
        prices.put("tea", 2);
        prices.put("cake", 4);
        ctx.set("prices", prices);

        Element root = expand("<for-each over=\"prices\" as=\"p\" index=\"k\"><b><%= k %>=<%= p %></b></for-each>");

        assertThat(root.select("b").eachText()).containsExactly("tea=2", "cake=4");
    }

    @Test
    void emptyLoopFallsThroughToOrElse() {
        Element root = expand("<for-each over=\"empty\" as=\"x\"><%= x %></for-each><or-else>none</or-else>");

        assertThat(root.html()).isEqualTo("none");
    }

    @Test
    void orElsePairsWithTheLatestConditionEvenWhenNotAdjacent() {
        Element root = expand("<if-true cond=\"false\">T</if-true><p>mid</p><or-else>E</or-else>");

        assertThat(root.html()).isEqualTo("<p>mid</p>E");
    }

    @Test
    void loopWithItemsSuppressesOrElse() {
        Element root = expand("<for-each over=\"items\" as=\"x\"><%= x %></for-each><or-else>none</or-else>");

        assertThat(root.html()).isEqualTo("ab");
    }

    @Test
    void orElseFollowsTheMostRecentOfSeveralConditions() {
        Element root = expand("<if-true cond=\"true\">A</if-true><for-each over=\"empty\" as=\"x\">L</for-each>"
                + "<or-else>E</or-else>");

        assertThat(root.html()).isEqualTo("AE");
    }

    @Test
    void loopVariablesStayInsideTheLoop() {
        Element root = expand("<for-each over=\"items\" as=\"item\"></for-each><span><%= item %></span>");

        assertThat(root.selectFirst("span").text()).isEmpty();
        assertThat(ctx.has("item")).isFalse();
    }

    @Test
    void renderTemplateBindsDataAndSeesParentScope() {
        Element root = expand("<render-template file=\"card.html\" data='{\"x\":1}'/>");

        assertThat(root.selectFirst("div.card").text()).isEqualTo("1-bob");
        assertThat(root.select("render-template")).isEmpty();
        assertThat(expand("<render-template file=\"check.html\" data='{\"x\":1}'/>").html()).isEqualTo("one");
        assertThat(ctx.hasLocal("data")).isFalse();
    }

    @Test
    void renderTemplateWithDebugCommentsBracketsThePartial() {
        Element root = parser.parseWrapped("<render-template file=\"card.html\"/>");
        expander(true).expand(root, ctx);

        assertThat(root.childNodes()).hasSize(3);
        assertThat(((Comment) root.childNode(0)).getData().trim()).isEqualTo("card.html");
        assertThat(((Comment) root.childNode(2)).getData().trim()).isEqualTo("end card.html");
    }

    @Test
    void missingPartialFails() {
        assertThatThrownBy(() -> expand("<render-template file=\"nope.html\"/>"))
                .isInstanceOf(MissingTemplateException.class);
    }

    @Test
    void hiddenFormDataSplicesFields() {
        Map<String, Object> address = new LinkedHashMap<>();
        address.put("city", "Lima");
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("name", "ann");
        user.put("address", address);
        ctx.set("user", user);

        Element root = expand("<form><hidden-form-data from=\"user\" name=\"u\"/></form>");

        assertThat(root.select("form > input").eachAttr("name"))
                .containsExactly("u", "u[name]", "u[address]", "u[address][city]");
        assertThat(root.select("form > input").last().attr("value")).isEqualTo("Lima");
        assertThat(root.select("hidden-form-data")).isEmpty();
    }

    @Test
    void outputIsEscapedUnlessHtml() {
        ctx.set("snippet", "<b>bold</b>");

        Element escaped = expand("<p><%= snippet %></p>");
        assertThat(escaped.select("b")).isEmpty();
        assertThat(escaped.selectFirst("p").text()).isEqualTo("<b>bold</b>");

        Element raw = expand("<p><%=HTML snippet %></p>");
        assertThat(raw.selectFirst("p > b").text()).isEqualTo("bold");
    }

    @Test
    void htmlOutputInsertsNodesStructurally() {
        ctx.set("node", new Element("em").text("hi"));

        Element root = expand("<p><%=HTML node %></p>");

        assertThat(root.selectFirst("p > em").text()).isEqualTo("hi");
    }

    @Test
    void htmlOutputDoesNotEvaluateMarkersInTheValue() {
        ctx.set("x", "secret");
        ctx.set("snippet", "<b><%= x %></b>");

        Element root = expand("<p><%=HTML snippet %></p>");

        Element b = root.selectFirst("p > b");
        assertThat(b.text()).isEqualTo("<%= x %>");
        assertThat(b.childNodes()).noneMatch(n -> n instanceof InlineCodeNode);
        assertThat(root.html()).doesNotContain("<%=").doesNotContain("secret");
    }

    @Test
    void configuredMapperWritesStructuredValues() {
        Map<String, Object> pair = new LinkedHashMap<>();
        pair.put("b", 1);
        pair.put("a", 2);
        ctx.set("pair", pair);
        ObjectMapper sorted = JsonMapper.builder().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS).build();

        Element root = parser.parseWrapped("<p title=\"<%= pair %>\"><%= pair %></p><script>var p = <%= pair %>;</script>");
        expander(false, sorted).expand(root, ctx);

        assertThat(root.selectFirst("p").attr("title")).isEqualTo("{\"a\":2,\"b\":1}");
        assertThat(root.selectFirst("p").text()).isEqualTo("{\"a\":2,\"b\":1}");
        assertThat(root.selectFirst("script").data()).isEqualTo("var p = {\"a\":2,\"b\":1};");
    }

    @Test
    void statementsEmitNothing() {
        Element root = expand("<p><% var x = 5 %><%= x * 2 %></p>");

        assertThat(root.selectFirst("p").html()).isEqualTo("10");
    }

    @Test
    void scriptMarkersBecomeJson() {
        ctx.set("payload", Map.of("html", "</script><b>"));

        Element root = expand("<script>var a = <%= payload %>; var n = <%= name %>;</script>");

        String code = root.selectFirst("script").data();
        assertThat(code).startsWith("var a = {\"html\":\"\\u003C/script\\u003E\\u003Cb\\u003E\"};");
        assertThat(code).endsWith("var n = \"bob\";");
    }

    @Test
    void scriptWithoutMarkersIsUntouched() {
        Element root = expand("<script>if (a < b) go();</script>");

        assertThat(root.selectFirst("script").data()).isEqualTo("if (a < b) go();");
    }

    @Test
    void unterminatedScriptMarkerIsMalformed() {
        assertThatThrownBy(() -> expand("<script>var a = <%= name;</script>"))
                .isInstanceOf(MalformedTemplateException.class);
    }

    @Test
    void translatorTextIsRescanned() {
        Element root = expand("<p><bracket>hi <%= name %></bracket></p>");

        assertThat(root.selectFirst("p").text()).isEqualTo("[hi bob]");
    }

    @Test
    void translatorCanOptOutOfRescan() {
        Element root = expand("<p><verbatim>hi <%= name %></verbatim></p>");

        assertThat(root.selectFirst("p").text()).isEqualTo("hi <%= name %>");
    }

    @Test
    void translatorWithoutResultRemovesTheTag() {
        Element root = expand("<p>a<drop>ignored</drop>b</p>");

        assertThat(root.selectFirst("p").html()).isEqualTo("ab");
    }

    @Test
    void translatorElementIsExpanded() {
        Element root = expand("<badge kind=\"info\"></badge>");

        assertThat(root.selectFirst("span.info").text()).isEqualTo("bob");
    }

    @Test
    void onrenderPopulatesForms() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("email", "a@b.c");
        data.put("age", 3);
        ctx.set("form", data);

        Element root = expand("<form onrender=\"this.populateFrom(form)\"><input name=\"email\"/></form>");

        Element form = root.selectFirst("form");
        assertThat(form.hasAttr("onrender")).isFalse();
        assertThat(form.selectFirst("input[name=email]").attr("value")).isEqualTo("a@b.c");
        assertThat(form.selectFirst("input[name=age]").attr("value")).isEqualTo("3");
        assertThat(ctx.has("this")).isFalse();
    }

    @Test
    void onrenderRunsAfterChildren() {
        Element root = expand("<div onrender=\"this.addClass(this.getText()); this.populateFrom(name)\"><%= name %></div>");

        Element div = root.selectFirst("div");
        assertThat(div.hasClass("bob")).isTrue();
        assertThat(div.select("input")).isEmpty();
    }

    @Test
    void reExpandingIsANoOp() {
        Element root = expand("<ul><for-each over=\"items\" as=\"i\"><li title=\"<%= i %>\"><%= i %></li></for-each></ul>"
                + "<if-true cond=\"true\"><p>ok</p></if-true><script>var n = <%= name %>;</script>");
        String once = root.html();

        expander(false).expand(root, ctx);

        assertThat(root.html()).isEqualTo(once);
    }
}
