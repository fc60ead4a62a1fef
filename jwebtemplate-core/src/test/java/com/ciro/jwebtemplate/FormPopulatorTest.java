package com.ciro.jwebtemplate;

import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FormPopulatorTest {

    private final FormPopulator populator = new FormPopulator();

    private static Map<String, Object> map(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }

    @Test
    void flattensNestedObjectsInOrder() {
        Element form = new Element("form");

        populator.populate(form, map("a", map("b", 1, "c", 2)), "x");

        assertThat(form.select("input").eachAttr("name")).containsExactly("x", "x[a]", "x[a][b]", "x[a][c]");
        assertThat(form.select("input").eachAttr("value")).containsExactly("", "", "1", "2");
        assertThat(form.select("input").eachAttr("type")).containsOnly("hidden");
    }

    @Test
    void wildcardNamesTakeTheKey() {
        Element form = new Element("form");

        populator.populate(form, map("id", 7, "name", "ann"), "user_%");

        assertThat(form.select("input").eachAttr("name")).containsExactly("user_%", "user_id", "user_name");
    }

    @Test
    void scalarsAndNull() {
        Element form = new Element("form");

        populator.populate(form, null, "empty");
        populator.populate(form, 3.0, "n");

        assertThat(form.select("input[name=empty]").attr("value")).isEmpty();
        assertThat(form.select("input[name=n]").attr("value")).isEqualTo("3");
    }

    @Test
    void updatesExistingControls() {
        Element form = new Element("form");
        form.appendElement("input").attr("name", "email");
        form.appendElement("textarea").attr("name", "bio");
        form.appendElement("input").attr("type", "checkbox").attr("name", "news").attr("value", "yes");
        Element select = form.appendElement("select").attr("name", "color");
        select.appendElement("option").attr("value", "r").text("Red");
        select.appendElement("option").attr("value", "g").text("Green");

        populator.setValue(form, "email", "a@b.c");
        populator.setValue(form, "bio", "<hello>");
        populator.setValue(form, "news", "yes");
        populator.setValue(form, "color", "g");

        assertThat(form.selectFirst("input[name=email]").attr("value")).isEqualTo("a@b.c");
        assertThat(form.selectFirst("textarea").text()).isEqualTo("<hello>");
        assertThat(form.selectFirst("input[name=news]").hasAttr("checked")).isTrue();
        assertThat(form.select("option[selected]").eachAttr("value")).containsExactly("g");
        assertThat(form.select("input[type=hidden]")).isEmpty();
    }

    @Test
    void controlTypesAreMatchedIndependentlyOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            Element form = new Element("form");
            form.appendElement("input").attr("type", "CHECKBOX").attr("name", "news").attr("value", "yes");

            populator.setValue(form, "news", "yes");

            assertThat(form.selectFirst("input[name=news]").hasAttr("checked")).isTrue();
            assertThat(form.selectFirst("input[name=news]").hasAttr("value")).isTrue();
            assertThat(form.selectFirst("input[name=news]").attr("value")).isEqualTo("yes");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
