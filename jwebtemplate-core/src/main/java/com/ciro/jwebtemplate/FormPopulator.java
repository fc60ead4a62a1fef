package com.ciro.jwebtemplate;

import com.ciro.jwebtemplate.expr.TemplateValues;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flattens a nested value into flat form-field bindings on a {@code <form>} element.
 * <p>
 * {@code populate(form, {"a": {"b": 1}}, "x")} sets {@code x}, {@code x[a]} and {@code x[a][b]} in
 * that order. A field name containing {@code %} takes the key in place of the wildcard instead:
 * {@code "item_%"} with key {@code id} becomes {@code item_id}.
 */
public class FormPopulator {

    public static final String WILDCARD = "%";

    public void populate(Element form, Object value, String fieldName) {
        if (TemplateValues.isObjectShaped(value)) {
            setValue(form, fieldName, "");
            for (Map.Entry<Object, Object> e : TemplateValues.entries(value)) {
                populate(form, e.getValue(), childName(fieldName, TemplateValues.toText(e.getKey())));
            }
        } else {
            setValue(form, fieldName, TemplateValues.toText(value));
        }
    }

    static String childName(String fieldName, String key) {
        if (fieldName.contains(WILDCARD)) {
            return fieldName.replace(WILDCARD, key);
        }
        return fieldName + "[" + key + "]";
    }

    /**
     * Writes {@code value} into every existing control named {@code name}, or appends a hidden
     * input when the form has none.
     */
    public void setValue(Element form, String name, String value) {
        List<Element> fields = new ArrayList<>();
        for (Element el : form.getAllElements()) {
            if (el != form && name.equals(el.attr("name")) && isControl(el)) {
                fields.add(el);
            }
        }
        if (fields.isEmpty()) {
            form.appendElement("input")
                    .attr("type", "hidden")
                    .attr("name", name)
                    .attr("value", value);
            return;
        }
        for (Element field : fields) {
            switch (field.normalName()) {
                case "textarea":
                    field.text(value);
                    break;
                case "select":
                    for (Element option : field.select("option")) {
                        String optionValue = option.hasAttr("value") ? option.attr("value") : option.text();
                        if (optionValue.equals(value)) option.attr("selected", "selected");
                        else option.removeAttr("selected");
                    }
                    break;
                default:
                    String type = field.attr("type").toLowerCase(Locale.ROOT);
                    if (type.equals("checkbox") || type.equals("radio")) {
                        String own = field.hasAttr("value") ? field.attr("value") : "on";
                        if (own.equals(value)) field.attr("checked", "checked");
                        else field.removeAttr("checked");
                    } else {
                        field.attr("value", value);
                    }
            }
        }
    }

    private static boolean isControl(Element el) {
        String n = el.normalName();
        return n.equals("input") || n.equals("textarea") || n.equals("select");
    }
}
