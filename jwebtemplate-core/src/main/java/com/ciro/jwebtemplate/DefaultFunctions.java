package com.ciro.jwebtemplate;

import com.ciro.jwebtemplate.exception.EvaluationException;
import com.ciro.jwebtemplate.expr.TemplateFunction;
import com.ciro.jwebtemplate.expr.TemplateValues;
import com.ciro.jwebtemplate.template.TemplateContext;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/** Helpers every render context gets: URI encoding, date and time formatting, key filtering. */
public final class DefaultFunctions {

    private DefaultFunctions() {}

    public static void register(TemplateContext context) {
        context.set("encodeURIComponent", (TemplateFunction) args -> encodeURIComponent(text(args, 0)));
        context.set("formatDate", (TemplateFunction) args -> formatDate(text(args, 0)));
        context.set("dayOfWeek", (TemplateFunction) args -> dayOfWeek(text(args, 0)));
        context.set("formatTime", (TemplateFunction) args -> formatTime(text(args, 0)));
        context.set("filterKeys", (TemplateFunction) args -> filterKeys(
                args.isEmpty() ? null : args.get(0),
                args.size() < 2 ? List.of() : filterList(args.get(1))));
    }

    private static String text(List<Object> args, int i) {
        return i < args.size() ? TemplateValues.toText(args.get(i)) : "";
    }

    private static List<String> filterList(Object value) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<Object, Object> e : TemplateValues.entries(value)) {
            out.add(TemplateValues.toText(e.getValue()));
        }
        return out;
    }

    /** Same escaping as JavaScript's {@code encodeURIComponent}. */
    public static String encodeURIComponent(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%21", "!")
                .replace("%27", "'")
                .replace("%28", "(")
                .replace("%29", ")")
                .replace("%7E", "~");
    }

    /** {@code 2024-03-05...} to {@code 03/05/2024}. Shorter input is returned unchanged. */
    public static String formatDate(String s) {
        if (s.length() < 10) return s;
        return s.substring(5, 7) + "/" + s.substring(8, 10) + "/" + s.substring(0, 4);
    }

    public static String dayOfWeek(String s) {
        try {
            LocalDate date = LocalDate.parse(s.length() > 10 ? s.substring(0, 10) : s);
            return date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        } catch (DateTimeException e) {
            throw new EvaluationException("dayOfWeek: not an ISO date: " + s, e);
        }
    }

    /** {@code 2024-03-05T14:07:00Z} to {@code 2:07 PM}. Input shorter than 20 characters is returned unchanged. */
    public static String formatTime(String s) {
        if (s.length() < 20) return s;
        int hour;
        int minutes;
        try {
            hour = Integer.parseInt(s.substring(11, 13));
            minutes = Integer.parseInt(s.substring(14, 16));
        } catch (NumberFormatException e) {
            throw new EvaluationException("formatTime: not an ISO date-time: " + s, e);
        }
        String am = hour >= 12 ? "PM" : "AM";
        if (hour > 12) hour -= 12;
        return hour + (minutes < 10 ? ":0" : ":") + minutes + " " + am;
    }

    /**
     * Keeps the keys of {@code object} accepted by {@code filters}. The first glob matching a key
     * decides: a leading {@code -} rejects it, anything else keeps it. Keys no filter matches are
     * dropped, so {@code ["-secret*", "*"]} keeps everything except the secrets.
     */
    public static Map<String, Object> filterKeys(Object object, List<String> filters) {
        List<Pattern> patterns = new ArrayList<>(filters.size());
        List<Boolean> rejects = new ArrayList<>(filters.size());
        for (String filter : filters) {
            if (filter == null || filter.isEmpty()) {
                throw new EvaluationException("filterKeys: invalid filter");
            }
            boolean off = filter.charAt(0) == '-';
            rejects.add(off);
            patterns.add(glob(off ? filter.substring(1) : filter));
        }

        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> e : TemplateValues.entries(object)) {
            String key = TemplateValues.toText(e.getKey());
            for (int i = 0; i < patterns.size(); i++) {
                if (patterns.get(i).matcher(key).matches()) {
                    if (!rejects.get(i)) out.put(key, e.getValue());
                    break;
                }
            }
        }
        return out;
    }

    static Pattern glob(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) regex.append(Pattern.quote(literal.toString()));
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
