package org.neuralchilli.conductor.util;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fills {@code {name}} placeholders in agent messages and instructions.
 * Placeholders with no value are left untouched.
 */
public final class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_.\\-]*)}");

    private TemplateRenderer() {
    }

    public static String render(String template, Map<String, ?> values) {
        if (template == null || template.isEmpty() || values == null || values.isEmpty()) {
            return template;
        }

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = values.containsKey(name)
                    ? format(values.get(name))
                    : matcher.group(0);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Collections render as comma separated items
     */
    static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                    .map(TemplateRenderer::format)
                    .collect(Collectors.joining(", "));
        }
        return value.toString();
    }
}
