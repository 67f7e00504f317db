package org.neuralchilli.decision.util;

import java.util.regex.Pattern;

/**
 * String helpers for task templates.
 * Instance methods are exposed to JEXL expressions under the {@code text} namespace.
 */
public class TextFunctions {

    private static final Pattern INDENTED_LINE = Pattern.compile("\n +");
    private static final Pattern SLUG_PATTERN = Pattern.compile("[^a-z0-9-]+");

    /**
     * Collapse leading indentation of every line to a single space, so scripts
     * written inside indented YAML blocks stay readable in task logs.
     */
    public static String deindent(String script) {
        if (script == null) {
            return "";
        }
        return INDENTED_LINE.matcher(script).replaceAll("\n ").strip();
    }

    /**
     * Last path segment of a URL or file path.
     */
    public static String urlBasename(String url) {
        if (url == null) {
            return "";
        }
        int slash = url.lastIndexOf('/');
        return slash < 0 ? url : url.substring(slash + 1);
    }

    public String basename(String path) {
        return urlBasename(path);
    }

    /**
     * Convert a string to a label-safe slug.
     * Example: "Desktop libs (Linux)" -> "desktop-libs-linux"
     */
    public String slugify(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }

        String slug = input.toLowerCase()
                .trim()
                .replaceAll("\\s+", "-");

        slug = SLUG_PATTERN.matcher(slug).replaceAll("");
        slug = slug.replaceAll("-+", "-");
        return slug.replaceAll("^-|-$", "");
    }

    public String upper(String input) {
        return input != null ? input.toUpperCase() : null;
    }

    public String lower(String input) {
        return input != null ? input.toLowerCase() : null;
    }

    public String replace(String input, String target, String replacement) {
        return input != null ? input.replace(target, replacement) : null;
    }

    /**
     * First {@code length} characters, e.g. a short git revision.
     */
    public String truncate(String input, int length) {
        if (input == null || input.length() <= length) {
            return input;
        }
        return input.substring(0, length);
    }
}
