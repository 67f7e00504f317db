package org.neuralchilli.decision.service;

import org.neuralchilli.decision.domain.TitleOverrides;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code [ci full]}, {@code [ci skip]} and {@code [branch <dependency>=<branch>]}
 * overrides from a pull request or commit title.
 */
public final class TriggerTitleParser {

    private static final Pattern BRANCH = Pattern.compile("\\[branch\\s+([\\w.-]+)\\s*=\\s*([\\w./-]+)\\s*]");

    private TriggerTitleParser() {
    }

    public static TitleOverrides parse(String title) {
        if (title == null || title.isBlank()) {
            return TitleOverrides.none();
        }

        String lower = title.toLowerCase(Locale.ROOT);
        boolean fullCi = lower.contains("[ci full]");
        boolean skipCi = lower.contains("[ci skip]") || lower.contains("[skip ci]");

        Map<String, String> branches = new LinkedHashMap<>();
        Matcher matcher = BRANCH.matcher(title);
        while (matcher.find()) {
            branches.put(matcher.group(1), matcher.group(2));
        }

        return new TitleOverrides(fullCi, skipCi, branches);
    }
}
