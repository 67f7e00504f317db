package org.neuralchilli.decision.domain;

import org.neuralchilli.decision.util.Immutables;

import java.util.Map;

/**
 * Overrides extracted from the free-text trigger title (pull request or commit title).
 *
 * @param fullCi   {@code [ci full]} was present
 * @param skipCi   {@code [ci skip]} was present
 * @param branches dependency name to branch, from {@code [branch <dependency>=<branch>]}
 */
public record TitleOverrides(boolean fullCi, boolean skipCi, Map<String, String> branches) {

    private static final TitleOverrides NONE = new TitleOverrides(false, false, Map.of());

    public TitleOverrides {
        branches = Immutables.map(branches);
    }

    public static TitleOverrides none() {
        return NONE;
    }

    public String branchFor(String dependency, String defaultBranch) {
        return branches.getOrDefault(dependency, defaultBranch);
    }
}
