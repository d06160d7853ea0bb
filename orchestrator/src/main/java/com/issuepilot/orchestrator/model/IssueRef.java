package com.issuepilot.orchestrator.model;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identity of an issue in the tracker: repository ("owner/name") plus number.
 */
public record IssueRef(String repo, int number) {

    private static final Pattern TEXT_FORM = Pattern.compile("^([\\w.-]+/[\\w.-]+)#(\\d+)$");

    public IssueRef {
        Objects.requireNonNull(repo, "repo");
        if (!repo.contains("/")) {
            throw new IllegalArgumentException("repo must be owner/name: " + repo);
        }
        if (number <= 0) {
            throw new IllegalArgumentException("issue number must be positive: " + number);
        }
    }

    /** Parse "owner/name#123". */
    public static IssueRef parse(String text) {
        Matcher m = TEXT_FORM.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not an issue reference: " + text);
        }
        return new IssueRef(m.group(1), Integer.parseInt(m.group(2)));
    }

    public String owner() { return repo.substring(0, repo.indexOf('/')); }
    public String name()  { return repo.substring(repo.indexOf('/') + 1); }

    @Override
    public String toString() {
        return repo + "#" + number;
    }
}
