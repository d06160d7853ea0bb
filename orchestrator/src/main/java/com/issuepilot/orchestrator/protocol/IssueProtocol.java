package com.issuepilot.orchestrator.protocol;

import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.tracker.TrackerComment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for the text conventions carried in issue comments and bodies.
 *
 * <pre>
 *   BLOCKED: what should the default timeout be?
 *
 *   **BLOCKED - Agent Needs Input**
 *   1. Which database?
 *   2. Keep the old endpoint?
 *
 *   ANSWER: use Postgres, drop the endpoint.
 *
 *   Depends on #12, acme/api#7
 * </pre>
 *
 * Keywords are upper case; "blocked" in ordinary prose is not a message.
 */
public final class IssueProtocol {

    private static final Pattern BLOCKED = Pattern.compile("^\\*{0,2}\\s*BLOCKED\\b(.*)$", Pattern.DOTALL);
    private static final Pattern ANSWER  = Pattern.compile("^\\*{0,2}\\s*ANSWER\\b(.*)$", Pattern.DOTALL);
    private static final Pattern ITEM    = Pattern.compile("^\\s*(?:\\d+[.)]|[-*])\\s+(.+?)\\s*$", Pattern.MULTILINE);
    private static final Pattern LEADING_PUNCT  = Pattern.compile("^[\\s*:\\-]+");
    private static final Pattern TRAILING_PUNCT = Pattern.compile("[\\s*]+$");
    private static final Pattern DEPENDENCY_LINE = Pattern.compile(
            "^\\s*(?:blocked by|depends on)\\s*:?(.*)$", Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);
    private static final Pattern ISSUE_REFERENCE = Pattern.compile("(?:([\\w.-]+/[\\w.-]+))?#(\\d+)");

    private IssueProtocol() {}

    // ------------------------------------------------------------------
    // BLOCKED / ANSWER
    // ------------------------------------------------------------------

    /**
     * Parse a BLOCKED message. Itemized lines become separate questions; with
     * no items the remainder of the message is the single question.
     *
     * @return empty when the text is not a BLOCKED message or carries no question
     */
    public static Optional<BlockedQuestions> parseBlocked(String text, Instant postedAt) {
        if (text == null) return Optional.empty();
        Matcher m = BLOCKED.matcher(text.strip());
        if (!m.matches()) return Optional.empty();
        String rest = m.group(1);

        List<String> questions = new ArrayList<>();
        // Items start on the lines after the keyword line.
        int firstBreak = rest.indexOf('\n');
        Matcher items = ITEM.matcher(firstBreak < 0 ? "" : rest.substring(firstBreak + 1));
        while (items.find()) {
            questions.add(items.group(1));
        }
        if (questions.isEmpty()) {
            String single = clean(rest);
            if (!single.isEmpty()) questions.add(single);
        }
        return questions.isEmpty()
                ? Optional.empty()
                : Optional.of(new BlockedQuestions(questions, postedAt));
    }

    /** @return empty when the text is not an ANSWER message or the answer is blank */
    public static Optional<Answer> parseAnswer(String text, Instant postedAt) {
        if (text == null) return Optional.empty();
        Matcher m = ANSWER.matcher(text.strip());
        if (!m.matches()) return Optional.empty();
        String body = clean(m.group(1));
        return body.isEmpty() ? Optional.empty() : Optional.of(new Answer(body, postedAt));
    }

    /** Latest BLOCKED message posted at or after {@code since}. */
    public static Optional<BlockedQuestions> latestBlocked(List<TrackerComment> comments, Instant since) {
        Optional<BlockedQuestions> latest = Optional.empty();
        for (TrackerComment c : comments) {
            if (c.createdAt().isBefore(since)) continue;
            Optional<BlockedQuestions> parsed = parseBlocked(c.body(), c.createdAt());
            if (parsed.isPresent()) latest = parsed;
        }
        return latest;
    }

    /**
     * Answers posted after the most recent BLOCKED message, joined in order.
     *
     * @return empty when there is no BLOCKED message or it is still unanswered
     */
    public static Optional<Answer> pendingAnswer(List<TrackerComment> comments) {
        int lastBlocked = -1;
        for (int i = 0; i < comments.size(); i++) {
            if (parseBlocked(comments.get(i).body(), comments.get(i).createdAt()).isPresent()) {
                lastBlocked = i;
            }
        }
        if (lastBlocked < 0) return Optional.empty();

        List<Answer> answers = new ArrayList<>();
        for (int i = lastBlocked + 1; i < comments.size(); i++) {
            TrackerComment c = comments.get(i);
            parseAnswer(c.body(), c.createdAt()).ifPresent(answers::add);
        }
        if (answers.isEmpty()) return Optional.empty();
        if (answers.size() == 1) return Optional.of(answers.get(0));

        StringBuilder joined = new StringBuilder();
        for (Answer a : answers) {
            if (!joined.isEmpty()) joined.append("\n\n");
            joined.append(a.text());
        }
        return Optional.of(new Answer(joined.toString(), answers.get(answers.size() - 1).postedAt()));
    }

    // ------------------------------------------------------------------
    // Dependencies written into the issue body
    // ------------------------------------------------------------------

    /**
     * Issue references on "Blocked by" / "Depends on" lines. A bare {@code #12}
     * refers to {@code defaultRepo}.
     */
    public static Set<IssueRef> parseDependencies(String body, String defaultRepo) {
        Set<IssueRef> refs = new LinkedHashSet<>();
        if (body == null) return refs;
        Matcher lines = DEPENDENCY_LINE.matcher(body);
        while (lines.find()) {
            Matcher r = ISSUE_REFERENCE.matcher(lines.group(1));
            while (r.find()) {
                String repo = r.group(1) != null ? r.group(1) : defaultRepo;
                refs.add(new IssueRef(repo, Integer.parseInt(r.group(2))));
            }
        }
        return refs;
    }

    private static String clean(String s) {
        String out = LEADING_PUNCT.matcher(s).replaceFirst("");
        return TRAILING_PUNCT.matcher(out).replaceFirst("").strip();
    }
}
