package com.issuepilot.orchestrator.protocol;

import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.tracker.TrackerComment;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class IssueProtocolTest {

    static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    // ------------------------------------------------------------------
    // BLOCKED
    // ------------------------------------------------------------------

    @Test
    void parseBlocked_singleLine_oneQuestion() {
        Optional<BlockedQuestions> q = IssueProtocol.parseBlocked("BLOCKED: what should the default timeout be?", T0);

        assertThat(q).map(BlockedQuestions::questions)
                .contains(List.of("what should the default timeout be?"));
    }

    @Test
    void parseBlocked_numberedItems_oneQuestionEach() {
        String text = """
                **BLOCKED - Agent Needs Input**

                1. Which database?
                2) Keep the old endpoint?
                - Who reviews the migration?
                """;

        assertThat(IssueProtocol.parseBlocked(text, T0)).map(BlockedQuestions::questions)
                .contains(List.of("Which database?", "Keep the old endpoint?", "Who reviews the migration?"));
    }

    @Test
    void parseBlocked_ordinaryProse_notAMessage() {
        assertThat(IssueProtocol.parseBlocked("The deploy is blocked on CI", T0)).isEmpty();
        assertThat(IssueProtocol.parseBlocked("blocked: lower case is prose", T0)).isEmpty();
        assertThat(IssueProtocol.parseBlocked(null, T0)).isEmpty();
    }

    @Test
    void parseBlocked_keywordOnly_noQuestion() {
        assertThat(IssueProtocol.parseBlocked("BLOCKED:", T0)).isEmpty();
    }

    @Test
    void parseBlocked_renderedComment_parsesBackToSameQuestions() {
        List<String> questions = List.of("Which region?", "Is downtime acceptable?");

        Optional<BlockedQuestions> parsed = IssueProtocol.parseBlocked(StatusComments.blocked(questions, "agent"), T0);

        assertThat(parsed).map(BlockedQuestions::questions).contains(questions);
    }

    // ------------------------------------------------------------------
    // ANSWER
    // ------------------------------------------------------------------

    @Test
    void parseAnswer_keywordWithText_answer() {
        assertThat(IssueProtocol.parseAnswer("ANSWER: use Postgres, drop the endpoint.", T0))
                .map(Answer::text).contains("use Postgres, drop the endpoint.");
    }

    @Test
    void parseAnswer_blank_empty() {
        assertThat(IssueProtocol.parseAnswer("ANSWER:   ", T0)).isEmpty();
        assertThat(IssueProtocol.parseAnswer("I think the answer is 42", T0)).isEmpty();
    }

    @Test
    void pendingAnswer_answersAfterLatestBlocked_joinedInOrder() {
        List<TrackerComment> comments = List.of(
                comment(1, "ANSWER: stale reply to nothing", 0),
                comment(2, "BLOCKED: first question", 1),
                comment(3, "ANSWER: old answer", 2),
                comment(4, "BLOCKED: which region?", 3),
                comment(5, "ANSWER: eu-west-1", 4),
                comment(6, "thanks!", 5),
                comment(7, "ANSWER: and keep a replica in us-east-1", 6));

        Optional<Answer> answer = IssueProtocol.pendingAnswer(comments);

        assertThat(answer).isPresent();
        assertThat(answer.get().text()).isEqualTo("eu-west-1\n\nand keep a replica in us-east-1");
        assertThat(answer.get().postedAt()).isEqualTo(T0.plusSeconds(6));
    }

    @Test
    void pendingAnswer_latestBlockedUnanswered_empty() {
        List<TrackerComment> comments = List.of(
                comment(1, "BLOCKED: first", 0),
                comment(2, "ANSWER: yes", 1),
                comment(3, "BLOCKED: second", 2));

        assertThat(IssueProtocol.pendingAnswer(comments)).isEmpty();
    }

    @Test
    void latestBlocked_ignoresMessagesBeforeSince() {
        List<TrackerComment> comments = List.of(
                comment(1, "BLOCKED: from an earlier run", 0),
                comment(2, "BLOCKED: from this run", 60));

        assertThat(IssueProtocol.latestBlocked(comments, T0.plusSeconds(30)))
                .map(BlockedQuestions::questions).contains(List.of("from this run"));
        assertThat(IssueProtocol.latestBlocked(comments, T0.plusSeconds(90))).isEmpty();
    }

    // ------------------------------------------------------------------
    // Dependencies
    // ------------------------------------------------------------------

    @Test
    void parseDependencies_bareAndQualifiedReferences() {
        String body = """
                Implements the new login flow.

                Depends on #12, acme/api#7
                Blocked by: #3
                See also #99 for background.
                """;

        assertThat(IssueProtocol.parseDependencies(body, "acme/app")).containsExactly(
                new IssueRef("acme/app", 12),
                new IssueRef("acme/api", 7),
                new IssueRef("acme/app", 3));
    }

    @Test
    void parseDependencies_noDependencyLines_empty() {
        assertThat(IssueProtocol.parseDependencies("Fixes #4 in passing", "acme/app")).isEmpty();
        assertThat(IssueProtocol.parseDependencies(null, "acme/app")).isEmpty();
    }

    private static TrackerComment comment(long id, String body, long offsetSeconds) {
        return new TrackerComment(id, "someone", body, T0.plusSeconds(offsetSeconds));
    }
}
