package com.issuepilot.orchestrator.tracker;

import com.issuepilot.orchestrator.model.Issue;
import com.issuepilot.orchestrator.model.IssueRef;
import com.issuepilot.orchestrator.model.IssueStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetryingTrackerClientTest {

    static final IssueRef REF = new IssueRef("acme/app", 7);

    @Mock TrackerClient delegate;

    final List<Duration> sleeps = new ArrayList<>();
    RetryingTrackerClient client;

    @BeforeEach
    void setUp() {
        client = new RetryingTrackerClient(delegate, 3, Duration.ofSeconds(1), Duration.ofSeconds(3), sleeps::add);
    }

    @Test
    void transientFailure_retriedWithBackoff() {
        when(delegate.compareAndSetStatus(REF, IssueStatus.READY, IssueStatus.IN_PROGRESS))
                .thenThrow(transientError(), transientError())
                .thenReturn(true);
        when(delegate.getIssue(REF)).thenReturn(issue(IssueStatus.READY));

        assertThat(client.compareAndSetStatus(REF, IssueStatus.READY, IssueStatus.IN_PROGRESS)).isTrue();
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void compareAndSetStatus_failedAttemptLanded_retryTakesItAsWritten() {
        when(delegate.compareAndSetStatus(REF, IssueStatus.IN_PROGRESS, IssueStatus.DONE))
                .thenThrow(transientError());
        when(delegate.getIssue(REF)).thenReturn(issue(IssueStatus.DONE));

        assertThat(client.compareAndSetStatus(REF, IssueStatus.IN_PROGRESS, IssueStatus.DONE)).isTrue();
        verify(delegate, times(1)).compareAndSetStatus(REF, IssueStatus.IN_PROGRESS, IssueStatus.DONE);
    }

    @Test
    void compareAndSetStatus_firstAttemptNotRereadBeforeWriting() {
        when(delegate.compareAndSetStatus(REF, IssueStatus.READY, IssueStatus.IN_PROGRESS)).thenReturn(false);

        assertThat(client.compareAndSetStatus(REF, IssueStatus.READY, IssueStatus.IN_PROGRESS)).isFalse();
        verify(delegate, never()).getIssue(REF);
    }

    @Test
    void transientFailure_budgetExhausted_lastErrorPropagates() {
        when(delegate.listComments(REF)).thenThrow(transientError());

        assertThatThrownBy(() -> client.listComments(REF))
                .isInstanceOf(TrackerException.class)
                .hasMessageContaining("503");
        verify(delegate, times(4)).listComments(REF);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3));
    }

    @Test
    void permanentFailure_notRetried() {
        doThrow(new TrackerException("HTTP 404", 404, false)).when(delegate).assign(REF, "maintainer");

        assertThatThrownBy(() -> client.assign(REF, "maintainer")).isInstanceOf(TrackerException.class);
        verify(delegate, times(1)).assign(REF, "maintainer");
        assertThat(sleeps).isEmpty();
    }

    @Test
    void interruptedDuringBackoff_stopsAndKeepsFlag() {
        when(delegate.getIssue(REF)).thenThrow(transientError());
        RetryingTrackerClient interrupting = new RetryingTrackerClient(delegate, 3,
                Duration.ofSeconds(1), Duration.ofSeconds(3), d -> { throw new InterruptedException(); });

        try {
            assertThatThrownBy(() -> interrupting.getIssue(REF))
                    .isInstanceOfSatisfying(TrackerException.class, e -> assertThat(e.isTransient()).isFalse());
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void delayFor_cappedAtMax() {
        assertThat(client.delayFor(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(client.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(client.delayFor(10)).isEqualTo(Duration.ofSeconds(3));
    }

    private static Issue issue(IssueStatus status) {
        return new Issue(REF, "Fix login", "", status, Set.of("agent", status.label()), null, Set.of());
    }

    private static TrackerException transientError() {
        return new TrackerException("HTTP 503", 503, true);
    }
}
