package com.aletheia.engine.core.matching;

import com.aletheia.engine.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AcceptanceTrackerTest {

    private final AcceptanceTracker tracker = new AcceptanceTracker();

    @Test
    void collectsAcceptancesInAnswerOrder() throws Exception {
        AcceptanceTracker.Round round = tracker.open("t", List.of("a", "b", "c"));

        tracker.respond("t", "c", true);
        tracker.respond("t", "a", false);
        tracker.respond("t", "b", true);

        assertThat(round.await(Duration.ZERO)).isTrue();
        assertThat(round.accepted()).containsExactly("c", "b");
    }

    @Test
    void firstAnswerCounts() {
        AcceptanceTracker.Round round = tracker.open("t", List.of("a"));

        tracker.respond("t", "a", false);
        tracker.respond("t", "a", true);

        assertThat(round.accepted()).isEmpty();
    }

    @Test
    void awaitTimesOutWhileWorkersAreSilent() throws Exception {
        AcceptanceTracker.Round round = tracker.open("t", List.of("a", "b"));
        tracker.respond("t", "a", true);

        assertThat(round.await(Duration.ofMillis(20))).isFalse();
        assertThat(round.accepted()).containsExactly("a");
    }

    @Test
    void withdrawnOfferCountsAsDecline() throws Exception {
        AcceptanceTracker.Round round = tracker.open("t", List.of("a", "b"));

        round.withdraw("a");
        tracker.respond("t", "b", true);

        assertThat(round.await(Duration.ZERO)).isTrue();
        assertThat(round.accepted()).containsExactly("b");
    }

    @Test
    void answerFromWorkerNotOffered_isRejected() {
        tracker.open("t", List.of("a"));

        assertThatThrownBy(() -> tracker.respond("t", "intruder", true))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("intruder");
    }

    @Test
    void answerWithoutOpenRound_isIgnored() {
        assertThat(tracker.respond("t", "a", true)).isFalse();
    }

    @Test
    void onlyOneRoundPerTask() {
        AcceptanceTracker.Round round = tracker.open("t", List.of("a"));

        assertThatThrownBy(() -> tracker.open("t", List.of("b")))
                .isInstanceOf(IllegalStateException.class);

        tracker.close(round);
        assertThat(tracker.isOpen("t")).isFalse();
        assertThat(tracker.open("t", List.of("b"))).isNotNull();
    }
}
