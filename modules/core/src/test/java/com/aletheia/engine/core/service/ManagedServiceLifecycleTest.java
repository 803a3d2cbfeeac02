package com.aletheia.engine.core.service;

import com.aletheia.engine.core.db.DatabaseService;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ManagedServiceLifecycleTest {

    static class FlakyService extends AbstractManagedService {

        String startError;
        int starts;

        @Override
        public String serviceId() {
            return "flaky";
        }

        @Override
        protected void doStart() {
            starts++;
            if (startError != null) {
                throw new IllegalStateException(startError);
            }
        }

        @Override
        protected void doStop() {
        }
    }

    @Test
    void startAndStop() throws Exception {
        FlakyService svc = new FlakyService();

        svc.start();
        svc.start();
        assertThat(svc.state()).isEqualTo(ManagedService.State.RUNNING);
        assertThat(svc.starts).isEqualTo(1);

        svc.stop();
        assertThat(svc.state()).isEqualTo(ManagedService.State.STOPPED);
    }

    @Test
    void failedStart_recordsTheCauseAndRethrows() {
        FlakyService svc = new FlakyService();
        svc.startError = "schema missing";

        assertThatThrownBy(svc::start).hasMessage("schema missing");

        assertThat(svc.state()).isEqualTo(ManagedService.State.FAILED);
        assertThat(svc.lastFailure()).contains("schema missing");
    }

    @Test
    void resume_restartsAFailedServiceAndClearsTheFailure() throws Exception {
        FlakyService svc = new FlakyService();
        svc.start();
        svc.fail(new IllegalStateException("connection reset"));
        assertThat(svc.isRunning()).isFalse();

        assertThat(svc.resume()).isTrue();

        assertThat(svc.state()).isEqualTo(ManagedService.State.RUNNING);
        assertThat(svc.lastFailure()).isEmpty();
        assertThat(svc.starts).isEqualTo(2);
    }

    @Test
    void resume_staysFailedWhileTheCauseRemains() throws Exception {
        FlakyService svc = new FlakyService();
        svc.start();
        svc.fail(new IllegalStateException("connection reset"));
        svc.startError = "still down";

        assertThat(svc.resume()).isFalse();

        assertThat(svc.state()).isEqualTo(ManagedService.State.FAILED);
        assertThat(svc.lastFailure()).contains("still down");
    }

    @Test
    void resume_leavesAStoppedServiceAlone() {
        FlakyService svc = new FlakyService();

        assertThat(svc.resume()).isFalse();
        assertThat(svc.state()).isEqualTo(ManagedService.State.STOPPED);
        assertThat(svc.starts).isZero();
    }

    @Test
    void failureWithoutMessage_usesTheExceptionName() {
        FlakyService svc = new FlakyService();

        svc.fail(new NullPointerException());
        svc.fail(new IllegalStateException("second"));

        assertThat(svc.lastFailure()).contains("NullPointerException");
    }

    @Test
    void dependenciesComeFromDependsOn() {
        assertThat(new EngineService().dependencies()).containsExactly(DatabaseService.class);
        assertThat(new FlakyService().dependencies()).isEmpty();
    }
}
