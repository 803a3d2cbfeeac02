package com.aletheia.engine.core.error;

/**
 * Submissions disagree too much to produce a result.
 */
public class ConsensusFailedException extends TaskFailureException {

    public ConsensusFailedException(String taskId, String message) {
        super(taskId, message);
    }

    public ConsensusFailedException(String taskId, String message, Throwable cause) {
        super(taskId, message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CONSENSUS_FAILED;
    }
}
