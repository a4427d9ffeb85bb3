package com.workstream.core.exception;

import java.util.List;

/**
 * Thrown when a run is resumed against a contract registry that no longer holds
 * the live contract versions recorded in the run's checkpoint.
 */
public class ContractDriftException extends WorkstreamException {

    public static final String ERROR_CODE = "CONTRACT_DRIFT";

    private final String runId;
    private final List<String> differences;

    public ContractDriftException(String runId, List<String> differences) {
        super(ERROR_CODE, String.format(
            "Run %s cannot resume, contracts changed since its checkpoint: %s",
            runId, String.join("; ", differences)
        ));
        this.runId = runId;
        this.differences = List.copyOf(differences);
    }

    public String getRunId() {
        return runId;
    }

    public List<String> getDifferences() {
        return differences;
    }
}
