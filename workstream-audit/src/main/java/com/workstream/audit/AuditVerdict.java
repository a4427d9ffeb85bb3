package com.workstream.audit;

import java.util.List;

/**
 * Result of an audit gateway check.
 *
 * @param failedStreams     names of the failed streams, sorted
 * @param deploymentAllowed true only for {@link Verdict#ALL_PASS}
 */
public record AuditVerdict(
    Verdict verdict,
    List<String> failedStreams,
    boolean deploymentAllowed,
    String summary
) {
    public AuditVerdict {
        failedStreams = failedStreams == null ? List.of() : List.copyOf(failedStreams);
    }

    public static AuditVerdict of(List<String> failedStreams, String summary) {
        Verdict verdict = Verdict.forFailedStreams(failedStreams.size());
        return new AuditVerdict(verdict, failedStreams, verdict == Verdict.ALL_PASS, summary);
    }
}
