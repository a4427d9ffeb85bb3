package com.workstream.audit;

/**
 * Outcome of auditing a finished run, per stream of work.
 */
public enum Verdict {
    ALL_PASS,
    STREAM_FAILED,
    MULTIPLE_STREAMS_FAILED;

    public static Verdict forFailedStreams(int failedStreams) {
        if (failedStreams == 0) {
            return ALL_PASS;
        }
        return failedStreams == 1 ? STREAM_FAILED : MULTIPLE_STREAMS_FAILED;
    }
}
