package com.example.audiobooksync.common.logging;

import org.slf4j.MDC;

/**
 * MDC keys shared by request logging and background job threads.
 */
public final class JobMdc {

    public static final String REQUEST_ID = "requestId";
    public static final String JOB_ID = "jobId";

    private JobMdc() {
    }

    public static MDC.MDCCloseable putJobId(Long jobId) {
        return MDC.putCloseable(JOB_ID, String.valueOf(jobId));
    }
}
