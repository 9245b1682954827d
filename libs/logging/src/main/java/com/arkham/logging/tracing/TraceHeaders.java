package com.arkham.logging.tracing;

/**
 * Header names used to carry the trace id across process boundaries.
 */
public final class TraceHeaders {

    /** Custom header carrying the bare trace id. Checked first on extraction. */
    public static final String TRACE_ID = "X-Trace-ID";

    /**
     * W3C-style composite header, {@code version-traceid-parentid-flags}. The second
     * dash-delimited field is read as the trace id.
     */
    public static final String TRACEPARENT = "traceparent";

    /** Version field written into synthesized {@code traceparent} headers. */
    public static final String TRACEPARENT_VERSION = "00";

    /** Flags field written into synthesized {@code traceparent} headers (sampled). */
    public static final String TRACEPARENT_FLAGS = "01";

    private TraceHeaders() {
        // constants only
    }
}
