package com.eventfunnel.analytics.model;

import java.io.Serializable;

/**
 * Diagnostic envelope for a raw row dropped during normalization, with failure metadata and the original payload.
 */
public class RejectedRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    public String schemaVersion;
    public long rowIndex;
    public FailureDetails failure;
    public Identity identity;
    public Payload payload;

    public RejectedRecord() {}

    public static class FailureDetails implements Serializable {
        private static final long serialVersionUID = 1L;

        public String stage;
        public String failureClass;
        public String reason;
        public String details;

        public FailureDetails() {}
    }

    /** Whatever identity could be read from the row before it failed; fields may be null. */
    public static class Identity implements Serializable {
        private static final long serialVersionUID = 1L;

        public String userId;
        public String eventType;

        public Identity() {}
    }

    public static class Payload implements Serializable {
        private static final long serialVersionUID = 1L;

        public String encoding;
        public String body;

        public Payload() {}
    }
}
