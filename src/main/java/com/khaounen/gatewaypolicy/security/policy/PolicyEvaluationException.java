package com.khaounen.gatewaypolicy.security.policy;

public class PolicyEvaluationException extends RuntimeException {

    public enum Kind {
        /** Unknown gateway or policy category. */
        CONFIGURATION,
        /** Request could not be built, sent or completed. */
        TRANSPORT,
        /** Non-200 status or undecodable response envelope. */
        PROTOCOL
    }

    private final Kind kind;

    public PolicyEvaluationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PolicyEvaluationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
