package com.ns.funnel.context;

/**
 * A referenced action or cohort does not exist.
 */
public class FunnelResolutionException extends RuntimeException {

    public enum ResolutionCode {
        UNKNOWN_ACTION,
        UNKNOWN_COHORT
    }

    private final ResolutionCode code;
    private final long referenceId;

    public FunnelResolutionException(ResolutionCode code, long referenceId) {
        super(code + ": no " + (code == ResolutionCode.UNKNOWN_ACTION ? "action" : "cohort") + " with id " + referenceId);
        this.code = code;
        this.referenceId = referenceId;
    }

    public ResolutionCode getCode() { return code; }
    public long getReferenceId() { return referenceId; }
}
