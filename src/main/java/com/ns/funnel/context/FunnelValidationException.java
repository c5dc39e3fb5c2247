package com.ns.funnel.context;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The funnel definition is internally inconsistent or asks for something the compiler
 * does not support. Carries every violation found, not just the first.
 */
public class FunnelValidationException extends IllegalArgumentException {

    public static final class Violation {
        private final ValidationCode code;
        private final String message;

        public Violation(ValidationCode code, String message) {
            this.code = Objects.requireNonNull(code, "code is null");
            this.message = Objects.requireNonNull(message, "message is null");
        }

        public ValidationCode getCode() { return code; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return code + ": " + message;
        }
    }

    private final List<Violation> violations;

    public FunnelValidationException(ValidationCode code, String message) {
        this(List.of(new Violation(code, message)));
    }

    public FunnelValidationException(List<Violation> violations) {
        super(violations.stream().map(Violation::toString).collect(Collectors.joining("; ")));
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("A validation failure needs at least one violation");
        }
        this.violations = List.copyOf(violations);
    }

    /** Code of the first violation. */
    public ValidationCode getCode() {
        return violations.get(0).getCode();
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public boolean hasViolation(ValidationCode code) {
        return violations.stream().anyMatch(v -> v.getCode() == code);
    }
}
