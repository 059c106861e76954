package warehouse.bridge.dispatch;

/**
 * Machine-readable classification of invocation failures.
 */
public enum ErrorKind {
    /** Malformed configuration; fatal at startup, never returned from an invocation */
    CONFIGURATION_ERROR("ConfigurationError"),
    /** Unknown tool, service or object reference */
    NOT_FOUND("NotFound"),
    /** Arguments do not match the tool's parameter contract */
    VALIDATION_ERROR("ValidationError"),
    /** Statement category is disallowed by the permission policy */
    POLICY_DENIED("PolicyDenied"),
    /** No session became available within the acquire timeout */
    RESOURCE_EXHAUSTED("ResourceExhausted"),
    /** Failure reported by the warehouse or an AI service, timeouts included */
    BACKEND_ERROR("BackendError"),
    /** Unexpected fault caught at the dispatcher boundary */
    INTERNAL_ERROR("InternalError");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
