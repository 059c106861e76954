package warehouse.bridge.dispatch;

import warehouse.bridge.policy.StatementCategory;

/**
 * Failure of a single tool invocation. Carries the error kind and, for policy denials, the
 * rejected statement category. Converted into a {@link ToolInvocationResult} by the dispatcher.
 */
public class ToolInvocationException extends RuntimeException {

    private final ErrorKind kind;
    private final StatementCategory category;

    public ToolInvocationException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public ToolInvocationException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    private ToolInvocationException(ErrorKind kind, String message, StatementCategory category, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.category = category;
    }

    public static ToolInvocationException notFound(String message) {
        return new ToolInvocationException(ErrorKind.NOT_FOUND, message);
    }

    public static ToolInvocationException validation(String message) {
        return new ToolInvocationException(ErrorKind.VALIDATION_ERROR, message);
    }

    public static ToolInvocationException policyDenied(StatementCategory category) {
        return new ToolInvocationException(ErrorKind.POLICY_DENIED,
            "Statement type '" + category.getConfigName() + "' is not permitted by the configured sql_statement_permissions",
            category, null);
    }

    public static ToolInvocationException backend(String message, Throwable cause) {
        return new ToolInvocationException(ErrorKind.BACKEND_ERROR, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return the rejected category for {@link ErrorKind#POLICY_DENIED}, otherwise null
     */
    public StatementCategory getCategory() {
        return category;
    }
}
