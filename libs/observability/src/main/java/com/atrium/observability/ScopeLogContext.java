package com.atrium.observability;

/**
 * The active session scope as it appears in log output.
 *
 * @param correlationId id of the context switch that produced this scope; log lines emitted while
 *                      loading and mutating under the scope share it
 * @param principalId   authenticated user (nullable before sign-in completes)
 * @param scopeType     lower-case scope discriminator, e.g. "organization"
 * @param scopeId       id of the identity the session acts as
 * @param workspaceId   selected workspace (nullable)
 */
public record ScopeLogContext(
        String correlationId,
        String principalId,
        String scopeType,
        String scopeId,
        String workspaceId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_PRINCIPAL_ID = "principalId";
    public static final String MDC_SCOPE_TYPE = "scopeType";
    public static final String MDC_SCOPE_ID = "scopeId";
    public static final String MDC_WORKSPACE_ID = "workspaceId";

    public ScopeLogContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Same scope with another workspace selection. */
    public ScopeLogContext withWorkspace(String workspaceId) {
        return new ScopeLogContext(correlationId, principalId, scopeType, scopeId, workspaceId);
    }
}
