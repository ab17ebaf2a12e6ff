package io.conformanceapi.core;

/**
 * Symbolic error codes carried by {@link ServiceError#code()}.
 */
public final class ErrorCodes {
    private ErrorCodes() {}

    public static final String NOT_MODIFIED = "NotModified";
    public static final String INVALID_REQUEST = "InvalidRequest";
    public static final String NOT_AUTHENTICATED = "NotAuthenticated";
    public static final String NOT_AUTHORIZED = "NotAuthorized";
    public static final String NOT_FOUND = "NotFound";
    public static final String CONFLICT = "Conflict";
    public static final String REQUEST_TOO_LARGE = "RequestTooLarge";
    public static final String TOO_MANY_REQUESTS = "TooManyRequests";
    public static final String INTERNAL_ERROR = "InternalError";
    public static final String SERVICE_UNAVAILABLE = "ServiceUnavailable";
    public static final String NOT_ADMIN = "NotAdmin";
}
