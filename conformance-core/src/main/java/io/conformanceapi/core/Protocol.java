package io.conformanceapi.core;

/**
 * Conformance API protocol constants (query keys, header names, and well-known values).
 */
public final class Protocol {
    private Protocol() {}

    // Query parameter keys
    public static final String Q_QUERY = "q";

    // Primitive field names, shared by the checkQuery parameters and the checkPath segments
    public static final String F_STRING = "string";
    public static final String F_BOOLEAN = "boolean";
    public static final String F_DOUBLE = "double";
    public static final String F_INT32 = "int32";
    public static final String F_INT64 = "int64";
    public static final String F_DECIMAL = "decimal";
    public static final String F_ENUM = "enum";
    public static final String F_DATETIME = "datetime";

    // HTTP headers
    public static final String H_ETAG = "eTag";
    public static final String H_IF_NONE_MATCH = "If-None-Match";
    public static final String H_IF_MATCH = "If-Match";
    public static final String H_LOCATION = "Location";
    public static final String H_CONTENT_TYPE = "Content-Type";

    // Content types
    public static final String CT_JSON = "application/json; charset=utf-8";

    /** Service name reported by {@code GET /}. */
    public static final String SERVICE_NAME = "ConformanceApi";

    /** Service version reported by {@code GET /}. */
    public static final String SERVICE_VERSION = "0.1.0";
}
