package io.conformanceapi.server.core;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes {

    /** Empty response body. */
    record Empty() implements ResponseBody {}

    /** In-memory byte array response body; the content type travels as a response header. */
    record Bytes(byte[] bytes) implements ResponseBody {}
}
