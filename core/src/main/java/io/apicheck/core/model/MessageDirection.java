package io.apicheck.core.model;

/**
 * Whether the instance is a request or a response body. Only consulted for the OpenAPI
 * {@code readOnly}/{@code writeOnly} keywords.
 */
public enum MessageDirection {
    /** Client to server: {@code readOnly} properties must not be sent. */
    REQUEST,

    /** Server to client: {@code writeOnly} properties must not be returned. */
    RESPONSE
}
