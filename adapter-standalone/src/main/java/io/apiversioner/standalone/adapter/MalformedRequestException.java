package io.apiversioner.standalone.adapter;

/**
 * Thrown by {@link JavalinRequestAdapter} when the request cannot be read into a request view,
 * for example a query string with a broken percent-escape. Answered with 400.
 */
public final class MalformedRequestException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MalformedRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
