package uk.ac.ntu.loopserve.server.route;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * A handler's outcome, normalized into one of four shapes before it is written out.
 */
public final class Reply {

    public enum Kind { EMPTY, TEXT, STRUCTURED, FAILURE }

    private static final Reply EMPTY = new Reply(Kind.EMPTY, 200, null, null);

    private final Kind kind;
    private final int status;
    private final Object value;
    private final Throwable cause;

    private Reply(Kind kind, int status, Object value, Throwable cause) {
        this.kind = kind;
        this.status = status;
        this.value = value;
        this.cause = cause;
    }

    /**
     * Maps a handler's return value: {@code null} is empty, a {@code String} is text,
     * a {@code Reply} is kept, anything else is structured.
     */
    public static Reply of(Object result) {
        if (result == null) return EMPTY;
        if (result instanceof Reply r) return r;
        if (result instanceof String s) return text(200, s);
        return json(200, result);
    }

    public static Reply empty() {
        return EMPTY;
    }

    public static Reply empty(int status) {
        return new Reply(Kind.EMPTY, status, null, null);
    }

    public static Reply text(int status, String body) {
        return new Reply(Kind.TEXT, status, Objects.requireNonNull(body, "body"), null);
    }

    public static Reply json(int status, Object value) {
        return new Reply(Kind.STRUCTURED, status, value, null);
    }

    public static Reply failure(Throwable cause) {
        return new Reply(Kind.FAILURE, 500, null, unwrap(Objects.requireNonNull(cause, "cause")));
    }

    public Kind kind() {
        return kind;
    }

    public int status() {
        return status;
    }

    public Object value() {
        return value;
    }

    public Throwable cause() {
        return cause;
    }

    /**
     * Text sent for a failure: {@code Error! } followed by the exception's own description.
     */
    public String describe() {
        return kind == Kind.FAILURE ? "Error! " + cause : String.valueOf(value);
    }

    static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    @Override
    public String toString() {
        return "Reply[" + kind + " " + status + "]";
    }
}
