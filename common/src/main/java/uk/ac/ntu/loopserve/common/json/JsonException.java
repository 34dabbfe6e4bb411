package uk.ac.ntu.loopserve.common.json;

public class JsonException extends RuntimeException {

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
