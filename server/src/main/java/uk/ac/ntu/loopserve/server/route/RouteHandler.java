package uk.ac.ntu.loopserve.server.route;

/**
 * User code bound to one path and method.
 * <p>
 * Return {@code null} for an empty response, a {@code String} to send it as-is,
 * a {@link Reply} to pick the status, or any other value to send it as JSON.
 * A {@link java.util.concurrent.CompletionStage} of any of these is awaited first.
 * Throwing (or failing the stage) produces a 500 response.
 */
@FunctionalInterface
public interface RouteHandler {

    Object handle(RouteRequest request) throws Exception;
}
