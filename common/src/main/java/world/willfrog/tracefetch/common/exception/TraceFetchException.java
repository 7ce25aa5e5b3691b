package world.willfrog.tracefetch.common.exception;

/**
 * 拉取链路的异常基类。
 */
public class TraceFetchException extends RuntimeException {

    public TraceFetchException(String message) {
        super(message);
    }

    public TraceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
