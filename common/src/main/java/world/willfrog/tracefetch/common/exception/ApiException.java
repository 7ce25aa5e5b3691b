package world.willfrog.tracefetch.common.exception;

import lombok.Getter;

/**
 * 远端接口返回非 2xx，或请求本身没有发出去。
 *
 * <p>{@code statusCode} 为 -1 表示网络层失败（连接、超时、中断），此时 {@code responseBody} 为空串。</p>
 */
@Getter
public class ApiException extends TraceFetchException {

    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String responseBody;

    public ApiException(String message, int statusCode, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody == null ? "" : responseBody;
    }

    public ApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
        this.responseBody = "";
    }
}
