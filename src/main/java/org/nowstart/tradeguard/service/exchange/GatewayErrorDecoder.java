package org.nowstart.tradeguard.service.exchange;

import feign.FeignException;
import feign.Response;
import feign.RetryableException;
import feign.codec.ErrorDecoder;

/**
 * Rate limits and server errors become {@link RetryableException} so the retryer sees them;
 * other statuses stay plain {@link FeignException}s and fail on the first attempt.
 */
public class GatewayErrorDecoder implements ErrorDecoder {

    private final ErrorDecoder defaultDecoder = new ErrorDecoder.Default();

    @Override
    public Exception decode(String methodKey, Response response) {
        Exception decoded = defaultDecoder.decode(methodKey, response);
        if (decoded instanceof RetryableException || !isRetryableStatus(response.status())) {
            return decoded;
        }

        return new RetryableException(
                response.status(),
                decoded.getMessage(),
                response.request().httpMethod(),
                decoded,
                (Long) null,
                response.request()
        );
    }

    static boolean isRetryableStatus(int status) {
        return status == 429 || status >= 500;
    }
}
