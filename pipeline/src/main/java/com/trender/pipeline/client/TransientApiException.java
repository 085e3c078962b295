package com.trender.pipeline.client;

import com.trender.pipeline.retry.RetryPolicy;

import java.io.IOException;

/**
 * Signals a GitHub response that is worth retrying (429 or 5xx).
 * Never escapes {@link GitHubApiClient}.
 */
class TransientApiException extends IOException implements RetryPolicy.DelayHint {

    private final int statusCode;
    private final long retryAfterMs;

    TransientApiException(int statusCode, String url, long retryAfterMs) {
        super("GitHub API " + statusCode + " for " + url);
        this.statusCode = statusCode;
        this.retryAfterMs = retryAfterMs;
    }

    int statusCode() {
        return statusCode;
    }

    @Override
    public long delayHintMs() {
        return retryAfterMs;
    }
}
