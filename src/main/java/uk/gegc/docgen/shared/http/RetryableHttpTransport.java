package uk.gegc.docgen.shared.http;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleSupplier;

/**
 * Executes HTTP requests with bounded retry and exponential backoff plus jitter.
 *
 * <p>Connection-level failures ({@link IOException}) and responses with status 429 or 5xx are retried.
 * Every other outcome is handed back untouched on the first attempt. When the budget is exhausted the
 * last IO error is rethrown, or the last retryable response is returned still open, so the caller can
 * classify it.
 *
 * <p>Backoff waits only block the calling thread. A caller can abandon a sequence through the
 * cancellation checker, which is consulted before every attempt and every wait.
 */
@Slf4j
public class RetryableHttpTransport {

    private final ClientHttpRequestFactory requestFactory;
    private final DoubleSupplier random;

    public RetryableHttpTransport(ClientHttpRequestFactory requestFactory) {
        this(requestFactory, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryableHttpTransport(ClientHttpRequestFactory requestFactory, DoubleSupplier random) {
        if (requestFactory == null) {
            throw new IllegalArgumentException("Request factory cannot be null");
        }
        this.requestFactory = requestFactory;
        this.random = random;
    }

    public ClientHttpResponse execute(OutboundRequest request, RetryPolicy policy) throws IOException {
        return execute(request, policy, () -> false);
    }

    public ClientHttpResponse execute(OutboundRequest request,
                                      RetryPolicy policy,
                                      BooleanSupplier cancellationChecker) throws IOException {
        int maxAttempts = policy.maxRetries() + 1;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            abortIfCancelled(cancellationChecker, attempt);
            boolean lastAttempt = attempt == maxAttempts - 1;

            ClientHttpResponse response;
            try {
                response = send(request);
            } catch (IOException e) {
                if (e instanceof RetryCancelledException || lastAttempt) {
                    throw e;
                }
                long delayMs = calculateBackoffDelay(attempt, policy);
                log.warn("Request to {} failed on attempt {}/{} ({}), retrying in {} ms",
                        request.uri(), attempt + 1, maxAttempts, e.getMessage(), delayMs);
                waitBeforeRetry(delayMs, cancellationChecker, attempt + 1);
                continue;
            }

            HttpStatusCode status = response.getStatusCode();
            if (!isRetryableStatus(status) || lastAttempt) {
                if (isRetryableStatus(status)) {
                    log.warn("Request to {} still failing with {} after {} attempts",
                            request.uri(), status.value(), maxAttempts);
                }
                return response;
            }

            drainAndClose(response);
            long delayMs = calculateBackoffDelay(attempt, policy);
            log.warn("Request to {} returned {} on attempt {}/{}, retrying in {} ms",
                    request.uri(), status.value(), attempt + 1, maxAttempts, delayMs);
            waitBeforeRetry(delayMs, cancellationChecker, attempt + 1);
        }

        // maxAttempts is always >= 1, every path above returns or throws on the last attempt
        throw new IllegalStateException("Retry loop exited without a result");
    }

    static boolean isRetryableStatus(HttpStatusCode status) {
        return status.value() == HttpStatus.TOO_MANY_REQUESTS.value() || status.is5xxServerError();
    }

    /**
     * Wait before retry number {@code retryIndex + 1}: {@code base * 2^retryIndex}, capped, then jittered.
     */
    long calculateBackoffDelay(int retryIndex, RetryPolicy policy) {
        long baseMs = policy.baseBackoff().toMillis();
        long maxMs = policy.maxBackoff().toMillis();
        int shift = Math.min(retryIndex, 30);
        long delay = Math.min(baseMs * (1L << shift), maxMs);
        if (delay < 0) {
            delay = maxMs;
        }
        double jitter = 1.0 + (random.getAsDouble() * 2 - 1) * policy.jitterFactor();
        return Math.max(0L, Math.round(delay * jitter));
    }

    /**
     * Blocks the calling thread. Overridden in tests.
     */
    protected void sleepForBackoff(long delayMs) throws InterruptedException {
        Thread.sleep(delayMs);
    }

    private ClientHttpResponse send(OutboundRequest request) throws IOException {
        ClientHttpRequest httpRequest = requestFactory.createRequest(request.uri(), request.method());
        httpRequest.getHeaders().putAll(request.headers());
        if (request.body().length > 0) {
            StreamUtils.copy(request.body(), httpRequest.getBody());
        }
        return httpRequest.execute();
    }

    private void waitBeforeRetry(long delayMs, BooleanSupplier cancellationChecker, int attemptsMade)
            throws RetryCancelledException {
        abortIfCancelled(cancellationChecker, attemptsMade);
        try {
            sleepForBackoff(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryCancelledException("Interrupted while waiting to retry", attemptsMade);
        }
    }

    private void abortIfCancelled(BooleanSupplier cancellationChecker, int attemptsMade)
            throws RetryCancelledException {
        if (cancellationChecker.getAsBoolean()) {
            throw new RetryCancelledException("Retry sequence cancelled by caller", attemptsMade);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new RetryCancelledException("Calling thread was interrupted", attemptsMade);
        }
    }

    private void drainAndClose(ClientHttpResponse response) {
        try {
            StreamUtils.drain(response.getBody());
        } catch (IOException e) {
            log.debug("Could not drain body of failed attempt: {}", e.getMessage());
        } finally {
            response.close();
        }
    }
}
