package com.domogeek.calendarservice.caldav;

import com.domogeek.calendarservice.config.CalendarProperties;
import com.domogeek.calendarservice.metrics.CalendarMetrics;
import com.domogeek.common.exception.CalendarConnectivityException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Blocks until a remote calendar validates, retrying with exponential back-off.
 * <p>
 * With {@code max-attempts} at 0 (the default) there is no attempt cap: the
 * calling thread waits as long as the server stays unreachable and each failed
 * attempt is logged. With a positive cap the last failure is rethrown once the
 * attempts are used up.
 */
@Slf4j
public class CaldavStartupValidator {

    public static final String RETRY_NAME = "caldav-startup";

    private final RetryConfig retryConfig;
    private final CalendarMetrics metrics;

    public CaldavStartupValidator(CalendarProperties.StartupRetry settings, CalendarMetrics metrics) {
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(settings.unbounded() ? Integer.MAX_VALUE : settings.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.initialInterval().toMillis(),
                        settings.multiplier(),
                        settings.maxInterval().toMillis()))
                .build();
        this.metrics = metrics;
    }

    /**
     * Returns once {@code client.validateServer(calendarPath)} succeeds.
     *
     * @throws CalendarConnectivityException only when an attempt cap is configured and exhausted
     */
    public void awaitReachable(CalendarOverrideClient client, String calendarPath) {
        Retry retry = Retry.of(RETRY_NAME, retryConfig);
        retry.getEventPublisher()
                .onRetry(event -> log.error("unable to validate caldav connection on retry {}: {}",
                        event.getNumberOfRetryAttempts(), describe(event.getLastThrowable())))
                .onSuccess(event -> log.info("caldav connection validated after {} retries",
                        event.getNumberOfRetryAttempts()));

        Runnable validation = Retry.decorateRunnable(retry, () -> {
            try {
                client.validateServer(calendarPath);
                metrics.recordValidationAttempt(true);
            } catch (RuntimeException e) {
                metrics.recordValidationAttempt(false);
                throw e;
            }
        });

        try {
            validation.run();
        } catch (CalendarConnectivityException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CalendarConnectivityException(
                    "unable to validate caldav connection: " + e.getMessage(), e);
        }
    }

    RetryConfig retryConfig() {
        return retryConfig;
    }

    private static String describe(Throwable throwable) {
        return throwable == null ? "unknown error" : throwable.getMessage();
    }
}
