package com.demo.changefeed;

import com.myorg.changefeed.contracts.core.exception.ChangefeedNonRetryableException;
import com.myorg.changefeed.contracts.core.exception.ChangefeedRetryableException;
import com.myorg.changefeed.contracts.core.exception.UnknownFeedException;
import com.myorg.changefeed.contracts.core.exception.UnknownShardException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.function.Supplier;

/**
 * Maps changefeed exceptions to HTTP statuses.
 */
@Slf4j
final class ApiErrors {

    private ApiErrors() {}

    static <T> T call(Supplier<T> action) {
        try {
            return action.get();
        } catch (UnknownFeedException | UnknownShardException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (ChangefeedRetryableException e) {
            log.warn("Retryable changefeed failure: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e);
        } catch (ChangefeedNonRetryableException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getReason() + ": " + e.getMessage(), e);
        }
    }
}
