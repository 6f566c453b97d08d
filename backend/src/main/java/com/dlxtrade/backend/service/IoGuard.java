package com.dlxtrade.backend.service;

import com.dlxtrade.backend.exception.CollaboratorTimeoutException;
import com.dlxtrade.backend.exception.TradingException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bounds every collaborator call (market data, orders, persistence) by the engine I/O timeout.
 * Calls run on the I/O pool; the calling engine thread waits at most the configured duration and a
 * call that overruns it is interrupted.
 */
@Component
public class IoGuard {

    private final TimeLimiter timeLimiter;
    private final AsyncTaskExecutor ioExecutor;

    public IoGuard(TimeLimiter engineIoTimeLimiter, @Qualifier("ioExecutor") AsyncTaskExecutor ioExecutor) {
        this.timeLimiter = engineIoTimeLimiter;
        this.ioExecutor = ioExecutor;
    }

    public <T> T call(String operation, Supplier<T> supplier) {
        try {
            return timeLimiter.executeFutureSupplier(() -> ioExecutor.submit((Callable<T>) supplier::get));
        } catch (TaskRejectedException e) {
            throw new TradingException(operation + " rejected: I/O pool saturated", e);
        } catch (TimeoutException e) {
            throw new CollaboratorTimeoutException(operation,
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TradingException(operation + " interrupted", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new TradingException(operation + " failed: " + e.getMessage(), e);
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
