package com.flagship.account_ledger.runtime;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shuts the application down and exits the JVM with a non-zero status, leaving the
 * restart to the process supervisor.
 *
 * The shutdown runs on its own thread: the failing request or listener thread is
 * itself part of what the context waits for while closing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProcessExitFatalErrorHandler implements FatalErrorHandler {

    static final int EXIT_CODE = 70;

    private final ApplicationContext applicationContext;
    private final AtomicBoolean exiting = new AtomicBoolean(false);

    @Override
    public void onFatalError(String context, Throwable error) {
        log.error("FATAL: {}; shutting down", context, error);

        if (!exiting.compareAndSet(false, true)) {
            return;
        }

        Thread shutdown = new Thread(
            () -> System.exit(SpringApplication.exit(applicationContext, () -> EXIT_CODE)),
            "fatal-error-shutdown");
        shutdown.setDaemon(false);
        shutdown.start();
    }
}
