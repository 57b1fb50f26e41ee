package com.phillippitts.hybridfactor.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the worker executor ({@code threadpool.worker.*}).
 *
 * <p>Every racing worker gets its own thread, so there is no pool size to tune.
 */
@ConfigurationProperties(prefix = "threadpool.worker")
@Validated
public class WorkerExecutorProperties {

    @NotBlank
    private String threadNamePrefix = "factor-worker-";

    /** Daemon threads let the JVM exit while an abandoned worker is still spinning. */
    private boolean daemon = true;

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public void setDaemon(boolean daemon) {
        this.daemon = daemon;
    }
}
