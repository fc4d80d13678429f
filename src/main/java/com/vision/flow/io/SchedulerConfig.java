package com.vision.flow.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Tunables of the scheduler and its buffer pool.
 *
 * Bindable from JSON; unknown properties are ignored and missing ones keep
 * their defaults.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SchedulerConfig {
    /** Classpath resource read by {@link #load()}. */
    public static final String RESOURCE = "inspection-flow.json";

    private static final int PROCESSORS = Runtime.getRuntime().availableProcessors();

    /** Nodes of one run in flight at once. */
    private int maxConcurrency = PROCESSORS;
    /** Size of the worker pool shared by all runs. */
    private int workerThreads = 2 * PROCESSORS;
    private long defaultTimeoutMs = 30_000;
    /**
     * Time each operator may run before it alone fails with TIMEOUT, counted
     * from dispatch; 0 leaves operators bounded by the run deadline only.
     */
    private long nodeTimeoutMs = 30_000;
    /**
     * Wind-down window for in-flight nodes. On a deadline it is taken from the
     * end of the timeout (at most half of it); on an explicit cancel it follows
     * the request. Nodes still running when it closes are abandoned.
     */
    private long cancelGraceMs = 500;
    private long poolMaxBytes = 512L * 1024 * 1024;
    private int poolMaxIdlePerShape = 10;
    private long poolAcquireTimeoutMs = 2_000;
    /** Finished runs whose status stays queryable. */
    private int statusRetention = 64;

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromJson(InputStream in) {
        try {
            SchedulerConfig config = new ObjectMapper().readValue(in, SchedulerConfig.class);
            config.validate();
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read scheduler configuration", e);
        }
    }

    /** Reads {@value #RESOURCE} from the classpath, or returns the defaults if absent. */
    public static SchedulerConfig load() {
        try (InputStream in = SchedulerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", RESOURCE);
                return defaults();
            }
            SchedulerConfig config = fromJson(in);
            log.info("Loaded scheduler configuration from {}: {}", RESOURCE, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close " + RESOURCE, e);
        }
    }

    /** @throws IllegalArgumentException on the first out-of-range limit */
    public SchedulerConfig validate() {
        require(maxConcurrency > 0, "maxConcurrency", maxConcurrency);
        require(workerThreads > 0, "workerThreads", workerThreads);
        require(defaultTimeoutMs > 0, "defaultTimeoutMs", defaultTimeoutMs);
        require(nodeTimeoutMs >= 0, "nodeTimeoutMs", nodeTimeoutMs);
        require(cancelGraceMs >= 0, "cancelGraceMs", cancelGraceMs);
        require(poolMaxBytes > 0, "poolMaxBytes", poolMaxBytes);
        require(poolMaxIdlePerShape > 0, "poolMaxIdlePerShape", poolMaxIdlePerShape);
        require(poolAcquireTimeoutMs >= 0, "poolAcquireTimeoutMs", poolAcquireTimeoutMs);
        require(statusRetention >= 0, "statusRetention", statusRetention);
        return this;
    }

    private static void require(boolean ok, String name, long value) {
        if (!ok)
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
    }
}
