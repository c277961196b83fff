package com.sensortwin.runner;

import com.sensortwin.core.environment.EnvironmentQuery;
import com.sensortwin.core.model.AnomalyLabel;
import com.sensortwin.core.model.LabeledSample;
import com.sensortwin.core.model.SampleTime;
import com.sensortwin.core.sensor.Sensor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every sensor of a scenario once per timestep.
 *
 * <p>
 * Within a step each sensor is an independent task on a fixed thread pool;
 * the step completes when all tasks have finished, and its samples are handed
 * to the sink in sensor order. Every sample draws from its own seeded random
 * generator, so the output is the same for any parallelism.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScenarioDriver implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ScenarioDriver.class);

    private final List<Sensor> sensors;
    private final EnvironmentQuery environment;
    private final ExecutorService executor;

    /**
     * @param sensors     sensors in emission order; must not be {@code null}
     * @param environment environment shared by all sensors
     * @param parallelism worker thread count, at least 1
     */
    public ScenarioDriver(List<Sensor> sensors, EnvironmentQuery environment, int parallelism) {
        this.sensors = List.copyOf(Objects.requireNonNull(sensors, "Sensor list must not be null"));
        this.environment = Objects.requireNonNull(environment, "EnvironmentQuery must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, "sensor-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        LOG.info("ScenarioDriver started with {} sensor(s) on {} thread(s)", this.sensors.size(), parallelism);
    }

    /**
     * Run {@code steps} timesteps starting at {@code start}.
     *
     * @param steps       number of steps, {@code >= 0}
     * @param start       timestamp of step 0
     * @param stepSeconds length of one step in seconds
     * @param sink        receives every sample
     * @return counts of the run
     * @throws IOException          if the sink fails
     * @throws InterruptedException if interrupted while waiting for a step
     */
    public RunSummary run(long steps, Instant start, double stepSeconds, SampleSink sink)
            throws IOException, InterruptedException {
        Objects.requireNonNull(start, "Start time must not be null");
        Objects.requireNonNull(sink, "SampleSink must not be null");

        long samples = 0;
        Map<String, Long> labelCounts = new HashMap<>();
        for (long step = 0; step < steps; step++) {
            SampleTime time = SampleTime.atStep(start, step, stepSeconds);
            for (LabeledSample sample : runStep(time)) {
                sink.accept(sample);
                samples++;
                for (AnomalyLabel label : sample.getGroundTruth()) {
                    labelCounts.merge(label.getAnomalyType(), 1L, Long::sum);
                }
            }
            LOG.debug("Step {} done at {}", step, time.getTimestamp());
        }
        RunSummary summary = new RunSummary(steps, samples, labelCounts);
        LOG.info("Run finished: {}", summary);
        return summary;
    }

    /**
     * Sample every sensor at {@code time}.
     *
     * @return the samples in sensor order
     * @throws InterruptedException if interrupted while waiting
     */
    public List<LabeledSample> runStep(SampleTime time) throws InterruptedException {
        Objects.requireNonNull(time, "SampleTime must not be null");
        List<Callable<LabeledSample>> tasks = new ArrayList<>(sensors.size());
        for (Sensor sensor : sensors) {
            tasks.add(() -> sensor.sample(environment, time));
        }

        List<LabeledSample> samples = new ArrayList<>(sensors.size());
        List<Future<LabeledSample>> futures = executor.invokeAll(tasks);
        for (int i = 0; i < futures.size(); i++) {
            try {
                samples.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                String sensorId = sensors.get(i).getSensorId();
                if (cause instanceof RuntimeException runtime) {
                    LOG.error("Sensor [{}] failed at step {}", sensorId, time.getStep(), runtime);
                    throw runtime;
                }
                throw new IllegalStateException("Sensor [" + sensorId + "] failed at step " + time.getStep(), cause);
            }
        }
        return samples;
    }

    public List<Sensor> getSensors() {
        return sensors;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Worker threads did not stop in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("ScenarioDriver stopped");
    }
}
