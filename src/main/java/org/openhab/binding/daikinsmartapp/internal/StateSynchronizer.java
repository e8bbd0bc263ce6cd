package org.openhab.binding.daikinsmartapp.internal;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.daikinsmartapp.internal.api.DaikinCloudApi;
import org.openhab.binding.daikinsmartapp.internal.api.exception.AuthenticationFailedException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.DaikinException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.NotConfiguredException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.SessionUnstableException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.UnknownDeviceException;
import org.openhab.binding.daikinsmartapp.internal.model.Command;
import org.openhab.binding.daikinsmartapp.internal.model.Confidence;
import org.openhab.binding.daikinsmartapp.internal.model.Device;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceState;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceStatusSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls every unit on its own schedule and reconciles the result with any
 * pending command in the {@link DeviceRegistry}.
 * <p>
 * A pending command is confirmed as soon as a poll reports its targets. If it
 * is still unconfirmed once the confirmation timeout has passed it is presumed
 * failed and the state reverts to what the cloud reports. Failed polls back
 * off per unit; after {@code failureThreshold} consecutive failures the state
 * is marked {@link Confidence#LOW}.
 */
@NonNullByDefault
public class StateSynchronizer {

    /**
     * Escalations the synchronizer cannot resolve on its own.
     */
    public interface Callback {
        /**
         * The cloud no longer knows a unit from the catalog.
         */
        default void onUnknownDevice(String deviceId) {
        }

        /**
         * A poll failed for a reason that retrying will not fix.
         */
        default void onFatalError(DaikinException error) {
        }

        /**
         * A poll of the unit was answered by the cloud.
         */
        default void onPollSucceeded(String deviceId) {
        }
    }

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(StateSynchronizer.class));

    private final DaikinCloudApi api;
    private final DeviceRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration confirmationTimeout;
    private final int failureThreshold;
    private final BackoffPolicy backoff;
    private final Callback callback;

    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();
    private boolean running;

    public StateSynchronizer(DaikinCloudApi api, DeviceRegistry registry, ScheduledExecutorService scheduler,
            Clock clock, Duration pollInterval, Duration confirmationTimeout, int failureThreshold,
            BackoffPolicy backoff, Callback callback) {
        this.api = Objects.requireNonNull(api, "api");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.confirmationTimeout = Objects.requireNonNull(confirmationTimeout, "confirmationTimeout");
        this.failureThreshold = Math.max(1, failureThreshold);
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.callback = Objects.requireNonNull(callback, "callback");
    }

    /**
     * Starts one polling task per unit in the catalog. The first poll runs
     * immediately.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        logger.debug("Starting state synchronization every {}", pollInterval);
        syncWithCatalog();
    }

    /**
     * Cancels all polling tasks. A poll that is already running finishes but
     * does not reschedule itself.
     */
    public synchronized void stop() {
        running = false;
        for (ScheduledFuture<?> future : tasks.values()) {
            future.cancel(false);
        }
        tasks.clear();
        logger.debug("Stopped state synchronization");
    }

    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * Aligns the polling tasks with the registry catalog after a discovery.
     */
    public synchronized void syncWithCatalog() {
        if (!running) {
            return;
        }
        Set<String> ids = new HashSet<>();
        for (Device device : registry.listDevices()) {
            ids.add(device.getDeviceId());
        }
        for (Map.Entry<String, ScheduledFuture<?>> entry : Set.copyOf(tasks.entrySet())) {
            if (!ids.contains(entry.getKey())) {
                entry.getValue().cancel(false);
                tasks.remove(entry.getKey());
                backoff.reset(entry.getKey());
                api.forgetDevice(entry.getKey());
            }
        }
        for (String id : ids) {
            if (!tasks.containsKey(id)) {
                schedule(id, Duration.ZERO);
            }
        }
    }

    synchronized int activeTaskCount() {
        return tasks.size();
    }

    private void schedule(String deviceId, Duration delay) {
        AtomicReference<@Nullable ScheduledFuture<?>> self = new AtomicReference<>();
        ScheduledFuture<?> future = scheduler.schedule(() -> runPoll(deviceId, self), delay.toMillis(),
                TimeUnit.MILLISECONDS);
        self.set(future);
        tasks.put(deviceId, Objects.requireNonNull(future));
    }

    /**
     * Runs one poll and reschedules it, unless the task was replaced or
     * cancelled in the meantime.
     */
    private void runPoll(String deviceId, AtomicReference<@Nullable ScheduledFuture<?>> self) {
        synchronized (this) {
            if (!isCurrent(deviceId, self)) {
                return;
            }
        }
        Duration next;
        try {
            next = pollDevice(deviceId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Polling of {} interrupted", deviceId);
            return;
        } catch (RuntimeException e) {
            logger.warn("Unexpected error polling {}: {}", deviceId, e.getMessage(), e);
            next = backoff.nextDelay(deviceId);
        }
        synchronized (this) {
            if (isCurrent(deviceId, self)) {
                schedule(deviceId, next);
            }
        }
    }

    private boolean isCurrent(String deviceId, AtomicReference<@Nullable ScheduledFuture<?>> self) {
        ScheduledFuture<?> own = self.get();
        return running && own != null && tasks.get(deviceId) == own;
    }

    /**
     * Polls one unit and reconciles the result.
     *
     * @return the delay until this unit should be polled again
     */
    public Duration pollDevice(String deviceId) throws InterruptedException {
        DeviceStatusSnapshot snapshot;
        try {
            snapshot = api.fetchStatus(deviceId);
        } catch (UnknownDeviceException e) {
            logger.info("Cloud reports unknown device {}; requesting rediscovery", deviceId);
            callback.onUnknownDevice(deviceId);
            return pollInterval;
        } catch (AuthenticationFailedException | SessionUnstableException | NotConfiguredException e) {
            logger.warn("Polling {} failed: {}", deviceId, e.getMessage());
            callback.onFatalError(e);
            return recordFailure(deviceId, e);
        } catch (DaikinException e) {
            return recordFailure(deviceId, e);
        }

        backoff.reset(deviceId);
        callback.onPollSucceeded(deviceId);
        try {
            reconcile(deviceId, snapshot);
        } catch (UnknownDeviceException e) {
            logger.debug("Device {} left the catalog while being polled", deviceId);
        }
        return pollInterval;
    }

    private void reconcile(String deviceId, DeviceStatusSnapshot snapshot) throws UnknownDeviceException {
        Instant now = clock.instant();
        AtomicReference<@Nullable Command> confirmed = new AtomicReference<>();
        AtomicReference<@Nullable Command> presumedFailed = new AtomicReference<>();

        registry.upsertState(deviceId, current -> {
            Command pending = current.getPendingCommand();
            if (pending == null) {
                return current.confirmed(snapshot, now);
            }
            if (pending.isSatisfiedBy(snapshot.isPower(), snapshot.getMode())) {
                confirmed.set(pending);
                return current.confirmed(snapshot, now);
            }
            Instant since = current.getPendingSince();
            if (since != null && Duration.between(since, now).compareTo(confirmationTimeout) > 0) {
                presumedFailed.set(pending);
                return current.confirmed(snapshot, now);
            }
            return current.withReadings(snapshot.getReadings());
        });

        Command confirmedCommand = confirmed.get();
        if (confirmedCommand != null) {
            logger.debug("{} confirmed by poll", confirmedCommand);
        }
        Command failedCommand = presumedFailed.get();
        if (failedCommand != null) {
            logger.warn("{} not confirmed within {} (issued {}); reverting to reported power={} mode={}",
                    failedCommand, confirmationTimeout, failedCommand.getIssuedAt(),
                    snapshot.isPower() ? "on" : "off", snapshot.getMode());
            registry.fireCommandPresumedFailed(failedCommand, snapshot);
        }
    }

    private Duration recordFailure(String deviceId, DaikinException cause) {
        int failures = backoff.recordFailure(deviceId);
        Duration delay = backoff.nextDelay(deviceId);
        logger.debug("Polling {} failed ({} in a row), next attempt in {}: {}", deviceId, failures, delay,
                cause.getMessage());
        if (failures >= failureThreshold) {
            try {
                DeviceState state = registry.upsertState(deviceId, s -> s.withConfidence(Confidence.LOW));
                if (failures == failureThreshold) {
                    logger.warn("Device {} unreachable for {} polls, state marked low confidence: {}", deviceId,
                            failures, state);
                }
            } catch (UnknownDeviceException e) {
                logger.debug("Device {} left the catalog while being polled", deviceId);
            }
        }
        return delay;
    }
}
