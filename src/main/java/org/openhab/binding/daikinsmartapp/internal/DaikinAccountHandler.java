package org.openhab.binding.daikinsmartapp.internal;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.daikinsmartapp.internal.api.AuthorizationMode;
import org.openhab.binding.daikinsmartapp.internal.api.ClientCredentialResolver;
import org.openhab.binding.daikinsmartapp.internal.api.ClientCredentialResolver.ClientCredentials;
import org.openhab.binding.daikinsmartapp.internal.api.DaikinAuthClient;
import org.openhab.binding.daikinsmartapp.internal.api.DaikinCloudApi;
import org.openhab.binding.daikinsmartapp.internal.api.SessionManager;
import org.openhab.binding.daikinsmartapp.internal.api.exception.AuthenticationFailedException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.DaikinException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.NotConfiguredException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.SessionUnstableException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.UnknownDeviceException;
import org.openhab.binding.daikinsmartapp.internal.model.Credential;
import org.openhab.binding.daikinsmartapp.internal.model.Device;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceState;
import org.openhab.binding.daikinsmartapp.internal.model.OperationMode;
import org.openhab.binding.daikinsmartapp.internal.store.CredentialStore;
import org.openhab.binding.daikinsmartapp.internal.store.FileCredentialStore;
import org.openhab.binding.daikinsmartapp.internal.util.EndpointResolver;
import org.openhab.binding.daikinsmartapp.internal.util.EndpointResolver.Endpoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Entry point for an adapter: one instance per configured account. Wires the
 * session, cloud client, registry, synchronizer and dispatcher together and
 * exposes the device list, device state and the power and mode controls.
 */
@NonNullByDefault
public class DaikinAccountHandler {

    private static final Duration MAX_POLL_BACKOFF = Duration.ofMinutes(15);
    private static final String CONNECT_KEY = "account";

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(DaikinAccountHandler.class));

    private final Map<String, ?> configuration;
    private final Clock clock;
    private final DeviceRegistry registry = new DeviceRegistry();
    private final AtomicBoolean rediscoveryRunning = new AtomicBoolean();

    private @Nullable AccountConfiguration cfg;
    private @Nullable CredentialStore store;
    private @Nullable SessionManager sessionManager;
    private @Nullable DaikinCloudApi api;
    private @Nullable StateSynchronizer synchronizer;
    private @Nullable CommandDispatcher dispatcher;
    private @Nullable ScheduledExecutorService scheduler;
    private @Nullable BackoffPolicy discoveryBackoff;

    private volatile AccountStatus status = AccountStatus.UNINITIALIZED;
    private volatile AccountStatus.Detail statusDetail = AccountStatus.Detail.NONE;
    private volatile @Nullable String statusDescription;

    public DaikinAccountHandler(Map<String, ?> configuration) {
        this(configuration, Clock.systemUTC());
    }

    public DaikinAccountHandler(Map<String, ?> configuration, Clock clock) {
        this.configuration = Map.copyOf(configuration);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Logs in, discovers the account's units and starts polling them. A
     * rejected credential fails here, before any unit is listed. When the
     * cloud cannot be reached the account goes OFFLINE and login and
     * discovery are retried in the background with backoff.
     */
    public synchronized void initialize() throws DaikinException, InterruptedException {
        if (status != AccountStatus.UNINITIALIZED) {
            dispose();
        }
        AccountConfiguration localCfg = AccountConfiguration.from(configuration);
        cfg = localCfg;

        Endpoints endpoints;
        try {
            JsonNode root = EndpointResolver.loadTree(getClass().getClassLoader(), localCfg.endpointsOverride);
            endpoints = EndpointResolver.resolve(root, localCfg.region);
        } catch (Exception e) {
            updateStatus(AccountStatus.OFFLINE, AccountStatus.Detail.CONFIGURATION_ERROR, e.getMessage());
            logger.warn("Account init failed: {}", e.getMessage());
            throw new NotConfiguredException("Cannot resolve cloud endpoints: " + e.getMessage(), e);
        }

        CredentialStore localStore = createCredentialStore(localCfg.resolveStorePath());
        store = localStore;
        if (localCfg.hasCredentials()) {
            localStore.set(new Credential(localCfg.username, localCfg.password));
        }

        HttpClient httpClient = createHttpClient();
        ClientCredentials preset = localCfg.clientId.isEmpty() || localCfg.clientSecret.isEmpty() ? null
                : new ClientCredentials(localCfg.clientId, localCfg.clientSecret);
        DaikinAuthClient authClient = createAuthClient(endpoints,
                createClientCredentialResolver(endpoints, httpClient, preset), httpClient, localCfg);
        SessionManager localSessions = new SessionManager(localStore, authClient, clock,
                localCfg.sessionSafetyMargin(), localCfg.maxInvalidations, localCfg.invalidationWindow());
        sessionManager = localSessions;
        DaikinCloudApi localApi = createCloudApi(endpoints, localSessions, httpClient, localCfg);
        api = localApi;

        ScheduledExecutorService localScheduler = createScheduler();
        scheduler = localScheduler;
        discoveryBackoff = createDiscoveryBackoff(localCfg);
        dispatcher = new CommandDispatcher(localApi, registry, clock, localCfg.confirmationTimeout());
        synchronizer = new StateSynchronizer(localApi, registry, localScheduler, clock, localCfg.pollInterval(),
                localCfg.confirmationTimeout(), localCfg.failureThreshold,
                new BackoffPolicy(localCfg.pollInterval(), MAX_POLL_BACKOFF), new SynchronizerCallback());

        List<Device> devices;
        try {
            localSessions.ensureSession();
            devices = localApi.discoverDevices();
        } catch (AuthenticationFailedException | NotConfiguredException e) {
            updateStatus(AccountStatus.OFFLINE, AccountStatus.Detail.CONFIGURATION_ERROR, e.getMessage());
            logger.warn("Account login failed: {}", e.getMessage());
            throw e;
        } catch (SessionUnstableException e) {
            updateStatus(AccountStatus.OFFLINE, AccountStatus.Detail.COMMUNICATION_ERROR, e.getMessage());
            logger.warn("Account initialization failed: {}", e.getMessage());
            throw e;
        } catch (DaikinException | IOException e) {
            updateStatus(AccountStatus.OFFLINE, AccountStatus.Detail.COMMUNICATION_ERROR, e.getMessage());
            scheduleConnectRetry(localApi, "Account initialization failed: " + e.getMessage());
            return;
        }
        goOnline(devices);
    }

    /**
     * Stops polling. Requests already on the wire complete on their own.
     */
    public synchronized void dispose() {
        StateSynchronizer localSynchronizer = synchronizer;
        if (localSynchronizer != null) {
            localSynchronizer.stop();
        }
        ScheduledExecutorService localScheduler = scheduler;
        if (localScheduler != null) {
            localScheduler.shutdown();
        }
        synchronizer = null;
        scheduler = null;
        discoveryBackoff = null;
        dispatcher = null;
        api = null;
        sessionManager = null;
        registry.clear();
        updateStatus(AccountStatus.UNINITIALIZED, AccountStatus.Detail.NONE, null);
    }

    /**
     * Forgets the account: stops polling and removes the stored credential
     * and session.
     */
    public synchronized void removeAccount() {
        CredentialStore localStore = store;
        dispose();
        if (localStore != null) {
            localStore.clear();
        }
        store = null;
        logger.info("Daikin account removed");
    }

    public List<Device> listDevices() {
        return registry.listDevices();
    }

    /**
     * @throws UnknownDeviceException if the unit is not in the catalog
     */
    public DeviceState getState(String deviceId) throws UnknownDeviceException {
        DeviceState state = registry.getState(deviceId);
        if (state == null) {
            throw new UnknownDeviceException(deviceId);
        }
        return state;
    }

    public DeviceState setPower(String deviceId, boolean on) throws DaikinException, InterruptedException {
        return requireDispatcher().dispatch(deviceId, Boolean.valueOf(on), null);
    }

    public DeviceState setMode(String deviceId, OperationMode mode) throws DaikinException, InterruptedException {
        return requireDispatcher().dispatch(deviceId, null, mode);
    }

    /**
     * Polls one unit right away, outside its regular schedule, and returns the
     * reconciled state.
     */
    public DeviceState refresh(String deviceId) throws DaikinException, InterruptedException {
        StateSynchronizer localSynchronizer = synchronizer;
        if (localSynchronizer == null) {
            throw new NotConfiguredException("Account is not initialized");
        }
        if (registry.getDevice(deviceId) == null) {
            throw new UnknownDeviceException(deviceId);
        }
        localSynchronizer.pollDevice(deviceId);
        return getState(deviceId);
    }

    /**
     * Fetches the catalog again. Units that persist keep their state.
     */
    public List<Device> rediscover() throws DaikinException, InterruptedException {
        DaikinCloudApi localApi = api;
        if (localApi == null) {
            throw new NotConfiguredException("Account is not initialized");
        }
        List<Device> devices = localApi.discoverDevices();
        synchronized (this) {
            if (api == localApi) {
                goOnline(devices);
            }
        }
        return devices;
    }

    /**
     * Stores a new credential; the next request logs in with it.
     */
    public void updateCredential(Credential credential) throws NotConfiguredException {
        SessionManager localSessions = sessionManager;
        if (localSessions == null) {
            throw new NotConfiguredException("Account is not initialized");
        }
        localSessions.updateCredential(credential);
    }

    public void addListener(DeviceStateListener listener) {
        registry.addListener(listener);
    }

    public void removeListener(DeviceStateListener listener) {
        registry.removeListener(listener);
    }

    public @Nullable AccountConfiguration getConfiguration() {
        return cfg;
    }

    public AccountStatus getStatus() {
        return status;
    }

    public AccountStatus.Detail getStatusDetail() {
        return statusDetail;
    }

    public @Nullable String getStatusDescription() {
        return statusDescription;
    }

    protected CredentialStore createCredentialStore(Path path) {
        return new FileCredentialStore(path);
    }

    protected HttpClient createHttpClient() {
        return HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL).build();
    }

    protected ClientCredentialResolver createClientCredentialResolver(Endpoints endpoints, HttpClient httpClient,
            @Nullable ClientCredentials preset) {
        return new ClientCredentialResolver(endpoints, httpClient, preset);
    }

    protected DaikinAuthClient createAuthClient(Endpoints endpoints, ClientCredentialResolver resolver,
            HttpClient httpClient, AccountConfiguration accountCfg) {
        return new DaikinAuthClient(endpoints, resolver, httpClient, accountCfg.clientUuid,
                accountCfg.sessionLifetime(), clock);
    }

    protected DaikinCloudApi createCloudApi(Endpoints endpoints, SessionManager sessions, HttpClient httpClient,
            AccountConfiguration accountCfg) {
        return new DaikinCloudApi(endpoints, sessions, httpClient, AuthorizationMode.fromConfig(accountCfg.authMode),
                clock);
    }

    protected ScheduledExecutorService createScheduler() {
        AtomicInteger counter = new AtomicInteger();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(2, runnable -> {
            Thread thread = new Thread(runnable, "daikinsmartapp-poll-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        // pending polls and login retries must not fire after dispose()
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return executor;
    }

    protected BackoffPolicy createDiscoveryBackoff(AccountConfiguration accountCfg) {
        return new BackoffPolicy(accountCfg.pollInterval(), MAX_POLL_BACKOFF);
    }

    private synchronized void goOnline(List<Device> devices) {
        StateSynchronizer localSynchronizer = synchronizer;
        if (localSynchronizer == null) {
            return;
        }
        registry.replaceCatalog(devices);
        BackoffPolicy localBackoff = discoveryBackoff;
        if (localBackoff != null) {
            localBackoff.reset(CONNECT_KEY);
        }
        if (localSynchronizer.isRunning()) {
            localSynchronizer.syncWithCatalog();
        } else {
            localSynchronizer.start();
        }
        if (status != AccountStatus.ONLINE) {
            AccountConfiguration localCfg = cfg;
            logger.info("Daikin account {} online with {} units", localCfg != null ? localCfg.username : "",
                    devices.size());
        }
        updateStatus(AccountStatus.ONLINE, AccountStatus.Detail.NONE, null);
    }

    private synchronized void scheduleConnectRetry(DaikinCloudApi forApi, String reason) {
        ScheduledExecutorService localScheduler = scheduler;
        BackoffPolicy localBackoff = discoveryBackoff;
        if (api != forApi || localScheduler == null || localBackoff == null) {
            return;
        }
        localBackoff.recordFailure(CONNECT_KEY);
        Duration delay = localBackoff.nextDelay(CONNECT_KEY);
        logger.warn("{}; retrying in {}", reason, delay);
        localScheduler.schedule(() -> retryConnect(forApi), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void retryConnect(DaikinCloudApi forApi) {
        SessionManager localSessions;
        synchronized (this) {
            if (api != forApi) {
                return;
            }
            localSessions = sessionManager;
        }
        if (localSessions == null) {
            return;
        }
        List<Device> devices;
        try {
            localSessions.ensureSession();
            devices = forApi.discoverDevices();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (AuthenticationFailedException | NotConfiguredException e) {
            logger.warn("Account login failed: {}", e.getMessage());
            updateStatusFor(forApi, AccountStatus.Detail.CONFIGURATION_ERROR, e.getMessage());
            return;
        } catch (SessionUnstableException e) {
            logger.warn("Account initialization failed: {}", e.getMessage());
            updateStatusFor(forApi, AccountStatus.Detail.COMMUNICATION_ERROR, e.getMessage());
            return;
        } catch (DaikinException | IOException e) {
            updateStatusFor(forApi, AccountStatus.Detail.COMMUNICATION_ERROR, e.getMessage());
            scheduleConnectRetry(forApi, "Account initialization failed: " + e.getMessage());
            return;
        }
        synchronized (this) {
            if (api == forApi) {
                goOnline(devices);
            }
        }
    }

    private synchronized void updateStatusFor(DaikinCloudApi forApi, AccountStatus.Detail detail,
            @Nullable String description) {
        if (api == forApi) {
            updateStatus(AccountStatus.OFFLINE, detail, description);
        }
    }

    private CommandDispatcher requireDispatcher() throws NotConfiguredException {
        CommandDispatcher localDispatcher = dispatcher;
        if (localDispatcher == null) {
            throw new NotConfiguredException("Account is not initialized");
        }
        return localDispatcher;
    }

    private void updateStatus(AccountStatus newStatus, AccountStatus.Detail detail, @Nullable String description) {
        status = newStatus;
        statusDetail = detail;
        statusDescription = description;
    }

    private void rediscoverInBackground() {
        ScheduledExecutorService localScheduler = scheduler;
        if (localScheduler == null || !rediscoveryRunning.compareAndSet(false, true)) {
            return;
        }
        localScheduler.execute(() -> {
            try {
                List<Device> devices = rediscover();
                logger.debug("Rediscovery found {} units", devices.size());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (DaikinException e) {
                logger.warn("Rediscovery failed: {}", e.getMessage());
            } finally {
                rediscoveryRunning.set(false);
            }
        });
    }

    private class SynchronizerCallback implements StateSynchronizer.Callback {
        @Override
        public void onUnknownDevice(String deviceId) {
            rediscoverInBackground();
        }

        @Override
        public void onFatalError(DaikinException error) {
            AccountStatus.Detail detail = error instanceof AuthenticationFailedException
                    || error instanceof NotConfiguredException ? AccountStatus.Detail.CONFIGURATION_ERROR
                            : AccountStatus.Detail.COMMUNICATION_ERROR;
            updateStatus(AccountStatus.OFFLINE, detail, error.getMessage());
        }

        @Override
        public void onPollSucceeded(String deviceId) {
            if (status != AccountStatus.OFFLINE) {
                return;
            }
            SessionManager localSessions = sessionManager;
            if (localSessions == null || localSessions.isUnstable() || localSessions.isCredentialRejected()) {
                return;
            }
            logger.info("Daikin cloud answering again for {}, account back online", deviceId);
            updateStatus(AccountStatus.ONLINE, AccountStatus.Detail.NONE, null);
        }
    }
}
