package com.panelbridge.runtime;

import com.panelbridge.client.ActionPlanClient;
import com.panelbridge.client.CommandResult;
import com.panelbridge.client.DiscoveryClient;
import com.panelbridge.client.OtrScheduleClient;
import com.panelbridge.client.OverrideMinutesCalculator;
import com.panelbridge.client.PanelCommandClient;
import com.panelbridge.client.TempCodeClient;
import com.panelbridge.dispatch.EntityKey;
import com.panelbridge.dispatch.StateChangeDispatcher;
import com.panelbridge.dispatch.StateChangeListener;
import com.panelbridge.dispatch.Subscription;
import com.panelbridge.domain.enums.ConnectionState;
import com.panelbridge.domain.enums.OverrideType;
import com.panelbridge.domain.enums.ReaderMode;
import com.panelbridge.domain.model.DiscoveryResult;
import com.panelbridge.domain.model.Door;
import com.panelbridge.domain.model.OtrSchedule;
import com.panelbridge.domain.model.PanelCredentials;
import com.panelbridge.domain.model.TempCode;
import com.panelbridge.event.EventPublisherHelper;
import com.panelbridge.exception.ValidationException;
import com.panelbridge.session.PanelSession;
import com.panelbridge.session.PanelSessionManager;
import com.panelbridge.state.PanelStateStore;
import com.panelbridge.stream.PanelEventStreamClient;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Wires the runtime's parts behind {@link PanelRuntime}. Holds no state of its own: the session
 * lives in {@link PanelSessionManager}, entities in {@link PanelStateStore}.
 */
@Service
public class DefaultPanelRuntime implements PanelRuntime {

    private static final Logger log = LoggerFactory.getLogger(DefaultPanelRuntime.class);

    private final PanelSessionManager sessionManager;
    private final DiscoveryClient discoveryClient;
    private final PanelCommandClient commandClient;
    private final TempCodeClient tempCodeClient;
    private final OtrScheduleClient otrScheduleClient;
    private final ActionPlanClient actionPlanClient;
    private final OverrideMinutesCalculator overrideMinutesCalculator;
    private final PanelEventStreamClient streamClient;
    private final PanelStateStore stateStore;
    private final StateChangeDispatcher stateChangeDispatcher;
    private final EventPublisherHelper eventPublisherHelper;

    public DefaultPanelRuntime(
            PanelSessionManager sessionManager,
            DiscoveryClient discoveryClient,
            PanelCommandClient commandClient,
            TempCodeClient tempCodeClient,
            OtrScheduleClient otrScheduleClient,
            ActionPlanClient actionPlanClient,
            OverrideMinutesCalculator overrideMinutesCalculator,
            PanelEventStreamClient streamClient,
            PanelStateStore stateStore,
            StateChangeDispatcher stateChangeDispatcher,
            EventPublisherHelper eventPublisherHelper) {
        this.sessionManager = sessionManager;
        this.discoveryClient = discoveryClient;
        this.commandClient = commandClient;
        this.tempCodeClient = tempCodeClient;
        this.otrScheduleClient = otrScheduleClient;
        this.actionPlanClient = actionPlanClient;
        this.overrideMinutesCalculator = overrideMinutesCalculator;
        this.streamClient = streamClient;
        this.stateStore = stateStore;
        this.stateChangeDispatcher = stateChangeDispatcher;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public PanelSession connect(PanelCredentials credentials) {
        if (credentials == null || credentials.normalizedBaseUrl() == null || credentials.getUsername() == null) {
            throw new ValidationException("Base URL and username are required");
        }
        return sessionManager.connect(credentials);
    }

    @Override
    public DiscoveryResult discover(int partitionId) {
        DiscoveryResult discovery = discoveryClient.discover(partitionId);
        stateStore.loadDiscovery(discovery);
        eventPublisherHelper.publishCacheRefresh(this, "discovery");
        return discovery;
    }

    @Override
    public Subscription subscribe(EntityKey key, StateChangeListener listener) {
        return stateChangeDispatcher.subscribe(key, listener);
    }

    @Override
    public CommandResult override(
            Collection<Integer> doorIds, OverrideType type, ReaderMode mode, Integer minutes, String until) {
        Instant untilInstant = overrideMinutesCalculator.parseUntil(until);
        return commandClient.override(doorIds, type, mode, minutes, untilInstant);
    }

    @Override
    public CommandResult resume(Collection<Integer> doorIds) {
        return commandClient.resume(doorIds);
    }

    @Override
    public CommandResult pulse(Collection<Integer> doorIds) {
        return commandClient.pulse(doorIds);
    }

    @Override
    public void updatePanels() {
        commandClient.updatePanels();
    }

    @Override
    public TempCode createTempCode(int doorId, String codeName, String pin, String start, String end) {
        return tempCodeClient.create(doorId, codeName, pin, start, end);
    }

    @Override
    public TempCode updateTempCode(int doorId, String pin, String start, String end) {
        return tempCodeClient.update(doorId, pin, start, end);
    }

    @Override
    public void deleteTempCode(int doorId, String pin) {
        tempCodeClient.delete(doorId, pin);
    }

    @Override
    public String deleteTempCodeByName(int doorId, String codeName) {
        return tempCodeClient.deleteByName(doorId, codeName);
    }

    @Override
    public int clearAllTempCodes(Integer doorId) {
        return tempCodeClient.clearAll(doorId);
    }

    @Override
    public List<TempCode> listTempCodes(int doorId) {
        return tempCodeClient.list(doorId);
    }

    @Override
    public OtrSchedule createOtrSchedule(
            Collection<Integer> doorIds, String start, String stop, ReaderMode mode, String name, String description) {
        return otrScheduleClient.create(doorIds, start, stop, mode, name, description);
    }

    @Override
    public List<OtrSchedule> listOtrSchedules() {
        return otrScheduleClient.list();
    }

    @Override
    public void deleteOtrSchedule(long scheduleId) {
        otrScheduleClient.delete(scheduleId);
    }

    @Override
    public void executePlan(long planId, Map<String, String> sessionVars) {
        actionPlanClient.executePlan(planId, sessionVars, null);
    }

    @Override
    public ConnectionState connectionState() {
        return streamClient.getState();
    }

    @Override
    public void startStream() {
        if (!stateStore.hasDoors()) {
            log.warn("Starting event stream before discovery: no doors are known yet");
        }
        streamClient.start();
    }

    @Override
    public void stop() {
        streamClient.stop();
    }

    @Override
    public Optional<Door> door(int doorId) {
        return stateStore.door(doorId);
    }
}
