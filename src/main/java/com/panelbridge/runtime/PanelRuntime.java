package com.panelbridge.runtime;

import com.panelbridge.client.CommandResult;
import com.panelbridge.dispatch.EntityKey;
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
import com.panelbridge.session.PanelSession;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Consumer-facing surface of the panel runtime: session, discovery, state subscriptions and the
 * command set.
 *
 * <p>Multi-door commands report per door in a {@link CommandResult}; single-target operations
 * throw the {@link com.panelbridge.exception.BaseException} subtype describing the failure.
 * Date-times given as strings accept an offset or {@code Z}; naive values are read in the
 * configured input zone.
 */
public interface PanelRuntime {

    PanelSession connect(PanelCredentials credentials);

    /** Discovers the partition and replaces the state store's door set with it. */
    DiscoveryResult discover(int partitionId);

    Subscription subscribe(EntityKey key, StateChangeListener listener);

    CommandResult override(Collection<Integer> doorIds, OverrideType type, ReaderMode mode, Integer minutes, String until);

    CommandResult resume(Collection<Integer> doorIds);

    CommandResult pulse(Collection<Integer> doorIds);

    void updatePanels();

    TempCode createTempCode(int doorId, String codeName, String pin, String start, String end);

    TempCode updateTempCode(int doorId, String pin, String start, String end);

    void deleteTempCode(int doorId, String pin);

    /** @return the PIN of the removed code */
    String deleteTempCodeByName(int doorId, String codeName);

    /**
     * Clears the mirrored temp codes of one door, or of every door when {@code doorId} is null.
     *
     * @return number of codes removed
     */
    int clearAllTempCodes(Integer doorId);

    List<TempCode> listTempCodes(int doorId);

    OtrSchedule createOtrSchedule(
            Collection<Integer> doorIds, String start, String stop, ReaderMode mode, String name, String description);

    List<OtrSchedule> listOtrSchedules();

    void deleteOtrSchedule(long scheduleId);

    void executePlan(long planId, Map<String, String> sessionVars);

    ConnectionState connectionState();

    void startStream();

    void stop();

    Optional<Door> door(int doorId);
}
