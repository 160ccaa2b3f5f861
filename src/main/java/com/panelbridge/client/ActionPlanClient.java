package com.panelbridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.panelbridge.domain.model.ActionPlan;
import com.panelbridge.exception.BaseException;
import com.panelbridge.exception.RemoteRejectionException;
import com.panelbridge.exception.ValidationException;
import com.panelbridge.mapper.JsonHelper;
import com.panelbridge.session.PanelRequest;
import com.panelbridge.session.PanelSessionManager;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes action plans and maintains the runtime's own System plans.
 *
 * <p>Trigger plans cannot be executed directly, so they are cloned into a System plan named
 * {@code "<name> (Home Assistant)"}. Cloning is a two-step call: create the plan skeleton, then
 * write its {@code Contents}. Both lookups are idempotent so repeated setup reuses the clone.
 */
@Service
public class ActionPlanClient {

    private static final Logger log = LoggerFactory.getLogger(ActionPlanClient.class);

    static final String CLONE_MARKER = " (Home Assistant)";
    static final String LOG_PLAN_NAME = "HA Door Log";
    static final String LOG_PLAN_DESCRIPTION = "Log each Home Assistant door button press";
    static final String SYSTEM_PLAN_TYPE = "System";

    private final PanelSessionManager sessionManager;
    private final DiscoveryClient discoveryClient;
    private final PartitionContext partitionContext;

    public ActionPlanClient(
            PanelSessionManager sessionManager, DiscoveryClient discoveryClient, PartitionContext partitionContext) {
        this.sessionManager = sessionManager;
        this.discoveryClient = discoveryClient;
        this.partitionContext = partitionContext;
    }

    /**
     * Executes one plan in the current partition.
     *
     * @param sessionVars values exposed to the plan as {@code @{Session.<name>}}, may be null
     * @param logLevel optional panel log level path segment
     */
    public void executePlan(long planId, Map<String, String> sessionVars, String logLevel) {
        String path = "/api/ActionPlans/" + planId + "/Exec";
        if (logLevel != null && !logLevel.isBlank()) {
            path += "/" + logLevel.trim();
        }
        ObjectNode body = JsonHelper.newObject();
        ObjectNode vars = body.putObject("SessionVars");
        if (sessionVars != null) {
            sessionVars.forEach(vars::put);
        }
        sessionManager.execute(PanelRequest.post(path, body)
                .queryParam("PartitionId", partitionContext.requirePartitionId())
                .build());
        log.info("Executed action plan {}", planId);
    }

    /** Executes several plans independently; failures are reported per plan. */
    public CommandResult executePlans(Collection<Long> planIds, Map<String, String> sessionVars, String logLevel) {
        if (planIds == null || planIds.isEmpty()) {
            throw new ValidationException("At least one plan id is required");
        }
        List<TargetResult> results = new ArrayList<>(planIds.size());
        for (Long planId : planIds) {
            try {
                executePlan(planId, sessionVars, logLevel);
                results.add(TargetResult.ok(planId));
            } catch (BaseException e) {
                log.error("Action plan {} failed: {}", planId, e.getMessage());
                results.add(TargetResult.failed(planId, e.getMessage()));
            }
        }
        return new CommandResult("executePlan", results);
    }

    /**
     * Returns the id of the System clone of a trigger plan, creating it when missing.
     */
    public long findOrCloneSystemPlan(long triggerPlanId) {
        ActionPlan original = discoveryClient.getActionPlan(triggerPlanId);
        String originalName = original.getName() != null ? original.getName() : "";
        if (originalName.endsWith(CLONE_MARKER) && original.isSystemPlan()) {
            return original.getId();
        }
        String cloneName = originalName.replace(CLONE_MARKER, "") + CLONE_MARKER;
        Integer partitionId = original.getPartitionId();

        for (ActionPlan plan : discoveryClient.listActionPlans(partitionContext.requirePartitionId())) {
            if (plan.isSystemPlan()
                    && cloneName.equals(plan.getName())
                    && Objects.equals(plan.getPartitionId(), partitionId)) {
                return plan.getId();
            }
        }

        long cloneId = createSystemPlan(
                cloneName, original.getDescription(), original.isHighSecurity(), partitionId, original.getContents());
        log.info("Cloned action plan {} into System plan {} '{}'", triggerPlanId, cloneId, cloneName);
        return cloneId;
    }

    /** Returns the id of the partition's door-log plan, creating it when missing. */
    public long findOrCreateLogPlan() {
        int partitionId = partitionContext.requirePartitionId();
        for (ActionPlan plan : discoveryClient.listActionPlans(partitionId)) {
            if (plan.isSystemPlan()
                    && LOG_PLAN_NAME.equals(plan.getName())
                    && Integer.valueOf(partitionId).equals(plan.getPartitionId())) {
                return plan.getId();
            }
        }
        long planId = createSystemPlan(LOG_PLAN_NAME, LOG_PLAN_DESCRIPTION, false, partitionId, logPlanContents());
        log.info("Created door log plan {}", planId);
        return planId;
    }

    // ---- Private helpers ----

    private long createSystemPlan(
            String name, String description, boolean highSecurity, Integer partitionId, String contents) {
        ObjectNode skeleton = JsonHelper.newObject();
        skeleton.put("PlanType", SYSTEM_PLAN_TYPE);
        skeleton.put("Name", name);
        skeleton.put("Description", description);
        skeleton.put("HighSecurity", highSecurity);
        if (partitionId != null) {
            skeleton.put("PartitionId", partitionId);
        } else {
            skeleton.putNull("PartitionId");
        }
        JsonNode created = sessionManager.execute(PanelRequest.post("/api/ActionPlans", skeleton).build()).json();
        Long planId = JsonHelper.longValue(created, "Id");
        if (planId == null) {
            throw new RemoteRejectionException(200, "Action plan creation returned no Id");
        }

        ObjectNode update = JsonHelper.newObject();
        update.put("Id", planId);
        ObjectNode property = update.putArray("Properties").addObject();
        property.put("Name", "Contents");
        property.put("Value", contents != null ? contents : "");
        sessionManager.execute(PanelRequest.put("/api/ActionPlans/" + planId, update).build());
        return planId;
    }

    static String logPlanContents() {
        ObjectNode content = JsonHelper.newObject();
        content.putObject("InitVar");
        ObjectNode action = content.putObject("Action");
        action.put("_Type", "Log");
        ObjectNode parameters = action.putObject("Parameters");
        parameters.put("Level", 1);
        parameters.put("Message", "@{Session.App} unlocked @{Session.Door}");
        action.putNull("Fail");
        action.putNull("Always");
        action.putNull("Then");
        return JsonHelper.toJson(content);
    }
}
