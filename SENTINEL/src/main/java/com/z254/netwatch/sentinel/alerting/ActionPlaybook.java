package com.z254.netwatch.sentinel.alerting;

import com.z254.netwatch.sentinel.domain.model.Location;
import com.z254.netwatch.sentinel.domain.model.Priority;
import com.z254.netwatch.sentinel.domain.model.RecommendedAction;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Troubleshooting playbooks keyed by failure category.
 * <p>
 * Command templates may reference {@code {device}}, {@code {interface}} and {@code {peer}};
 * missing interface or peer values render as {@code all}.
 */
@Slf4j
@Component
public class ActionPlaybook {

    private final Map<FailureCategory, List<ActionTemplate>> playbooks = new EnumMap<>(FailureCategory.class);

    public ActionPlaybook() {
        initializePlaybooks();
    }

    /**
     * Ordered actions for a category; P1 incidents end with an escalation step.
     */
    public List<RecommendedAction> actionsFor(FailureCategory category, Location location, Priority priority) {
        List<ActionTemplate> templates = playbooks.getOrDefault(category,
                playbooks.get(FailureCategory.UNKNOWN_ANOMALY));

        List<RecommendedAction> actions = new ArrayList<>();
        int order = 1;
        for (ActionTemplate template : templates) {
            actions.add(RecommendedAction.builder()
                    .order(order++)
                    .description(render(template.getDescription(), location))
                    .command(template.getCommand() != null ? render(template.getCommand(), location) : null)
                    .estimatedMinutes(template.getEstimatedMinutes())
                    .build());
        }

        if (priority == Priority.P1) {
            actions.add(RecommendedAction.builder()
                    .order(order)
                    .description("Escalate to on-call network engineer via NOC hotline")
                    .estimatedMinutes(0)
                    .build());
        }
        return List.copyOf(actions);
    }

    /**
     * Replace the playbook of a category.
     */
    public void registerPlaybook(FailureCategory category, List<ActionTemplate> templates) {
        playbooks.put(category, List.copyOf(templates));
        log.debug("Registered playbook for {} with {} actions", category, templates.size());
    }

    // ========== Private Methods ==========

    private static String render(String template, Location location) {
        return template
                .replace("{device}", location.getDevice())
                .replace("{interface}", location.getInterfaceName() != null ? location.getInterfaceName() : "all")
                .replace("{peer}", location.getBgpPeer() != null ? location.getBgpPeer() : "all");
    }

    private void initializePlaybooks() {
        // Link failure
        registerPlaybook(FailureCategory.LINK_FAILURE, List.of(
                action("Check physical link status on {device}", "show interface {interface} status", 2),
                action("Verify BGP session health", "show bgp neighbor {peer}", 1),
                action("Check SNMP interface counters for errors", "show snmp interface {device}", 1),
                action("Drain traffic from {device} if a redundant path exists", null, 10)));

        // Link degradation
        registerPlaybook(FailureCategory.LINK_DEGRADATION, List.of(
                action("Check interface error counters on {device}", "show interface {interface} counters errors", 2),
                action("Inspect optical levels on {interface}", "show interface {interface} transceiver", 2),
                action("Schedule optic or cable replacement if errors persist", null, 30)));

        // Hardware
        registerPlaybook(FailureCategory.HARDWARE_FAILURE, List.of(
                action("Check chassis environment on {device}", "show environment all", 2),
                action("Review hardware error log", "show logging | include HW", 3),
                action("Open a hardware replacement case for {device}", null, 15)));
        registerPlaybook(FailureCategory.THERMAL_ISSUE, List.of(
                action("Check temperature sensors on {device}", "show environment temperature", 1),
                action("Verify fan tray status", "show environment fan", 1),
                action("Check data-center cooling for the rack of {device}", null, 15)));
        registerPlaybook(FailureCategory.POWER_ISSUE, List.of(
                action("Check power supply status on {device}", "show environment power", 1),
                action("Verify feed redundancy at the PDU", null, 10)));
        registerPlaybook(FailureCategory.RESOURCE_EXHAUSTION, List.of(
                action("Check CPU utilization on {device}", "show processes cpu sorted", 1),
                action("Check memory utilization on {device}", "show processes memory sorted", 1)));

        // Routing
        registerPlaybook(FailureCategory.BGP_PROCESS_ISSUE, List.of(
                action("Verify BGP process state on {device}", "show bgp summary", 1),
                action("Check CPU used by the routing process", "show processes cpu sorted", 1),
                action("Verify BGP session health", "show bgp neighbor {peer}", 1)));
        registerPlaybook(FailureCategory.ROUTE_WITHDRAWAL, List.of(
                action("Verify BGP session health", "show bgp neighbor {peer}", 1),
                action("Compare received routes with baseline", "show bgp neighbor {peer} received-routes", 2)));
        registerPlaybook(FailureCategory.ROUTING_INSTABILITY, List.of(
                action("Review AS path changes from {peer}", "show bgp neighbor {peer} routes", 2),
                action("Check route flap statistics", "show bgp dampening flap-statistics", 2)));

        // Fallback
        registerPlaybook(FailureCategory.UNKNOWN_ANOMALY, List.of(
                action("Review recent logs on {device}", "show logging", 3)));
    }

    private static ActionTemplate action(String description, String command, int minutes) {
        return ActionTemplate.builder()
                .description(description)
                .command(command)
                .estimatedMinutes(minutes)
                .build();
    }

    /**
     * One playbook step before location placeholders are filled in.
     */
    @Value
    @Builder
    public static class ActionTemplate {
        String description;
        String command;
        int estimatedMinutes;
    }
}
