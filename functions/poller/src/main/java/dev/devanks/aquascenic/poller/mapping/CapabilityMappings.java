package dev.devanks.aquascenic.poller.mapping;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static dev.devanks.aquascenic.poller.mapping.Transforms.scaledDown;
import static dev.devanks.aquascenic.poller.mapping.Transforms.scaledUp;
import static dev.devanks.aquascenic.poller.mapping.Transforms.scaledUpAsString;
import static dev.devanks.aquascenic.poller.mapping.Transforms.secondsToHours;
import static dev.devanks.aquascenic.poller.mapping.Transforms.truthToCode;
import static dev.devanks.aquascenic.poller.mapping.Transforms.truthy;

/**
 * Which pool document fields become which device capabilities. Unmapped fields are ignored.
 */
public final class CapabilityMappings {

    private CapabilityMappings() {
    }

    public static final CodeTable FILTRATION_MODE = CodeTable.builder("filtration mode")
            .code(0, "manual")
            .code(1, "auto")
            .code(2, "heat")
            .code(3, "smart")
            .code(4, "intel")
            .defaults("auto", 0)
            .build();

    public static final CodeTable FILTRATION_SPEED = CodeTable.builder("filtration speed")
            .code(0, "slow")
            .code(1, "medium")
            .code(2, "fast")
            .defaults("slow", 0)
            .build();

    public static final CodeTable BACKWASH_MODE = CodeTable.builder("backwash mode")
            .code(0, "manual")
            .code(1, "auto")
            .defaults("manual", 0)
            .build();

    public static final CodeTable LIGHTING_MODE = CodeTable.builder("lighting mode")
            .code(0, "manual")
            .code(1, "auto")
            .defaults("manual", 0)
            .build();

    public static final CodeTable RELAY_MODE = CodeTable.builder("relay mode")
            .code(0, "off")
            .code(1, "on")
            .code(2, "auto")
            .defaults("off", 0)
            .build();

    public static final CodeTable IONIZATION_ACTIVATION = CodeTable.builder("ionization activation")
            .code(0, "off")
            .code(1, "on")
            .defaults("off", 0)
            .build();

    public static final List<FieldMapping> READ_ONLY = List.of(
            FieldMapping.of("main_temperature", "measure_temperature"),
            FieldMapping.of("modules_ph_current", "measure_ph", scaledDown(100)),
            FieldMapping.of("modules_rx_status_value", "measure_orp"),
            FieldMapping.of("hidro_current", "measure_hydrolysis", scaledDown(10)),
            FieldMapping.of("hidro_cellTotalTime", "measure_salt_cell_hours", secondsToHours()),
            FieldMapping.of("filtration_status", "status_filtration", truthy()),
            FieldMapping.of("hidro_is_electrolysis", "status_electrolysis", truthy()),
            FieldMapping.of("main_RSSI", "measure_wifi_signal"),
            // Only some controllers carry these modules
            FieldMapping.optional("modules_cd_current", "measure_conductivity"),
            FieldMapping.optional("modules_io_current", "measure_ionization"),
            FieldMapping.optional("hidro_fl1", "alarm_flow", truthy())
    );

    public static final List<SettableFieldMapping> SETTABLE = List.of(
            // The pH setpoint is stored as a string, e.g. "720"
            SettableFieldMapping.of("modules_ph_status_high_value", "target_ph", "modules.ph.status.high_value",
                    scaledDown(100), scaledUpAsString(100)),
            SettableFieldMapping.of("hidro_level", "target_hydrolysis", "hidro.level",
                    scaledDown(10), scaledUp(10)),
            SettableFieldMapping.of("filtration_mode", "filtration_mode", "filtration.mode", FILTRATION_MODE),
            SettableFieldMapping.of("filtration_manVel", "filtration_speed", "filtration.manVel", FILTRATION_SPEED),
            SettableFieldMapping.of("backwash_mode", "backwash_mode", "backwash.mode", BACKWASH_MODE),
            SettableFieldMapping.of("light_status", "light_onoff", "light.status", truthy(), truthToCode()),
            SettableFieldMapping.of("light_mode", "light_mode", "light.mode", LIGHTING_MODE),
            SettableFieldMapping.of("relays_relay1_info_onoff", "relay1_mode", "relays.relay1.info.onoff", RELAY_MODE),
            SettableFieldMapping.of("modules_io_activation", "ionization_activation", "modules.io.activation",
                    IONIZATION_ACTIVATION)
    );

    public static final Map<String, TriggerBinding> TRIGGERS = Stream.of(
            new TriggerBinding("status_filtration", "filtration_started", "filtration_stopped"),
            new TriggerBinding("status_electrolysis", "electrolysis_started", "electrolysis_stopped"),
            new TriggerBinding("light_onoff", "light_turned_on", "light_turned_off"),
            new TriggerBinding("alarm_flow", "flow_alarm_raised", "flow_alarm_cleared")
    ).collect(Collectors.toUnmodifiableMap(TriggerBinding::getCapabilityId, Function.identity()));

    /**
     * Capabilities every paired device starts with.
     */
    public static List<String> requiredCapabilities() {
        return READ_ONLY.stream()
                .filter(mapping -> !mapping.isOptional())
                .map(FieldMapping::getCapabilityId)
                .toList();
    }

    public static Optional<TriggerBinding> triggerFor(String capabilityId) {
        return Optional.ofNullable(TRIGGERS.get(capabilityId));
    }
}
