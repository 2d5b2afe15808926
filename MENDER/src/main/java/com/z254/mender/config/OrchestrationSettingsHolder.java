package com.z254.mender.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holds the current {@link OrchestrationSettings}; swapped atomically on reload.
 */
@Slf4j
@Component
public class OrchestrationSettingsHolder {

    private final AtomicReference<OrchestrationSettings> current;

    @Autowired
    public OrchestrationSettingsHolder(MenderProperties properties) {
        this(OrchestrationSettings.from(properties));
    }

    public OrchestrationSettingsHolder(OrchestrationSettings initial) {
        this.current = new AtomicReference<>(initial);
    }

    public OrchestrationSettings current() {
        return current.get();
    }

    public OrchestrationSettings update(UnaryOperator<OrchestrationSettings> change) {
        OrchestrationSettings updated = current.updateAndGet(change);
        log.info("Orchestration settings updated: {}", updated);
        return updated;
    }
}
