package com.z254.mender.dispatch;

import com.z254.mender.config.MenderProperties;
import com.z254.mender.domain.model.Incident;
import com.z254.mender.domain.repository.IncidentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rebuilds running-job counts from persisted incidents when the service starts.
 * Pending incidents are not re-queued; they can be re-entered with a manual trigger.
 */
@Slf4j
@Component
public class DispatchStateReconciler {

    private final IncidentRepository incidentRepository;
    private final DispatchQueueManager queueManager;
    private final MenderProperties properties;

    public DispatchStateReconciler(IncidentRepository incidentRepository,
                                   DispatchQueueManager queueManager,
                                   MenderProperties properties) {
        this.incidentRepository = incidentRepository;
        this.queueManager = queueManager;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getDispatch().isReconcileOnStartup()) {
            log.info("Dispatch state reconciliation disabled");
            return;
        }
        reconcile();
    }

    public Map<String, Long> reconcile() {
        Map<String, Long> activeByRepository = incidentRepository.findAll().stream()
                .filter(Incident::isDispatchActive)
                .filter(Incident::isRouted)
                .collect(Collectors.groupingBy(Incident::getRepository, Collectors.counting()));

        activeByRepository.forEach((repository, count) ->
                queueManager.restoreActive(repository, count.intValue()));
        log.info("Reconciled dispatch state for {} repositories", activeByRepository.size());
        return activeByRepository;
    }
}
