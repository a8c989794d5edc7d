package com.poolmate.backend.modules.draw.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class DrawRoundRecoveryScheduler {

    private static final Logger log = LoggerFactory.getLogger(DrawRoundRecoveryScheduler.class);

    private final DrawOrchestrator drawOrchestrator;

    public DrawRoundRecoveryScheduler(DrawOrchestrator drawOrchestrator) {
        this.drawOrchestrator = drawOrchestrator;
    }

    @Scheduled(
            initialDelayString = "${app.draw.recovery-initial-delay:PT10S}",
            fixedDelayString = "${app.draw.recovery-interval:PT1M}"
    )
    public void resumeOrphanedRounds() {
        try {
            int resumed = drawOrchestrator.resumeOrphanedRounds();
            if (resumed > 0) {
                log.info("Resumed {} draw rounds without a live handle", resumed);
            }
        } catch (Exception ex) {
            log.error("Failed to resume orphaned draw rounds", ex);
        }
    }
}
