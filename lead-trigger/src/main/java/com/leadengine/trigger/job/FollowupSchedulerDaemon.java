package com.leadengine.trigger.job;

import com.leadengine.domain.followup.model.valobj.CycleResult;
import com.leadengine.trigger.application.command.FollowupCycleApplicationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 自动跟进守护进程：按固定间隔认领到期线索并执行一轮跟进。
 */
@Slf4j
@Component
public class FollowupSchedulerDaemon {

    private final FollowupCycleApplicationService followupCycleApplicationService;
    private final boolean enabled;

    public FollowupSchedulerDaemon(FollowupCycleApplicationService followupCycleApplicationService,
                                   @Value("${followup.scheduler-enabled:true}") boolean enabled) {
        this.followupCycleApplicationService = followupCycleApplicationService;
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${followup.poll-interval-ms:60000}", scheduler = "daemonScheduler")
    public void runFollowupCycle() {
        if (!enabled) {
            return;
        }
        try {
            CycleResult result = followupCycleApplicationService.runCycle();
            if (result.attempted() > 0) {
                log.info("Followup cycle finished. owner={}, attempted={}, succeeded={}, failed={}",
                        followupCycleApplicationService.getClaimOwner(),
                        result.attempted(), result.succeeded(), result.failed());
            }
        } catch (Exception ex) {
            log.error("Followup cycle aborted. owner={}, error={}",
                    followupCycleApplicationService.getClaimOwner(), ex.getMessage(), ex);
        }
    }
}
