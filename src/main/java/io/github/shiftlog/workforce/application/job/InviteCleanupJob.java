package io.github.shiftlog.workforce.application.job;

import io.github.shiftlog.workforce.application.service.InviteService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class InviteCleanupJob {

    private final InviteService inviteService;

    @Scheduled(cron = "${workforce.invite.cleanup-cron:0 0 * * * *}")
    public void run() {
        try {
            int removed = inviteService.cleanupExpired();
            log.debug("Invite cleanup finished: removed={}", removed);
        } catch (Exception e) {
            log.error("Invite cleanup failed", e);
        }
    }
}
