package com.bullrunhub.gameservice.games.bullrun.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期清理从未开局的空闲房间（默认每小时一次，超过 24 小时）。
 */
@Slf4j
@Component
public class RoomJanitor {

    private final SessionCoordinator coordinator;
    private final long maxAgeMs;

    public RoomJanitor(SessionCoordinator coordinator,
                       @Value("${bullrun.session.idle-room-max-age-ms:86400000}") long maxAgeMs) {
        this.coordinator = coordinator;
        this.maxAgeMs = maxAgeMs;
    }

    @Scheduled(fixedDelayString = "${bullrun.session.idle-sweep-ms:3600000}",
            initialDelayString = "${bullrun.session.idle-sweep-ms:3600000}")
    public void sweep() {
        try {
            int removed = coordinator.sweepIdleRooms(maxAgeMs);
            if (removed > 0) {
                log.info("空闲房间清理完成: removed={}", removed);
            }
        } catch (RuntimeException e) {
            log.error("空闲房间清理失败", e);
        }
    }
}
