package com.bullrunhub.gameservice.games.bullrun.interfaces.http;

import com.bullrunhub.gameservice.games.bullrun.application.SessionCoordinator;
import com.bullrunhub.gameservice.games.bullrun.domain.constants.GameMessages;
import com.bullrunhub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 调试用接口：直接结束对局。
 *
 * 说明：
 * - 仅在 bullrun.debug.enabled=true 时注册，默认关闭；
 * - 无鉴权，只用于本地联调结算流程；
 * - 走与自然终局相同的路径（最终排行榜 + GAME_ENDED）。
 */
@Slf4j
@RestController
@RequestMapping("/debug/rooms")
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "bullrun.debug", name = "enabled", havingValue = "true")
public class BullRunDebugController {

    private final SessionCoordinator coordinator;

    /**
     * 用法：POST /debug/rooms/{code}/end
     */
    @PostMapping("/{code}/end")
    public ApiResponse<Map<String, Object>> end(@PathVariable("code") String code) {
        log.warn("调试接口结束对局: room={}", code);
        if (!coordinator.endGame(code)) {
            throw new IllegalStateException(GameMessages.GAME_NOT_STARTED);
        }
        return ApiResponse.success(Map.of("roomId", code, "ended", true));
    }
}
