package com.bullrunhub.gameservice.games.bullrun.interfaces.http;

import com.bullrunhub.gameservice.games.bullrun.domain.constants.GameMessages;
import com.bullrunhub.gameservice.games.bullrun.domain.error.RoomError;
import com.bullrunhub.gameservice.games.bullrun.domain.error.RoomException;
import com.bullrunhub.gameservice.games.bullrun.domain.model.PlayerInfo;
import com.bullrunhub.gameservice.games.bullrun.interfaces.http.dto.RoomView;
import com.bullrunhub.gameservice.games.bullrun.service.RoomService;
import com.bullrunhub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 房间只读查询（大厅 / 结算页用）
 */
@RestController
@RequestMapping("/api/bullrun/rooms")
@RequiredArgsConstructor
public class BullRunRoomController {

    private final RoomService roomService;

    /**
     * 房间视图
     * 用法：GET /api/bullrun/rooms/{code}
     */
    @GetMapping("/{code}")
    public ApiResponse<RoomView> get(@PathVariable("code") String code) {
        return roomService.snapshot(normalize(code))
                .map(room -> ApiResponse.success(RoomView.of(room)))
                .orElseThrow(() -> new RoomException(RoomError.ROOM_NOT_FOUND, GameMessages.ROOM_NOT_FOUND));
    }

    /**
     * 当前排行榜（不含房主，按净值降序）
     */
    @GetMapping("/{code}/leaderboard")
    public ApiResponse<List<PlayerInfo>> leaderboard(@PathVariable("code") String code) {
        String roomCode = normalize(code);
        if (roomService.snapshot(roomCode).isEmpty()) {
            throw new RoomException(RoomError.ROOM_NOT_FOUND, GameMessages.ROOM_NOT_FOUND);
        }
        return ApiResponse.success(roomService.getLeaderboard(roomCode));
    }

    private static String normalize(String code) {
        return StringUtils.upperCase(StringUtils.trim(code));
    }
}
