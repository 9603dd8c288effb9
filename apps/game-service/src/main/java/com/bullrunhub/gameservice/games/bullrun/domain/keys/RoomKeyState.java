package com.bullrunhub.gameservice.games.bullrun.domain.keys;

/**
 * 房间密钥状态：未初始化 / 就绪 / 失败（带原因）。
 */
public interface RoomKeyState {

    RoomKeyState UNINITIALIZED = new Uninitialized();

    record Uninitialized() implements RoomKeyState {
    }

    record Ready(RoomKeys keys) implements RoomKeyState {
    }

    record Failed(String reason) implements RoomKeyState {
    }
}
