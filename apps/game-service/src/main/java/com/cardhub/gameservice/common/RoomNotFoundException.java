package com.cardhub.gameservice.common;

import com.cardhub.gameservice.games.bigtwo.domain.constants.GameMessages;

/**
 * 房间不存在（既不在内存也不在存储中）。映射为 HTTP 404。
 */
public class RoomNotFoundException extends RuntimeException {

    private final String roomId;

    public RoomNotFoundException(String roomId) {
        super(GameMessages.ROOM_NOT_FOUND + ": " + roomId);
        this.roomId = roomId;
    }

    public String getRoomId() {
        return roomId;
    }
}
