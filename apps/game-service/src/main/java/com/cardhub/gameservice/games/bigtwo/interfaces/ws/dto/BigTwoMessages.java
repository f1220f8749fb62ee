package com.cardhub.gameservice.games.bigtwo.interfaces.ws.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 * 前端 -> 后端的指令，通过 /app/bigtwo.* 发送；
 * 后端 -> 前端统一用 Envelope 包装，广播到 /topic/room.{roomId}。
 * 座位号由房间目录（上游）解析后带上，服务端只做规则校验。
 */
public class BigTwoMessages {

    /** 开局（/app/bigtwo.start） */
    @Data
    public static class StartCmd {
        private String roomId;
        /** 机器人座位 */
        private List<Integer> botSeats = new ArrayList<>();
    }

    /** 出牌（/app/bigtwo.play） */
    @Data
    public static class PlayCmd {
        private String roomId;
        private int seat;
        /** 牌面编码，如 ["3D","3S"] */
        private List<String> cards = new ArrayList<>();
    }

    /** 过牌 / 下一局 / 计时器到期上报（/app/bigtwo.pass、/app/bigtwo.next、/app/bigtwo.expire） */
    @Data
    public static class SimpleCmd {
        private String roomId;
        private int seat;
    }
}
