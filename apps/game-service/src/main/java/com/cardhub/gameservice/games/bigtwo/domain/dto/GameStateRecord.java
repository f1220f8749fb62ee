package com.cardhub.gameservice.games.bigtwo.domain.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * GameStateRecord
 * -------------------------------------------------------
 * 房间对局的权威状态（用于 Redis 持久化）。
 * - 牌一律用线上编码字符串（"3D"、"10H"），避免把领域类型直接写进 Redis；
 * - 计时器拆成平铺字段，timerSequence 为 null 表示没有计时器；
 * - version 用于 WATCH/MULTI 的 CAS 比较。
 * -------------------------------------------------------
 */
@Data
public class GameStateRecord {
    /** 房间ID（冗余保存） */
    private String roomId;
    /** 四家手牌 */
    private List<List<String>> hands = new ArrayList<>();
    /** 本局已出牌 */
    private List<String> playedPile = new ArrayList<>();
    private int currentTurn;
    /** 上一手座位；无则为 null */
    private Integer lastPlaySeat;
    /** 上一手牌面 */
    private List<String> lastPlayCards;
    private int consecutivePasses;
    private int matchNumber;
    /** FIRST_PLAY / PLAYING / FINISHED / GAME_OVER */
    private String phase;

    // ---- 自动过牌计时器 ----
    private Integer timerExemptSeat;
    private Long timerEndTimestamp;
    private Long timerCreatedAt;
    private Long timerDurationMs;
    private Long timerSequence;
    private List<String> timerComboCards;

    private long lastTimerSequence;

    private List<Integer> totals = new ArrayList<>();

    // ---- 最近一局结算 ----
    private Integer lastMatchNumber;
    private Integer lastMatchWinner;
    private List<Integer> lastMatchRemaining;
    private List<Integer> lastMatchDeltas;

    private Integer finalWinner;
    private List<Integer> botSeats = new ArrayList<>();
    /** 版本号（每次提交 +1） */
    private long version;
}
