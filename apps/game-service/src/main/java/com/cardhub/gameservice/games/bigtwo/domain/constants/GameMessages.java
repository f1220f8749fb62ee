package com.cardhub.gameservice.games.bigtwo.domain.constants;

/**
 * 锄大地相关的消息常量
 * 统一管理所有用户可见的提示消息，避免硬编码
 *
 * 使用示例：
 *   RuleViolation.of(ErrorKind.NOT_YOUR_TURN, GameMessages.formatNotYourTurn(2));
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 游戏状态消息 ==========

    /** 游戏开始 */
    public static final String GAME_STARTED = "游戏开始";

    /** 新一局开始（需要格式化，传入局号） */
    public static final String MATCH_STARTED = "第 %d 局开始";

    /** 一局结束（需要格式化，传入局号与赢家座位） */
    public static final String MATCH_FINISHED = "第 %d 局结束，%d 号位出完";

    /** 整场结束 */
    public static final String GAME_OVER = "游戏结束，%d 号位获胜";

    /** 自动过牌 */
    public static final String AUTO_PASSED = "%d 号位超时，自动过牌";

    public static String formatMatchStarted(int matchNumber) {
        return String.format(MATCH_STARTED, matchNumber);
    }

    public static String formatMatchFinished(int matchNumber, int winnerSeat) {
        return String.format(MATCH_FINISHED, matchNumber, winnerSeat);
    }

    public static String formatGameOver(int winnerSeat) {
        return String.format(GAME_OVER, winnerSeat);
    }

    public static String formatAutoPassed(int seat) {
        return String.format(AUTO_PASSED, seat);
    }

    // ========== 错误消息 ==========

    /** 未轮到该座位 */
    public static final String NOT_YOUR_TURN = "未轮到该座位出牌（当前应为 %d 号位）";

    public static String formatNotYourTurn(int currentSeat) {
        return String.format(NOT_YOUR_TURN, currentSeat);
    }

    /** 出了不在手里的牌 */
    public static final String CARDS_NOT_OWNED = "手牌中没有 %s";

    public static String formatCardsNotOwned(String cards) {
        return String.format(CARDS_NOT_OWNED, cards);
    }

    /** 非法牌型 */
    public static final String INVALID_COMBO = "不是合法的牌型";

    /** 压不过上一手 */
    public static final String CANNOT_BEAT_LAST_PLAY = "压不过上一手";

    /** 首手必须带方块 3 */
    public static final String MISSING_REQUIRED_CARD = "首手必须包含 %s";

    public static String formatMissingRequiredCard(String card) {
        return String.format(MISSING_REQUIRED_CARD, card);
    }

    /** 报单：必须出最大的单张 */
    public static final String ONE_CARD_LEFT_MUST_PLAY = "下家只剩一张牌，必须出最大的单张 %s";

    public static String formatOneCardLeft(String card) {
        return String.format(ONE_CARD_LEFT_MUST_PLAY, card);
    }

    /** 领出时不能过 */
    public static final String CANNOT_PASS_WHILE_LEADING = "轮到你领出，不能过牌";

    /** 房间正在被其它操作修改 */
    public static final String ROOM_LOCK_CONFLICT = "房间状态正在更新，请重试";

    /** 过期的计时器通知 */
    public static final String STALE_TIMER_SEQUENCE = "计时器通知已过期（序号 %d < %d）";

    public static String formatStaleTimer(long got, long newest) {
        return String.format(STALE_TIMER_SEQUENCE, got, newest);
    }

    /** 对局不在进行中 */
    public static final String GAME_NOT_IN_PROGRESS = "对局未在进行中（当前阶段 %s）";

    public static String formatGameNotInProgress(String phase) {
        return String.format(GAME_NOT_IN_PROGRESS, phase);
    }

    /** 只能在一局结束后开始下一局 */
    public static final String NEXT_MATCH_NOT_READY = "本局尚未结束，不能开始下一局";

    /** 房间不存在 */
    public static final String ROOM_NOT_FOUND = "房间不存在";
}
