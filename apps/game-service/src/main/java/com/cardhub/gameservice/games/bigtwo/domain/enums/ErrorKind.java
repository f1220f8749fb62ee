package com.cardhub.gameservice.games.bigtwo.domain.enums;

/**
 * 出牌/过牌/计时器相关的错误类型。
 * 校验失败以值的形式返回（见 RuleViolation），不抛异常。
 */
public enum ErrorKind {
    NOT_YOUR_TURN,
    CARDS_NOT_OWNED,
    INVALID_COMBO,
    CANNOT_BEAT_LAST_PLAY,
    MISSING_REQUIRED_CARD,
    ONE_CARD_LEFT_VIOLATION,
    CANNOT_PASS_WHILE_LEADING,
    ROOM_LOCK_CONFLICT,
    STALE_TIMER_SEQUENCE,
    GAME_NOT_IN_PROGRESS;

    /** 调用方拿到最新状态后可重试 */
    public boolean isRetryable() {
        return this == ROOM_LOCK_CONFLICT;
    }
}
