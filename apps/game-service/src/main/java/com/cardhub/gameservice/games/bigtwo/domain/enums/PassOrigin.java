package com.cardhub.gameservice.games.bigtwo.domain.enums;

/**
 * 过牌来源：玩家主动过牌，或自动过牌计时器到期后的强制过牌。
 * 强制过牌不受“报单”规则约束。
 */
public enum PassOrigin {
    PLAYER,
    AUTO_PASS
}
