package com.cardhub.gameservice.games.bigtwo.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 一次状态迁移请求的结果：成功带新快照，失败带 RuleViolation。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MoveResult(boolean ok, BigTwoSnapshot snapshot, RuleViolation violation) {

    public static MoveResult ok(BigTwoSnapshot snapshot) {
        return new MoveResult(true, snapshot, null);
    }

    public static MoveResult rejected(RuleViolation violation) {
        return new MoveResult(false, null, violation);
    }
}
