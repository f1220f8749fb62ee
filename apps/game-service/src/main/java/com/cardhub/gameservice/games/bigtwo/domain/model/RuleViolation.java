package com.cardhub.gameservice.games.bigtwo.domain.model;

import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 校验失败（以值返回，不抛异常）。
 * requiredCard 仅在“报单”规则要求必须出某张牌时给出。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuleViolation(ErrorKind kind, String message, Card requiredCard) {

    public static RuleViolation of(ErrorKind kind, String message) {
        return new RuleViolation(kind, message, null);
    }
}
