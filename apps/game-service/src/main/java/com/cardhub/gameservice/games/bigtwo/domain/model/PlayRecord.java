package com.cardhub.gameservice.games.bigtwo.domain.model;

/** 桌面上的“上一手”：谁出的、出了什么 */
public record PlayRecord(int seat, Combo combo) {
}
