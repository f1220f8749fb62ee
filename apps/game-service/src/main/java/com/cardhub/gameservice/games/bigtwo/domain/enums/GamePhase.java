package com.cardhub.gameservice.games.bigtwo.domain.enums;

public enum GamePhase {

    FIRST_PLAY,  // 第 1 局首手（必须带方块 3）
    PLAYING,     // 对局中
    FINISHED,    // 本局结束（有人出完），等待下一局发牌
    GAME_OVER    // 整场结束（有人累计分数达到阈值），终态
}
