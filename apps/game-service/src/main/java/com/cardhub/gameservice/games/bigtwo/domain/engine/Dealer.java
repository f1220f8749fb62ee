package com.cardhub.gameservice.games.bigtwo.domain.engine;

import com.cardhub.gameservice.games.bigtwo.domain.model.Card;

import java.util.List;

/**
 * 发牌：把 52 张牌分成 4 手，每手 13 张（各自排好序）。
 */
public interface Dealer {

    List<List<Card>> deal();
}
