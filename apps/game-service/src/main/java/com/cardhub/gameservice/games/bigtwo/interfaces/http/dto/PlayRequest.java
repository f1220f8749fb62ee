package com.cardhub.gameservice.games.bigtwo.interfaces.http.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** 出牌请求 */
@Data
public class PlayRequest {
    private int seat;
    /** 牌面编码，如 ["3D","3S"] */
    private List<String> cards = new ArrayList<>();
}
