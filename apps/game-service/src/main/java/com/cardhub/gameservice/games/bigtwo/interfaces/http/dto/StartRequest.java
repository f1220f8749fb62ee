package com.cardhub.gameservice.games.bigtwo.interfaces.http.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** 开局请求 */
@Data
public class StartRequest {
    /** 机器人座位（0..3），可为空 */
    private List<Integer> botSeats = new ArrayList<>();
}
