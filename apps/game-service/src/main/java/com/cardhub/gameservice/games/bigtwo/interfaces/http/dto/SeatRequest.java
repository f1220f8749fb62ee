package com.cardhub.gameservice.games.bigtwo.interfaces.http.dto;

import lombok.Data;

/** 只带座位号的请求（过牌） */
@Data
public class SeatRequest {
    private int seat;
}
