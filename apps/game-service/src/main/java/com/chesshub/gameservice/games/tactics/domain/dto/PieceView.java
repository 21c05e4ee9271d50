package com.chesshub.gameservice.games.tactics.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 棋子的传输格式：{ "type": "mage", "color": "white", "state": 2 }
 * state：勇士为姿态值（0/1/2），法师为冷却回合数，其余种类不输出。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PieceView {
    private String type;
    private String color;
    private Integer state;
}
