package com.chesshub.gameservice.platform.ws;

import java.security.Principal;

/**
 * 匿名参与者身份：一条 STOMP 连接对应一个参与者ID。
 * name 即参与者ID，也是 /user/... 点对点投递的键。
 */
public record ParticipantPrincipal(String name) implements Principal {

    @Override
    public String getName() {
        return name;
    }
}
