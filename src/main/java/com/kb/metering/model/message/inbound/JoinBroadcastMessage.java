package com.kb.metering.model.message.inbound;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 방송 룸 입장
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
@AllArgsConstructor
public class JoinBroadcastMessage extends ClientMessage {

    private String broadcastId;
}
