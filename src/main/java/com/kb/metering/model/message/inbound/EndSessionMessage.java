package com.kb.metering.model.message.inbound;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
@AllArgsConstructor
public class EndSessionMessage extends ClientMessage {

    private String sessionId;

    private String reason;
}
