package com.kb.metering.model.message.inbound;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 알 수 없는 type 의 메시지 (무시 대상)
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class UnknownClientMessage extends ClientMessage {
}
