package com.kb.metering.service;

import com.kb.metering.model.entity.ClientBalance;
import com.kb.metering.model.entity.MeteredSession;
import lombok.Value;

/**
 * 세션 연장 결과
 */
@Value
public class SessionExtension {

    MeteredSession session;

    int additionalMinutes;

    long reservedAmount;

    ClientBalance clientBalance;
}
