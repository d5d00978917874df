package com.kb.metering.ledger;

import com.kb.metering.model.entity.ClientBalance;
import com.kb.metering.model.entity.GiftTransaction;
import com.kb.metering.model.entity.Livestream;
import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.entity.ReaderBalance;
import com.kb.metering.model.entity.SettlementRecord;
import lombok.Builder;
import lombok.Value;

/**
 * 한 번에 원자적으로 저장할 원장 변경 묶음
 * null 인 항목은 저장하지 않음
 */
@Value
@Builder
public class LedgerChange {

    MeteredSession session;

    ClientBalance clientBalance;

    ReaderBalance readerBalance;

    SettlementRecord settlement;

    GiftTransaction giftTransaction;

    Livestream livestream;
}
