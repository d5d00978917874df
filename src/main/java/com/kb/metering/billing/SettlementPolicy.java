package com.kb.metering.billing;

import com.kb.metering.exception.InsufficientFundsException;
import com.kb.metering.model.entity.ClientBalance;
import com.kb.metering.model.entity.GiftTransaction;
import com.kb.metering.model.entity.ReaderBalance;
import com.kb.metering.model.entity.SettlementRecord;
import com.kb.metering.model.entity.SettlementType;

import java.time.Instant;
import java.util.UUID;

/**
 * 정산 경로
 * 세션 과금액과 선물 금액을 같은 방식으로 분배하고 리더 지급 잔액에 적립
 */
public class SettlementPolicy {

    private final RevenueSplit sessionSplit;
    private final RevenueSplit giftSplit;

    public SettlementPolicy(RevenueSplit sessionSplit, RevenueSplit giftSplit) {
        this.sessionSplit = sessionSplit;
        this.giftSplit = giftSplit;
    }

    /**
     * 세션 과금액 정산 기록 생성 및 리더 적립
     */
    public SettlementRecord settleSession(String sessionId, String clientId, ReaderBalance reader,
                                          long billedAmount, Instant now) {
        return settle(SettlementType.SESSION, SettlementRecord.sessionReference(sessionId),
                clientId, reader, billedAmount, sessionSplit, now);
    }

    /**
     * 선물 결제: 보낸 사람 가용 잔액 차감 후 수신자에게 정산
     * 잔액이 부족하면 아무것도 변경하지 않고 예외
     */
    public SettlementRecord settleGift(GiftTransaction transaction, ClientBalance sender, ReaderBalance receiver,
                                       Instant now) {
        long amount = transaction.getAmount();
        if (amount <= 0) {
            throw new IllegalArgumentException("선물 금액은 0보다 커야 합니다: " + amount);
        }
        if (sender.getAvailable() < amount) {
            throw new InsufficientFundsException(amount, sender.getAvailable());
        }
        sender.setAvailable(sender.getAvailable() - amount);
        sender.setUpdatedAt(now);
        return settle(SettlementType.GIFT, SettlementRecord.giftReference(transaction.getId()),
                transaction.getSenderId(), receiver, amount, giftSplit, now);
    }

    private SettlementRecord settle(SettlementType type, String reference, String payerId, ReaderBalance reader,
                                    long grossAmount, RevenueSplit split, Instant now) {
        RevenueSplit.Shares shares = split.split(grossAmount);

        reader.setPayable(reader.getPayable() + shares.getReaderShare());
        reader.setLifetimeEarnings(reader.getLifetimeEarnings() + shares.getReaderShare());
        reader.setUpdatedAt(now);

        return SettlementRecord.builder()
                .id(UUID.randomUUID().toString())
                .sourceReference(reference)
                .type(type)
                .readerId(reader.getReaderId())
                .payerId(payerId)
                .grossAmount(shares.getGrossAmount())
                .readerShare(shares.getReaderShare())
                .platformShare(shares.getPlatformShare())
                .readerSharePercent(split.getReaderSharePercent())
                .createdAt(now)
                .build();
    }
}
