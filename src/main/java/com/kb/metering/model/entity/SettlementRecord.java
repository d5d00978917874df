package com.kb.metering.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * 정산 기록 (생성 후 불변)
 * readerShare + platformShare = grossAmount
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "settlements")
public class SettlementRecord {

    @Id
    private String id;

    /**
     * 정산 원천 참조 (session:{id} 또는 gift:{txId}). 원천당 1건만 허용
     */
    @Indexed(unique = true)
    private String sourceReference;

    private SettlementType type;

    @Indexed
    private String readerId;

    private String payerId;

    private long grossAmount;

    private long readerShare;

    private long platformShare;

    /**
     * 정산 시점에 적용된 리더 몫 (%)
     */
    private int readerSharePercent;

    private Instant createdAt;

    public static String sessionReference(String sessionId) {
        return "session:" + sessionId;
    }

    public static String giftReference(String transactionId) {
        return "gift:" + transactionId;
    }
}
