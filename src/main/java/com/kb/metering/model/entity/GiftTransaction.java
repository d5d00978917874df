package com.kb.metering.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * 방송 선물 거래 기록
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "gift_transactions")
@CompoundIndex(def = "{'livestreamId': 1, 'createdAt': -1}")
public class GiftTransaction {

    @Id
    private String id;

    private String livestreamId;

    private String senderId;

    private String receiverId;

    private String giftId;

    private String label;

    private long amount;

    private Instant createdAt;
}
