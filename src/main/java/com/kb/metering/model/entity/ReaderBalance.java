package com.kb.metering.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * 리더 지급 예정 잔액
 * 정산(credit)과 외부 지급 배치(debit to zero)로만 변경
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "reader_balances")
public class ReaderBalance {

    @Id
    private String readerId;

    private long payable;

    private long lifetimeEarnings;

    private Instant lastPayoutAt;

    private Instant updatedAt;

    @Version
    private Long version;

    public static ReaderBalance empty(String readerId) {
        return ReaderBalance.builder().readerId(readerId).build();
    }
}
