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
 * 고객 선불 잔액
 * available ≥ 0, locked = Σ(활성 세션의 authorizedAmount − billedAmount)
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "client_balances")
public class ClientBalance {

    /**
     * 고객 ID (문서 ID로 사용)
     */
    @Id
    private String clientId;

    private long available;

    /**
     * 진행 중인 세션에 예치된 금액
     */
    private long locked;

    private long lastTopUpAmount;

    private Instant lastTopUpAt;

    private Instant updatedAt;

    @Version
    private Long version;

    public static ClientBalance empty(String clientId) {
        return ClientBalance.builder().clientId(clientId).build();
    }
}
