package com.kb.metering.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 라이브 방송 (외부 관리, 선물 수신자 조회와 누적 수익 갱신에만 사용)
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "livestreams")
public class Livestream {

    @Id
    private String id;

    /**
     * 방송 진행자(선물 수신자) ID
     */
    @Indexed
    private String hostId;

    private String title;

    private String status;

    /**
     * 선물 누적 총액
     */
    private long earnings;

    @Version
    private Long version;
}
