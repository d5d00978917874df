package com.kb.metering.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 리더 프로필 (외부 관리, 분당 요금 조회 전용)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "readers")
public class ReaderProfile {

    @Id
    private String id;

    private String displayName;

    private long chatRate;

    private long voiceRate;

    private long videoRate;

    /**
     * 종류별 요금이 없을 때 사용하는 기본 요금
     */
    private long defaultRate;

    /**
     * 세션 종류별 분당 요금. 종류별 요금이 없으면 기본 요금
     */
    public long rateFor(SessionKind kind) {
        long specific;
        switch (kind) {
            case VIDEO:
                specific = videoRate;
                break;
            case VOICE:
                specific = voiceRate;
                break;
            default:
                specific = chatRate;
        }
        return specific > 0 ? specific : defaultRate;
    }
}
