package com.kb.metering.service;

import com.kb.metering.config.MeteringProperties;
import com.kb.metering.config.MeteringProperties.GiftDefinition;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 선물 카탈로그 (giftId -> 가격/애니메이션)
 */
@Component
public class GiftCatalog {

    private final Map<String, GiftDefinition> gifts;

    public GiftCatalog(MeteringProperties properties) {
        this.gifts = Collections.unmodifiableMap(new LinkedHashMap<>(properties.getGifts()));
    }

    public Optional<GiftDefinition> find(String giftId) {
        return giftId == null ? Optional.empty() : Optional.ofNullable(gifts.get(giftId));
    }

    public Map<String, GiftDefinition> getGifts() {
        return gifts;
    }
}
