package com.kb.metering.model.entity;

/**
 * 정산 원천 구분
 */
public enum SettlementType {
    SESSION,
    GIFT
}
