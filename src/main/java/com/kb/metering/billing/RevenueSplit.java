package com.kb.metering.billing;

import lombok.Value;

/**
 * 리더/플랫폼 수익 분배 비율
 * 리더 몫은 내림(floor), 나머지는 모두 플랫폼 몫이므로 합계는 항상 총액과 일치
 */
public final class RevenueSplit {

    private final int readerSharePercent;

    public RevenueSplit(int readerSharePercent) {
        if (readerSharePercent < 0 || readerSharePercent > 100) {
            throw new IllegalArgumentException("리더 몫 비율은 0~100 사이여야 합니다: " + readerSharePercent);
        }
        this.readerSharePercent = readerSharePercent;
    }

    public int getReaderSharePercent() {
        return readerSharePercent;
    }

    /**
     * 총액을 리더/플랫폼 몫으로 분배
     *
     * @param grossAmount 총액 (최소 통화 단위, 0 이상)
     * @return 분배 결과
     */
    public Shares split(long grossAmount) {
        if (grossAmount < 0) {
            throw new IllegalArgumentException("정산 금액은 음수일 수 없습니다: " + grossAmount);
        }
        long readerShare = Math.floorDiv(Math.multiplyExact(grossAmount, (long) readerSharePercent), 100L);
        return new Shares(grossAmount, readerShare, grossAmount - readerShare);
    }

    @Value
    public static class Shares {
        long grossAmount;
        long readerShare;
        long platformShare;
    }
}
