package com.kb.metering.model.message.outbound;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 방송 시청자 수 변경
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class ViewerCountMessage extends ServerMessage {

    public static final String TYPE = "viewer_count_update";

    private String broadcastId;

    private int viewerCount;

    @Override
    public String getType() {
        return TYPE;
    }
}
