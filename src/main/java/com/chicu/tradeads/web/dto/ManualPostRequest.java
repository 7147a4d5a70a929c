package com.chicu.tradeads.web.dto;

import com.chicu.tradeads.engine.AdJob;
import lombok.Data;

import java.util.List;

/**
 * Разовая публикация без сохранения пресета.
 */
@Data
public class ManualPostRequest {
    private long playerId;
    private List<Long> offerItemIds;
    private List<Long> requestItemIds;
    private List<String> requestTags;
    private String roliVerification;

    public AdJob toJob() {
        return new AdJob("manual", "manual", playerId, roliVerification,
                offerItemIds, requestItemIds, requestTags, 0);
    }
}
