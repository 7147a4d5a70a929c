package com.chicu.tradeads.web.dto;

import com.chicu.tradeads.domain.TradeAd;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeAdDto {

    private String id;
    private String name;
    private long playerId;
    private String roliVerification;
    private List<Long> offerItemIds;
    private List<Long> requestItemIds;
    private List<String> requestTags;
    private int intervalMinutes;

    /** Для UI: крутится ли цикл прямо сейчас */
    private boolean running;

    /** Успешных публикаций с момента запуска процесса */
    private long postCount;

    public static TradeAdDto from(TradeAd ad, boolean running, long postCount) {
        return TradeAdDto.builder()
                .id(ad.getId())
                .name(ad.getName())
                .playerId(ad.getPlayerId())
                .roliVerification(ad.getRoliVerification())
                .offerItemIds(List.copyOf(ad.getOfferItemIds()))
                .requestItemIds(List.copyOf(ad.getRequestItemIds()))
                .requestTags(List.copyOf(ad.getRequestTags()))
                .intervalMinutes(ad.getIntervalMinutes())
                .running(running)
                .postCount(postCount)
                .build();
    }

    public TradeAd toEntity() {
        return TradeAd.builder()
                .id(id)
                .name(name != null ? name : "")
                .playerId(playerId)
                .roliVerification(roliVerification)
                .offerItemIds(offerItemIds != null ? new ArrayList<>(offerItemIds) : new ArrayList<>())
                .requestItemIds(requestItemIds != null ? new ArrayList<>(requestItemIds) : new ArrayList<>())
                .requestTags(requestTags != null ? new ArrayList<>(requestTags) : new ArrayList<>())
                .intervalMinutes(intervalMinutes)
                .build();
    }
}
