package com.chicu.tradeads.domain;

import com.chicu.tradeads.engine.AdJob;
import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "trade_ads")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(exclude = "roliVerification")
public class TradeAd {

    @Id
    @Column(length = 64)
    @EqualsAndHashCode.Include
    private String id;

    @Builder.Default
    @Column(nullable = false)
    private String name = "";

    private long playerId;

    /** Cookie _RoliVerification; пусто: цикл будет пропускать публикацию */
    @Column(length = 4096)
    private String roliVerification;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trade_ad_offer_items", joinColumns = @JoinColumn(name = "ad_id"))
    @OrderColumn(name = "pos")
    @Column(name = "item_id")
    private List<Long> offerItemIds = new ArrayList<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trade_ad_request_items", joinColumns = @JoinColumn(name = "ad_id"))
    @OrderColumn(name = "pos")
    @Column(name = "item_id")
    private List<Long> requestItemIds = new ArrayList<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trade_ad_request_tags", joinColumns = @JoinColumn(name = "ad_id"))
    @OrderColumn(name = "pos")
    @Column(name = "tag", length = 32)
    private List<String> requestTags = new ArrayList<>();

    /** Интервал в минутах; 0 = наследовать глобальный (передаётся при старте) */
    @Builder.Default
    private int intervalMinutes = 0;

    public AdJob toJob() {
        return new AdJob(
                id,
                name,
                playerId,
                roliVerification,
                offerItemIds,
                requestItemIds,
                requestTags,
                intervalMinutes
        );
    }
}
