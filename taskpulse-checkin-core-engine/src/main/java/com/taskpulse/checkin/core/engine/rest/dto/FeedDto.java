package com.taskpulse.checkin.core.engine.rest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskpulse.checkin.core.engine.statistics.ManagerFeed;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Manager feed page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FeedDto {

    private List<FeedItemDto> items;
    private long total;
    private long needsAttentionCount;
    private int skip;
    private int limit;
    private boolean hasMore;

    public static FeedDto from(ManagerFeed feed) {
        List<FeedItemDto> items = feed.getItems().stream()
                .map(FeedItemDto::from)
                .collect(Collectors.toList());
        return FeedDto.builder()
                .items(items)
                .total(feed.getTotal())
                .needsAttentionCount(feed.getNeedsAttentionCount())
                .skip(feed.getSkip())
                .limit(feed.getLimit())
                .hasMore(feed.getSkip() + items.size() < feed.getTotal())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class FeedItemDto {

        private CheckInDto checkin;
        private boolean needsAttention;
        private String attentionReason;

        static FeedItemDto from(ManagerFeed.FeedItem item) {
            return FeedItemDto.builder()
                    .checkin(CheckInDto.fromEntity(item.getCheckIn()))
                    .needsAttention(item.isNeedsAttention())
                    .attentionReason(item.getAttentionReason())
                    .build();
        }
    }
}
