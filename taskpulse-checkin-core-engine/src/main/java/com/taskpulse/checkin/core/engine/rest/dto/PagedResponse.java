package com.taskpulse.checkin.core.engine.rest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of a listing.
 *
 * @param <T> the type of items in the response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PagedResponse<T> {

    private List<T> items;

    /**
     * Total number of matching items across all pages.
     */
    private long total;

    private int skip;

    private int limit;

    private boolean hasMore;

    public static <T> PagedResponse<T> of(List<T> items, long total, int skip, int limit) {
        return PagedResponse.<T>builder()
                .items(items)
                .total(total)
                .skip(skip)
                .limit(limit)
                .hasMore(skip + items.size() < total)
                .build();
    }
}
