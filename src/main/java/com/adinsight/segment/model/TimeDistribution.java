package com.adinsight.segment.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeDistribution {
    private int weekday;
    private int weekend;
    @Builder.Default
    private Map<DayOfWeek, Integer> byDayOfWeek = new EnumMap<>(DayOfWeek.class);

    public int total() {
        return weekday + weekend;
    }
}
