package com.eventbacktest.backtester.domain.data;

import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Per-symbol bar series reindexed onto one shared timestamp axis.
 * Each series has exactly one slot per index entry; a slot is null only
 * before that symbol's first real observation.
 */
@Value
public class AlignedSeries {

    List<LocalDateTime> index;
    Map<String, List<Bar>> series;

    public int length() {
        return index.size();
    }

    public Bar barAt(String symbol, int position) {
        return series.get(symbol).get(position);
    }
}
