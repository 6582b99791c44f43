package com.eventbacktest.backtester.domain.data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the union of all symbols' native timestamps and forward-fills every
 * series onto it.
 */
public final class SeriesAligner {

    private SeriesAligner() {
    }

    public static AlignedSeries align(Map<String, List<Bar>> nativeSeries) {
        TreeSet<LocalDateTime> union = new TreeSet<>();
        Map<String, TreeMap<LocalDateTime, Bar>> bySymbol = new LinkedHashMap<>();

        for (Map.Entry<String, List<Bar>> entry : nativeSeries.entrySet()) {
            TreeMap<LocalDateTime, Bar> byTime = new TreeMap<>();
            for (Bar bar : entry.getValue()) {
                // Later duplicates of a timestamp win
                byTime.put(bar.getTimestamp(), bar);
            }
            union.addAll(byTime.keySet());
            bySymbol.put(entry.getKey(), byTime);
        }

        List<LocalDateTime> index = List.copyOf(union);
        Map<String, List<Bar>> aligned = new LinkedHashMap<>();

        for (Map.Entry<String, TreeMap<LocalDateTime, Bar>> entry : bySymbol.entrySet()) {
            TreeMap<LocalDateTime, Bar> byTime = entry.getValue();
            List<Bar> filled = new ArrayList<>(index.size());
            Bar last = null;
            for (LocalDateTime timestamp : index) {
                Bar observed = byTime.get(timestamp);
                if (observed != null) {
                    last = observed;
                    filled.add(observed);
                } else if (last != null) {
                    filled.add(last.withTimestamp(timestamp));
                } else {
                    filled.add(null);
                }
            }
            aligned.put(entry.getKey(), Collections.unmodifiableList(filled));
        }

        return new AlignedSeries(index, Collections.unmodifiableMap(aligned));
    }
}
