package com.example.contextrag.infrastructure.ingest;

import com.example.contextrag.domain.model.CanonicalRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Combines capture batches into one duplicate-free sequence.
 *
 * <p>Per id the whole record with the latest {@code modifiedAt} wins, then the highest
 * revision, then the one seen last in input order. Output keeps the position where each id
 * first appeared across the batches, concatenated in the caller's priority order.
 */
@Component
public class RecordMerger {

    private static final Logger log = LoggerFactory.getLogger(RecordMerger.class);

    private static final Comparator<CanonicalRecord> NEWER =
            Comparator.comparing(CanonicalRecord::modifiedAt)
                    .thenComparingLong(CanonicalRecord::revision);

    public MergeResult merge(List<List<CanonicalRecord>> batches) {
        Map<String, CanonicalRecord> survivors = new LinkedHashMap<>();
        int input = 0;

        for (List<CanonicalRecord> batch : batches) {
            if (batch == null) {
                continue;
            }
            for (CanonicalRecord r : batch) {
                input++;
                CanonicalRecord current = survivors.get(r.id());
                // LinkedHashMap keeps the first insertion position on replace
                if (current == null || NEWER.compare(r, current) >= 0) {
                    survivors.put(r.id(), r);
                }
            }
        }

        List<CanonicalRecord> out = new ArrayList<>(survivors.values());
        int collapsed = input - out.size();
        if (collapsed > 0) {
            log.info("event=merge_duplicates_resolved batches={} input={} output={} collapsed={}",
                    batches.size(), input, out.size(), collapsed);
        }
        return new MergeResult(out, input, collapsed);
    }

    public MergeResult merge(List<CanonicalRecord> first, List<CanonicalRecord> second) {
        return merge(List.of(first, second));
    }
}
