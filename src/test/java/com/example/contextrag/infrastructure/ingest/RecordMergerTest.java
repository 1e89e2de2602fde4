package com.example.contextrag.infrastructure.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.contextrag.domain.model.CanonicalRecord;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class RecordMergerTest {

    private final RecordMerger merger = new RecordMerger();

    private static CanonicalRecord rec(String id, String modifiedAt, long revision, String content) {
        return new CanonicalRecord(id, "forum", Instant.parse(modifiedAt), revision, content,
                null, null, null, Map.of());
    }

    private static Map<String, String> contentById(List<CanonicalRecord> records) {
        return records.stream().collect(Collectors.toMap(CanonicalRecord::id, CanonicalRecord::content));
    }

    @Test
    void latestModifiedAtWins_regardlessOfBatchOrder() {
        CanonicalRecord older = rec("X", "2024-01-01T00:00:00Z", 0, "old");
        CanonicalRecord newer = rec("X", "2024-02-01T00:00:00Z", 0, "new");

        MergeResult forward = merger.merge(List.of(older), List.of(newer));
        MergeResult backward = merger.merge(List.of(newer), List.of(older));

        assertEquals(1, forward.records().size());
        assertEquals("new", forward.records().get(0).content());
        assertEquals("new", backward.records().get(0).content());
        assertEquals(1, forward.duplicatesCollapsed());
        assertEquals(2, forward.inputCount());
    }

    @Test
    void sameTimestamp_higherRevisionWins_thenLastSeen() {
        CanonicalRecord r1 = rec("X", "2024-01-01T00:00:00Z", 2, "rev2");
        CanonicalRecord r2 = rec("X", "2024-01-01T00:00:00Z", 1, "rev1");
        CanonicalRecord r3 = rec("Y", "2024-01-01T00:00:00Z", 0, "first");
        CanonicalRecord r4 = rec("Y", "2024-01-01T00:00:00Z", 0, "second");

        Map<String, String> merged = contentById(merger.merge(List.of(List.of(r1, r3), List.of(r2, r4))).records());

        assertEquals("rev2", merged.get("X"));
        assertEquals("second", merged.get("Y"));
    }

    @Test
    void outputKeepsFirstAppearanceOrder() {
        MergeResult result = merger.merge(
                List.of(rec("A", "2024-01-01T00:00:00Z", 0, "a"), rec("B", "2024-01-01T00:00:00Z", 0, "b")),
                List.of(rec("C", "2024-01-01T00:00:00Z", 0, "c"), rec("A", "2024-05-01T00:00:00Z", 0, "a2")));

        assertEquals(List.of("A", "B", "C"),
                result.records().stream().map(CanonicalRecord::id).collect(Collectors.toList()));
        assertEquals("a2", result.records().get(0).content());
    }

    @Test
    void mergeIsIdempotent() {
        List<List<CanonicalRecord>> input = List.of(
                List.of(rec("A", "2024-01-01T00:00:00Z", 0, "a"), rec("B", "2024-03-01T00:00:00Z", 0, "b-new")),
                List.of(rec("B", "2024-01-01T00:00:00Z", 0, "b-old"), rec("C", "2024-01-01T00:00:00Z", 0, "c")));

        List<CanonicalRecord> once = merger.merge(input).records();
        List<CanonicalRecord> twice = merger.merge(once, once).records();

        assertEquals(contentById(once), contentById(twice));
        assertEquals(once.size(), twice.size());
    }
}
