package com.example.contextrag.infrastructure.ingest;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Field-name mapping for one source type. Each list is tried in order; the first non-blank
 * value wins.
 *
 * @param renderContentFromFields when no content field is present, build content from the
 *                                remaining scalar fields (tabular captures)
 * @param parentIdPrefixes        prefixes stripped from parent ids, e.g. Reddit's {@code t3_}
 * @param nestedMetadataField     object field whose entries are flattened into metadata
 * @param scoresEngagement        derive a {@code quality_score} from votes, replies and author
 */
public record SourceSchema(
        String sourceType,
        List<String> idFields,
        List<String> contentFields,
        List<String> modifiedFields,
        List<String> revisionFields,
        List<String> parentFields,
        List<String> titleFields,
        List<String> urlFields,
        boolean renderContentFromFields,
        List<String> parentIdPrefixes,
        String nestedMetadataField,
        boolean scoresEngagement
) {
    private static final List<String> IDS = List.of("id");
    private static final List<String> REVISIONS = List.of("revision", "version");
    private static final List<String> PARENTS = List.of("parent_id", "parentId");
    private static final List<String> TITLES = List.of("title");
    private static final List<String> URLS = List.of("url", "permalink");

    public static final SourceSchema DEFAULT = new SourceSchema(
            "default",
            IDS,
            List.of("content", "text"),
            List.of("modified_at", "updated_at", "ingested_at"),
            REVISIONS, PARENTS, TITLES, URLS,
            false, List.of(), "metadata", false);

    public static final SourceSchema FORUM = new SourceSchema(
            "forum",
            IDS,
            List.of("content", "text", "body", "selftext"),
            List.of("modified_at", "ingested_at", "edited_utc", "created_utc"),
            REVISIONS, PARENTS, TITLES, URLS,
            false, List.of("t1_", "t3_"), "metadata", true);

    public static final SourceSchema WEB = new SourceSchema(
            "web",
            IDS,
            List.of("content", "text"),
            List.of("modified_at", "ingested_at", "last_modified"),
            REVISIONS, PARENTS, TITLES, URLS,
            false, List.of(), "metadata", false);

    public static final SourceSchema TABULAR = new SourceSchema(
            "tabular",
            IDS,
            List.of("content", "text"),
            List.of("modified_at", "ingested_at"),
            REVISIONS, PARENTS, TITLES, URLS,
            true, List.of(), "metadata", false);

    /**
     * Every field name this schema interprets. Anything else is kept as opaque metadata.
     */
    public Set<String> mappedFields() {
        Set<String> all = new LinkedHashSet<>();
        all.addAll(idFields);
        all.addAll(contentFields);
        all.addAll(modifiedFields);
        all.addAll(revisionFields);
        all.addAll(parentFields);
        all.addAll(titleFields);
        all.addAll(urlFields);
        if (nestedMetadataField != null) {
            all.add(nestedMetadataField);
        }
        return all;
    }
}
