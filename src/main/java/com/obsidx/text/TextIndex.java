package com.obsidx.text;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

import com.obsidx.note.Note;

public interface TextIndex extends Closeable {
    List<String> DEFAULT_FIELDS = List.of(LuceneTextIndex.TITLE, LuceneTextIndex.CONTENT, LuceneTextIndex.TAGS);

    /**
     * Writes notes into the index. In incremental mode a note is skipped when
     * the stored document for its note id has an mtime at least as new; otherwise
     * the stored document is deleted and the fresh one inserted. A
     * non-incremental batch starts from an empty index.
     */
    UpsertResult upsertBatch(List<Note> notes, boolean incremental);

    List<TextHit> queryRanked(String text, List<String> fields, int limit, String collectionFilter);

    default List<TextHit> queryRanked(String text, int limit, String collectionFilter) {
        return queryRanked(text, DEFAULT_FIELDS, limit, collectionFilter);
    }

    Optional<Note> exactLookup(String field, String value);

    List<Note> termLookup(String field, String value, int limit);

    /**
     * Paths of notes whose outbound links contain {@code target} exactly,
     * sorted and deduplicated.
     */
    List<String> backlinks(String target);

    int documentCount();

    SortedMap<String, Integer> tagCounts();
}
