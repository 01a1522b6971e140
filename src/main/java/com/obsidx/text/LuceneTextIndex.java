package com.obsidx.text;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.DocValues;
import org.apache.lucene.index.IndexFormatTooNewException;
import org.apache.lucene.index.IndexFormatTooOldException;
import org.apache.lucene.index.IndexNotFoundException;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.LeafReader;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.NumericDocValues;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.store.LockObtainFailedException;
import org.apache.lucene.util.Bits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.obsidx.note.Note;
import com.obsidx.runtime.ErrorKind;
import com.obsidx.runtime.ObsidxException;

/**
 * Lexical index stored as a Lucene index under {@code <location>/lexical}.
 * One document per note path; BM25 ranking over title, content and tags.
 */
public class LuceneTextIndex implements TextIndex {
    private static final Logger log = LoggerFactory.getLogger(LuceneTextIndex.class);
    static final String DIRECTORY = "lexical";

    public static final String DOC_ID = "doc_id";
    public static final String PATH = "path";
    public static final String COLLECTION = "collection";
    public static final String TITLE = "title";
    public static final String CONTENT = "content";
    public static final String TAGS = "tags";
    public static final String TAG_LIST = "tag_list";
    public static final String LINKS = "links";
    public static final String HEADINGS = "headings";
    public static final String FRONTMATTER = "frontmatter";
    public static final String LINK = "link";
    public static final String MTIME = "mtime";

    private static final Set<String> SEARCHABLE_FIELDS = Set.of(TITLE, CONTENT, TAGS);
    private static final Set<String> EXACT_FIELDS = Set.of(DOC_ID, PATH, COLLECTION, LINK);
    private static final Map<String, Float> BOOSTS = Map.of(TITLE, 2.0f, TAGS, 1.5f, CONTENT, 1.0f);
    private static final String TAG_SEPARATOR = "\n";

    private final Directory directory;
    private final IndexWriter writer;
    private final Analyzer analyzer;
    private final ObjectMapper mapper = new ObjectMapper();

    private LuceneTextIndex(Directory directory, IndexWriter writer, Analyzer analyzer) {
        this.directory = directory;
        this.writer = writer;
        this.analyzer = analyzer;
    }

    public static LuceneTextIndex openOrCreate(Path location) {
        Path indexDir = location.resolve(DIRECTORY);
        Directory directory = null;
        try {
            Files.createDirectories(indexDir);
            directory = FSDirectory.open(indexDir);
            Analyzer analyzer = new StandardAnalyzer();
            IndexWriterConfig config = new IndexWriterConfig(analyzer)
                    .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            IndexWriter writer = new IndexWriter(directory, config);
            writer.commit();
            log.debug("lexical.opened location={} mode=read-write", indexDir);
            return new LuceneTextIndex(directory, writer, analyzer);
        } catch (IOException e) {
            closeQuietly(directory);
            throw translateOpenFailure(indexDir, e);
        }
    }

    /**
     * Opens an existing index for queries only, without taking the write
     * lock, so lookups can run while another process is indexing.
     */
    public static LuceneTextIndex openReadOnly(Path location) {
        Path indexDir = location.resolve(DIRECTORY);
        if (!Files.isDirectory(indexDir)) {
            throw new ObsidxException(ErrorKind.STORE_UNAVAILABLE,
                    "No index at " + location.toAbsolutePath().normalize() + "; run 'obsidx index' first");
        }
        Directory directory = null;
        try {
            directory = FSDirectory.open(indexDir);
            if (!DirectoryReader.indexExists(directory)) {
                throw new IndexNotFoundException("no segments in " + indexDir);
            }
            SegmentInfos.readLatestCommit(directory);
            log.debug("lexical.opened location={} mode=read-only", indexDir);
            return new LuceneTextIndex(directory, null, new StandardAnalyzer());
        } catch (IOException e) {
            closeQuietly(directory);
            throw translateOpenFailure(indexDir, e);
        }
    }

    @Override
    public UpsertResult upsertBatch(List<Note> notes, boolean incremental) {
        IndexWriter indexWriter = requireWriter();
        try {
            Map<String, Long> stored;
            if (incremental) {
                stored = snapshotMtimes();
            } else {
                indexWriter.deleteAll();
                stored = Map.of();
            }

            int written = 0;
            int skipped = 0;
            for (Note note : notes) {
                Long storedMtime = stored.get(note.id());
                if (storedMtime != null && storedMtime >= note.mtime()) {
                    skipped++;
                    continue;
                }
                indexWriter.deleteDocuments(new Term(DOC_ID, note.id()));
                indexWriter.addDocument(toDocument(note));
                written++;
            }
            indexWriter.commit();
            log.debug("lexical.upsert incremental={} written={} skipped={}", incremental, written, skipped);
            return new UpsertResult(written, skipped);
        } catch (IOException e) {
            throw new ObsidxException(ErrorKind.STORE_UNAVAILABLE, "Failed to write lexical index: " + e.getMessage(), e);
        }
    }

    @Override
    public List<TextHit> queryRanked(String text, List<String> fields, int limit, String collectionFilter) {
        if (limit <= 0) {
            return List.of();
        }
        Query query = buildQuery(text, fields, collectionFilter);
        try (DirectoryReader reader = openReader()) {
            IndexSearcher searcher = new IndexSearcher(reader);
            TopDocs topDocs = searcher.search(query, limit);
            StoredFields storedFields = searcher.storedFields();
            List<TextHit> hits = new ArrayList<>();
            for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                Document document = storedFields.document(scoreDoc.doc, Set.of(DOC_ID, PATH));
                hits.add(new TextHit(document.get(DOC_ID), document.get(PATH), scoreDoc.score));
            }
            return hits;
        } catch (IOException e) {
            throw new ObsidxException(ErrorKind.STORE_UNAVAILABLE, "Failed to query lexical index: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Note> exactLookup(String field, String value) {
        List<Note> found = termLookup(field, value, 1);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<Note> termLookup(String field, String value, int limit) {
        if (!EXACT_FIELDS.contains(field)) {
            throw new IllegalArgumentException("Field '" + field + "' is not exact-match searchable; use one of " + EXACT_FIELDS);
        }
        if (value == null || limit <= 0) {
            return List.of();
        }
        try (DirectoryReader reader = openReader()) {
            IndexSearcher searcher = new IndexSearcher(reader);
            TopDocs topDocs = searcher.search(new TermQuery(new Term(field, value)), limit);
            StoredFields storedFields = searcher.storedFields();
            List<Note> notes = new ArrayList<>();
            for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                notes.add(toNote(storedFields.document(scoreDoc.doc)));
            }
            return notes;
        } catch (IOException e) {
            throw new ObsidxException(ErrorKind.STORE_UNAVAILABLE, "Failed to read lexical index: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> backlinks(String target) {
        int limit = Math.max(1, documentCount());
        TreeSet<String> paths = new TreeSet<>();
        for (Note note : termLookup(LINK, target, limit)) {
            paths.add(note.path());
        }
        return List.copyOf(paths);
    }

    @Override
    public int documentCount() {
        try (DirectoryReader reader = openReader()) {
            return reader.numDocs();
        } catch (IOException e) {
            throw new ObsidxException(ErrorKind.STORE_UNAVAILABLE, "Failed to read lexical index: " + e.getMessage(), e);
        }
    }

    @Override
    public SortedMap<String, Integer> tagCounts() {
        SortedMap<String, Integer> counts = new TreeMap<>();
        try (DirectoryReader reader = openReader()) {
            for (LeafReaderContext leaf : reader.leaves()) {
                LeafReader leafReader = leaf.reader();
                Bits liveDocs = leafReader.getLiveDocs();
                StoredFields storedFields = leafReader.storedFields();
                for (int doc = 0; doc < leafReader.maxDoc(); doc++) {
                    if (liveDocs != null && !liveDocs.get(doc)) {
                        continue;
                    }
                    Document document = storedFields.document(doc, Set.of(PATH, TAG_LIST));
                    for (String tag : readList(document.get(TAG_LIST), TAG_LIST, document.get(PATH))) {
                        counts.merge(tag, 1, Integer::sum);
                    }
                }
            }
            return counts;
        } catch (IOException e) {
            throw new ObsidxException(ErrorKind.STORE_UNAVAILABLE, "Failed to read lexical index: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            if (writer != null) {
                writer.close();
            }
        } finally {
            directory.close();
        }
    }

    private Map<String, Long> snapshotMtimes() throws IOException {
        Map<String, Long> snapshot = new HashMap<>();
        try (DirectoryReader reader = openReader()) {
            for (LeafReaderContext leaf : reader.leaves()) {
                LeafReader leafReader = leaf.reader();
                Bits liveDocs = leafReader.getLiveDocs();
                StoredFields storedFields = leafReader.storedFields();
                NumericDocValues mtimes = DocValues.getNumeric(leafReader, MTIME);
                for (int doc = 0; doc < leafReader.maxDoc(); doc++) {
                    if (liveDocs != null && !liveDocs.get(doc)) {
                        continue;
                    }
                    String id = storedFields.document(doc, Set.of(DOC_ID)).get(DOC_ID);
                    long mtime = mtimes.advanceExact(doc) ? mtimes.longValue() : Long.MIN_VALUE;
                    snapshot.merge(id, mtime, Math::max);
                }
            }
        }
        return snapshot;
    }

    private Query buildQuery(String text, List<String> fields, String collectionFilter) {
        if (text == null || text.isBlank()) {
            throw new ObsidxException(ErrorKind.INVALID_QUERY, "Query text must not be blank");
        }
        List<String> searchFields = fields == null || fields.isEmpty() ? DEFAULT_FIELDS : fields;
        for (String field : searchFields) {
            if (!SEARCHABLE_FIELDS.contains(field)) {
                throw new ObsidxException(ErrorKind.INVALID_QUERY,
                        "Field '" + field + "' is not full-text searchable; use one of " + SEARCHABLE_FIELDS);
            }
        }
        Map<String, Float> boosts = new HashMap<>();
        searchFields.forEach(field -> boosts.put(field, BOOSTS.get(field)));
        MultiFieldQueryParser parser = new MultiFieldQueryParser(searchFields.toArray(new String[0]), analyzer, boosts);
        Query parsed;
        try {
            parsed = parser.parse(text);
        } catch (ParseException e) {
            throw new ObsidxException(ErrorKind.INVALID_QUERY, "Cannot parse query '" + text + "': " + e.getMessage(), e);
        }
        if (collectionFilter == null) {
            return parsed;
        }
        return new BooleanQuery.Builder()
                .add(parsed, BooleanClause.Occur.MUST)
                .add(new TermQuery(new Term(COLLECTION, collectionFilter)), BooleanClause.Occur.FILTER)
                .build();
    }

    private Document toDocument(Note note) throws JsonProcessingException {
        Document document = new Document();
        document.add(new StringField(DOC_ID, note.id(), Field.Store.YES));
        document.add(new StringField(PATH, note.path(), Field.Store.YES));
        document.add(new StringField(COLLECTION, note.collection(), Field.Store.YES));
        document.add(new TextField(TITLE, note.title(), Field.Store.YES));
        document.add(new TextField(CONTENT, note.body(), Field.Store.YES));
        document.add(new TextField(TAGS, String.join(TAG_SEPARATOR, note.tags()), Field.Store.NO));
        document.add(new StoredField(TAG_LIST, mapper.writeValueAsString(note.tags())));
        document.add(new StoredField(LINKS, mapper.writeValueAsString(note.links())));
        document.add(new StoredField(HEADINGS, mapper.writeValueAsString(note.headings())));
        document.add(new StoredField(FRONTMATTER, mapper.writeValueAsString(note.frontmatter())));
        for (String link : note.links()) {
            document.add(new StringField(LINK, link, Field.Store.NO));
        }
        document.add(new NumericDocValuesField(MTIME, note.mtime()));
        document.add(new StoredField(MTIME, note.mtime()));
        return document;
    }

    private Note toNote(Document document) {
        String path = document.get(PATH);
        IndexableField mtimeField = document.getField(MTIME);
        return new Note(
                document.get(DOC_ID),
                path,
                document.get(COLLECTION),
                document.get(TITLE),
                readList(document.get(TAG_LIST), TAG_LIST, path),
                readList(document.get(HEADINGS), HEADINGS, path),
                readList(document.get(LINKS), LINKS, path),
                readObject(document.get(FRONTMATTER), path),
                document.get(CONTENT),
                mtimeField == null || mtimeField.numericValue() == null ? 0L : mtimeField.numericValue().longValue());
    }

    private List<String> readList(String json, String field, String path) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return mapper.readValue(json, new TypeReference<List<String>>() {
            });
        } catch (JsonProcessingException e) {
            log.warn("lexical.record.malformed path={} field={} reason={}", path, field, e.getOriginalMessage());
            return List.of();
        }
    }

    private ObjectNode readObject(String json, String path) {
        if (json == null || json.isBlank()) {
            return JsonNodeFactory.instance.objectNode();
        }
        try {
            JsonNode node = mapper.readTree(json);
            if (node instanceof ObjectNode object) {
                return object;
            }
        } catch (JsonProcessingException e) {
            log.warn("lexical.record.malformed path={} field={} reason={}", path, FRONTMATTER, e.getOriginalMessage());
        }
        return JsonNodeFactory.instance.objectNode();
    }

    private DirectoryReader openReader() throws IOException {
        return writer != null ? DirectoryReader.open(writer) : DirectoryReader.open(directory);
    }

    private IndexWriter requireWriter() {
        if (writer == null) {
            throw new IllegalStateException("Lexical index was opened read-only");
        }
        return writer;
    }

    private static ObsidxException translateOpenFailure(Path indexDir, IOException e) {
        if (e instanceof CorruptIndexException
                || e instanceof IndexFormatTooOldException
                || e instanceof IndexFormatTooNewException) {
            return new ObsidxException(ErrorKind.MALFORMED_INDEX, "Lexical index at " + indexDir + " is unreadable: " + e.getMessage(), e);
        }
        if (e instanceof LockObtainFailedException) {
            return new ObsidxException(ErrorKind.STORE_UNAVAILABLE, "Lexical index at " + indexDir + " is locked by another writer", e);
        }
        if (e instanceof IndexNotFoundException) {
            return new ObsidxException(ErrorKind.STORE_UNAVAILABLE,
                    "No index at " + indexDir + "; run 'obsidx index' first", e);
        }
        return new ObsidxException(ErrorKind.STORE_UNAVAILABLE, "Cannot open lexical index at " + indexDir + ": " + e.getMessage(), e);
    }

    private static void closeQuietly(Directory directory) {
        if (directory == null) {
            return;
        }
        try {
            directory.close();
        } catch (IOException e) {
            log.debug("lexical.close.failed reason={}", e.getMessage());
        }
    }
}
