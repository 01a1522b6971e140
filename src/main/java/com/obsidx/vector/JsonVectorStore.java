package com.obsidx.vector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.obsidx.note.Note;
import com.obsidx.runtime.ErrorKind;
import com.obsidx.runtime.ObsidxException;

/**
 * Chunk and embedding store kept in memory and persisted as JSON under
 * {@code <location>/vectors}. Chunks keep insertion order, which is the
 * tie-break for equal similarity scores.
 */
public class JsonVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(JsonVectorStore.class);
    static final String DIRECTORY = "vectors";
    static final String CHUNKS_FILE = "chunks.json";
    static final String MTIMES_FILE = "mtimes.json";

    private final Path directory;
    private final EmbeddingService embeddingService;
    private final List<IndexedChunk> chunks;
    private final Map<String, Long> mtimes;
    private final MtimeTable mtimeTable = new MtimeTable();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonVectorStore(Path directory, EmbeddingService embeddingService, List<IndexedChunk> chunks, Map<String, Long> mtimes) {
        this.directory = directory;
        this.embeddingService = embeddingService;
        this.chunks = chunks;
        this.mtimes = mtimes;
    }

    public static JsonVectorStore openOrCreate(Path location, EmbeddingService embeddingService) {
        Path directory = location.resolve(DIRECTORY);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ObsidxException(ErrorKind.STORE_UNAVAILABLE, "Cannot create vector store at " + directory, e);
        }

        Path chunksPath = directory.resolve(CHUNKS_FILE);
        Path mtimesPath = directory.resolve(MTIMES_FILE);
        try {
            List<IndexedChunk> chunks = new ArrayList<>();
            if (Files.exists(chunksPath) && Files.size(chunksPath) > 0L) {
                chunks.addAll(new ObjectMapper().readValue(chunksPath.toFile(), new TypeReference<List<IndexedChunk>>() {
                }));
            }
            Map<String, Long> mtimes = new MtimeTable().load(mtimesPath);
            log.debug("vectors.opened location={} chunks={} notes={}", directory, chunks.size(), mtimes.size());
            return new JsonVectorStore(directory, embeddingService, chunks, mtimes);
        } catch (JsonProcessingException e) {
            throw new ObsidxException(ErrorKind.MALFORMED_INDEX, "Vector store files under " + directory + " are not readable: "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ObsidxException(ErrorKind.STORE_UNAVAILABLE, "Cannot read vector store at " + directory, e);
        }
    }

    @Override
    public boolean upsertNote(Note note, ChunkParams params, boolean incremental) {
        Long stored = mtimes.get(note.id());
        if (incremental && stored != null && stored >= note.mtime()) {
            return false;
        }

        removeByNoteId(note.id());
        Set<String> seenHashes = new HashSet<>();
        for (Chunk chunk : new Chunker(params).chunk(note)) {
            if (!seenHashes.add(chunk.contentHash())) {
                continue;
            }
            Embedding embedding = embeddingService.embedVersioned(chunk.text());
            chunks.add(new IndexedChunk(chunk, embedding.vector(), embedding.version()));
        }
        mtimes.put(note.id(), note.mtime());
        return true;
    }

    @Override
    public List<SimilarityHit> queryBySimilarity(String text, int limit, String collectionFilter) {
        if (limit <= 0) {
            return List.of();
        }
        Embedding query = embeddingService.embedVersioned(text);
        List<SimilarityHit> hits = new ArrayList<>();
        for (IndexedChunk indexed : chunks) {
            Chunk chunk = indexed.chunk();
            if (collectionFilter != null && !collectionFilter.equals(chunk.collection())) {
                continue;
            }
            // vectors from different embedding versions are not comparable
            float score = query.version().equals(indexed.embeddingVersion()) ? cosine(query.vector(), indexed.embedding()) : 0f;
            hits.add(new SimilarityHit(chunk.path(), chunk.chunkIndex(), chunk.text(), score));
        }
        // List.sort is stable, so equal scores keep storage order
        hits.sort(Comparator.comparingDouble(SimilarityHit::score).reversed());
        return List.copyOf(hits.subList(0, Math.min(limit, hits.size())));
    }

    @Override
    public boolean requiresReembedding(String embeddingVersion) {
        return chunks.stream().anyMatch(chunk -> !embeddingVersion.equals(chunk.embeddingVersion()));
    }

    @Override
    public void clear() {
        chunks.clear();
        mtimes.clear();
    }

    @Override
    public int chunkCount() {
        return chunks.size();
    }

    public Map<String, Long> mtimes() {
        return Map.copyOf(mtimes);
    }

    @Override
    public void save() throws IOException {
        Files.createDirectories(directory);
        Path chunksPath = directory.resolve(CHUNKS_FILE);
        Path tmp = directory.resolve(CHUNKS_FILE + ".tmp");
        objectMapper.writeValue(tmp.toFile(), chunks);
        Files.move(tmp, chunksPath, StandardCopyOption.REPLACE_EXISTING);
        // the side table follows the chunks it describes
        mtimeTable.save(directory.resolve(MTIMES_FILE), mtimes);
    }

    private void removeByNoteId(String noteId) {
        chunks.removeIf(indexed -> indexed.chunk().noteId().equals(noteId));
    }

    static float cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 0f;
        }
        float dot = 0f;
        float aNorm = 0f;
        float bNorm = 0f;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0f || bNorm == 0f) {
            return 0f;
        }
        return (float) (dot / Math.sqrt(aNorm * bNorm));
    }

    public record IndexedChunk(Chunk chunk, float[] embedding, String embeddingVersion) {
    }
}
