package eu.virtualparadox.docingest.ingest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bookkeeping attached to every chunk handed to the embedding/storage side.
 * <p>
 * The typed components are always present; page and character spans only when the
 * document was chunked with page context. Anything else the caller wants stored
 * travels in {@code extra} and can never overwrite a typed field in {@link #toPayload()}.
 */
public record ChunkMetadata(String filename,
                            String fileType,
                            String contentHash,
                            int chunkIndex,
                            int totalChunks,
                            List<Integer> pages,
                            String pageRange,
                            Integer charStart,
                            Integer charEnd,
                            Map<String, Object> extra) {

    public ChunkMetadata {
        pages = pages == null ? List.of() : List.copyOf(pages);
        pageRange = pageRange == null ? "" : pageRange;
        // JSON-sourced extras may hold null values, which Map.copyOf rejects
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public static ChunkMetadata of(final String filename,
                                   final String fileType,
                                   final String contentHash,
                                   final int chunkIndex,
                                   final int totalChunks,
                                   final Map<String, Object> extra) {
        return new ChunkMetadata(filename, fileType, contentHash, chunkIndex, totalChunks,
                List.of(), "", null, null, extra);
    }

    public static ChunkMetadata ofChunk(final String filename,
                                        final String fileType,
                                        final String contentHash,
                                        final int chunkIndex,
                                        final int totalChunks,
                                        final ChunkRecord chunk,
                                        final Map<String, Object> extra) {
        return new ChunkMetadata(filename, fileType, contentHash, chunkIndex, totalChunks,
                chunk.pages(), chunk.pageRangeLabel(), chunk.charStart(), chunk.charEnd(), extra);
    }

    public boolean hasCharSpan() {
        return charStart != null && charEnd != null;
    }

    /**
     * Flat key/value view for vector store payloads.
     */
    public Map<String, Object> toPayload() {
        final Map<String, Object> payload = new LinkedHashMap<>(extra);
        payload.put("filename", filename);
        payload.put("file_type", fileType);
        payload.put("file_hash", contentHash);
        payload.put("chunk_index", chunkIndex);
        payload.put("total_chunks", totalChunks);
        if (hasCharSpan()) {
            payload.put("pages", pages);
            payload.put("page_range", pageRange);
            payload.put("char_start", charStart);
            payload.put("char_end", charEnd);
        }
        return payload;
    }
}
