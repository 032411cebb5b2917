package com.creditrust.rag.chat;

import com.creditrust.rag.index.ScoredChunk;
import com.creditrust.rag.ingest.Chunk;
import com.creditrust.rag.ingest.TextSpan;

/**
 * Reference from an answer to one of the excerpts it was generated from.
 */
public record Citation(String chunkId, String documentId, TextSpan span, String snippet, double score,
        String product, String company) {

    public static Citation of(ScoredChunk scored, int snippetLength) {
        Chunk chunk = scored.chunk();
        String text = chunk.text().strip();
        String snippet = text.length() <= snippetLength ? text : text.substring(0, snippetLength) + "...";
        return new Citation(chunk.id(), chunk.documentId(), chunk.span(), snippet, scored.score(),
                chunk.source().product(), chunk.source().company());
    }
}
