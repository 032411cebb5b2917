package com.creditrust.rag.index;

import com.creditrust.rag.ingest.Chunk;

public record ScoredChunk(Chunk chunk, double score) {
}
