package com.production.scholar_service.lucene;

import com.production.scholar_service.model.Chunk;

/**
 * A chunk together with its embedding, the unit written to and read back from the index.
 */
public record IndexedChunk(Chunk chunk, float[] vector) {
}
