package org.learningjava.vecstore.domain.model.store;

// typed content unit attached to a vector entry
public record Chunk(String type, String content) {

    public static Chunk empty() {
        return new Chunk("", "");
    }
}
