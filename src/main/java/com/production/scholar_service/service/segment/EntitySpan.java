package com.production.scholar_service.service.segment;

/**
 * A recognized entity occurrence; {@code end} is exclusive.
 */
public record EntitySpan(String type, String text, int start, int end) {

    public boolean contains(int offset) {
        return offset > start && offset < end;
    }

    public boolean within(int from, int to) {
        return start >= from && end <= to;
    }

    public int length() {
        return end - start;
    }
}
