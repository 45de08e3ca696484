package io.txnbox.core.arena;

import java.util.Objects;

/**
 * Read-only view of text stored in an {@link Arena}: a block, an offset and a length. Equality and
 * hashing follow {@link String} semantics on the content.
 */
public final class ArenaText implements CharSequence {

    private final Arena owner;
    private final char[] block;
    private final int offset;
    private final int length;

    ArenaText(Arena owner, char[] block, int offset, int length) {
        this.owner = owner;
        this.block = block;
        this.offset = offset;
        this.length = length;
    }

    Arena owner() {
        return owner;
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    public char charAt(int index) {
        Objects.checkIndex(index, length);
        return block[offset + index];
    }

    @Override
    public ArenaText subSequence(int start, int end) {
        Objects.checkFromToIndex(start, end, length);
        return new ArenaText(owner, block, offset + start, end - start);
    }

    public boolean contentEquals(CharSequence other) {
        if (other == null || other.length() != length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (block[offset + i] != other.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArenaText that && contentEquals(that);
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (int i = 0; i < length; i++) {
            h = 31 * h + block[offset + i];
        }
        return h;
    }

    @Override
    public String toString() {
        return new String(block, offset, length);
    }
}
