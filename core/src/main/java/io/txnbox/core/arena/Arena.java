package io.txnbox.core.arena;

import java.util.ArrayList;
import java.util.List;

/**
 * Bump allocator for configuration text. Text is copied into fixed size character blocks and
 * handed back as {@link ArenaText} views, so compiled configuration never refers to the transient
 * YAML buffers. Nothing is reclaimed until {@link #release()}.
 *
 * <p>Not thread-safe. An arena belongs to exactly one compiler instance and is only written while
 * that instance compiles.
 */
public final class Arena {

    /** Default block size in characters. */
    public static final int DEFAULT_BLOCK_SIZE = 4096;

    private final int blockSize;
    private final List<char[]> blocks = new ArrayList<>();
    private char[] current;
    private int fill;
    private long allocated;
    private boolean released;

    public Arena() {
        this(DEFAULT_BLOCK_SIZE);
    }

    public Arena(int blockSize) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("blockSize must be positive, got: " + blockSize);
        }
        this.blockSize = blockSize;
    }

    /**
     * Copies {@code text} into the arena.
     *
     * @param text text to copy; a view already owned by this arena is returned unchanged
     * @return a view of the copy, valid for the lifetime of the owning compiler instance
     */
    public ArenaText localize(CharSequence text) {
        if (released) {
            throw new IllegalStateException("arena has been released");
        }
        if (text instanceof ArenaText view && view.owner() == this) {
            return view;
        }
        int length = text.length();
        char[] block = reserve(length);
        int offset = block == current ? fill : 0;
        for (int i = 0; i < length; i++) {
            block[offset + i] = text.charAt(i);
        }
        if (block == current) {
            fill += length;
        }
        allocated += length;
        return new ArenaText(this, block, offset, length);
    }

    /** Characters handed out so far. */
    public long allocated() {
        return allocated;
    }

    /** Number of blocks obtained so far. */
    public int blockCount() {
        return blocks.size();
    }

    public boolean isReleased() {
        return released;
    }

    /** Drops all blocks. Existing views keep their content but no further allocation is possible. */
    public void release() {
        blocks.clear();
        current = null;
        fill = 0;
        released = true;
    }

    private char[] reserve(int length) {
        // Oversized text gets its own block and leaves the current block in place.
        if (length > blockSize / 2) {
            char[] dedicated = new char[length];
            blocks.add(dedicated);
            return dedicated;
        }
        if (current == null || fill + length > current.length) {
            current = new char[blockSize];
            fill = 0;
            blocks.add(current);
        }
        return current;
    }
}
