package vn.com.fecredit.fileportal.manager;

import vn.com.fecredit.fileportal.model.util.BitsetUtil;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * View over a session's arrival bitset.
 *
 * <p>
 * The tracker writes through to the array it wraps, so marking a chunk mutates the
 * session's persisted bitset. It is not thread-safe; callers hold the session lock.
 */
public class ChunkTracker {

    private final byte[] bitset;
    private final int totalChunks;

    public ChunkTracker(byte[] bitset, int totalChunks) {
        if (bitset == null || bitset.length != (totalChunks + 7) / 8) {
            throw new IllegalArgumentException("Bitset length does not match " + totalChunks + " chunks");
        }
        this.bitset = bitset;
        this.totalChunks = totalChunks;
    }

    public static ChunkTracker fresh(int totalChunks) {
        return new ChunkTracker(BitsetUtil.newBitset(totalChunks), totalChunks);
    }

    /**
     * Marks the index as arrived.
     *
     * @return {@code true} if the index was not present before
     */
    public boolean mark(int index) {
        checkIndex(index);
        if (BitsetUtil.isBitSet(bitset, index)) {
            return false;
        }
        BitsetUtil.setBit(bitset, index);
        return true;
    }

    public boolean isPresent(int index) {
        return index >= 0 && index < totalChunks && BitsetUtil.isBitSet(bitset, index);
    }

    public List<Integer> missingChunks() {
        return BitsetUtil.missingIndices(bitset, totalChunks);
    }

    public int uploadedCount() {
        return BitsetUtil.countSet(bitset, totalChunks);
    }

    public boolean isComplete() {
        return BitsetUtil.isFull(bitset);
    }

    /**
     * Uploaded share in percent, rounded half-up to two decimals.
     */
    public double progressPercent() {
        return BigDecimal.valueOf(uploadedCount() * 100.0 / totalChunks)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public int getTotalChunks() {
        return totalChunks;
    }

    public byte[] bitset() {
        return bitset;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= totalChunks) {
            throw new IndexOutOfBoundsException("Chunk index " + index + " outside [0, " + totalChunks + ")");
        }
    }
}
