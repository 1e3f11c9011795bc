package vn.com.fecredit.fileportal.model.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Bit operations over the chunk-arrival bitset of an upload session.
 *
 * <p>Bit {@code i} lives in byte {@code i / 8} at position {@code i % 8}. Padding bits
 * beyond the chunk count are kept set, so a bitset is complete exactly when every
 * byte equals {@code 0xFF}.
 */
public final class BitsetUtil {

    private BitsetUtil() {
    }

    /**
     * Allocates a bitset for the given number of chunks with the padding bits already set.
     */
    public static byte[] newBitset(int totalChunks) {
        if (totalChunks <= 0) {
            throw new IllegalArgumentException("totalChunks must be positive: " + totalChunks);
        }
        byte[] bitset = new byte[(totalChunks + 7) / 8];
        setUnusedBits(bitset, totalChunks);
        return bitset;
    }

    /**
     * Sets every bit at or beyond {@code totalChunks} to 1.
     */
    public static void setUnusedBits(byte[] bitset, int totalChunks) {
        if (bitset == null) return;
        for (int i = totalChunks; i < bitset.length * 8; i++) {
            setBit(bitset, i);
        }
    }

    public static void setBit(byte[] bitset, int bitIndex) {
        if (bitset != null && bitIndex >= 0) {
            int byteIndex = bitIndex / 8;
            if (byteIndex < bitset.length) {
                bitset[byteIndex] |= (byte) (1 << (bitIndex % 8));
            }
        }
    }

    public static boolean isBitSet(byte[] bitset, int bitIndex) {
        if (bitset == null || bitIndex < 0) return false;
        int byteIndex = bitIndex / 8;
        if (byteIndex >= bitset.length) return false;
        return (bitset[byteIndex] & (1 << (bitIndex % 8))) != 0;
    }

    /**
     * True when every byte is {@code 0xFF}, which with padding bits set means every chunk arrived.
     */
    public static boolean isFull(byte[] bitset) {
        if (bitset == null) return false;
        for (byte b : bitset) {
            if (b != (byte) 0xFF) {
                return false;
            }
        }
        return true;
    }

    /**
     * Indices below {@code totalChunks} whose bit is clear, in ascending order.
     */
    public static List<Integer> missingIndices(byte[] bitset, int totalChunks) {
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < totalChunks; i++) {
            if (!isBitSet(bitset, i)) {
                missing.add(i);
            }
        }
        return missing;
    }

    /**
     * Number of bits set below {@code totalChunks}; padding is not counted.
     */
    public static int countSet(byte[] bitset, int totalChunks) {
        int count = 0;
        for (int i = 0; i < totalChunks; i++) {
            if (isBitSet(bitset, i)) {
                count++;
            }
        }
        return count;
    }
}
