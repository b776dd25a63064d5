package com.troveindexer.ingestion.decoder;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Hex helpers for 32-byte ABI words (log data and topics).
 */
public final class AbiWords {

    static final int WORD_HEX = 64;
    private static final BigInteger TWO_256 = BigInteger.ONE.shiftLeft(256);

    private AbiWords() {
    }

    /** Splits 0x-prefixed data into 64-hex-char words; fails when the length is not a whole number of words. */
    static List<String> split(String data) {
        String hex = strip0x(data);
        if (hex.length() % WORD_HEX != 0) {
            throw new PayloadDecodeException("Payload length " + hex.length() / 2 + " bytes is not a multiple of 32");
        }
        if (!hex.chars().allMatch(AbiWords::isHexDigit)) {
            throw new PayloadDecodeException("Payload is not hex");
        }
        List<String> words = new ArrayList<>(hex.length() / WORD_HEX);
        for (int i = 0; i < hex.length(); i += WORD_HEX) {
            words.add(hex.substring(i, i + WORD_HEX).toLowerCase());
        }
        return words;
    }

    /**
     * Lowercased 0x address held in the low 20 bytes of a topic; empty string for null or malformed topics.
     */
    public static String topicToAddress(String topic) {
        String hex = strip0x(topic);
        if (hex.length() != WORD_HEX) {
            return "";
        }
        return "0x" + hex.substring(WORD_HEX - 40).toLowerCase();
    }

    static BigInteger unsigned(String word) {
        return new BigInteger(word, 16);
    }

    static BigInteger signed(String word) {
        BigInteger v = unsigned(word);
        return v.testBit(255) ? v.subtract(TWO_256) : v;
    }

    static String strip0x(String hex) {
        if (hex == null) {
            return "";
        }
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

    private static boolean isHexDigit(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
