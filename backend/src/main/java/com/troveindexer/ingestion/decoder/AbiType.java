package com.troveindexer.ingestion.decoder;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Solidity ABI type of one event input. Only static single-word types are decodable; anything else is
 * kept as {@link Kind#UNSUPPORTED} so the event still resolves but its payload is rejected.
 */
public record AbiType(Kind kind, int bits, String canonical) {

    private static final Pattern UINT = Pattern.compile("uint(\\d*)");
    private static final Pattern INT = Pattern.compile("int(\\d*)");
    private static final Pattern FIXED_BYTES = Pattern.compile("bytes(\\d+)");

    public enum Kind {
        ADDRESS,
        BOOL,
        UINT,
        INT,
        FIXED_BYTES,
        UNSUPPORTED
    }

    public static AbiType parse(String solidityType) {
        String t = solidityType == null ? "" : solidityType.strip();
        if (t.equals("address")) {
            return new AbiType(Kind.ADDRESS, 160, t);
        }
        if (t.equals("bool")) {
            return new AbiType(Kind.BOOL, 8, t);
        }
        Matcher m = UINT.matcher(t);
        if (m.matches()) {
            int bits = m.group(1).isEmpty() ? 256 : Integer.parseInt(m.group(1));
            return validBits(bits) ? new AbiType(Kind.UINT, bits, "uint" + bits) : unsupported(t);
        }
        m = INT.matcher(t);
        if (m.matches()) {
            int bits = m.group(1).isEmpty() ? 256 : Integer.parseInt(m.group(1));
            return validBits(bits) ? new AbiType(Kind.INT, bits, "int" + bits) : unsupported(t);
        }
        m = FIXED_BYTES.matcher(t);
        if (m.matches()) {
            int size = Integer.parseInt(m.group(1));
            return size >= 1 && size <= 32 ? new AbiType(Kind.FIXED_BYTES, size * 8, t) : unsupported(t);
        }
        return unsupported(t);
    }

    public boolean isDecodable() {
        return kind != Kind.UNSUPPORTED;
    }

    private static boolean validBits(int bits) {
        return bits >= 8 && bits <= 256 && bits % 8 == 0;
    }

    private static AbiType unsupported(String t) {
        return new AbiType(Kind.UNSUPPORTED, 0, t);
    }
}
