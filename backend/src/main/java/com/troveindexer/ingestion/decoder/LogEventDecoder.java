package com.troveindexer.ingestion.decoder;

import com.troveindexer.domain.AuditOnlyEvent;
import com.troveindexer.domain.DomainEvent;
import com.troveindexer.domain.LogMeta;
import com.troveindexer.domain.TroveUpdatedEvent;
import com.troveindexer.ingestion.adapter.RawLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a raw log into a typed {@link DomainEvent}. Unknown (address, topic 0) pairs are not errors and
 * yield empty; a resolved log whose payload does not fit its shape raises {@link PayloadDecodeException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LogEventDecoder {

    private final DecodingTable decodingTable;

    public Optional<DomainEvent> decode(RawLog rawLog) {
        Optional<EventShape> shape = decodingTable.resolve(rawLog.address(), rawLog.signatureTopic());
        if (shape.isEmpty()) {
            log.debug("Unresolved log {}:{} from {} topic0={}",
                    rawLog.txHash(), rawLog.logIndex(), rawLog.address(), rawLog.signatureTopic());
            return Optional.empty();
        }
        LogMeta meta = new LogMeta(
                rawLog.address(),
                rawLog.txHash(),
                rawLog.blockNumber(),
                rawLog.logIndex(),
                rawLog.topics().subList(1, rawLog.topics().size()));
        Map<String, Object> values = unpack(shape.get(), rawLog.data());
        return Optional.of(toDomainEvent(shape.get(), meta, values));
    }

    static Map<String, Object> unpack(EventShape shape, String data) {
        List<AbiParam> params = shape.nonIndexed();
        List<String> words = AbiWords.split(data);
        if (words.size() != params.size()) {
            throw new PayloadDecodeException(shape.name() + ": expected " + params.size()
                    + " words, payload has " + words.size());
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < params.size(); i++) {
            AbiParam param = params.get(i);
            values.put(param.name(), decodeWord(shape.name(), param, words.get(i)));
        }
        return values;
    }

    private static Object decodeWord(String eventName, AbiParam param, String word) {
        AbiType type = param.type();
        return switch (type.kind()) {
            case ADDRESS -> {
                requireZeroPrefix(eventName, param, word, 24);
                yield "0x" + word.substring(24);
            }
            case BOOL -> {
                BigInteger v = AbiWords.unsigned(word);
                if (v.compareTo(BigInteger.ONE) > 0) {
                    throw new PayloadDecodeException(eventName + "." + param.name() + ": invalid bool");
                }
                yield v.signum() == 1;
            }
            case UINT -> {
                BigInteger v = AbiWords.unsigned(word);
                if (v.bitLength() > type.bits()) {
                    throw new PayloadDecodeException(eventName + "." + param.name() + ": value overflows " + type.canonical());
                }
                yield v;
            }
            case INT -> {
                BigInteger v = AbiWords.signed(word);
                if (v.bitLength() > type.bits() - 1) {
                    throw new PayloadDecodeException(eventName + "." + param.name() + ": value overflows " + type.canonical());
                }
                yield v;
            }
            case FIXED_BYTES -> "0x" + word.substring(0, type.bits() / 4);
            case UNSUPPORTED -> throw new PayloadDecodeException(eventName + "." + param.name()
                    + ": unsupported type " + type.canonical());
        };
    }

    private static void requireZeroPrefix(String eventName, AbiParam param, String word, int hexChars) {
        for (int i = 0; i < hexChars; i++) {
            if (word.charAt(i) != '0') {
                throw new PayloadDecodeException(eventName + "." + param.name() + ": dirty high bytes");
            }
        }
    }

    private static DomainEvent toDomainEvent(EventShape shape, LogMeta meta, Map<String, Object> values) {
        if (TroveUpdatedEvent.NAME.equals(shape.name())) {
            return new TroveUpdatedEvent(
                    meta,
                    requireUint(shape, values, "debt"),
                    requireUint(shape, values, "coll"),
                    optionalUint(values, "stake"),
                    requireUint(shape, values, "operation").intValueExact());
        }
        return new AuditOnlyEvent(shape.name(), meta, values);
    }

    private static BigInteger requireUint(EventShape shape, Map<String, Object> values, String field) {
        BigInteger v = optionalUint(values, field);
        if (v == null) {
            throw new PayloadDecodeException(shape.name() + ": missing uint field " + field);
        }
        return v;
    }

    /** Looks the field up with and without the Solidity leading underscore. */
    private static BigInteger optionalUint(Map<String, Object> values, String field) {
        Object v = values.containsKey("_" + field) ? values.get("_" + field) : values.get(field);
        return v instanceof BigInteger b ? b : null;
    }
}
