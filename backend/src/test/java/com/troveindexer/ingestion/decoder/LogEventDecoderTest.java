package com.troveindexer.ingestion.decoder;

import com.troveindexer.domain.AuditOnlyEvent;
import com.troveindexer.domain.DomainEvent;
import com.troveindexer.domain.LifecycleOperation;
import com.troveindexer.domain.TroveUpdatedEvent;
import com.troveindexer.ingestion.adapter.RawLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static com.troveindexer.ingestion.TroveLogFixtures.ASSET;
import static com.troveindexer.ingestion.TroveLogFixtures.BORROWER_OPERATIONS;
import static com.troveindexer.ingestion.TroveLogFixtures.TROVE_MANAGER;
import static com.troveindexer.ingestion.TroveLogFixtures.TROVE_UPDATED_TOPIC;
import static com.troveindexer.ingestion.TroveLogFixtures.WALLET;
import static com.troveindexer.ingestion.TroveLogFixtures.addressTopic;
import static com.troveindexer.ingestion.TroveLogFixtures.data;
import static com.troveindexer.ingestion.TroveLogFixtures.decodingTable;
import static com.troveindexer.ingestion.TroveLogFixtures.ether;
import static com.troveindexer.ingestion.TroveLogFixtures.totalStakesUpdated;
import static com.troveindexer.ingestion.TroveLogFixtures.troveUpdated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogEventDecoderTest {

    private LogEventDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new LogEventDecoder(decodingTable());
    }

    @Test
    void decode_troveUpdated_yieldsTypedEvent() {
        RawLog log = troveUpdated("0xabc", 3772001L, 4L, ether(1000), ether(2), 0);

        Optional<DomainEvent> decoded = decoder.decode(log);

        assertThat(decoded).get().isInstanceOf(TroveUpdatedEvent.class);
        TroveUpdatedEvent event = (TroveUpdatedEvent) decoded.get();
        assertThat(event.debt()).isEqualTo(ether(1000));
        assertThat(event.collateral()).isEqualTo(ether(2));
        assertThat(event.stake()).isEqualTo(ether(2));
        assertThat(event.operation()).isEqualTo(LifecycleOperation.OPENED);
        assertThat(event.meta().txHash()).isEqualTo("0xabc");
        assertThat(event.meta().blockNumber()).isEqualTo(3772001L);
        assertThat(event.meta().logIndex()).isEqualTo(4L);
        assertThat(event.meta().topic(1)).contains(addressTopic(WALLET));
        assertThat(event.meta().topic(2)).contains(addressTopic(ASSET));
        assertThat(event.meta().topic(3)).isEmpty();
    }

    @Test
    void decode_otherResolvedEvent_yieldsAuditOnlyEvent() {
        Optional<DomainEvent> decoded = decoder.decode(totalStakesUpdated("0xdef", 10L, 0L, ether(5)));

        assertThat(decoded).get().isInstanceOf(AuditOnlyEvent.class);
        assertThat(decoded.get().name()).isEqualTo("TotalStakesUpdated");
        assertThat(decoded.get().auditFields()).containsEntry("_newTotalStakes", ether(5));
    }

    @Test
    void decode_unknownTopic_isEmpty() {
        RawLog log = new RawLog(TROVE_MANAGER, List.of("0x" + "1".repeat(64)), "0x", "0x1", 1L, 0L);

        assertThat(decoder.decode(log)).isEmpty();
    }

    @Test
    void decode_knownTopicFromUnwatchedContract_isEmpty() {
        RawLog log = new RawLog("0x0000000000000000000000000000000000000001",
                List.of(TROVE_UPDATED_TOPIC, addressTopic(WALLET), addressTopic(ASSET)),
                data(BigInteger.ONE, BigInteger.ONE, BigInteger.ONE, BigInteger.ZERO), "0x1", 1L, 0L);

        assertThat(decoder.decode(log)).isEmpty();
    }

    @Test
    void decode_topicOnlyKnownOnOtherContract_isEmpty() {
        RawLog log = new RawLog(BORROWER_OPERATIONS,
                List.of(TROVE_UPDATED_TOPIC, addressTopic(WALLET), addressTopic(ASSET)),
                data(BigInteger.ONE, BigInteger.ONE, BigInteger.ONE, BigInteger.ZERO), "0x1", 1L, 0L);

        assertThat(decoder.decode(log)).isEmpty();
    }

    @Test
    void decode_logWithoutTopics_isEmpty() {
        assertThat(decoder.decode(new RawLog(TROVE_MANAGER, List.of(), "0x", "0x1", 1L, 0L))).isEmpty();
    }

    @Test
    void decode_truncatedPayload_throwsPayloadDecode() {
        RawLog log = new RawLog(TROVE_MANAGER,
                List.of(TROVE_UPDATED_TOPIC, addressTopic(WALLET), addressTopic(ASSET)),
                data(BigInteger.ONE, BigInteger.ONE, BigInteger.ONE, BigInteger.ZERO).substring(0, 200),
                "0x1", 1L, 0L);

        assertThatThrownBy(() -> decoder.decode(log))
                .isInstanceOf(PayloadDecodeException.class)
                .hasMessageContaining("not a multiple of 32");
    }

    @Test
    void decode_missingWord_throwsPayloadDecode() {
        RawLog log = new RawLog(TROVE_MANAGER,
                List.of(TROVE_UPDATED_TOPIC, addressTopic(WALLET), addressTopic(ASSET)),
                data(BigInteger.ONE, BigInteger.ONE, BigInteger.ONE), "0x1", 1L, 0L);

        assertThatThrownBy(() -> decoder.decode(log))
                .isInstanceOf(PayloadDecodeException.class)
                .hasMessageContaining("expected 4 words");
    }

    @Test
    void decode_operationOverflowsUint8_throwsPayloadDecode() {
        RawLog log = new RawLog(TROVE_MANAGER,
                List.of(TROVE_UPDATED_TOPIC, addressTopic(WALLET), addressTopic(ASSET)),
                data(BigInteger.ONE, BigInteger.ONE, BigInteger.ONE, BigInteger.valueOf(256)), "0x1", 1L, 0L);

        assertThatThrownBy(() -> decoder.decode(log))
                .isInstanceOf(PayloadDecodeException.class)
                .hasMessageContaining("_operation");
    }

    @Test
    void decode_nonHexPayload_throwsPayloadDecode() {
        RawLog log = new RawLog(TROVE_MANAGER,
                List.of(TROVE_UPDATED_TOPIC, addressTopic(WALLET), addressTopic(ASSET)),
                "0x" + "zz".repeat(128), "0x1", 1L, 0L);

        assertThatThrownBy(() -> decoder.decode(log)).isInstanceOf(PayloadDecodeException.class);
    }
}
