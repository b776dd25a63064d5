package com.troveindexer.ingestion.store;

import com.troveindexer.domain.HistoryEntry;
import com.troveindexer.domain.LifecycleOperation;
import com.troveindexer.domain.Position;
import com.troveindexer.domain.PositionRepository;
import com.troveindexer.domain.PositionStatus;
import com.troveindexer.domain.TroveUpdatedEvent;
import com.troveindexer.ingestion.adapter.RawLog;
import com.troveindexer.ingestion.decoder.LogEventDecoder;
import com.troveindexer.ingestion.position.DuplicateIdentityException;
import com.troveindexer.ingestion.position.FoldOutcome;
import com.troveindexer.ingestion.position.PositionNotFoundException;
import com.troveindexer.ingestion.position.PositionState;
import com.troveindexer.ingestion.position.PositionStateFolder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static com.troveindexer.ingestion.TroveLogFixtures.ASSET;
import static com.troveindexer.ingestion.TroveLogFixtures.WALLET;
import static com.troveindexer.ingestion.TroveLogFixtures.ether;
import static com.troveindexer.ingestion.TroveLogFixtures.troveUpdated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = "troveindexer.ingestion.tailing.enabled=false")
@Testcontainers(disabledWithoutDocker = true)
class MongoPositionGatewayIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    MongoPositionGateway gateway;
    @Autowired
    PositionRepository positionRepository;
    @Autowired
    PositionStateFolder folder;
    @Autowired
    LogEventDecoder decoder;

    @BeforeEach
    void clean() {
        positionRepository.deleteAll();
    }

    @Test
    @DisplayName("nextIdentity is 1 on an empty store, then max + 1")
    void nextIdentity_emptyThenMaxPlusOne() {
        assertThat(gateway.nextIdentity()).isEqualTo(1L);

        gateway.insert(position(1L, "0xh1"));
        gateway.insert(position(5L, "0xh5"));

        assertThat(gateway.nextIdentity()).isEqualTo(6L);
    }

    @Test
    @DisplayName("Opened then Adjusted to zero debt: liquidated, ratio 0, two history entries")
    void openedThenAdjustedToZero_liquidated() {
        assertThat(folder.fold(decode(troveUpdated("0xaa01", 100L, 0L, ether(5), ether(10), 0))))
                .isEqualTo(FoldOutcome.CREATED);
        assertThat(folder.fold(decode(troveUpdated("0xaa02", 101L, 2L, BigInteger.ZERO, ether(10), 2))))
                .isEqualTo(FoldOutcome.UPDATED);

        Position stored = positionRepository.findByPositionId(1L).orElseThrow();
        assertThat(stored.getWalletAddress()).isEqualTo(WALLET);
        assertThat(stored.getAsset()).isEqualTo(ASSET);
        assertThat(stored.getStatus()).isEqualTo(PositionStatus.LIQUIDATED);
        assertThat(stored.getHealthRatio()).isEqualByComparingTo("0");
        assertThat(stored.getCollateral()).isEqualByComparingTo("10");
        assertThat(stored.getDebt()).isEqualByComparingTo("0");
        assertThat(stored.getBlockNumber()).isEqualTo(101L);
        assertThat(stored.getHistory()).extracting(HistoryEntry::operation)
                .containsExactly(LifecycleOperation.OPENED, LifecycleOperation.ADJUSTED);
    }

    @Test
    @DisplayName("re-applying the same logs leaves state and history unchanged")
    void replay_isIdempotent() {
        List<TroveUpdatedEvent> events = List.of(
                decode(troveUpdated("0xbb01", 200L, 0L, ether(1), ether(2), 0)),
                decode(troveUpdated("0xbb02", 201L, 0L, ether(3), ether(4), 2)));
        events.forEach(folder::fold);
        Position before = positionRepository.findByPositionId(1L).orElseThrow();

        events.forEach(e -> assertThat(folder.fold(e)).isEqualTo(FoldOutcome.REPLAYED));

        assertThat(positionRepository.count()).isEqualTo(1L);
        Position after = positionRepository.findByPositionId(1L).orElseThrow();
        assertThat(after.getHistory()).hasSize(before.getHistory().size());
        assertThat(after.getDebt()).isEqualByComparingTo(before.getDebt());
    }

    @Test
    @DisplayName("updateLatest refuses a history entry the position already holds")
    void updateLatest_sameSourceLog_notApplied() {
        gateway.insert(position(1L, "0xcc01"));
        HistoryEntry entry = new HistoryEntry("0xcc02", 1L, BigDecimal.ONE, BigDecimal.ONE,
                LifecycleOperation.ADJUSTED, Instant.now(), 11L);
        PositionState state = new PositionState(BigDecimal.ONE, BigDecimal.ONE, new BigDecimal("100.00"),
                PositionStatus.ACTIVE, 11L);

        assertThat(gateway.updateLatest(WALLET, ASSET, EnumSet.of(PositionStatus.ACTIVE), state, entry)).isTrue();
        assertThat(gateway.updateLatest(WALLET, ASSET, EnumSet.of(PositionStatus.ACTIVE), state, entry)).isFalse();
        assertThat(positionRepository.findByPositionId(1L).orElseThrow().getHistory()).hasSize(2);
    }

    @Test
    @DisplayName("updateLatest without a matching record fails with PositionNotFound")
    void updateLatest_noMatch_notFound() {
        HistoryEntry entry = new HistoryEntry("0xdd01", 0L, BigDecimal.ONE, BigDecimal.ONE,
                LifecycleOperation.ADJUSTED, Instant.now(), 1L);
        PositionState state = new PositionState(BigDecimal.ONE, BigDecimal.ONE, new BigDecimal("100.00"),
                PositionStatus.ACTIVE, 1L);

        assertThatThrownBy(() -> gateway.updateLatest(WALLET, ASSET, EnumSet.of(PositionStatus.ACTIVE), state, entry))
                .isInstanceOf(PositionNotFoundException.class);
    }

    @Test
    @DisplayName("inserting a taken positionId for another lifecycle is a DuplicateIdentity")
    void insert_takenIdentity_duplicate() {
        gateway.insert(position(3L, "0xee01"));

        assertThatThrownBy(() -> gateway.insert(position(3L, "0xee02")))
                .isInstanceOf(DuplicateIdentityException.class)
                .hasMessageContaining("3");
    }

    @Test
    @DisplayName("inserting the same opening log twice returns the existing record")
    void insert_sameOpeningLog_returnsExisting() {
        Position first = gateway.insert(position(1L, "0xff01"));

        Position second = gateway.insert(position(2L, "0xff01"));

        assertThat(second.getPositionId()).isEqualTo(first.getPositionId());
        assertThat(positionRepository.count()).isEqualTo(1L);
    }

    private TroveUpdatedEvent decode(RawLog log) {
        return (TroveUpdatedEvent) decoder.decode(log).orElseThrow();
    }

    private static Position position(long id, String openingTx) {
        Position p = new Position();
        p.setPositionId(id);
        p.setWalletAddress(WALLET);
        p.setAsset(ASSET);
        p.setCollateral(new BigDecimal("2"));
        p.setDebt(new BigDecimal("1"));
        p.setHealthRatio(new BigDecimal("50.00"));
        p.setStatus(PositionStatus.ACTIVE);
        p.setBlockNumber(10L);
        p.setHistory(new ArrayList<>(List.of(new HistoryEntry(openingTx, 0L, new BigDecimal("2"), new BigDecimal("1"),
                LifecycleOperation.OPENED, Instant.parse("2025-03-01T12:00:00Z"), 10L))));
        return p;
    }
}
