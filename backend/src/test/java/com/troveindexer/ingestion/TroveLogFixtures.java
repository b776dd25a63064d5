package com.troveindexer.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.troveindexer.ingestion.adapter.RawLog;
import com.troveindexer.ingestion.config.WatchedContractsProperties.WatchedContract;
import com.troveindexer.ingestion.decoder.DecodingTable;
import com.troveindexer.ingestion.decoder.DecodingTableLoader;
import org.springframework.core.io.DefaultResourceLoader;
import org.web3j.abi.EventEncoder;

import java.math.BigInteger;
import java.util.List;

/**
 * Raw TroveManager logs for decoder, pipeline and store tests.
 */
public final class TroveLogFixtures {

    public static final String TROVE_MANAGER = "0xe5d2644be06c5b5d48b42aa7f9eaf27f0bc84265";
    public static final String BORROWER_OPERATIONS = "0x165fb19121ab4f74dc66c520866b9ef4eb86aff8";
    public static final String WALLET = "0x742d35cc6634c0532925a3b844bc454e4438f44e";
    public static final String ASSET = "0x92a68f6de3ba732a13a0ddee7d5ee77b2b3bb63f";

    public static final String TROVE_UPDATED_TOPIC =
            EventEncoder.buildEventSignature("TroveUpdated(address,address,uint256,uint256,uint256,uint8)");
    public static final String TOTAL_STAKES_UPDATED_TOPIC =
            EventEncoder.buildEventSignature("TotalStakesUpdated(address,uint256)");

    public static final BigInteger ONE_E18 = BigInteger.TEN.pow(18);

    private TroveLogFixtures() {
    }

    public static DecodingTable decodingTable() {
        WatchedContract troveManager = new WatchedContract();
        troveManager.setName("TroveManager");
        troveManager.setAddress(TROVE_MANAGER);
        troveManager.setAbi("classpath:abi/TroveManager.json");
        WatchedContract borrowerOperations = new WatchedContract();
        borrowerOperations.setName("BorrowerOperations");
        borrowerOperations.setAddress(BORROWER_OPERATIONS);
        borrowerOperations.setAbi("classpath:abi/BorrowerOperations.json");
        return new DecodingTableLoader(new DefaultResourceLoader(), new ObjectMapper())
                .load(List.of(troveManager, borrowerOperations));
    }

    /** TroveUpdated(wallet, asset, debt, coll, stake, op) from TroveManager. */
    public static RawLog troveUpdated(String txHash, long block, long logIndex,
                                      BigInteger debt, BigInteger coll, int operation) {
        return troveUpdated(txHash, block, logIndex, WALLET, ASSET, debt, coll, operation);
    }

    public static RawLog troveUpdated(String txHash, long block, long logIndex, String wallet, String asset,
                                      BigInteger debt, BigInteger coll, int operation) {
        return new RawLog(
                TROVE_MANAGER,
                List.of(TROVE_UPDATED_TOPIC, addressTopic(wallet), addressTopic(asset)),
                data(debt, coll, coll, BigInteger.valueOf(operation)),
                txHash,
                block,
                logIndex);
    }

    public static RawLog totalStakesUpdated(String txHash, long block, long logIndex, BigInteger stakes) {
        return new RawLog(TROVE_MANAGER, List.of(TOTAL_STAKES_UPDATED_TOPIC, addressTopic(ASSET)),
                data(stakes), txHash, block, logIndex);
    }

    public static String addressTopic(String address) {
        return "0x" + "0".repeat(24) + address.substring(2).toLowerCase();
    }

    public static String word(BigInteger value) {
        String hex = value.toString(16);
        return "0".repeat(64 - hex.length()) + hex;
    }

    public static String data(BigInteger... values) {
        StringBuilder sb = new StringBuilder("0x");
        for (BigInteger v : values) {
            sb.append(word(v));
        }
        return sb.toString();
    }

    public static BigInteger ether(long whole) {
        return BigInteger.valueOf(whole).multiply(ONE_E18);
    }
}
