package com.troveindexer.ingestion.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.troveindexer.ingestion.config.WatchedContractsProperties.WatchedContract;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.web3j.abi.EventEncoder;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the {@link DecodingTable} from each watched contract's ABI JSON (plain ABI array, or a build
 * artifact with an "abi" field). Topic hashes are keccak256 of the canonical event signature.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DecodingTableLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalStateException when an ABI cannot be read or parsed; the service must not start without it
     */
    public DecodingTable load(List<WatchedContract> contracts) {
        DecodingTable.Builder builder = DecodingTable.builder();
        for (WatchedContract contract : contracts) {
            List<EventShape> shapes = readShapes(contract.getName(), contract.getAbi());
            shapes.forEach(shape -> builder.add(contract.getAddress(), shape));
            log.info("Decoding table: {} ({}) → {} events: {}", contract.getName(), contract.getAddress().toLowerCase(),
                    shapes.size(), shapes.stream().map(EventShape::name).collect(Collectors.joining(", ")));
        }
        return builder.build();
    }

    List<EventShape> readShapes(String contractName, String abiLocation) {
        Resource resource = resourceLoader.getResource(abiLocation);
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ABI " + abiLocation + " for " + contractName, e);
        }
        JsonNode entries = root.isArray() ? root : root.path("abi");
        if (!entries.isArray()) {
            throw new IllegalStateException("ABI " + abiLocation + " is neither an array nor an artifact with 'abi'");
        }
        List<EventShape> shapes = new ArrayList<>();
        for (JsonNode entry : entries) {
            if (!"event".equals(entry.path("type").asText()) || entry.path("anonymous").asBoolean(false)) {
                continue;
            }
            String name = entry.path("name").asText();
            List<AbiParam> inputs = new ArrayList<>();
            for (JsonNode input : entry.path("inputs")) {
                inputs.add(new AbiParam(
                        input.path("name").asText(),
                        AbiType.parse(input.path("type").asText()),
                        input.path("indexed").asBoolean(false)));
            }
            if (inputs.stream().anyMatch(p -> p.type().kind() == AbiType.Kind.UNSUPPORTED
                    && p.type().canonical().startsWith("tuple"))) {
                log.warn("Skipping event {}.{}: tuple inputs have no canonical signature here", contractName, name);
                continue;
            }
            String signature = name + inputs.stream()
                    .map(p -> p.type().canonical())
                    .collect(Collectors.joining(",", "(", ")"));
            shapes.add(new EventShape(contractName, name, signature, EventEncoder.buildEventSignature(signature), inputs));
        }
        return shapes;
    }
}
