package com.troveindexer.ingestion.decoder;

import com.troveindexer.ingestion.config.WatchedContractsProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the decoding table once at startup from the watched contracts' ABIs.
 */
@Configuration
public class DecoderConfig {

    @Bean
    public DecodingTable decodingTable(DecodingTableLoader loader, WatchedContractsProperties contractsProperties) {
        return loader.load(contractsProperties.getContracts());
    }
}
