package com.troveindexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Trove position indexer: tails TroveManager / BorrowerOperations logs into Mongo and serves the read API.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TroveIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TroveIndexerApplication.class, args);
    }
}
