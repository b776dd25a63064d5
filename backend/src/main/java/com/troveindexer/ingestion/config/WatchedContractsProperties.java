package com.troveindexer.ingestion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Contracts whose logs are tailed, each with the ABI the decoding table is built from.
 */
@ConfigurationProperties(prefix = "troveindexer.ingestion")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class WatchedContractsProperties {

    @NotEmpty
    @Valid
    private List<WatchedContract> contracts = new ArrayList<>();

    public void setContracts(List<WatchedContract> contracts) {
        this.contracts = contracts != null ? contracts : new ArrayList<>();
    }

    public List<String> addresses() {
        return contracts.stream().map(c -> c.getAddress().toLowerCase()).distinct().toList();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class WatchedContract {

        @NotBlank
        private String name;
        @NotBlank
        @Pattern(regexp = "^0x[0-9a-fA-F]{40}$")
        private String address;
        /** Spring resource location of the ABI JSON, e.g. classpath:abi/TroveManager.json. */
        @NotBlank
        private String abi;
    }
}
