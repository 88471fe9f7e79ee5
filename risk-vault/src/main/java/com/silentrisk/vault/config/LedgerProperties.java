package com.silentrisk.vault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;

@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private String owner;
    private String vaultAddress;
    private String passportAddress;
    private String verifierAddress;
    private Instant genesisTime;
    private Duration blockTime = Duration.ofSeconds(12);

}
