package com.silentrisk.vault.config;

import com.silentrisk.vault.repository.ledger.InMemoryLedgerConfigRegistry;
import com.silentrisk.vault.repository.ledger.JsonFileLedgerConfigRegistry;
import com.silentrisk.vault.repository.ledger.LedgerConfigRegistry;
import com.silentrisk.vault.repository.passport.InMemoryPassportTokenRegistry;
import com.silentrisk.vault.repository.passport.JsonFilePassportTokenRegistry;
import com.silentrisk.vault.repository.passport.PassportTokenRegistry;
import com.silentrisk.vault.repository.vault.CommitmentRecordRegistry;
import com.silentrisk.vault.repository.vault.InMemoryCommitmentRecordRegistry;
import com.silentrisk.vault.repository.vault.InMemoryNullifierRegistry;
import com.silentrisk.vault.repository.vault.InMemoryUpdaterStateRegistry;
import com.silentrisk.vault.repository.vault.JsonFileCommitmentRecordRegistry;
import com.silentrisk.vault.repository.vault.JsonFileNullifierRegistry;
import com.silentrisk.vault.repository.vault.JsonFileUpdaterStateRegistry;
import com.silentrisk.vault.repository.vault.NullifierRegistry;
import com.silentrisk.vault.repository.vault.UpdaterStateRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class LedgerRegistryConfig {

    @Value("${ledger.registry.type:memory}")
    private String registryType;

    @Value("${ledger.registry.storage-path:./data/ledger}")
    private String storagePath;

    @Bean
    public CommitmentRecordRegistry commitmentRecordRegistry() throws IOException {
        return switch (registryType.toLowerCase()) {
            case "json" -> new JsonFileCommitmentRecordRegistry(storagePath);
            case "memory" -> new InMemoryCommitmentRecordRegistry();
            default -> throw new IllegalArgumentException("Unsupported registry type: " + registryType);
        };
    }

    @Bean
    public NullifierRegistry nullifierRegistry() throws IOException {
        return switch (registryType.toLowerCase()) {
            case "json" -> new JsonFileNullifierRegistry(storagePath);
            case "memory" -> new InMemoryNullifierRegistry();
            default -> throw new IllegalArgumentException("Unsupported registry type: " + registryType);
        };
    }

    @Bean
    public UpdaterStateRegistry updaterStateRegistry() throws IOException {
        return switch (registryType.toLowerCase()) {
            case "json" -> new JsonFileUpdaterStateRegistry(storagePath);
            case "memory" -> new InMemoryUpdaterStateRegistry();
            default -> throw new IllegalArgumentException("Unsupported registry type: " + registryType);
        };
    }

    @Bean
    public PassportTokenRegistry passportTokenRegistry() throws IOException {
        return switch (registryType.toLowerCase()) {
            case "json" -> new JsonFilePassportTokenRegistry(storagePath);
            case "memory" -> new InMemoryPassportTokenRegistry();
            default -> throw new IllegalArgumentException("Unsupported registry type: " + registryType);
        };
    }

    @Bean
    public LedgerConfigRegistry ledgerConfigRegistry() throws IOException {
        return switch (registryType.toLowerCase()) {
            case "json" -> new JsonFileLedgerConfigRegistry(storagePath);
            case "memory" -> new InMemoryLedgerConfigRegistry();
            default -> throw new IllegalArgumentException("Unsupported registry type: " + registryType);
        };
    }

}
