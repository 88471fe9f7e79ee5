package com.silentrisk.vault;

import com.silentrisk.vault.config.LedgerProperties;
import com.silentrisk.vault.config.VaultProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({LedgerProperties.class, VaultProperties.class})
public class RiskVaultApplication {

	public static void main(String[] args) {
		SpringApplication.run(RiskVaultApplication.class, args);
	}

}
