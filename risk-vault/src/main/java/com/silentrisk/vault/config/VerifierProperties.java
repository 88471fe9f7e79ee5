package com.silentrisk.vault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "verifier")
public class VerifierProperties {

    /** Shortest proof the structural verifier accepts, in bytes. */
    private int minProofLength = 64;

}
