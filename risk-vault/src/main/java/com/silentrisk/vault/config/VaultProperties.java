package com.silentrisk.vault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "vault")
public class VaultProperties {

    private Duration minUpdateInterval = Duration.ofHours(1);
    private int maxDailyDecryptions = 10;
    private Duration scoreValidityPeriod = Duration.ofDays(30);
    private List<String> authorizedUpdaters = new ArrayList<>();
    private Bands bands = new Bands();

    @Data
    public static class Bands {
        private int mediumFrom = 3000;
        private int highFrom = 7000;
        private Integer criticalFrom; // unset: three tiers
    }

}
