package com.silentrisk.vault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "passport")
public class PassportProperties {

    private Duration validityPeriod = Duration.ofDays(30);

}
