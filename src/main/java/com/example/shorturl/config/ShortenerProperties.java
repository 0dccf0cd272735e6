package com.example.shorturl.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for code generation, input validation and store calls, bound from {@code app.shortener.*}.
 * Components receive this object through their constructors.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.shortener")
public class ShortenerProperties {

    @Min(4)
    @Max(20)
    private int codeLength = 6;

    @Min(1)
    private int maxRetries = 5;

    @Min(1)
    private int maxUrlLength = 2048;

    // exact host match, see UrlValidator
    private List<String> blockedDomains = new ArrayList<>(List.of("malware.com", "phishing.com"));

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(30);

    private List<String> corsAllowedOrigins = new ArrayList<>(List.of("*"));
}
