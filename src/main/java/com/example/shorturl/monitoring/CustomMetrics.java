package com.example.shorturl.monitoring;

import com.example.shorturl.repository.ShortUrlStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class CustomMetrics {

    public CustomMetrics(MeterRegistry registry, ShortUrlStore store) {
        Gauge.builder("app.urls.total", store::count)
             .description("Total number of shortened URLs")
             .register(registry);
    }
}
