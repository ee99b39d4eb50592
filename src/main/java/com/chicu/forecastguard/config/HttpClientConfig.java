package com.chicu.forecastguard.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    /**
     * 🌐 ЕДИНЫЙ OkHttpClient: NASA POWER / ML sidecar / MLflow.
     * Таймауты под конкретный вызов каждый клиент докручивает через newBuilder().
     */
    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .writeTimeout(Duration.ofSeconds(30))
                .retryOnConnectionFailure(true)
                .build();
    }
}
