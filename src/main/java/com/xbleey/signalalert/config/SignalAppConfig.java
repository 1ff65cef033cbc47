package com.xbleey.signalalert.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SignalAppConfig {

    @Bean
    public OkHttpClient okHttpClient(SignalProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(properties.getHttpTimeout())
                .readTimeout(properties.getHttpTimeout())
                .callTimeout(properties.getHttpTimeout().multipliedBy(2))
                .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
