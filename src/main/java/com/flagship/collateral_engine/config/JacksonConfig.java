package com.flagship.collateral_engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.math.BigInteger;

/**
 * Jackson configuration for the REST API.
 *
 * Key features:
 * - Java 8 date/time support, ISO-8601 strings instead of timestamps
 * - BigInteger written as a JSON string: 18-decimal amounts overflow JavaScript numbers
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        SimpleModule amounts = new SimpleModule("fixed-point-amounts");
        amounts.addSerializer(BigInteger.class, ToStringSerializer.instance);
        mapper.registerModule(amounts);

        return mapper;
    }
}
