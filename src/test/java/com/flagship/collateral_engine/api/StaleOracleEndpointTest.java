package com.flagship.collateral_engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.engine.AccountingEngine;
import com.flagship.collateral_engine.ledger.AccountId;
import com.flagship.collateral_engine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Endpoints while every price feed is older than the staleness window.
 *
 * These tests verify:
 * - A deposit, which needs no price, commits and is reported as a success
 * - Operations that need a valuation fail with 503 and change nothing
 */
@SpringBootTest
@AutoConfigureMockMvc
class StaleOracleEndpointTest {

    private static final String ONE_ETH = "1000000000000000000";

    @TestConfiguration
    static class ClockConfig {

        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    @Autowired
    private AccountingEngine engine;

    private String account;

    @BeforeEach
    void setUp() throws Exception {
        account = "stale-" + UUID.randomUUID();
        mockMvc.perform(post("/api/simulation/collateral/WETH/fund")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("account", account, "amount", ONE_ETH))))
            .andExpect(status().isOk());
        clock.advance(Duration.ofHours(4));
    }

    @Test
    @DisplayName("Deposit with stale prices returns 200 with balances and no valuation")
    void testDepositReportedAsCommitted() throws Exception {
        mockMvc.perform(post("/api/engine/collateral/deposit")
                .header("X-Account-Id", account)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("asset", "WETH", "amount", ONE_ETH))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.collateral.WETH").value(ONE_ETH))
            .andExpect(jsonPath("$.debt").value("0"))
            .andExpect(jsonPath("$.collateral_value_usd").doesNotExist())
            .andExpect(jsonPath("$.health_factor").doesNotExist());

        assertEquals(new BigInteger(ONE_ETH), engine.collateralBalance(AccountId.of(account), AssetId.of("WETH")));
    }

    @Test
    @DisplayName("Mint with stale prices returns 503 and records no debt")
    void testMintRejected() throws Exception {
        mockMvc.perform(post("/api/engine/collateral/deposit")
                .header("X-Account-Id", account)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("asset", "WETH", "amount", ONE_ETH))))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/engine/debt/mint")
                .header("X-Account-Id", account)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("amount", "100"))))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.code").value("ORACLE_STALE"));

        assertEquals(BigInteger.ZERO, engine.position(AccountId.of(account)).getDebt());
    }
}
