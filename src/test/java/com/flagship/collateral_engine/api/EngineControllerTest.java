package com.flagship.collateral_engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface of the engine, running against the simulated collaborators.
 *
 * These tests verify:
 * - Committed operations return the caller's updated position
 * - Engine failures map to their status codes and error codes
 * - The account header is required on mutating endpoints
 *
 * Prices are left at their configured values; each test uses fresh accounts.
 */
@SpringBootTest
@AutoConfigureMockMvc
class EngineControllerTest {

    private static final String TEN_ETH = "10000000000000000000";
    private static final String HUNDRED = "100000000000000000000";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String account;

    @BeforeEach
    void setUp() throws Exception {
        account = "acct-" + UUID.randomUUID();
        mockMvc.perform(post("/api/simulation/collateral/WETH/fund")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("account", account, "amount", TEN_ETH))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.wallet_balance").value(TEN_ETH));
    }

    @Test
    @DisplayName("Deposit and mint returns the updated position")
    void testDepositAndMint() throws Exception {
        mockMvc.perform(post("/api/engine/collateral/deposit-and-mint")
                .header("X-Account-Id", account)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("asset", "WETH", "amount", TEN_ETH, "debt_amount", HUNDRED))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.account").value(account))
            .andExpect(jsonPath("$.debt").value(HUNDRED))
            .andExpect(jsonPath("$.collateral_value_usd").value("20000000000000000000000"))
            .andExpect(jsonPath("$.health_factor").value(HUNDRED))
            .andExpect(jsonPath("$.collateral.WETH").value(TEN_ETH));

        mockMvc.perform(get("/api/engine/accounts/" + account + "/collateral/WETH"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(TEN_ETH));
    }

    @Test
    @DisplayName("Minting past the collateral limit returns 409 with the health factor")
    void testOverMintConflict() throws Exception {
        mockMvc.perform(post("/api/engine/collateral/deposit")
                .header("X-Account-Id", account)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("asset", "WETH", "amount", TEN_ETH))))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/engine/debt/mint")
                .header("X-Account-Id", account)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("amount", "11000000000000000000000"))))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("BREAKS_HEALTH_FACTOR"))
            .andExpect(jsonPath("$.details.category").value("INVARIANT_VIOLATION"))
            .andExpect(jsonPath("$.details.health_factor").value("909090909090909090"));

        mockMvc.perform(get("/api/engine/accounts/" + account))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.debt").value("0"));
    }

    @Test
    @DisplayName("Unapproved asset is a 400")
    void testUnapprovedAsset() throws Exception {
        mockMvc.perform(post("/api/engine/collateral/deposit")
                .header("X-Account-Id", account)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("asset", "LINK", "amount", TEN_ETH))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("ASSET_NOT_ALLOWED"));
    }

    @Test
    @DisplayName("Missing account header is a 400")
    void testMissingAccountHeader() throws Exception {
        mockMvc.perform(post("/api/engine/collateral/deposit")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("asset", "WETH", "amount", TEN_ETH))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));
    }

    @Test
    @DisplayName("Missing amount fails request validation")
    void testMissingAmount() throws Exception {
        mockMvc.perform(post("/api/engine/collateral/deposit")
                .header("X-Account-Id", account)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("asset", "WETH"))))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Liquidating a healthy account is a 422")
    void testLiquidateHealthyAccount() throws Exception {
        mockMvc.perform(post("/api/engine/collateral/deposit-and-mint")
                .header("X-Account-Id", account)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("asset", "WETH", "amount", TEN_ETH, "debt_amount", HUNDRED))))
            .andExpect(status().isOk());

        Map<String, String> request = new LinkedHashMap<>();
        request.put("collateral_asset", "WETH");
        request.put("target_account", account);
        request.put("debt_to_cover", HUNDRED);

        mockMvc.perform(post("/api/engine/liquidations")
                .header("X-Account-Id", "liquidator-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(request)))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("HEALTH_FACTOR_OK"))
            .andExpect(jsonPath("$.details.category").value("LIQUIDATION_NOT_ELIGIBLE"));
    }

    @Test
    @DisplayName("Read-only endpoints expose the registry, prices and constants")
    void testReadOnlyEndpoints() throws Exception {
        mockMvc.perform(get("/api/engine/collateral"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].asset").value("WETH"))
            .andExpect(jsonPath("$[1].asset").value("WBTC"));

        mockMvc.perform(get("/api/engine/prices/WETH"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.price").exists());

        mockMvc.perform(get("/api/engine/parameters"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.debt_token").value("DSC"))
            .andExpect(jsonPath("$.liquidation_threshold_pct").value(50))
            .andExpect(jsonPath("$.liquidation_bonus_pct").value(10))
            .andExpect(jsonPath("$.min_health_factor").value("1000000000000000000"));
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }
}
