package com.assuranceledger.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.annotation.Transactional;

import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * REST tests for the contract, account and milestone endpoints and their error mapping.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class ContractControllerTest {

    private static final String TENANT = "tenant-api";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void testCreateAndActivateContract() throws Exception {
        String contractId = createContract("10000");

        mockMvc.perform(post("/api/v1/contracts/{id}/activate", contractId)
                .header("X-Tenant-Id", TENANT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status", is("ACTIVE")));

        mockMvc.perform(get("/api/v1/contracts/{id}", contractId)
                .header("X-Tenant-Id", TENANT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.committedAmount", is(10000)));
    }

    @Test
    void testFractionalMinorUnitsAreRejected() throws Exception {
        mockMvc.perform(post("/api/v1/contracts")
                .header("X-Tenant-Id", TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(contractJson("100.5")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.field", is("committedAmount")));
    }

    @Test
    void testMissingFieldsAreReportedPerField() throws Exception {
        mockMvc.perform(post("/api/v1/contracts")
                .header("X-Tenant-Id", TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"currency\":\"USD\",\"committedAmount\":100}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.contractType", is("Contract type is required")));
    }

    @Test
    void testUnknownContractIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/contracts/{id}", "missing")
                .header("X-Tenant-Id", TENANT))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status", is("404")));
    }

    @Test
    void testInvalidTransitionIsConflict() throws Exception {
        String contractId = createContract("500");

        mockMvc.perform(post("/api/v1/contracts/{id}/pause", contractId)
                .header("X-Tenant-Id", TENANT))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.state", is("DRAFT")));
    }

    @Test
    void testOtherTenantCannotSeeContract() throws Exception {
        String contractId = createContract("500");

        mockMvc.perform(get("/api/v1/contracts/{id}", contractId)
                .header("X-Tenant-Id", "someone-else"))
            .andExpect(status().isNotFound());
    }

    @Test
    void testFundAndReconcileAccount() throws Exception {
        String contractId = createContract("10000");

        String accountId = openAccount(contractId);

        String funding = "{\"amount\":2500,\"idempotencyKey\":\"fund-api-1\",\"externalTransactionId\":\"psp-9\"}";
        mockMvc.perform(post("/api/v1/accounts/{id}/fund", accountId)
                .header("X-Tenant-Id", TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(funding))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.replayed", is(false)));

        // Same key again replays the original entry
        mockMvc.perform(post("/api/v1/accounts/{id}/fund", accountId)
                .header("X-Tenant-Id", TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(funding))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.replayed", is(true)));

        mockMvc.perform(get("/api/v1/accounts/{id}/reconciliation", accountId)
                .header("X-Tenant-Id", TENANT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.consistent", is(true)))
            .andExpect(jsonPath("$.snapshotHeld", is(2500)));
    }

    @Test
    void testFundingAboveCommittedAmountIsUnprocessable() throws Exception {
        String accountId = openAccount(createContract("2000"));

        mockMvc.perform(post("/api/v1/accounts/{id}/fund", accountId)
                .header("X-Tenant-Id", TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":2500,\"idempotencyKey\":\"fund-api-2\"}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.invariant", is("held <= committed - released - forfeited - refunded")));
    }

    @Test
    void testAdjustmentNeedsReasonCode() throws Exception {
        String accountId = openAccount(createContract("2000"));

        mockMvc.perform(post("/api/v1/accounts/{id}/adjustments", accountId)
                .header("X-Tenant-Id", TENANT)
                .header("X-Actor-Id", "user:ops-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"balanceDelta\":100,\"idempotencyKey\":\"adjust-api-1\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testReleaseWithoutActorHeaderIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/milestones/{id}/release", "m-1")
                .header("X-Tenant-Id", TENANT))
            .andExpect(status().isBadRequest());
    }

    private String createContract(String committedAmount) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/contracts")
                .header("X-Tenant-Id", TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(contractJson(committedAmount)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status", is("DRAFT")))
            .andReturn();
        return idOf(result);
    }

    private String openAccount(String contractId) throws Exception {
        MvcResult opened = mockMvc.perform(post("/api/v1/accounts")
                .header("X-Tenant-Id", TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"contractId\":\"" + contractId + "\",\"accountType\":\"ESCROW\","
                    + "\"ownerSubject\":{\"kind\":\"user\",\"id\":\"buyer-1\"}}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.currency", is("USD")))
            .andReturn();
        return idOf(opened);
    }

    private String idOf(MvcResult result) throws Exception {
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("id").asText();
    }

    private static String contractJson(String committedAmount) {
        return "{\"contractType\":\"ESCROW\",\"title\":\"Fence repair\","
            + "\"anchorSubject\":{\"kind\":\"user\",\"id\":\"buyer-1\"},"
            + "\"counterpartySubject\":{\"kind\":\"org\",\"id\":\"fencer-1\"},"
            + "\"currency\":\"USD\",\"committedAmount\":" + committedAmount + "}";
    }
}
