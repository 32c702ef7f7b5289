package com.liquidation.auctionengine.api;

import com.liquidation.auctionengine.domain.exception.AuctionError;
import com.liquidation.auctionengine.domain.exception.AuctionException;
import com.liquidation.auctionengine.domain.model.AuctionEventRecord;
import com.liquidation.auctionengine.domain.model.AuctionEventType;
import com.liquidation.auctionengine.domain.model.AuctionRecord;
import com.liquidation.auctionengine.domain.model.ExposureLimit;
import com.liquidation.auctionengine.domain.model.MarketKey;
import com.liquidation.auctionengine.domain.model.SettlementResult;
import com.liquidation.auctionengine.domain.repository.AuctionEventRepository;
import com.liquidation.auctionengine.domain.service.AuctionLifecycleService;
import com.liquidation.auctionengine.domain.service.ExposureLimiter;
import com.liquidation.auctionengine.infra.disruptor.AuctionCommandGateway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {AuctionController.class, AuctionAdminController.class})
class AuctionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuctionCommandGateway commandGateway;

    @MockBean
    private AuctionLifecycleService lifecycleService;

    @MockBean
    private AuctionEventRepository auctionEventRepository;

    @MockBean
    private ExposureLimiter exposureLimiter;

    private final AuctionRecord record = AuctionRecord.builder()
            .vaultId("vault-1")
            .owner("alice")
            .start(1_700_000_000L)
            .ilkId("ETH")
            .debtAssetId("USDC")
            .art(BigInteger.valueOf(50_000))
            .ink(BigInteger.valueOf(50))
            .build();

    @Test
    void openReturnsAuctionRecord() throws Exception {
        when(commandGateway.open("vault-1")).thenReturn(CompletableFuture.completedFuture(record));

        mockMvc.perform(post("/api/auctions/vault-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.auction.vaultId").value("vault-1"))
                .andExpect(jsonPath("$.auction.owner").value("alice"))
                .andExpect(jsonPath("$.auction.art").value(50_000));
    }

    @Test
    void openConflictMapsTo409() throws Exception {
        when(commandGateway.open("vault-1")).thenReturn(CompletableFuture.failedFuture(
                new AuctionException(AuctionError.VAULT_ALREADY_AUCTIONED)));

        mockMvc.perform(post("/api/auctions/vault-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("VAULT_ALREADY_AUCTIONED"));
    }

    @Test
    void cancelUnknownAuctionMapsTo404() throws Exception {
        when(commandGateway.cancel("vault-9")).thenReturn(CompletableFuture.failedFuture(
                AuctionException.of(AuctionError.VAULT_NOT_AUCTIONED, "vaultId=%s", "vault-9")));

        mockMvc.perform(delete("/api/auctions/vault-9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("VAULT_NOT_AUCTIONED"));
    }

    @Test
    void settleWithAssetDefaultsReceiverToBuyer() throws Exception {
        when(commandGateway.settleWithAsset("bot", "vault-1", "bot", BigInteger.ZERO, BigInteger.valueOf(20_000)))
                .thenReturn(CompletableFuture.completedFuture(new SettlementResult(
                        BigInteger.valueOf(14), BigInteger.valueOf(20_000), BigInteger.valueOf(20_000), false)));

        mockMvc.perform(post("/api/auctions/vault-1/settle/asset")
                        .header("X-Account", "bot")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minInkOut\":0,\"maxAmountIn\":20000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.settlement.inkOut").value(14))
                .andExpect(jsonPath("$.settlement.completed").value(false));
    }

    @Test
    void settleWithTokenLeavingDustMapsTo422() throws Exception {
        when(commandGateway.settleWithDebtToken(eq("bot"), eq("vault-1"), eq("treasury"), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new AuctionException(AuctionError.LEAVES_DUST)));

        mockMvc.perform(post("/api/auctions/vault-1/settle/token")
                        .header("X-Account", "bot")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receiver\":\"treasury\",\"minInkOut\":1,\"maxAmountIn\":49950}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("LEAVES_DUST"));
    }

    @Test
    void settleWithoutAmountIsRejectedBeforeQueueing() throws Exception {
        mockMvc.perform(post("/api/auctions/vault-1/settle/asset")
                        .header("X-Account", "bot")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minInkOut\":0,\"maxAmountIn\":-5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_PARAMETER"));

        verifyNoInteractions(commandGateway);
    }

    @Test
    void settleWithoutAccountHeaderIsForbidden() throws Exception {
        mockMvc.perform(post("/api/auctions/vault-1/settle/asset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minInkOut\":0,\"maxAmountIn\":10}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(commandGateway);
    }

    @Test
    void auctionLookup() throws Exception {
        when(lifecycleService.auction("vault-1")).thenReturn(Optional.of(record));
        when(lifecycleService.auction("vault-2")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/auctions/vault-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.debtAssetId").value("USDC"));
        mockMvc.perform(get("/api/auctions/vault-2"))
                .andExpect(status().isNotFound());
    }

    @Test
    void quoteReturnsPayout() throws Exception {
        when(lifecycleService.quotePayout("vault-1", BigInteger.valueOf(1_000))).thenReturn(BigInteger.valueOf(7));

        mockMvc.perform(get("/api/auctions/vault-1/quote").param("artIn", "1000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.inkOut").value(7));
    }

    @Test
    void historyListsJournaledEvents() throws Exception {
        when(auctionEventRepository.findByVaultIdOrderByIdAsc("vault-1")).thenReturn(List.of(
                AuctionEventRecord.builder().id(1L).type(AuctionEventType.AUCTION_OPENED).vaultId("vault-1").build(),
                AuctionEventRecord.builder().id(2L).type(AuctionEventType.BOUGHT).vaultId("vault-1").build()));

        mockMvc.perform(get("/api/auctions/vault-1/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].type").value("BOUGHT"));
    }

    @Test
    void adminSetLimitRequiresRole() throws Exception {
        when(commandGateway.setLimit("mallory", "ETH", "USDC", BigInteger.TEN)).thenReturn(
                CompletableFuture.failedFuture(new AuctionException(AuctionError.UNAUTHORIZED)));

        mockMvc.perform(put("/api/admin/limits/ETH/USDC")
                        .header("X-Account", "mallory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"max\":10}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
    }

    @Test
    void adminReadsLimit() throws Exception {
        when(exposureLimiter.limit(MarketKey.of("ETH", "USDC")))
                .thenReturn(new ExposureLimit(BigInteger.valueOf(100), BigInteger.valueOf(40)));

        mockMvc.perform(get("/api/admin/limits/ETH/USDC"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.max").value(100))
                .andExpect(jsonPath("$.sum").value(40));
    }

    @Test
    void adminSetsProtection() throws Exception {
        when(commandGateway.setProtected("governance", "alice", true))
                .thenReturn(CompletableFuture.completedFuture(true));

        mockMvc.perform(put("/api/admin/protected/alice")
                        .header("X-Account", "governance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"protect\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.protected").value(true));
    }
}
