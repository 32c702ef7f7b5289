package com.liquidation.auctionengine.api;

import com.liquidation.auctionengine.domain.exception.AuctionError;
import com.liquidation.auctionengine.domain.exception.AuctionException;
import com.liquidation.auctionengine.domain.model.AuctionEventRecord;
import com.liquidation.auctionengine.domain.model.AuctionRecord;
import com.liquidation.auctionengine.domain.model.SettlementResult;
import com.liquidation.auctionengine.domain.repository.AuctionEventRepository;
import com.liquidation.auctionengine.domain.service.AuctionLifecycleService;
import com.liquidation.auctionengine.infra.disruptor.AuctionCommandGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/auctions")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class AuctionController {

    static final String ACCOUNT_HEADER = "X-Account";

    private final AuctionCommandGateway commandGateway;
    private final AuctionLifecycleService lifecycleService;
    private final AuctionEventRepository auctionEventRepository;

    @PostMapping("/{vaultId}")
    public ResponseEntity<Map<String, Object>> open(@PathVariable String vaultId) {
        AuctionRecord record = commandGateway.open(vaultId).join();
        log.info("[Auction API] 경매 시작 요청 처리: vaultId={}", vaultId);

        return ResponseEntity.ok(Map.of(
                "success", true,
                "auction", record));
    }

    @DeleteMapping("/{vaultId}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String vaultId) {
        commandGateway.cancel(vaultId).join();
        log.info("[Auction API] 경매 취소 요청 처리: vaultId={}", vaultId);

        return ResponseEntity.ok(Map.of(
                "success", true,
                "vaultId", vaultId,
                "message", "경매가 취소되었습니다."));
    }

    @PostMapping("/{vaultId}/settle/asset")
    public ResponseEntity<Map<String, Object>> settleWithAsset(@RequestHeader(ACCOUNT_HEADER) String buyer,
                                                               @PathVariable String vaultId,
                                                               @RequestBody SettleRequest req) {
        SettlementResult result = commandGateway.settleWithAsset(
                buyer, vaultId, req.receiverOr(buyer),
                requireAmount("minInkOut", req.minInkOut()),
                requireAmount("maxAmountIn", req.maxAmountIn())).join();
        return settled(vaultId, result);
    }

    @PostMapping("/{vaultId}/settle/token")
    public ResponseEntity<Map<String, Object>> settleWithDebtToken(@RequestHeader(ACCOUNT_HEADER) String buyer,
                                                                   @PathVariable String vaultId,
                                                                   @RequestBody SettleRequest req) {
        SettlementResult result = commandGateway.settleWithDebtToken(
                buyer, vaultId, req.receiverOr(buyer),
                requireAmount("minInkOut", req.minInkOut()),
                requireAmount("maxAmountIn", req.maxAmountIn())).join();
        return settled(vaultId, result);
    }

    @GetMapping("/{vaultId}")
    public ResponseEntity<AuctionRecord> auction(@PathVariable String vaultId) {
        return lifecycleService.auction(vaultId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> AuctionException.of(AuctionError.VAULT_NOT_AUCTIONED, "vaultId=%s", vaultId));
    }

    @GetMapping("/{vaultId}/quote")
    public ResponseEntity<Map<String, Object>> quote(@PathVariable String vaultId,
                                                     @RequestParam BigInteger artIn) {
        BigInteger inkOut = lifecycleService.quotePayout(vaultId, requireAmount("artIn", artIn));

        return ResponseEntity.ok(Map.of(
                "success", true,
                "vaultId", vaultId,
                "artIn", artIn,
                "inkOut", inkOut));
    }

    @GetMapping("/{vaultId}/history")
    public ResponseEntity<List<AuctionEventRecord>> history(@PathVariable String vaultId) {
        return ResponseEntity.ok(auctionEventRepository.findByVaultIdOrderByIdAsc(vaultId));
    }

    private ResponseEntity<Map<String, Object>> settled(String vaultId, SettlementResult result) {
        log.info("[Auction API] 매수 처리: vaultId={}, artIn={}, inkOut={}, completed={}",
                vaultId, result.artIn(), result.inkOut(), result.completed());

        return ResponseEntity.ok(Map.of(
                "success", true,
                "vaultId", vaultId,
                "settlement", result));
    }

    static BigInteger requireAmount(String name, BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw AuctionException.of(AuctionError.INVALID_PARAMETER, "%s=%s", name, amount);
        }
        return amount;
    }

    public record SettleRequest(
            String receiver,
            BigInteger minInkOut,
            BigInteger maxAmountIn
    ) {
        String receiverOr(String buyer) {
            return receiver == null || receiver.isBlank() ? buyer : receiver;
        }
    }
}
