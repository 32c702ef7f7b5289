package com.liquidation.auctionengine.api;

import com.liquidation.auctionengine.domain.exception.AuctionError;
import com.liquidation.auctionengine.domain.exception.AuctionException;
import com.liquidation.auctionengine.domain.model.ExposureLimit;
import com.liquidation.auctionengine.domain.model.MarketKey;
import com.liquidation.auctionengine.domain.model.MarketLine;
import com.liquidation.auctionengine.domain.service.ExposureLimiter;
import com.liquidation.auctionengine.infra.disruptor.AuctionCommandGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.Map;

import static com.liquidation.auctionengine.api.AuctionController.ACCOUNT_HEADER;

@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class AuctionAdminController {

    private final AuctionCommandGateway commandGateway;
    private final ExposureLimiter exposureLimiter;

    @PutMapping("/lines/{ilkId}/{baseId}")
    public ResponseEntity<Map<String, Object>> setLine(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                       @PathVariable String ilkId,
                                                       @PathVariable String baseId,
                                                       @RequestBody LineRequest req) {
        if (req.duration() == null) {
            throw AuctionException.of(AuctionError.INVALID_PARAMETER, "duration is required");
        }
        MarketLine line = commandGateway.setLine(caller, ilkId, baseId,
                req.duration(), req.initialOffer(), req.proportion()).join();
        log.info("[Admin API] 라인 설정: caller={}, market={}/{}", caller, ilkId, baseId);

        return ResponseEntity.ok(Map.of(
                "success", true,
                "market", MarketKey.of(ilkId, baseId).toString(),
                "line", line));
    }

    @PutMapping("/limits/{ilkId}/{baseId}")
    public ResponseEntity<Map<String, Object>> setLimit(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                        @PathVariable String ilkId,
                                                        @PathVariable String baseId,
                                                        @RequestBody LimitRequest req) {
        ExposureLimit limit = commandGateway.setLimit(caller, ilkId, baseId, req.max()).join();
        log.info("[Admin API] 한도 설정: caller={}, market={}/{}, max={}", caller, ilkId, baseId, req.max());

        return ResponseEntity.ok(limitBody(ilkId, baseId, limit));
    }

    @GetMapping("/limits/{ilkId}/{baseId}")
    public ResponseEntity<Map<String, Object>> limit(@PathVariable String ilkId, @PathVariable String baseId) {
        return ResponseEntity.ok(limitBody(ilkId, baseId, exposureLimiter.limit(MarketKey.of(ilkId, baseId))));
    }

    @PutMapping("/protected/{owner}")
    public ResponseEntity<Map<String, Object>> setProtected(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                            @PathVariable String owner,
                                                            @RequestBody ProtectionRequest req) {
        boolean isProtected = commandGateway.setProtected(caller, owner, req.protect()).join();

        return ResponseEntity.ok(Map.of(
                "success", true,
                "owner", owner,
                "protected", isProtected));
    }

    @PutMapping("/roles/{role}/{account}")
    public ResponseEntity<Map<String, Object>> grantRole(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                         @PathVariable String role,
                                                         @PathVariable String account) {
        commandGateway.grantRole(caller, role, account).join();

        return ResponseEntity.ok(Map.of(
                "success", true,
                "role", role,
                "account", account));
    }

    @DeleteMapping("/roles/{role}/{account}")
    public ResponseEntity<Map<String, Object>> revokeRole(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                          @PathVariable String role,
                                                          @PathVariable String account) {
        commandGateway.revokeRole(caller, role, account).join();

        return ResponseEntity.ok(Map.of(
                "success", true,
                "role", role,
                "account", account));
    }

    private static Map<String, Object> limitBody(String ilkId, String baseId, ExposureLimit limit) {
        return Map.of(
                "success", true,
                "market", MarketKey.of(ilkId, baseId).toString(),
                "max", limit.max(),
                "sum", limit.sum());
    }

    public record LineRequest(
            Long duration,
            BigInteger initialOffer,
            BigInteger proportion
    ) {
    }

    public record LimitRequest(BigInteger max) {
    }

    public record ProtectionRequest(boolean protect) {
    }
}
