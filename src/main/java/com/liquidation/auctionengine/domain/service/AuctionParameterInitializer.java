package com.liquidation.auctionengine.domain.service;

import com.liquidation.auctionengine.domain.model.MarketKey;
import com.liquidation.auctionengine.domain.service.pricing.WadMath;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class AuctionParameterInitializer {

    private final AuctionEngineProperties properties;
    private final AccessControl accessControl;
    private final AuctionAdminService adminService;
    private final ExposureLimiter exposureLimiter;
    private final VaultProtectionRegistry vaultProtectionRegistry;

    @PostConstruct
    public void initialize() {
        properties.getAdmins().forEach(admin -> accessControl.grant(AccessControl.ADMIN_ROLE, admin));

        for (AuctionEngineProperties.LineConfig line : properties.getLines()) {
            adminService.installLine(
                    MarketKey.of(line.getIlkId(), line.getBaseId()),
                    line.getDuration(),
                    WadMath.toWad(line.getInitialOffer()),
                    WadMath.toWad(line.getProportion()));
        }

        for (AuctionEngineProperties.LimitConfig limit : properties.getLimits()) {
            exposureLimiter.setMax(MarketKey.of(limit.getIlkId(), limit.getBaseId()), limit.getMax());
        }

        properties.getProtectedOwners().forEach(owner -> vaultProtectionRegistry.setProtected(owner, true));

        log.info("[Init] 경매 파라미터 적용 완료: admins={}, lines={}, limits={}, protected={}",
                properties.getAdmins().size(), properties.getLines().size(),
                properties.getLimits().size(), properties.getProtectedOwners().size());
    }
}
