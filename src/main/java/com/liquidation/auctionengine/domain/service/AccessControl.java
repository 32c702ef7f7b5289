package com.liquidation.auctionengine.domain.service;

import com.liquidation.auctionengine.domain.exception.AuctionError;
import com.liquidation.auctionengine.domain.exception.AuctionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class AccessControl {

    public static final String ADMIN_ROLE = "AUCTION_ADMIN";

    private final Map<String, Set<String>> members = new ConcurrentHashMap<>();

    public boolean hasRole(String role, String account) {
        if (role == null || account == null) return false;
        Set<String> accounts = members.get(role);
        return accounts != null && accounts.contains(account);
    }

    public void requireRole(String role, String caller) {
        if (!hasRole(role, caller)) {
            log.warn("[Access] 권한 없음: role={}, caller={}", role, caller);
            throw AuctionException.of(AuctionError.UNAUTHORIZED, "role=%s, caller=%s", role, caller);
        }
    }

    void grant(String role, String account) {
        members.computeIfAbsent(role, r -> ConcurrentHashMap.newKeySet()).add(account);
        log.info("[Access] 권한 부여: role={}, account={}", role, account);
    }

    void revoke(String role, String account) {
        Set<String> accounts = members.get(role);
        if (accounts != null) {
            accounts.remove(account);
        }
        log.info("[Access] 권한 회수: role={}, account={}", role, account);
    }
}
