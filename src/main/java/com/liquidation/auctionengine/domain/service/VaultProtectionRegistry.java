package com.liquidation.auctionengine.domain.service;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class VaultProtectionRegistry {

    private final Set<String> protectedOwners = ConcurrentHashMap.newKeySet();

    public boolean isProtected(String owner) {
        return owner != null && protectedOwners.contains(owner);
    }

    void setProtected(String owner, boolean isProtected) {
        if (isProtected) {
            protectedOwners.add(owner);
        } else {
            protectedOwners.remove(owner);
        }
    }
}
