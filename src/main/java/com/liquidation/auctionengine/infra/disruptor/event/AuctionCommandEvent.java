package com.liquidation.auctionengine.infra.disruptor.event;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

public class AuctionCommandEvent {

    private CommandType type;
    private String caller;
    private String vaultId;
    private String ilkId;
    private String baseId;
    private String account;
    private BigInteger minInkOut;
    private BigInteger maxIn;
    private long duration;
    private BigInteger initialOffer;
    private BigInteger proportion;
    private boolean flag;
    private String role;
    private long enqueueNanoTime;
    private CompletableFuture<Object> result;

    public void clear() {
        type = null;
        caller = null;
        vaultId = null;
        ilkId = null;
        baseId = null;
        account = null;
        minInkOut = null;
        maxIn = null;
        duration = 0L;
        initialOffer = null;
        proportion = null;
        flag = false;
        role = null;
        enqueueNanoTime = 0L;
        result = null;
    }

    public CommandType getType() {
        return type;
    }

    public void setType(CommandType type) {
        this.type = type;
    }

    public String getCaller() {
        return caller;
    }

    public void setCaller(String caller) {
        this.caller = caller;
    }

    public String getVaultId() {
        return vaultId;
    }

    public void setVaultId(String vaultId) {
        this.vaultId = vaultId;
    }

    public String getIlkId() {
        return ilkId;
    }

    public void setIlkId(String ilkId) {
        this.ilkId = ilkId;
    }

    public String getBaseId() {
        return baseId;
    }

    public void setBaseId(String baseId) {
        this.baseId = baseId;
    }

    public String getAccount() {
        return account;
    }

    public void setAccount(String account) {
        this.account = account;
    }

    public BigInteger getMinInkOut() {
        return minInkOut;
    }

    public void setMinInkOut(BigInteger minInkOut) {
        this.minInkOut = minInkOut;
    }

    public BigInteger getMaxIn() {
        return maxIn;
    }

    public void setMaxIn(BigInteger maxIn) {
        this.maxIn = maxIn;
    }

    public long getDuration() {
        return duration;
    }

    public void setDuration(long duration) {
        this.duration = duration;
    }

    public BigInteger getInitialOffer() {
        return initialOffer;
    }

    public void setInitialOffer(BigInteger initialOffer) {
        this.initialOffer = initialOffer;
    }

    public BigInteger getProportion() {
        return proportion;
    }

    public void setProportion(BigInteger proportion) {
        this.proportion = proportion;
    }

    public boolean isFlag() {
        return flag;
    }

    public void setFlag(boolean flag) {
        this.flag = flag;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public long getEnqueueNanoTime() {
        return enqueueNanoTime;
    }

    public void setEnqueueNanoTime(long enqueueNanoTime) {
        this.enqueueNanoTime = enqueueNanoTime;
    }

    public CompletableFuture<Object> getResult() {
        return result;
    }

    public void setResult(CompletableFuture<Object> result) {
        this.result = result;
    }

    @Override
    public String toString() {
        return "AuctionCommandEvent{type=" + type + ", caller=" + caller + ", vaultId=" + vaultId
                + ", market=" + ilkId + "/" + baseId + "}";
    }
}
