package com.liquidation.auctionengine.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigInteger;

@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuctionEvent {

    private AuctionEventType type;
    private String vaultId;
    private String ilkId;
    private String baseId;
    private String account;
    private BigInteger ink;
    private BigInteger art;
    private BigInteger amount;
    private String detail;
    private long timestamp;
}
