package com.liquidation.auctionengine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;

@Entity
@Table(name = "auction_event_record", indexes = {
        @Index(name = "idx_auction_event_vault", columnList = "vaultId"),
        @Index(name = "idx_auction_event_timestamp", columnList = "timestampEpochSec")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuctionEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    private AuctionEventType type;

    private String vaultId;
    private String ilkId;
    private String baseId;
    private String account;

    @Column(precision = 39)
    private BigInteger ink;

    @Column(precision = 39)
    private BigInteger art;

    @Column(precision = 39)
    private BigInteger amount;

    private String detail;
    private long timestampEpochSec;

    public static AuctionEventRecord from(AuctionEvent event) {
        return AuctionEventRecord.builder()
                .type(event.getType())
                .vaultId(event.getVaultId())
                .ilkId(event.getIlkId())
                .baseId(event.getBaseId())
                .account(event.getAccount())
                .ink(event.getInk())
                .art(event.getArt())
                .amount(event.getAmount())
                .detail(event.getDetail())
                .timestampEpochSec(event.getTimestamp())
                .build();
    }
}
