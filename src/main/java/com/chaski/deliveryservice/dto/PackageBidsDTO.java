package com.chaski.deliveryservice.dto;

import com.chaski.deliveryservice.enums.PackageStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * The sender's view of a package's bids, with the window fields needed for a countdown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PackageBidsDTO {
    private Long packageId;
    private PackageStatus status;
    private Instant biddingDeadline;
    private int deadlineExtensionCount;
    private List<BidDTO> bids;
}
