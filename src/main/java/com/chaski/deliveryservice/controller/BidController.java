package com.chaski.deliveryservice.controller;

import com.chaski.deliveryservice.dto.BidDTO;
import com.chaski.deliveryservice.dto.PackageBidsDTO;
import com.chaski.deliveryservice.dto.PlaceBidRequest;
import com.chaski.deliveryservice.service.BidLedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api/v1/bids")
@RequiredArgsConstructor
public class BidController {
    private final BidLedgerService bidLedgerService;

    @PostMapping
    public Mono<ResponseEntity<BidDTO>> placeBid(@Valid @RequestBody PlaceBidRequest request,
                                                 @AuthenticationPrincipal Jwt jwt) {
        Long courierId = CurrentUser.id(jwt);
        return Mono.fromCallable(() -> bidLedgerService.placeBid(courierId, request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(bid -> new ResponseEntity<>(BidDTO.fromEntity(bid), HttpStatus.CREATED));
    }

    @DeleteMapping("/{bidId}")
    public Mono<ResponseEntity<BidDTO>> withdrawBid(@PathVariable Long bidId, @AuthenticationPrincipal Jwt jwt) {
        Long courierId = CurrentUser.id(jwt);
        return Mono.fromCallable(() -> bidLedgerService.withdrawBid(bidId, courierId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(bid -> ResponseEntity.ok(BidDTO.fromEntity(bid)));
    }

    @PostMapping("/{bidId}/select")
    public Mono<ResponseEntity<BidDTO>> selectBid(@PathVariable Long bidId, @AuthenticationPrincipal Jwt jwt) {
        Long senderId = CurrentUser.id(jwt);
        return Mono.fromCallable(() -> bidLedgerService.selectBid(bidId, senderId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(bid -> ResponseEntity.ok(BidDTO.fromEntity(bid)));
    }

    @GetMapping("/package/{packageId}")
    public Mono<ResponseEntity<PackageBidsDTO>> getBidsForPackage(@PathVariable Long packageId,
                                                                  @AuthenticationPrincipal Jwt jwt) {
        Long senderId = CurrentUser.id(jwt);
        return Mono.fromCallable(() -> bidLedgerService.getBidsForPackage(packageId, senderId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/my-bids")
    public Mono<ResponseEntity<List<BidDTO>>> getMyBids(@AuthenticationPrincipal Jwt jwt) {
        Long courierId = CurrentUser.id(jwt);
        return Mono.fromCallable(() -> bidLedgerService.getMyBids(courierId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
