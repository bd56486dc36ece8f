package com.chaski.deliveryservice.controller;

import com.chaski.deliveryservice.dto.CreatePackageRequest;
import com.chaski.deliveryservice.dto.DeliveryProofRequest;
import com.chaski.deliveryservice.dto.FailureReportRequest;
import com.chaski.deliveryservice.dto.PackageDTO;
import com.chaski.deliveryservice.service.PackageLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/v1/packages")
@RequiredArgsConstructor
public class PackageController {
    private final PackageLifecycleService packageLifecycleService;

    @PostMapping
    public Mono<ResponseEntity<PackageDTO>> createPackage(@Valid @RequestBody CreatePackageRequest request,
                                                          @AuthenticationPrincipal Jwt jwt) {
        Long senderId = CurrentUser.id(jwt);
        return Mono.fromCallable(() -> packageLifecycleService.createPackage(senderId, request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(pkg -> new ResponseEntity<>(PackageDTO.fromEntity(pkg), HttpStatus.CREATED));
    }

    @GetMapping("/{packageId}")
    public Mono<ResponseEntity<PackageDTO>> getPackage(@PathVariable Long packageId) {
        return Mono.fromCallable(() -> packageLifecycleService.getPackage(packageId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(pkg -> ResponseEntity.ok(PackageDTO.fromEntity(pkg)));
    }

    @PostMapping("/{packageId}/cancel")
    public Mono<ResponseEntity<PackageDTO>> cancel(@PathVariable Long packageId, @AuthenticationPrincipal Jwt jwt) {
        Long senderId = CurrentUser.id(jwt);
        return Mono.fromCallable(() -> packageLifecycleService.cancel(packageId, senderId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(pkg -> ResponseEntity.ok(PackageDTO.fromEntity(pkg)));
    }

    @PostMapping("/{packageId}/pickup-scheduled")
    public Mono<ResponseEntity<PackageDTO>> confirmPickupScheduled(@PathVariable Long packageId,
                                                                   @AuthenticationPrincipal Jwt jwt) {
        Long courierId = CurrentUser.id(jwt);
        return Mono.fromCallable(() -> packageLifecycleService.confirmPickupScheduled(packageId, courierId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(pkg -> ResponseEntity.ok(PackageDTO.fromEntity(pkg)));
    }

    @PostMapping("/{packageId}/pickup")
    public Mono<ResponseEntity<PackageDTO>> confirmPickup(@PathVariable Long packageId, @AuthenticationPrincipal Jwt jwt) {
        Long courierId = CurrentUser.id(jwt);
        return Mono.fromCallable(() -> packageLifecycleService.confirmPickup(packageId, courierId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(pkg -> ResponseEntity.ok(PackageDTO.fromEntity(pkg)));
    }

    @PostMapping("/{packageId}/deliver")
    public Mono<ResponseEntity<PackageDTO>> markDelivered(@PathVariable Long packageId,
                                                          @Valid @RequestBody DeliveryProofRequest request,
                                                          @AuthenticationPrincipal Jwt jwt) {
        Long courierId = CurrentUser.id(jwt);
        return Mono.fromCallable(() -> packageLifecycleService.markDelivered(packageId, courierId, request.proofReference()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(pkg -> ResponseEntity.ok(PackageDTO.fromEntity(pkg)));
    }

    @PostMapping("/{packageId}/fail")
    public Mono<ResponseEntity<PackageDTO>> reportFailure(@PathVariable Long packageId,
                                                          @Valid @RequestBody FailureReportRequest request,
                                                          @AuthenticationPrincipal Jwt jwt,
                                                          Authentication authentication) {
        Long reporterId = CurrentUser.id(jwt);
        boolean operator = CurrentUser.isOperator(authentication);
        return Mono.fromCallable(() -> packageLifecycleService.reportFailure(packageId, reporterId, operator, request.reason()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(pkg -> ResponseEntity.ok(PackageDTO.fromEntity(pkg)));
    }
}
