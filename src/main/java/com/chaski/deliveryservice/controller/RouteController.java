package com.chaski.deliveryservice.controller;

import com.chaski.deliveryservice.dto.CreateRouteRequest;
import com.chaski.deliveryservice.dto.MatchResult;
import com.chaski.deliveryservice.dto.RouteDTO;
import com.chaski.deliveryservice.service.MatchEngineService;
import com.chaski.deliveryservice.service.RouteService;
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
@RequestMapping("/api/v1/routes")
@RequiredArgsConstructor
public class RouteController {
    private final RouteService routeService;
    private final MatchEngineService matchEngineService;

    @PostMapping
    public Mono<ResponseEntity<RouteDTO>> createRoute(@Valid @RequestBody CreateRouteRequest request,
                                                      @AuthenticationPrincipal Jwt jwt) {
        Long courierId = CurrentUser.id(jwt);
        return Mono.fromCallable(() -> routeService.createRoute(courierId, request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(route -> new ResponseEntity<>(RouteDTO.fromEntity(route), HttpStatus.CREATED));
    }

    @GetMapping("/active")
    public Mono<ResponseEntity<RouteDTO>> getActiveRoute(@AuthenticationPrincipal Jwt jwt) {
        Long courierId = CurrentUser.id(jwt);
        return Mono.fromCallable(() -> routeService.getActiveRoute(courierId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(active -> active
                        .map(route -> ResponseEntity.ok(RouteDTO.fromEntity(route)))
                        .orElseGet(() -> ResponseEntity.noContent().build()));
    }

    @GetMapping("/{routeId}")
    public Mono<ResponseEntity<RouteDTO>> getRoute(@PathVariable Long routeId) {
        return Mono.fromCallable(() -> routeService.getRoute(routeId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(route -> ResponseEntity.ok(RouteDTO.fromEntity(route)));
    }

    @DeleteMapping("/{routeId}")
    public Mono<ResponseEntity<RouteDTO>> deactivateRoute(@PathVariable Long routeId, @AuthenticationPrincipal Jwt jwt) {
        Long courierId = CurrentUser.id(jwt);
        return Mono.fromCallable(() -> routeService.deactivateRoute(routeId, courierId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(route -> ResponseEntity.ok(RouteDTO.fromEntity(route)));
    }

    @GetMapping("/{routeId}/matches")
    public Mono<ResponseEntity<List<MatchResult>>> findMatches(@PathVariable Long routeId) {
        return Mono.fromCallable(() -> matchEngineService.findMatches(routeId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
