package com.kb.metering.controller;

import com.kb.metering.model.dto.BalanceResponse;
import com.kb.metering.model.dto.PayoutRequest;
import com.kb.metering.model.dto.TopUpRequest;
import com.kb.metering.service.BalanceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 잔액 REST API 컨트롤러
 * 충전/지급 반영은 결제 게이트웨이와 지급 배치가 호출한다.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/balance")
@RequiredArgsConstructor
public class BalanceRestController {

    private final BalanceService balanceService;

    @GetMapping
    public Mono<ResponseEntity<BalanceResponse>> getBalance(@RequestHeader(SessionRestController.USER_HEADER) String userId) {
        return balanceService.getBalance(userId)
                .map(ResponseEntity::ok);
    }

    /**
     * 충전 반영
     *
     * @param request 고객 ID, 충전 금액
     * @return 충전 후 잔액
     */
    @PostMapping("/top-up")
    public Mono<ResponseEntity<BalanceResponse>> topUp(@Valid @RequestBody TopUpRequest request) {
        log.info("REST API - 충전 반영 요청: clientId={}, amount={}", request.getClientId(), request.getAmount());

        return balanceService.creditTopUp(request.getClientId(), request.getAmount())
                .map(balance -> ResponseEntity.ok(BalanceResponse.builder()
                        .userId(balance.getClientId())
                        .available(balance.getAvailable())
                        .locked(balance.getLocked())
                        .build()));
    }

    /**
     * 리더 지급 반영
     */
    @PostMapping("/payout")
    public Mono<ResponseEntity<BalanceResponse>> payout(@Valid @RequestBody PayoutRequest request) {
        log.info("REST API - 지급 반영 요청: readerId={}", request.getReaderId());

        return balanceService.settlePayout(request.getReaderId())
                .then(balanceService.getBalance(request.getReaderId()))
                .map(ResponseEntity::ok);
    }
}
