package com.schemeengine.api.controller;

import com.schemeengine.api.dto.ContributionRequest;
import com.schemeengine.api.dto.CreateSchemeRequest;
import com.schemeengine.api.dto.SchemeView;
import com.schemeengine.api.dto.ShareApprovalRequest;
import com.schemeengine.api.dto.ShareTransferRequest;
import com.schemeengine.order.OrderOutcome;
import com.schemeengine.refund.RedemptionReport;
import com.schemeengine.scheme.Scheme;
import com.schemeengine.scheme.SchemeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.Map;

/**
 * REST API for scheme lifecycle, contributions and shares.
 *
 * Trusted-caller surface: participant, owner and sender identities are taken from
 * the request body as given and are not checked against an authenticated caller.
 * Anything that can reach this API can act for any holder, so allowances only
 * constrain callers that choose to go through the spender path. Expose it only
 * behind a gateway that authenticates the caller and pins these fields to them.
 */
@RestController
@RequestMapping("/api/v1/schemes")
@RequiredArgsConstructor
@Tag(name = "Schemes", description = "Pooled investment scheme API")
public class SchemeController {

    private final SchemeService schemeService;

    @PostMapping
    @Operation(summary = "Create a new scheme")
    public ResponseEntity<SchemeView> createScheme(@Valid @RequestBody CreateSchemeRequest request) {
        Scheme scheme = schemeService.createScheme(
            request.getUnderlyingAssetRef(),
            request.getOfferClosingTime(),
            request.getOrderExpiration(),
            request.getMaturity()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(view(scheme));
    }

    @GetMapping("/{schemeId}")
    @Operation(summary = "Get scheme details")
    public ResponseEntity<SchemeView> getScheme(@PathVariable String schemeId) {
        return ResponseEntity.ok(view(schemeService.getScheme(schemeId)));
    }

    @PostMapping("/{schemeId}/deposit")
    @Operation(summary = "Deposit settlement funds while the offer is open")
    public ResponseEntity<Void> deposit(@PathVariable String schemeId,
                                        @Valid @RequestBody ContributionRequest request) {
        if (request.getAmount() == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        schemeService.deposit(schemeId, request.getParticipant(), request.getAmount());
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{schemeId}/withdraw")
    @Operation(summary = "Withdraw a contribution, or all of it when no amount is given")
    public ResponseEntity<Map<String, BigInteger>> withdraw(@PathVariable String schemeId,
                                                            @Valid @RequestBody ContributionRequest request) {
        BigInteger withdrawn = request.getAmount();
        if (withdrawn == null) {
            withdrawn = schemeService.withdraw(schemeId, request.getParticipant());
        } else {
            schemeService.withdraw(schemeId, request.getParticipant(), withdrawn);
        }
        return ResponseEntity.ok(Map.of("withdrawn", withdrawn));
    }

    @GetMapping("/{schemeId}/deposits/{participant}")
    @Operation(summary = "Get a participant's contribution")
    public ResponseEntity<Map<String, BigInteger>> getDeposit(@PathVariable String schemeId,
                                                              @PathVariable String participant) {
        return ResponseEntity.ok(Map.of(
            "deposit", schemeService.depositOf(schemeId, participant),
            "depositTotal", schemeService.depositTotal(schemeId)));
    }

    @PostMapping("/{schemeId}/buy-order")
    @Operation(summary = "Close the offer and place the buy order")
    public ResponseEntity<SchemeView> makeBuyOrder(@PathVariable String schemeId) {
        schemeService.makeBuyOrder(schemeId);
        return ResponseEntity.ok(view(schemeService.getScheme(schemeId)));
    }

    @PostMapping("/{schemeId}/publish")
    @Operation(summary = "Complete the purchase if the buy order filled")
    public ResponseEntity<OrderOutcome> publishToken(@PathVariable String schemeId) {
        return ResponseEntity.ok(schemeService.publishToken(schemeId));
    }

    @PostMapping("/{schemeId}/sell")
    @Operation(summary = "Place the sell order once the position matured")
    public ResponseEntity<SchemeView> sellAsset(@PathVariable String schemeId) {
        schemeService.sellAsset(schemeId);
        return ResponseEntity.ok(view(schemeService.getScheme(schemeId)));
    }

    @PostMapping("/{schemeId}/sell-order")
    @Operation(summary = "Record the sale if the sell order filled, otherwise refresh it")
    public ResponseEntity<OrderOutcome> updateSellOrder(@PathVariable String schemeId) {
        return ResponseEntity.ok(schemeService.updateSellOrder(schemeId));
    }

    @PostMapping("/{schemeId}/redeem")
    @Operation(summary = "Pay out every claim and close the scheme")
    public ResponseEntity<RedemptionReport> redeem(@PathVariable String schemeId) {
        return ResponseEntity.ok(schemeService.redeem(schemeId));
    }

    @PostMapping("/{schemeId}/shares/transfer")
    @Operation(summary = "Transfer shares, optionally on behalf of the sender")
    public ResponseEntity<Void> transferShares(@PathVariable String schemeId,
                                               @Valid @RequestBody ShareTransferRequest request) {
        if (request.getSpender() == null) {
            schemeService.transfer(schemeId, request.getFrom(), request.getTo(), request.getAmount());
        } else {
            schemeService.transferFrom(schemeId, request.getSpender(),
                request.getFrom(), request.getTo(), request.getAmount());
        }
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{schemeId}/shares/approve")
    @Operation(summary = "Set a spender's share allowance")
    public ResponseEntity<Void> approveShares(@PathVariable String schemeId,
                                              @Valid @RequestBody ShareApprovalRequest request) {
        schemeService.approve(schemeId, request.getOwner(), request.getSpender(), request.getAmount());
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{schemeId}/shares/{holder}")
    @Operation(summary = "Get a holder's share balance")
    public ResponseEntity<Map<String, BigInteger>> getShareBalance(@PathVariable String schemeId,
                                                                   @PathVariable String holder) {
        return ResponseEntity.ok(Map.of(
            "balance", schemeService.balanceOf(schemeId, holder),
            "totalSupply", schemeService.totalSupply(schemeId)));
    }

    @GetMapping("/{schemeId}/shares/{owner}/allowance/{spender}")
    @Operation(summary = "Get a spender's share allowance")
    public ResponseEntity<Map<String, BigInteger>> getAllowance(@PathVariable String schemeId,
                                                                @PathVariable String owner,
                                                                @PathVariable String spender) {
        return ResponseEntity.ok(Map.of("allowance", schemeService.allowance(schemeId, owner, spender)));
    }

    private SchemeView view(Scheme scheme) {
        return SchemeView.of(scheme, schemeService.custodyBalance(scheme.getSchemeId()));
    }
}
