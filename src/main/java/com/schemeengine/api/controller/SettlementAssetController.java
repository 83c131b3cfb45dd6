package com.schemeengine.api.controller;

import com.schemeengine.api.dto.IssueRequest;
import com.schemeengine.asset.InternalSettlementAsset;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.Map;

/**
 * REST API for the internal settlement asset.
 */
@RestController
@RequestMapping("/api/v1/settlement-asset")
@RequiredArgsConstructor
@Tag(name = "Settlement Asset", description = "Internal settlement asset API")
public class SettlementAssetController {

    private final InternalSettlementAsset settlementAsset;

    @PostMapping("/{holder}/issue")
    @Operation(summary = "Issue settlement funds to a holder")
    public ResponseEntity<Map<String, BigInteger>> issue(@PathVariable String holder,
                                                         @Valid @RequestBody IssueRequest request) {
        settlementAsset.issue(holder, request.getAmount());
        return ResponseEntity.ok(Map.of("balance", settlementAsset.balanceOf(holder)));
    }

    @GetMapping("/{holder}")
    @Operation(summary = "Get a holder's settlement balance")
    public ResponseEntity<Map<String, BigInteger>> getBalance(@PathVariable String holder) {
        return ResponseEntity.ok(Map.of("balance", settlementAsset.balanceOf(holder)));
    }
}
