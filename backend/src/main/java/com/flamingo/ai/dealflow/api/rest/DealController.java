package com.flamingo.ai.dealflow.api.rest;

import com.flamingo.ai.dealflow.api.dto.request.DealActionRequest;
import com.flamingo.ai.dealflow.api.dto.request.ManualFactRequest;
import com.flamingo.ai.dealflow.api.dto.request.MergeDealsRequest;
import com.flamingo.ai.dealflow.api.dto.request.SubmitManualFactsRequest;
import com.flamingo.ai.dealflow.api.dto.response.DealResponse;
import com.flamingo.ai.dealflow.api.dto.response.FactResponse;
import com.flamingo.ai.dealflow.api.dto.response.FinancingEventResponse;
import com.flamingo.ai.dealflow.api.dto.response.MergeRecordResponse;
import com.flamingo.ai.dealflow.api.dto.response.ParticipantResponse;
import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.DealMergeRecord;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.service.attribution.AttributionService;
import com.flamingo.ai.dealflow.service.deal.DealService;
import com.flamingo.ai.dealflow.service.fact.FactService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for deal queries, reviewer lifecycle actions and manual facts. */
@RestController
@RequestMapping("/api/deals")
@RequiredArgsConstructor
public class DealController {

  private final DealService dealService;
  private final FactService factService;
  private final AttributionService attributionService;

  /** Lists deals, optionally filtered by state. */
  @GetMapping
  public ResponseEntity<List<DealResponse>> listDeals(
      @RequestParam(value = "state", required = false) DealState state) {
    return ResponseEntity.ok(
        dealService.listDeals(state).stream().map(DealResponse::fromEntity).toList());
  }

  @GetMapping("/{dealId}")
  public ResponseEntity<DealResponse> getDeal(@PathVariable UUID dealId) {
    return ResponseEntity.ok(DealResponse.fromEntity(dealService.getDeal(dealId)));
  }

  /** Looks a deal up by clustering key, following merges. */
  @GetMapping("/by-key")
  public ResponseEntity<DealResponse> getDealByKey(@RequestParam("key") String key) {
    return ResponseEntity.ok(DealResponse.fromEntity(dealService.getDealByKey(key)));
  }

  @GetMapping("/{dealId}/facts")
  public ResponseEntity<List<FactResponse>> getFacts(@PathVariable UUID dealId) {
    return ResponseEntity.ok(
        factService.getFactsForDeal(dealId).stream().map(FactResponse::fromEntity).toList());
  }

  /** Gets the financing events linked to a deal, with their participants. */
  @GetMapping("/{dealId}/financing-events")
  public ResponseEntity<List<FinancingEventResponse>> getFinancingEvents(
      @PathVariable UUID dealId) {
    List<FinancingEventResponse> events =
        dealService.getFinancingEvents(dealId).stream()
            .map(
                event ->
                    FinancingEventResponse.fromEntity(
                        event,
                        dealService.getParticipants(event.getId()).stream()
                            .map(ParticipantResponse::fromEntity)
                            .toList()))
            .toList();
    return ResponseEntity.ok(events);
  }

  /** Gets the modeled advisory fee split across the deal's financial advisors. */
  @GetMapping("/{dealId}/advisors")
  public ResponseEntity<List<AttributionService.AdvisorShare>> getAdvisorShares(
      @PathVariable UUID dealId) {
    return ResponseEntity.ok(attributionService.advisoryShares(dealId));
  }

  @GetMapping("/{dealId}/merges")
  public ResponseEntity<List<MergeRecordResponse>> getMergeHistory(@PathVariable UUID dealId) {
    return ResponseEntity.ok(
        dealService.getMergeHistory(dealId).stream().map(MergeRecordResponse::fromEntity).toList());
  }

  /** Merges one deal into another. */
  @PostMapping("/merge")
  public ResponseEntity<MergeRecordResponse> merge(@Valid @RequestBody MergeDealsRequest request) {
    DealMergeRecord record =
        dealService.merge(
            request.getSurvivorId(),
            request.getSupersededId(),
            request.getAuthor(),
            request.getReason());
    return ResponseEntity.ok(MergeRecordResponse.fromEntity(record));
  }

  @PostMapping("/{dealId}/lock")
  public ResponseEntity<DealResponse> lock(
      @PathVariable UUID dealId, @Valid @RequestBody DealActionRequest request) {
    return ResponseEntity.ok(DealResponse.fromEntity(dealService.lock(dealId, request.getActor())));
  }

  @PostMapping("/{dealId}/close")
  public ResponseEntity<DealResponse> close(
      @PathVariable UUID dealId, @Valid @RequestBody DealActionRequest request) {
    return ResponseEntity.ok(
        DealResponse.fromEntity(dealService.close(dealId, request.getActor())));
  }

  /** Resumes a deal held for review. */
  @PostMapping("/{dealId}/resume")
  public ResponseEntity<DealResponse> resume(
      @PathVariable UUID dealId, @Valid @RequestBody DealActionRequest request) {
    return ResponseEntity.ok(
        DealResponse.fromEntity(
            dealService.resume(dealId, request.getResumeTo(), request.getActor())));
  }

  /** Enters manual facts against a deal; the next pipeline pass applies them. */
  @PostMapping("/{dealId}/manual-facts")
  public ResponseEntity<List<FactResponse>> submitManualFacts(
      @PathVariable UUID dealId, @Valid @RequestBody SubmitManualFactsRequest request) {
    List<AtomicFact> facts =
        factService.submitManualFacts(
            dealId,
            request.getAuthor(),
            request.getFacts().stream().map(ManualFactRequest::toInput).toList());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(facts.stream().map(FactResponse::fromEntity).toList());
  }
}
