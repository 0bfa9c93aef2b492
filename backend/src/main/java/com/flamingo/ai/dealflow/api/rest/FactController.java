package com.flamingo.ai.dealflow.api.rest;

import com.flamingo.ai.dealflow.api.dto.request.DismissFactRequest;
import com.flamingo.ai.dealflow.api.dto.response.AttachmentResponse;
import com.flamingo.ai.dealflow.service.deal.DealService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for reviewer actions on individual facts. */
@RestController
@RequestMapping("/api/facts")
@RequiredArgsConstructor
public class FactController {

  private final DealService dealService;

  /** Sets a fact aside so clustering no longer considers it. */
  @PostMapping("/{factId}/dismiss")
  public ResponseEntity<AttachmentResponse> dismiss(
      @PathVariable UUID factId, @Valid @RequestBody DismissFactRequest request) {
    return ResponseEntity.ok(
        AttachmentResponse.fromEntity(
            dealService.dismissFact(factId, request.getReviewer(), request.getReason())));
  }
}
