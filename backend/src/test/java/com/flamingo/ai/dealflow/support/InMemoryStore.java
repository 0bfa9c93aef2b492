package com.flamingo.ai.dealflow.support;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.FactAttachment;
import com.flamingo.ai.dealflow.domain.enums.DealState;
import com.flamingo.ai.dealflow.domain.enums.FactKind;
import com.flamingo.ai.dealflow.domain.repository.AtomicFactRepository;
import com.flamingo.ai.dealflow.domain.repository.DealRepository;
import com.flamingo.ai.dealflow.domain.repository.FactAttachmentRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

/**
 * Map-backed repository mocks for service tests that need several stages to see each other's
 * writes.
 */
public final class InMemoryStore {

  private final Map<UUID, Deal> deals = new LinkedHashMap<>();
  private final Map<UUID, AtomicFact> facts = new LinkedHashMap<>();
  private final List<FactAttachment> attachments = new ArrayList<>();
  private long clock;

  private final DealRepository dealRepository = mock(DealRepository.class);
  private final AtomicFactRepository factRepository = mock(AtomicFactRepository.class);
  private final FactAttachmentRepository attachmentRepository =
      mock(FactAttachmentRepository.class);

  public InMemoryStore() {
    stubDeals();
    stubFacts();
    stubAttachments();
  }

  public DealRepository deals() {
    return dealRepository;
  }

  public AtomicFactRepository facts() {
    return factRepository;
  }

  public FactAttachmentRepository attachments() {
    return attachmentRepository;
  }

  /** A transaction manager whose transactions always commit. */
  public static PlatformTransactionManager transactionManager() {
    PlatformTransactionManager manager = mock(PlatformTransactionManager.class);
    lenient().when(manager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
    return manager;
  }

  public AtomicFact addFact(AtomicFact fact) {
    facts.put(fact.getId(), fact);
    return fact;
  }

  public Deal addDeal(Deal deal) {
    return save(deal);
  }

  public List<Deal> allDeals() {
    return List.copyOf(deals.values());
  }

  public List<FactAttachment> allAttachments() {
    return List.copyOf(attachments);
  }

  public Optional<UUID> dealOf(AtomicFact fact) {
    return attachments.stream()
        .filter(a -> a.getFactId().equals(fact.getId()))
        .filter(FactAttachment::isAttached)
        .map(FactAttachment::getDealId)
        .filter(Objects::nonNull)
        .findFirst();
  }

  private Deal save(Deal deal) {
    if (deal.getId() == null) {
      deal.setId(UUID.randomUUID());
    }
    if (deal.getCreatedAt() == null) {
      // strictly increasing so creation order is observable
      deal.setCreatedAt(LocalDateTime.of(2024, 1, 1, 0, 0).plusSeconds(clock++));
    }
    deals.put(deal.getId(), deal);
    return deal;
  }

  private void stubDeals() {
    lenient().when(dealRepository.save(any(Deal.class))).thenAnswer(i -> save(i.getArgument(0)));
    lenient()
        .when(dealRepository.saveAndFlush(any(Deal.class)))
        .thenAnswer(i -> save(i.getArgument(0)));
    lenient()
        .when(dealRepository.findById(any(UUID.class)))
        .thenAnswer(i -> Optional.ofNullable(deals.get(i.<UUID>getArgument(0))));
    lenient()
        .when(dealRepository.findByDealKey(any()))
        .thenAnswer(
            i ->
                deals.values().stream()
                    .filter(d -> Objects.equals(d.getDealKey(), i.getArgument(0)))
                    .findFirst());
    lenient()
        .when(dealRepository.findByAcquirerIdentifierAndTargetNameNormalized(any(), any()))
        .thenAnswer(
            i ->
                deals.values().stream()
                    .filter(d -> Objects.equals(d.getAcquirerIdentifier(), i.getArgument(0)))
                    .filter(d -> Objects.equals(d.getTargetNameNormalized(), i.getArgument(1)))
                    .toList());
    lenient()
        .when(dealRepository.findByAcquirerNameNormalizedAndTargetNameNormalized(any(), any()))
        .thenAnswer(
            i ->
                deals.values().stream()
                    .filter(d -> Objects.equals(d.getAcquirerNameNormalized(), i.getArgument(0)))
                    .filter(d -> Objects.equals(d.getTargetNameNormalized(), i.getArgument(1)))
                    .toList());
    lenient()
        .when(dealRepository.findByStateInOrderByCreatedAtAsc(anyCollection()))
        .thenAnswer(
            i -> {
              Collection<DealState> states = i.getArgument(0);
              return deals.values().stream().filter(d -> states.contains(d.getState())).toList();
            });
    lenient().when(dealRepository.findAll()).thenAnswer(i -> List.copyOf(deals.values()));
  }

  private void stubFacts() {
    lenient()
        .when(factRepository.findUnattachedByKindIn(anyCollection()))
        .thenAnswer(
            i -> {
              Collection<FactKind> kinds = i.getArgument(0);
              return facts.values().stream()
                  .filter(f -> kinds.contains(f.getKind()))
                  .filter(f -> attachments.stream().noneMatch(a -> a.getFactId().equals(f.getId())))
                  .toList();
            });
    lenient()
        .when(factRepository.findById(any(UUID.class)))
        .thenAnswer(i -> Optional.ofNullable(facts.get(i.<UUID>getArgument(0))));
    lenient()
        .when(factRepository.findAllById(any()))
        .thenAnswer(
            i -> {
              List<AtomicFact> found = new ArrayList<>();
              for (UUID id : i.<Iterable<UUID>>getArgument(0)) {
                Optional.ofNullable(facts.get(id)).ifPresent(found::add);
              }
              return found;
            });
    lenient()
        .when(factRepository.save(any(AtomicFact.class)))
        .thenAnswer(i -> addFact(i.getArgument(0)));
  }

  private void stubAttachments() {
    lenient()
        .when(attachmentRepository.saveAll(anyList()))
        .thenAnswer(
            i -> {
              List<FactAttachment> saved = i.getArgument(0);
              saved.forEach(this::saveAttachment);
              return saved;
            });
    lenient()
        .when(attachmentRepository.save(any(FactAttachment.class)))
        .thenAnswer(i -> saveAttachment(i.getArgument(0)));
    lenient()
        .when(attachmentRepository.findByDocumentId(any()))
        .thenAnswer(
            i ->
                attachments.stream()
                    .filter(a -> Objects.equals(a.getDocumentId(), i.getArgument(0)))
                    .toList());
    lenient()
        .when(attachmentRepository.findByDealId(any()))
        .thenAnswer(
            i ->
                attachments.stream()
                    .filter(a -> Objects.equals(a.getDealId(), i.getArgument(0)))
                    .toList());
    lenient()
        .when(attachmentRepository.findByFactId(any()))
        .thenAnswer(
            i ->
                attachments.stream()
                    .filter(a -> Objects.equals(a.getFactId(), i.getArgument(0)))
                    .findFirst());
  }

  private FactAttachment saveAttachment(FactAttachment attachment) {
    if (attachment.getId() == null) {
      attachment.setId(UUID.randomUUID());
      attachments.add(attachment);
    }
    return attachment;
  }
}
