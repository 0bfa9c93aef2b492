package com.flamingo.ai.dealflow.service.clustering;

import com.flamingo.ai.dealflow.domain.entity.AtomicFact;
import com.flamingo.ai.dealflow.domain.entity.Deal;
import com.flamingo.ai.dealflow.domain.entity.PayloadKeys;
import com.flamingo.ai.dealflow.domain.enums.PartyRole;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Folds attached facts into a deal's identity fields. A field only changes when the new fact is
 * stronger than what the deal holds, so the result does not depend on the order facts arrive in.
 */
@Component
@Slf4j
public class DealIdentityUpdater {

  /** Higher effective confidence, then identifier presence, then the alphabetically first name. */
  static final Comparator<Claim> STRENGTH =
      Comparator.comparingDouble(Claim::confidence)
          .thenComparing(Claim::hasIdentifier)
          .thenComparing(Claim::name, Comparator.reverseOrder());

  /**
   * An identity claim on one side of a deal.
   *
   * @param confidence effective confidence; manual claims are infinite
   * @param hasIdentifier whether a canonical identifier is known
   * @param name normalized name
   */
  record Claim(double confidence, boolean hasIdentifier, String name) {

    static Claim of(AtomicFact fact) {
      return new Claim(
          fact.effectiveConfidence(),
          fact.payloadValue(PayloadKeys.IDENTIFIER).isPresent(),
          fact.payloadValue(PayloadKeys.PARTY_NAME_NORMALIZED).orElse(""));
    }
  }

  /** Best identity fact for a side, if any. */
  public static Optional<AtomicFact> best(Collection<AtomicFact> facts, PartyRole role) {
    return facts.stream()
        .filter(fact -> fact.getKind().isIdentity())
        .filter(fact -> fact.partyRole() == role)
        .filter(fact -> fact.payloadValue(PayloadKeys.PARTY_NAME_NORMALIZED).isPresent())
        .max(Comparator.comparing(Claim::of, STRENGTH));
  }

  /**
   * Parties named by a set of facts: the best fact of each side, with its identifier filled from
   * any other fact naming the same party.
   */
  public static ClusteringKey.Parties partiesOf(Collection<AtomicFact> facts) {
    Optional<AtomicFact> acquirer = best(facts, PartyRole.ACQUIRER);
    Optional<AtomicFact> target = best(facts, PartyRole.TARGET);
    return new ClusteringKey.Parties(
        acquirer.flatMap(fact -> identifierFor(facts, fact)).orElse(null),
        acquirer.flatMap(fact -> fact.payloadValue(PayloadKeys.PARTY_NAME_NORMALIZED)).orElse(null),
        target.flatMap(fact -> identifierFor(facts, fact)).orElse(null),
        target.flatMap(fact -> fact.payloadValue(PayloadKeys.PARTY_NAME_NORMALIZED)).orElse(null));
  }

  /**
   * Applies facts to the deal's identity, date, value and sponsor fields.
   *
   * @return whether any field changed
   */
  public boolean apply(Deal deal, Collection<AtomicFact> facts) {
    boolean changed = false;
    for (Side side : Side.values()) {
      Optional<AtomicFact> candidate = best(facts, side.role);
      if (candidate.isPresent()) {
        changed |= applySide(deal, side, candidate.get(), facts);
      }
    }
    for (AtomicFact fact : facts) {
      changed |=
          switch (fact.getKind()) {
            case DEAL_DATE -> applyDate(deal, fact);
            case CURRENCY_AMOUNT -> applyValue(deal, fact);
            case SPONSOR_MENTION -> applySponsor(deal, fact);
            default -> false;
          };
    }
    return changed;
  }

  private boolean applySide(Deal deal, Side side, AtomicFact fact, Collection<AtomicFact> facts) {
    Claim current = side.claim(deal);
    Claim candidate = Claim.of(fact);
    String name = candidate.name();
    Optional<String> identifier = identifierFor(facts, fact);

    if (current == null || STRENGTH.compare(candidate, current) > 0) {
      boolean renamed = current == null || !name.equals(current.name());
      side.set(
          deal,
          fact.payloadValue(PayloadKeys.PARTY_NAME_RAW).orElse(name),
          fact.payloadValue(PayloadKeys.PARTY_NAME_DISPLAY).orElse(name),
          name,
          fact.getConfidence(),
          fact.isManual());
      // An identifier belongs to the party it came with, never to a replacement name.
      if (renamed) {
        side.setIdentifier(deal, identifier.orElse(null));
      } else {
        identifier.ifPresent(id -> side.setIdentifier(deal, id));
      }
      log.debug("Deal {} {} set to '{}' by fact {}", deal.getDealKey(), side, name, fact.getId());
      return true;
    }
    if (identifier.isPresent() && side.identifier(deal) == null && name.equals(current.name())) {
      side.setIdentifier(deal, identifier.get());
      return true;
    }
    return false;
  }

  private static boolean applyDate(Deal deal, AtomicFact fact) {
    Optional<LocalDate> date =
        fact.payloadValue(PayloadKeys.DATE).flatMap(DealIdentityUpdater::parseDate);
    if (date.isEmpty()) {
      return false;
    }
    Double current = deal.getAgreementDateConfidence();
    boolean stronger =
        current == null
            || fact.effectiveConfidence() > current
            || (fact.effectiveConfidence() == current
                && date.get().isBefore(deal.getAgreementDate()));
    if (!stronger) {
      return false;
    }
    deal.setAgreementDate(date.get());
    deal.setAgreementDateConfidence(fact.getConfidence());
    return true;
  }

  private static boolean applyValue(Deal deal, AtomicFact fact) {
    if (!PayloadKeys.AMOUNT_CONTEXT_DEAL_VALUE.equals(
        fact.payloadValue(PayloadKeys.AMOUNT_CONTEXT).orElse(null))) {
      return false;
    }
    Optional<BigDecimal> amount = fact.payloadValue(PayloadKeys.AMOUNT).map(BigDecimal::new);
    if (amount.isEmpty()) {
      return false;
    }
    Double current = deal.getDealValueConfidence();
    boolean stronger =
        current == null
            || fact.effectiveConfidence() > current
            || (fact.effectiveConfidence() == current
                && amount.get().compareTo(deal.getDealValue()) > 0);
    if (!stronger) {
      return false;
    }
    deal.setDealValue(amount.get());
    deal.setDealValueConfidence(fact.getConfidence());
    return true;
  }

  private static boolean applySponsor(Deal deal, AtomicFact fact) {
    Optional<String> name = fact.payloadValue(PayloadKeys.SPONSOR_NAME_NORMALIZED);
    boolean absent = Boolean.parseBoolean(fact.getPayload().get(PayloadKeys.SPONSOR_ABSENT));
    if (name.isEmpty() || absent) {
      return false;
    }
    Double current = deal.getSponsorConfidence();
    boolean stronger =
        current == null
            || fact.effectiveConfidence() > current
            || (fact.effectiveConfidence() == current
                && name.get().compareTo(deal.getSponsorNameNormalized()) < 0);
    if (!stronger) {
      return false;
    }
    deal.setSponsorNameRaw(fact.payloadValue(PayloadKeys.SPONSOR_NAME_RAW).orElse(name.get()));
    deal.setSponsorNameDisplay(
        fact.payloadValue(PayloadKeys.SPONSOR_NAME_DISPLAY).orElse(name.get()));
    deal.setSponsorNameNormalized(name.get());
    deal.setSponsorConfidence(fact.getConfidence());
    deal.setSponsorUnresolved(
        Boolean.parseBoolean(fact.getPayload().get(PayloadKeys.UNRESOLVED_SPONSOR_ENTITY)));
    return true;
  }

  /** Identifier of the party {@code fact} names, taken from any fact naming the same party. */
  private static Optional<String> identifierFor(Collection<AtomicFact> facts, AtomicFact fact) {
    Optional<String> own = fact.payloadValue(PayloadKeys.IDENTIFIER);
    if (own.isPresent()) {
      return own;
    }
    String name = fact.payloadValue(PayloadKeys.PARTY_NAME_NORMALIZED).orElse("");
    List<String> identifiers =
        facts.stream()
            .filter(other -> other.getKind().isIdentity())
            .filter(
                other -> name.equals(other.getPayload().get(PayloadKeys.PARTY_NAME_NORMALIZED)))
            .flatMap(other -> other.payloadValue(PayloadKeys.IDENTIFIER).stream())
            .distinct()
            .sorted()
            .toList();
    return identifiers.isEmpty() ? Optional.empty() : Optional.of(identifiers.get(0));
  }

  private static Optional<LocalDate> parseDate(String value) {
    try {
      return Optional.of(LocalDate.parse(value));
    } catch (DateTimeParseException e) {
      log.warn("Ignoring unparseable deal date '{}'", value);
      return Optional.empty();
    }
  }

  /** The two identity sides of a deal. */
  private enum Side {
    TARGET(PartyRole.TARGET) {
      @Override
      Claim claim(Deal deal) {
        return deal.getTargetNameNormalized() == null
            ? null
            : new Claim(
                deal.isTargetManual()
                    ? Double.POSITIVE_INFINITY
                    : nonNull(deal.getTargetConfidence()),
                deal.getTargetIdentifier() != null,
                deal.getTargetNameNormalized());
      }

      @Override
      String identifier(Deal deal) {
        return deal.getTargetIdentifier();
      }

      @Override
      void set(
          Deal deal,
          String raw,
          String display,
          String normalized,
          double confidence,
          boolean manual) {
        deal.setTargetNameRaw(raw);
        deal.setTargetNameDisplay(display);
        deal.setTargetNameNormalized(normalized);
        deal.setTargetConfidence(confidence);
        deal.setTargetManual(manual);
      }

      @Override
      void setIdentifier(Deal deal, String identifier) {
        deal.setTargetIdentifier(identifier);
      }
    },

    ACQUIRER(PartyRole.ACQUIRER) {
      @Override
      Claim claim(Deal deal) {
        return deal.getAcquirerNameNormalized() == null
            ? null
            : new Claim(
                deal.isAcquirerManual()
                    ? Double.POSITIVE_INFINITY
                    : nonNull(deal.getAcquirerConfidence()),
                deal.getAcquirerIdentifier() != null,
                deal.getAcquirerNameNormalized());
      }

      @Override
      String identifier(Deal deal) {
        return deal.getAcquirerIdentifier();
      }

      @Override
      void set(
          Deal deal,
          String raw,
          String display,
          String normalized,
          double confidence,
          boolean manual) {
        deal.setAcquirerNameRaw(raw);
        deal.setAcquirerNameDisplay(display);
        deal.setAcquirerNameNormalized(normalized);
        deal.setAcquirerConfidence(confidence);
        deal.setAcquirerManual(manual);
      }

      @Override
      void setIdentifier(Deal deal, String identifier) {
        deal.setAcquirerIdentifier(identifier);
      }
    };

    private final PartyRole role;

    Side(PartyRole role) {
      this.role = role;
    }

    abstract Claim claim(Deal deal);

    abstract String identifier(Deal deal);

    abstract void set(
        Deal deal,
        String raw,
        String display,
        String normalized,
        double confidence,
        boolean manual);

    abstract void setIdentifier(Deal deal, String identifier);
  }

  private static double nonNull(Double value) {
    return value == null ? 0.0 : value;
  }
}
