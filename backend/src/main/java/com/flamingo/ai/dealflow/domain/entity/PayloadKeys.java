package com.flamingo.ai.dealflow.domain.entity;

/** Payload field names shared by extraction rules and the stages that consume facts. */
public final class PayloadKeys {

  public static final String PARTY_NAME_RAW = "partyNameRaw";
  public static final String PARTY_NAME_DISPLAY = "partyNameDisplay";
  public static final String PARTY_NAME_NORMALIZED = "partyNameNormalized";
  public static final String ROLE = "role";
  public static final String ROLE_LABEL = "roleLabel";
  public static final String ROLE_SOURCE = "roleSource";
  public static final String IDENTIFIER = "identifier";

  public static final String SPONSOR_NAME_RAW = "sponsorNameRaw";
  public static final String SPONSOR_NAME_DISPLAY = "sponsorNameDisplay";
  public static final String SPONSOR_NAME_NORMALIZED = "sponsorNameNormalized";
  public static final String UNRESOLVED_SPONSOR_ENTITY = "unresolvedSponsorEntity";
  public static final String SPONSOR_ABSENT = "sponsorAbsent";
  public static final String MATCH_TIER = "matchTier";
  public static final String KEYWORD = "keyword";

  public static final String DATE = "date";
  public static final String DATE_TYPE = "dateType";

  public static final String AMOUNT = "amount";
  public static final String CURRENCY = "currency";
  public static final String AMOUNT_CONTEXT = "amountContext";

  public static final String INSTRUMENT_TYPE = "instrumentType";
  public static final String INTEREST_RATE = "interestRate";
  public static final String MATURITY_YEAR = "maturityYear";
  public static final String PURPOSE = "purpose";
  public static final String PURPOSE_TARGET_RAW = "purposeTargetRaw";
  public static final String PURPOSE_TARGET_NORMALIZED = "purposeTargetNormalized";
  public static final String PARTICIPANTS = "participants";

  public static final String INSTITUTION_NAME_RAW = "institutionNameRaw";
  public static final String INSTITUTION_NAME_NORMALIZED = "institutionNameNormalized";
  public static final String TABLE_INDEX = "tableIndex";
  public static final String ROW = "row";
  public static final String COLUMN = "column";

  public static final String ADVISOR_NAME_RAW = "advisorNameRaw";
  public static final String ADVISOR_NAME_NORMALIZED = "advisorNameNormalized";
  public static final String ADVISED_PARTY_RAW = "advisedPartyRaw";

  public static final String FINANCING_EVENT_ID = "financingEventId";
  public static final String DEAL_ID = "dealId";

  public static final String ROLE_SOURCE_DEFINED_TERM = "defined-term";
  public static final String ROLE_SOURCE_POSITIONAL = "positional";
  public static final String ROLE_SOURCE_NAME = "name";
  public static final String AMOUNT_CONTEXT_DEAL_VALUE = "DEAL_VALUE";

  private PayloadKeys() {}
}
