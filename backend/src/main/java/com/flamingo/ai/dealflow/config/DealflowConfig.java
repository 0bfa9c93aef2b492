package com.flamingo.ai.dealflow.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the extraction, clustering and reconciliation pipeline. */
@Configuration
@ConfigurationProperties(prefix = "dealflow")
@Getter
@Setter
public class DealflowConfig {

  private Normalizer normalizer = new Normalizer();
  private Extraction extraction = new Extraction();
  private Table table = new Table();
  private Material material = new Material();
  private Clustering clustering = new Clustering();
  private Reconciliation reconciliation = new Reconciliation();
  private Classification classification = new Classification();
  private Pipeline pipeline = new Pipeline();
  private Reference reference = new Reference();

  @Getter
  @Setter
  public static class Normalizer {
    /** Bump to force re-normalization of stored documents. */
    private int version = 1;
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Prefix searched for the party list and defined terms. */
    private int preambleWindow = 5000;

    /** Prefix searched for the agreement date. */
    private int dateWindow = 2000;

    /** Radius around sponsor keywords searched for seed names and negations. */
    private int sponsorContextRadius = 150;

    /** Radius around an amount searched for deal-value phrases. */
    private int amountContextRadius = 80;

    private double definedTermConfidence = 0.9;
    private double mentionConfidence = 0.7;
    private double positionalTargetConfidence = 0.4;
    private double positionalAcquirerConfidence = 0.5;
    private double seedSponsorConfidence = 0.95;
    private double linkageSponsorConfidence = 0.85;
    private double dateConfidence = 0.95;
    private double amountConfidence = 0.8;
    private double financingConfidence = 0.8;
    private double advisorConfidence = 0.75;
  }

  @Getter
  @Setter
  public static class Table {
    /** Minimum share of data rows carrying a role keyword for a role column. */
    private double roleColumnThreshold = 0.5;

    /** Minimum share of bank-like values for a name-bearing column. */
    private double nameColumnThreshold = 0.2;

    /** Rows inspected for a header row. */
    private int headerScanRows = 3;

    private double roleConfidence = 0.8;
  }

  @Getter
  @Setter
  public static class Material {
    private List<String> keywords =
        new ArrayList<>(
            List.of(
                "credit agreement",
                "commitment letter",
                "bridge",
                "debt financing",
                "underwriting agreement",
                "indenture",
                "loan agreement",
                "term loan",
                "revolving"));

    /** Extracted text with fewer words is treated as poor quality. */
    private int minWords = 50;
  }

  @Getter
  @Setter
  public static class Clustering {
    /** Both party confidences must reach this for a candidate to be promoted. */
    private double promotionMinConfidence = 0.6;

    /** Target-name similarity above which two deals of one acquirer are merge candidates. */
    private double mergeCandidateSimilarity = 0.85;

    private int lockStripes = 64;
  }

  @Getter
  @Setter
  public static class Reconciliation {
    private double minConfidence = 0.5;

    /** Candidates scoring within this margin of the best make the match ambiguous. */
    private double ambiguityMargin = 0.1;

    private double fuzzyThreshold = 0.85;
    private double targetExactWeight = 0.5;
    private double targetFuzzyWeight = 0.4;
    private double acquirerExactWeight = 0.3;
    private double acquirerFuzzyWeight = 0.2;
    private double sponsorExactWeight = 0.2;
    private double sponsorFuzzyWeight = 0.1;
  }

  @Getter
  @Setter
  public static class Classification {
    /** Automatic sponsor facts below this confidence leave the sponsor tag unknown. */
    private double sponsorMinConfidence = 0.7;
  }

  @Getter
  @Setter
  public static class Pipeline {
    private Schedule schedule = new Schedule();
  }

  @Getter
  @Setter
  public static class Schedule {
    private boolean enabled = false;
    private Duration fixedDelay = Duration.ofMinutes(10);
  }

  @Getter
  @Setter
  public static class Reference {
    private String rateTable = "classpath:reference/attribution-rates.json";
    private String sponsorSeeds = "classpath:reference/sponsor-seeds.json";
  }
}
