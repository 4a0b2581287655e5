package com.leaplabs.discovery.jobs;

import com.leaplabs.discovery.estimate.Visibility;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one analysis to submit. Shape checks live in {@link
 * AnalysisRequestValidator}; this class only carries values.
 */
public final class AnalysisRequest {
  private final Path dataset;
  private final String targetColumn;
  private final int depth;
  private final Visibility visibility;
  private final Map<String, String> columnDescriptions;
  private final String title;
  private final String description;
  private final Integer numColumns;
  private final String idempotencyToken;
  private final String nonce;

  private AnalysisRequest(Builder b) {
    this.dataset = Objects.requireNonNull(b.dataset, "dataset");
    this.targetColumn = b.targetColumn;
    this.depth = b.depth;
    this.visibility = b.visibility == null ? Visibility.PUBLIC : b.visibility;
    this.columnDescriptions =
        b.columnDescriptions == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(b.columnDescriptions));
    this.title = b.title;
    this.description = b.description;
    this.numColumns = b.numColumns;
    this.idempotencyToken = b.idempotencyToken;
    this.nonce = b.nonce;
  }

  public static Builder builder(Path dataset, String targetColumn) {
    return new Builder(dataset, targetColumn);
  }

  public Path dataset() {
    return dataset;
  }

  public String targetColumn() {
    return targetColumn;
  }

  public int depth() {
    return depth;
  }

  public Visibility visibility() {
    return visibility;
  }

  public Map<String, String> columnDescriptions() {
    return columnDescriptions;
  }

  public String title() {
    return title;
  }

  public String description() {
    return description;
  }

  /** Column count declared by the caller, or null when only the service will know it. */
  public Integer numColumns() {
    return numColumns;
  }

  /** Caller supplied token used verbatim, or null to derive one. */
  public String idempotencyToken() {
    return idempotencyToken;
  }

  /** Caller supplied nonce mixed into a derived token, or null. */
  public String nonce() {
    return nonce;
  }

  public static final class Builder {
    private final Path dataset;
    private final String targetColumn;
    private int depth = 1;
    private Visibility visibility = Visibility.PUBLIC;
    private Map<String, String> columnDescriptions;
    private String title;
    private String description;
    private Integer numColumns;
    private String idempotencyToken;
    private String nonce;

    private Builder(Path dataset, String targetColumn) {
      this.dataset = dataset;
      this.targetColumn = targetColumn;
    }

    public Builder depth(int depth) {
      this.depth = depth;
      return this;
    }

    public Builder visibility(Visibility visibility) {
      this.visibility = visibility;
      return this;
    }

    public Builder columnDescriptions(Map<String, String> columnDescriptions) {
      this.columnDescriptions = columnDescriptions;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder numColumns(Integer numColumns) {
      this.numColumns = numColumns;
      return this;
    }

    public Builder idempotencyToken(String idempotencyToken) {
      this.idempotencyToken = idempotencyToken;
      return this;
    }

    public Builder nonce(String nonce) {
      this.nonce = nonce;
      return this;
    }

    public AnalysisRequest build() {
      return new AnalysisRequest(this);
    }
  }
}
