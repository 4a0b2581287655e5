package com.leaplabs.discovery.client;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/** Dataset file types the service accepts, keyed by file extension. */
public enum DatasetFormat {
  CSV(".csv", "text/csv"),
  TSV(".tsv", "text/tab-separated-values"),
  XLSX(".xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
  XLS(".xls", "application/vnd.ms-excel"),
  JSON(".json", "application/json"),
  PARQUET(".parquet", "application/vnd.apache.parquet"),
  ARFF(".arff", "text/plain"),
  FEATHER(".feather", "application/octet-stream");

  private final String extension;
  private final String contentType;

  DatasetFormat(String extension, String contentType) {
    this.extension = extension;
    this.contentType = contentType;
  }

  public String extension() {
    return extension;
  }

  public String contentType() {
    return contentType;
  }

  public static Optional<DatasetFormat> fromFileName(String fileName) {
    if (fileName == null) return Optional.empty();
    String lower = fileName.toLowerCase(Locale.ROOT);
    int dot = lower.lastIndexOf('.');
    if (dot < 0) return Optional.empty();
    String ext = lower.substring(dot);
    return Arrays.stream(values()).filter(f -> f.extension.equals(ext)).findFirst();
  }

  /** Sorted, comma separated list of accepted extensions for error messages. */
  public static String supportedExtensions() {
    return Arrays.stream(values())
        .map(DatasetFormat::extension)
        .sorted()
        .collect(Collectors.joining(", "));
  }
}
