package com.leaplabs.discovery.http;

import com.leaplabs.discovery.DiscoverySettings;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /** Client for the Discovery API and dashboard hosts. */
  public static OkHttpClient create(DiscoverySettings settings) {
    return new OkHttpClient.Builder()
        .connectTimeout(settings.connectTimeout())
        .readTimeout(settings.readTimeout())
        .writeTimeout(settings.readTimeout())
        .callTimeout(settings.readTimeout().plus(settings.connectTimeout()))
        .addInterceptor(new ClientHeadersInterceptor("mcp"))
        .addInterceptor(new LoggingInterceptor())
        .build();
  }

  /**
   * Client for raw dataset uploads to presigned storage URLs. No service headers are added because
   * the storage host validates the signed request as-is.
   */
  public static OkHttpClient createUploadClient(OkHttpClient base, DiscoverySettings settings) {
    OkHttpClient.Builder builder =
        base.newBuilder()
            .readTimeout(settings.uploadTimeout())
            .writeTimeout(settings.uploadTimeout())
            .callTimeout(settings.uploadTimeout().plus(settings.connectTimeout()));
    builder.interceptors().clear();
    builder.addInterceptor(new LoggingInterceptor(false));
    return builder.build();
  }
}
