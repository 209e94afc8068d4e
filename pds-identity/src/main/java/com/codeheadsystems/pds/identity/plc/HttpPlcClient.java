package com.codeheadsystems.pds.identity.plc;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PlcClient} speaking to a PLC directory over HTTP.
 * <ul>
 *   <li>{@code POST {plcUrl}/{did}} submits an operation</li>
 *   <li>{@code GET {plcUrl}/{did}/data} fetches document data</li>
 * </ul>
 */
@Singleton
public class HttpPlcClient implements PlcClient {
  private static final Logger log = LoggerFactory.getLogger(HttpPlcClient.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String plcUrl;
  private final Duration timeout;

  /**
   * Instantiates a new Http plc client.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param plcUrl       base url of the directory, e.g. {@code https://plc.directory}
   * @param timeout      per-request timeout
   */
  @Inject
  public HttpPlcClient(final HttpClient httpClient,
                       final ObjectMapper objectMapper,
                       final String plcUrl,
                       final Duration timeout) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.plcUrl = plcUrl.endsWith("/") ? plcUrl.substring(0, plcUrl.length() - 1) : plcUrl;
    this.timeout = timeout;
    log.info("HttpPlcClient({})", this.plcUrl);
  }

  @Override
  public void sendOperation(final String did, final PlcOperation op) {
    log.debug("sendOperation(did={})", did);
    try {
      final String body = objectMapper.writeValueAsString(op);
      final HttpRequest request = HttpRequest.newBuilder()
          .uri(URI.create(plcUrl + "/" + did))
          .timeout(timeout)
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(body))
          .build();
      final HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(did, response);
    } catch (IOException e) {
      throw new PlcClientException("PLC request failed for " + did, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PlcClientException("PLC request interrupted for " + did, e);
    }
  }

  @Override
  public PlcDocumentData getDocumentData(final String did) {
    log.debug("getDocumentData(did={})", did);
    try {
      final HttpRequest request = HttpRequest.newBuilder()
          .uri(URI.create(plcUrl + "/" + did + "/data"))
          .timeout(timeout)
          .GET()
          .build();
      final HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(did, response);
      return objectMapper.readValue(response.body(), PlcDocumentData.class);
    } catch (IOException e) {
      throw new PlcClientException("PLC request failed for " + did, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PlcClientException("PLC request interrupted for " + did, e);
    }
  }

  private void checkStatus(final String did, final HttpResponse<String> response) {
    final int statusCode = response.statusCode();
    if (statusCode >= 400) {
      throw new PlcClientException(
          "PLC directory returned HTTP " + statusCode + " for " + did + ": " + response.body(), statusCode);
    }
  }
}
