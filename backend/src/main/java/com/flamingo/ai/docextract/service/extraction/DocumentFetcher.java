package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.config.ExtractionProperties;
import com.flamingo.ai.docextract.domain.entity.ExtractionFile;
import com.flamingo.ai.docextract.exception.DocumentFetchException;
import com.flamingo.ai.docextract.service.extraction.model.SourceDocument;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import java.net.URI;
import java.time.Duration;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyExtractors;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

/** Downloads source files and provider result images from object storage. */
@Service
@Slf4j
public class DocumentFetcher {

  private final WebClient webClient;
  private final Retry storageRetry;
  private final Duration timeout;
  private final int maxSize;

  public DocumentFetcher(
      @Qualifier("storageWebClient") WebClient webClient,
      RetryRegistry retryRegistry,
      ExtractionProperties properties) {
    this.webClient = webClient;
    this.storageRetry = retryRegistry.retry("storage");
    this.timeout = properties.getStorage().getTimeout();
    this.maxSize = properties.getStorage().getMaxInMemorySize();
  }

  /**
   * Downloads the source file of an extraction job. The MIME type comes from the record, then the
   * response, then defaults to {@code image/png}. Failed downloads are retried with the {@code
   * storage} policy; a missing URL is not.
   *
   * @throws DocumentFetchException if the file has no URL or cannot be downloaded
   */
  public SourceDocument fetch(ExtractionFile file) {
    if (file.getFileUrl() == null || file.getFileUrl().isBlank()) {
      throw new DocumentFetchException(file.getId(), "File has no storage URL");
    }
    Download download = storageRetry.executeSupplier(() -> get(file.getId(), file.getFileUrl()));
    String mimeType =
        file.getMimeType() != null && !file.getMimeType().isBlank()
            ? file.getMimeType()
            : download.mimeType();
    SourceDocument document = new SourceDocument(download.content(), mimeType, file.getName());
    log.info(
        "Fetched file {} ({}, {} KB)",
        file.getId(),
        document.mimeType(),
        document.content().length / 1024);
    return document;
  }

  /**
   * Downloads a URL. The response's content type wins over {@code fallbackMimeType}.
   *
   * @throws DocumentFetchException if the download fails
   */
  public SourceDocument download(String url, String fallbackMimeType) {
    Download download = get(null, url);
    return new SourceDocument(
        download.content(),
        download.mimeType() != null ? download.mimeType() : fallbackMimeType,
        null);
  }

  /** Reads the raw body and Content-Type header; storage servers send non-standard parameters. */
  private Download get(UUID fileId, String url) {
    Download download;
    try {
      download =
          webClient
              .get()
              .uri(URI.create(url))
              .exchangeToMono(response -> readDownload(fileId, response))
              .block(timeout);
    } catch (WebClientException | IllegalStateException | IllegalArgumentException e) {
      throw new DocumentFetchException(fileId, "Failed to fetch file: " + e.getMessage(), e);
    }
    if (download == null) {
      throw new DocumentFetchException(fileId, "Failed to fetch file: empty response");
    }
    return download;
  }

  private Mono<Download> readDownload(UUID fileId, ClientResponse response) {
    if (response.statusCode().isError()) {
      return response
          .releaseBody()
          .then(
              Mono.error(
                  new DocumentFetchException(
                      fileId, "Failed to fetch file: HTTP " + response.statusCode().value())));
    }
    String mimeType =
        baseMimeType(response.headers().asHttpHeaders().getFirst(HttpHeaders.CONTENT_TYPE));
    return DataBufferUtils.join(response.body(BodyExtractors.toDataBuffers()), maxSize)
        .map(buffer -> new Download(toBytes(buffer), mimeType));
  }

  private static byte[] toBytes(DataBuffer buffer) {
    try {
      byte[] bytes = new byte[buffer.readableByteCount()];
      buffer.read(bytes);
      return bytes;
    } finally {
      DataBufferUtils.release(buffer);
    }
  }

  static String baseMimeType(String contentType) {
    if (contentType == null || contentType.isBlank()) {
      return null;
    }
    int parameters = contentType.indexOf(';');
    return (parameters >= 0 ? contentType.substring(0, parameters) : contentType).trim();
  }

  private record Download(byte[] content, String mimeType) {}
}
