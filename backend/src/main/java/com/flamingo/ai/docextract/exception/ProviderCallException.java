package com.flamingo.ai.docextract.exception;

/** Exception thrown when a call to an external layout, upscaling or vision provider fails. */
public class ProviderCallException extends RuntimeException {

  private final String provider;
  private final boolean rateLimited;

  public ProviderCallException(String provider, String message) {
    super(message);
    this.provider = provider;
    this.rateLimited = false;
  }

  public ProviderCallException(String provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
    this.rateLimited = ProviderErrors.isRateLimited(cause);
  }

  public ProviderCallException(String provider, String message, boolean rateLimited) {
    super(message);
    this.provider = provider;
    this.rateLimited = rateLimited;
  }

  public String getProvider() {
    return provider;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }
}
