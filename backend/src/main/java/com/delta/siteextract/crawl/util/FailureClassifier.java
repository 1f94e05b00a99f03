package com.delta.siteextract.crawl.util;

import com.delta.siteextract.crawl.model.ErrorCategory;
import com.delta.siteextract.crawl.model.FailureKind;
import com.delta.siteextract.crawl.model.FetchFailure;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.Locale;
import javax.net.ssl.SSLException;

public final class FailureClassifier {
  public static final String DNS_FAILURE = "dns_failure";
  public static final String CONNECTION_REFUSED = "connection_refused";
  public static final String TLS_FAILURE = "tls_failure";
  public static final String IO_ERROR = "io_error";
  public static final String INTERRUPTED = "interrupted";
  public static final String ROBOTS_DISALLOWED = "robots_disallowed";

  private FailureClassifier() {}

  public static ErrorCategory categorize(FetchFailure failure) {
    if (failure == null) {
      return null;
    }
    switch (failure.kind()) {
      case TIMEOUT:
        return ErrorCategory.TIMEOUT;
      case BLOCKED:
        return ErrorCategory.POLICY_BLOCKED;
      case INVALID_URL:
        return ErrorCategory.PERMANENT_FETCH;
      case HTTP_ERROR:
        return isTransientStatus(failure.statusCode())
            ? ErrorCategory.TRANSIENT_NETWORK
            : ErrorCategory.PERMANENT_FETCH;
      case NETWORK_ERROR:
      default:
        return isPermanentNetworkDetail(failure.detail())
            ? ErrorCategory.PERMANENT_FETCH
            : ErrorCategory.TRANSIENT_NETWORK;
    }
  }

  /** Timeouts are recorded but never retried; only transient network and server errors are. */
  public static boolean isRetryable(FetchFailure failure) {
    return failure != null
        && failure.kind() != FailureKind.TIMEOUT
        && categorize(failure) == ErrorCategory.TRANSIENT_NETWORK
        && !startsWith(failure.detail(), INTERRUPTED);
  }

  public static boolean isTransientStatus(Integer status) {
    if (status == null) {
      return false;
    }
    return status == 408 || status == 429 || (status >= 500 && status < 600);
  }

  public static FetchFailure fromException(Throwable error) {
    if (error instanceof HttpTimeoutException) {
      return FetchFailure.timeout(describe("timeout", error));
    }
    if (error instanceof InterruptedException) {
      return FetchFailure.networkError(describe(INTERRUPTED, error));
    }
    Throwable cursor = error;
    while (cursor != null) {
      if (cursor instanceof UnknownHostException || cursor instanceof UnresolvedAddressException) {
        return FetchFailure.networkError(describe(DNS_FAILURE, error));
      }
      if (cursor instanceof SSLException) {
        return FetchFailure.networkError(describe(TLS_FAILURE, error));
      }
      if (cursor instanceof ConnectException || cursor instanceof NoRouteToHostException) {
        return FetchFailure.networkError(describe(CONNECTION_REFUSED, error));
      }
      cursor = cursor.getCause();
    }
    return FetchFailure.networkError(describe(IO_ERROR, error));
  }

  private static boolean isPermanentNetworkDetail(String detail) {
    return startsWith(detail, DNS_FAILURE) || startsWith(detail, TLS_FAILURE);
  }

  private static boolean startsWith(String detail, String prefix) {
    return detail != null && detail.toLowerCase(Locale.ROOT).startsWith(prefix);
  }

  private static String describe(String code, Throwable error) {
    String message = error == null ? null : error.getMessage();
    if (message == null || message.isBlank()) {
      return error == null ? code : code + ": " + error.getClass().getSimpleName();
    }
    return code + ": " + message;
  }
}
