package com.marketwatch.tracker.scrape.util;

import com.marketwatch.tracker.scrape.adapter.AdapterErrorKind;
import com.marketwatch.tracker.scrape.model.HttpFetchResult;

import java.util.List;
import java.util.Locale;

public final class FetchFailureClassifier {
  private static final List<String> BLOCK_MARKERS = List.of(
      "captcha",
      "access denied",
      "cf-challenge",
      "are you a robot",
      "unusual traffic",
      "アクセスが集中",
      "アクセスが制限",
      "不正なアクセス");

  private FetchFailureClassifier() {}

  /** Returns null when the result is usable. */
  public static AdapterErrorKind classify(HttpFetchResult result) {
    if (result == null) {
      return AdapterErrorKind.NETWORK;
    }
    if (result.errorCode() != null) {
      return fromErrorCode(result.errorCode());
    }
    AdapterErrorKind byStatus = fromHttpStatus(result.statusCode());
    if (byStatus != null) {
      return byStatus;
    }
    if (looksBlocked(result.body())) {
      return AdapterErrorKind.BLOCKED;
    }
    return null;
  }

  public static AdapterErrorKind fromHttpStatus(int status) {
    if (status >= 200 && status < 300) {
      return null;
    }
    if (status == 401 || status == 403 || status == 429) {
      return AdapterErrorKind.BLOCKED;
    }
    if (status == 408 || status == 504) {
      return AdapterErrorKind.TIMEOUT;
    }
    if (status == 404 || status == 410) {
      return AdapterErrorKind.PARSE;
    }
    return AdapterErrorKind.NETWORK;
  }

  public static AdapterErrorKind fromErrorCode(String errorCode) {
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return AdapterErrorKind.TIMEOUT;
    }
    if (code.equals("cancelled") || code.equals("interrupted")) {
      return AdapterErrorKind.CANCELLED;
    }
    if (code.equals("invalid_url")) {
      return AdapterErrorKind.PARSE;
    }
    return AdapterErrorKind.NETWORK;
  }

  public static boolean looksBlocked(String body) {
    if (body == null || body.isBlank()) {
      return false;
    }
    String head = body.length() > 4096 ? body.substring(0, 4096) : body;
    String lower = head.toLowerCase(Locale.ROOT);
    for (String marker : BLOCK_MARKERS) {
      if (lower.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}
