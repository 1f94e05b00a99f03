package com.delta.siteextract.crawl.model;

public record FetchFailure(FailureKind kind, Integer statusCode, String detail) {

    public static FetchFailure timeout(String detail) {
        return new FetchFailure(FailureKind.TIMEOUT, null, detail);
    }

    public static FetchFailure httpError(int statusCode) {
        return new FetchFailure(FailureKind.HTTP_ERROR, statusCode, "http_" + statusCode);
    }

    public static FetchFailure networkError(String detail) {
        return new FetchFailure(FailureKind.NETWORK_ERROR, null, detail);
    }

    public static FetchFailure blocked(String detail) {
        return new FetchFailure(FailureKind.BLOCKED, null, detail);
    }

    public static FetchFailure invalidUrl(String detail) {
        return new FetchFailure(FailureKind.INVALID_URL, null, detail);
    }

    public String errorKey() {
        if (kind == FailureKind.HTTP_ERROR && statusCode != null) {
            return "http_" + statusCode;
        }
        return kind.name().toLowerCase(java.util.Locale.ROOT);
    }
}
