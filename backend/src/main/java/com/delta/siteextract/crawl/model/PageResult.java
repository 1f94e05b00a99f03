package com.delta.siteextract.crawl.model;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of processing one {@link PageTask}. {@code sequence} is the order in which the page
 * was taken off the crawl queue and is what "first seen" means during aggregation.
 */
public record PageResult(
    PageTask task,
    int sequence,
    PageStatus status,
    Integer httpStatus,
    PageType pageType,
    Map<String, List<FieldValue>> fields,
    List<String> discoveredLinks,
    Duration duration,
    long bytesFetched,
    ErrorCategory errorCategory,
    String errorDetail
) {
    public PageResult {
        fields = fields == null ? Map.of() : java.util.Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        discoveredLinks = discoveredLinks == null ? List.of() : List.copyOf(discoveredLinks);
        pageType = pageType == null ? PageType.OTHER : pageType;
        duration = duration == null ? Duration.ZERO : duration;
    }

    public String url() {
        return task.url();
    }

    public boolean isSuccessful() {
        return status == PageStatus.SUCCESS;
    }

    public static PageResult failed(
        PageTask task,
        int sequence,
        PageStatus status,
        Integer httpStatus,
        Duration duration,
        ErrorCategory category,
        String detail
    ) {
        PageType type = task.pageTypeHint() == null ? PageType.OTHER : task.pageTypeHint();
        return new PageResult(task, sequence, status, httpStatus, type, Map.of(), List.of(), duration, 0L, category, detail);
    }
}
