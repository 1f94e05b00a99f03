package com.delta.siteextract.crawl.aggregate;

import com.delta.siteextract.crawl.extraction.FieldNormalizer;
import com.delta.siteextract.crawl.model.EntityRecord;
import com.delta.siteextract.crawl.model.FieldConflict;
import com.delta.siteextract.crawl.model.FieldSchema;
import com.delta.siteextract.crawl.model.FieldSpec;
import com.delta.siteextract.crawl.model.FieldValue;
import com.delta.siteextract.crawl.model.PageResult;
import com.delta.siteextract.crawl.model.PageType;
import com.delta.siteextract.crawl.model.ResolutionRule;
import com.delta.siteextract.crawl.model.ResolvedField;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Merges the per-page field values of one site into a single {@link EntityRecord}.
 *
 * <p>Scalar fields resolve by confidence, then page-type authority, then content length; a tie
 * that survives all three is reported as a conflict and settled by the first-seen value. List
 * fields are unioned in first-seen order with case- and whitespace-insensitive dedup.
 *
 * <p>"First seen" follows each page's crawl sequence number, so the result does not depend on
 * the order in which results are handed over.
 */
@Service
public class DataAggregator {
    private static final double CONFIDENCE_EPSILON = 1e-9;

    private final PageAuthorityTable authorityTable;

    public DataAggregator(PageAuthorityTable authorityTable) {
        this.authorityTable = authorityTable;
    }

    public EntityRecord aggregate(String siteUrl, List<PageResult> pages, FieldSchema schema) {
        List<PageResult> ordered = new ArrayList<>();
        for (PageResult page : pages) {
            if (page.isSuccessful()) {
                ordered.add(page);
            }
        }
        ordered.sort(Comparator.comparingInt(PageResult::sequence).thenComparing(PageResult::url));

        Map<String, ResolvedField> fields = new LinkedHashMap<>();
        List<String> absent = new ArrayList<>();
        List<FieldConflict> conflicts = new ArrayList<>();
        for (FieldSpec field : schema.fields()) {
            List<Candidate> candidates = collect(field, ordered);
            if (candidates.isEmpty()) {
                if (field.required()) {
                    absent.add(field.name());
                }
                continue;
            }
            ResolvedField resolved = field.listValued()
                ? union(field, candidates)
                : resolve(field, candidates, conflicts);
            fields.put(field.name(), resolved);
        }
        return new EntityRecord(siteUrl, fields, absent, overallConfidence(schema, fields), conflicts);
    }

    private List<Candidate> collect(FieldSpec field, List<PageResult> pages) {
        List<Candidate> out = new ArrayList<>();
        for (PageResult page : pages) {
            List<FieldValue> values = page.fields().get(field.name());
            if (values == null) {
                continue;
            }
            for (FieldValue value : values) {
                if (!value.isEmpty()) {
                    out.add(new Candidate(value, page.pageType(), page.sequence()));
                }
            }
        }
        return out;
    }

    private ResolvedField union(FieldSpec field, List<Candidate> candidates) {
        List<String> items = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Set<String> urls = new LinkedHashSet<>();
        double confidence = 0.0;
        for (Candidate candidate : candidates) {
            boolean contributed = false;
            for (String item : candidate.value().values()) {
                if (item != null && !item.isBlank() && seen.add(FieldNormalizer.dedupKey(item))) {
                    items.add(item);
                    contributed = true;
                }
            }
            if (contributed) {
                urls.add(candidate.value().sourceUrl());
                confidence = Math.max(confidence, candidate.value().confidence());
            }
        }
        return new ResolvedField(field.name(), items, true, confidence, new ArrayList<>(urls), ResolutionRule.LIST_UNION);
    }

    private ResolvedField resolve(FieldSpec field, List<Candidate> candidates, List<FieldConflict> conflicts) {
        List<Distinct> distinct = mergeIdentical(field, candidates);
        if (distinct.size() == 1) {
            Distinct only = distinct.get(0);
            return resolved(field, only, ResolutionRule.SINGLE_VALUE);
        }

        double best = distinct.stream().mapToDouble(Distinct::confidence).max().orElse(0.0);
        List<Distinct> tied = filter(distinct, d -> best - d.confidence() <= CONFIDENCE_EPSILON);
        if (tied.size() == 1) {
            return resolved(field, tied.get(0), ResolutionRule.CONFIDENCE);
        }

        int bestRank = tied.stream().mapToInt(Distinct::authorityRank).min().orElse(PageAuthorityTable.NO_AUTHORITY);
        if (bestRank != PageAuthorityTable.NO_AUTHORITY) {
            List<Distinct> authoritative = filter(tied, d -> d.authorityRank() == bestRank);
            if (authoritative.size() == 1) {
                return resolved(field, authoritative.get(0), ResolutionRule.PAGE_AUTHORITY);
            }
            tied = authoritative;
        }

        int longest = tied.stream().mapToInt(Distinct::contentLength).max().orElse(0);
        List<Distinct> longestTied = filter(tied, d -> d.contentLength() == longest);
        if (longestTied.size() == 1) {
            return resolved(field, longestTied.get(0), ResolutionRule.CONTENT_LENGTH);
        }

        longestTied.sort(Comparator.comparingInt(Distinct::firstSequence));
        Distinct chosen = longestTied.get(0);
        List<FieldConflict.Candidate> conflictCandidates = new ArrayList<>();
        for (Distinct option : longestTied) {
            conflictCandidates.add(new FieldConflict.Candidate(
                option.value(),
                option.confidence(),
                option.urls().get(0),
                option.pageType()
            ));
        }
        conflicts.add(new FieldConflict(field.name(), chosen.value(), conflictCandidates));
        return resolved(field, chosen, ResolutionRule.FIRST_SEEN);
    }

    /**
     * Collapses candidates whose normalized values are equal, keeping the best confidence and
     * authority and the union of contributing pages. Result is in first-seen order.
     */
    private List<Distinct> mergeIdentical(FieldSpec field, List<Candidate> candidates) {
        Map<String, Distinct> byKey = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            String text = candidate.value().text();
            String key = FieldNormalizer.dedupKey(text);
            int rank = authorityTable.rank(field.name(), candidate.pageType());
            Distinct existing = byKey.get(key);
            if (existing == null) {
                List<String> urls = new ArrayList<>();
                urls.add(candidate.value().sourceUrl());
                byKey.put(key, new Distinct(
                    text,
                    candidate.value().confidence(),
                    rank,
                    candidate.pageType(),
                    candidate.sequence(),
                    urls
                ));
                continue;
            }
            if (!existing.urls().contains(candidate.value().sourceUrl())) {
                existing.urls().add(candidate.value().sourceUrl());
            }
            boolean higher = candidate.value().confidence() - existing.confidence() > CONFIDENCE_EPSILON;
            byKey.put(key, new Distinct(
                higher ? text : existing.value(),
                Math.max(existing.confidence(), candidate.value().confidence()),
                Math.min(existing.authorityRank(), rank),
                rank < existing.authorityRank() ? candidate.pageType() : existing.pageType(),
                existing.firstSequence(),
                existing.urls()
            ));
        }
        return new ArrayList<>(byKey.values());
    }

    private ResolvedField resolved(FieldSpec field, Distinct winner, ResolutionRule rule) {
        return new ResolvedField(field.name(), List.of(winner.value()), false, winner.confidence(), winner.urls(), rule);
    }

    private double overallConfidence(FieldSchema schema, Map<String, ResolvedField> fields) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (FieldSpec field : schema.fields()) {
            ResolvedField resolved = fields.get(field.name());
            if (resolved == null) {
                continue;
            }
            weighted += field.importanceWeight() * resolved.confidence();
            totalWeight += field.importanceWeight();
        }
        return totalWeight <= 0.0 ? 0.0 : weighted / totalWeight;
    }

    private static List<Distinct> filter(List<Distinct> values, Predicate<Distinct> predicate) {
        List<Distinct> out = new ArrayList<>();
        for (Distinct value : values) {
            if (predicate.test(value)) {
                out.add(value);
            }
        }
        return out;
    }

    private record Candidate(FieldValue value, PageType pageType, int sequence) {
    }

    private record Distinct(
        String value,
        double confidence,
        int authorityRank,
        PageType pageType,
        int firstSequence,
        List<String> urls
    ) {
        int contentLength() {
            return value == null ? 0 : value.length();
        }
    }
}
