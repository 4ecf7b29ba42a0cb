package com.nevis.places.scoring;

import com.nevis.places.matching.Candidate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Confidence of a candidate: the share of the matched term covered by the query.
 * An exact match scores 1.0 and a prefix of length L of a term of length N scores L / N.
 */
@Component
public class MatchScorer {

    private static final int SCORE_SCALE = 2;

    public double score(Candidate candidate) {
        double coverage = (double) candidate.queryLength() / candidate.matchedLength();
        return round(Math.max(0.0, Math.min(1.0, coverage)));
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCORE_SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
