package com.ngramdict.cli;

import java.util.List;

public record MatchReport(
        String query,
        int maxNgramSize,
        List<String> matches,
        long elapsedMs
) {
}
