package com.goormthonuniv.citecheck.extract;

import java.util.List;

public interface CitationMatcher {
    MatchStrategy strategy();
    List<CitationMatch> match(String text);
}
