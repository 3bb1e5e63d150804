package com.lumen.query.retrieval;

import com.lumen.query.backend.BackendHit;
import java.util.List;

public interface FusionStrategy {
    List<SearchCandidate> fuse(List<BackendHit> vectorResults, List<BackendHit> keywordResults, int k);
}
