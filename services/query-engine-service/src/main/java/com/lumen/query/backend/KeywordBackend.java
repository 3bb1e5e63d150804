package com.lumen.query.backend;

import java.util.List;

public interface KeywordBackend {
    List<BackendHit> query(List<String> terms, int topK);
}
