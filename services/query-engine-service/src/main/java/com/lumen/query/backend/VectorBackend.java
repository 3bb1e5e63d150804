package com.lumen.query.backend;

import java.util.List;
import java.util.Map;

public interface VectorBackend {
    List<BackendHit> query(float[] embedding, int topK, Map<String, Object> filters);
}
