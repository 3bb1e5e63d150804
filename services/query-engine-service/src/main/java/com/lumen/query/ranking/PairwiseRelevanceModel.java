package com.lumen.query.ranking;

import java.util.List;

public interface PairwiseRelevanceModel {
    double[] score(String query, List<String> passages);
}
