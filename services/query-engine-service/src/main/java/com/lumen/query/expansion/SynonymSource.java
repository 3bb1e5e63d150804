package com.lumen.query.expansion;

import java.util.List;
import java.util.Map;
import java.util.Set;

public interface SynonymSource {
    Set<PartOfSpeech> partsOfSpeech(String term);

    List<RelatedTerm> related(String term);

    Map<String, String> acronyms();
}
