package com.lumen.query.expansion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class QueryExpanderTest {

    private static SynonymSource thesaurus;

    @BeforeAll
    static void loadThesaurus() {
        thesaurus = ThesaurusSynonymSource.load("classpath:thesaurus/default-thesaurus.yaml");
    }

    @Test
    void addsMostFrequentSameSenseSynonyms() {
        QueryExpander expander = new QueryExpander(thesaurus, new QueryExpansionProperties());

        ExpansionResult result = expander.expandDetailed("machine learning basics");

        assertThat(result.getOriginalTerms()).containsExactly("machine", "learning", "basics");
        assertThat(result.getSynonymExpansions().get("learning")).containsExactly("training", "education", "study");
        assertThat(result.getSynonymExpansions().get("basics")).containsExactly("fundamentals", "introduction", "essentials");
        // the verb "learn" is a different sense of "learning"
        assertThat(result.getExpandedTerms()).doesNotContain("learn", "rudiments");
        assertThat(result.getExpandedTerms()).hasSize(9);
        assertThat(result.getTotalExpansions()).isEqualTo(6);
    }

    @Test
    void expandsAcronymsBeforeSynonyms() {
        QueryExpander expander = new QueryExpander(thesaurus, new QueryExpansionProperties());

        ExpansionResult result = expander.expandDetailed("ML basics");

        assertThat(result.getAcronymExpansions()).containsEntry("ml", "machine learning");
        assertThat(result.getExpandedTerms())
            .containsExactly("ml", "basics", "machine", "learning", "fundamentals", "introduction");
    }

    @Test
    void respectsPartOfSpeechOfSourceTerm() {
        QueryExpander expander = new QueryExpander(thesaurus, new QueryExpansionProperties());

        List<String> terms = expander.expand("fast search");

        assertThat(terms).containsExactly("fast", "search", "quick", "quickly", "rapid", "find");
        assertThat(terms).doesNotContain("fasten");
    }

    @Test
    void customAcronymsAreCaseInsensitive() {
        QueryExpansionProperties properties = new QueryExpansionProperties();
        properties.getCustomAcronyms().put("QE", "query engine");
        QueryExpander expander = new QueryExpander(thesaurus, properties);

        assertThat(expander.getAcronyms()).containsEntry("qe", "query engine");
        assertThat(expander.expand("qe tuning")).containsExactly("qe", "tuning", "query", "engine");
    }

    @Test
    void addAndRemoveAcronym() {
        QueryExpander expander = new QueryExpander(ThesaurusSynonymSource.empty(), new QueryExpansionProperties());

        expander.addAcronym("IR", "information retrieval");

        assertThat(expander.expand("ir")).containsExactly("ir", "information", "retrieval");
        assertThat(expander.removeAcronym("Ir")).isTrue();
        assertThat(expander.removeAcronym("ir")).isFalse();
        assertThat(expander.expand("ir")).containsExactly("ir");
        assertThatThrownBy(() -> expander.addAcronym(" ", "blank")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void disabledExpansionReturnsOriginalTerms() {
        QueryExpansionProperties properties = new QueryExpansionProperties();
        properties.setEnabled(false);
        QueryExpander expander = new QueryExpander(thesaurus, properties);

        assertThat(expander.expand("ML basics")).containsExactly("ml", "basics");
    }

    @Test
    void stopwordOnlyQueryKeepsItsTokens() {
        QueryExpander expander = new QueryExpander(thesaurus, new QueryExpansionProperties());

        assertThat(expander.expand("what is the")).containsExactly("what", "is", "the");
        assertThat(expander.expand("  ")).isEmpty();
    }

    @Test
    void expansionFactorBoundsTotalTerms() {
        QueryExpansionProperties properties = new QueryExpansionProperties();
        properties.setMaxExpansionFactor(1.5);
        QueryExpander expander = new QueryExpander(thesaurus, properties);

        assertThat(expander.expand("learning basics")).containsExactly("learning", "basics", "training");
    }

    @Test
    void buildsOrQuery() {
        QueryExpansionProperties properties = new QueryExpansionProperties();
        properties.setUseSynonyms(false);
        properties.setMaxExpansionFactor(4.0);
        QueryExpander expander = new QueryExpander(thesaurus, properties);

        assertThat(expander.toOrQuery("nlp")).isEqualTo("nlp OR natural OR language OR processing");
    }
}
