package com.lumen.query.expansion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ThesaurusSynonymSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsTermsAndAcronymsFromFile() throws Exception {
        Path file = tempDir.resolve("thesaurus.yaml");
        Files.writeString(file, String.join("\n",
            "acronyms:",
            "  IR: information retrieval",
            "terms:",
            "  Quick:",
            "    pos: adj",
            "    related:",
            "      - { term: Fast, pos: adjective, frequency: 0.9 }",
            "      - { term: speedy, pos: a, frequency: \"0.4\" }",
            "      - nimble",
            ""
        ));

        ThesaurusSynonymSource source = ThesaurusSynonymSource.load(file.toString());

        assertThat(source.acronyms()).containsEntry("ir", "information retrieval");
        assertThat(source.partsOfSpeech("quick")).containsExactly(PartOfSpeech.ADJECTIVE);
        assertThat(source.related("quick"))
            .extracting(RelatedTerm::getTerm, RelatedTerm::getFrequency)
            .containsExactly(
                tuple("fast", 0.9),
                tuple("speedy", 0.4),
                tuple("nimble", 0.0)
            );
    }

    @Test
    void missingFileYieldsEmptyThesaurus() {
        ThesaurusSynonymSource source = ThesaurusSynonymSource.load(tempDir.resolve("absent.yaml").toString());

        assertThat(source.acronyms()).isEmpty();
        assertThat(source.related("anything")).isEmpty();
    }

    @Test
    void nonMapRootYieldsEmptyThesaurus() throws Exception {
        Path file = tempDir.resolve("list.yaml");
        Files.writeString(file, "- just\n- a list\n");

        ThesaurusSynonymSource source = ThesaurusSynonymSource.load(file.toString());

        assertThat(source.partsOfSpeech("just")).isEmpty();
        assertThat(source.acronyms()).isEmpty();
    }

    @Test
    void loadsBundledThesaurusFromClasspath() {
        ThesaurusSynonymSource source = ThesaurusSynonymSource.load("classpath:thesaurus/default-thesaurus.yaml");

        assertThat(source.acronyms()).containsEntry("ml", "machine learning");
        assertThat(source.partsOfSpeech("search")).contains(PartOfSpeech.NOUN, PartOfSpeech.VERB);
    }
}
