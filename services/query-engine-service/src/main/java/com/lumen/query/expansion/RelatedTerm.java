package com.lumen.query.expansion;

public final class RelatedTerm {
    private final String term;
    private final PartOfSpeech partOfSpeech;
    private final double frequency;

    public RelatedTerm(String term, PartOfSpeech partOfSpeech, double frequency) {
        this.term = term;
        this.partOfSpeech = partOfSpeech;
        this.frequency = frequency;
    }

    public String getTerm() {
        return term;
    }

    public PartOfSpeech getPartOfSpeech() {
        return partOfSpeech;
    }

    public double getFrequency() {
        return frequency;
    }
}
