package guraa.doccompare.model;

public enum ComparisonMode {
    /**
     * Every document against every other document.
     */
    FULL,
    /**
     * One document against a candidate set.
     */
    TARGETED
}
