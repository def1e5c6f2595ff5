package com.autosort.resolve;

/**
 * A scored path-like substring found in oracle prose. Lives only inside {@link ResponseParser}.
 */
final class PathCandidate {

    private final String text;
    private final int score;

    PathCandidate(String text, int score) {
        this.text = text;
        this.score = score;
    }

    String getText() {
        return text;
    }

    int getScore() {
        return score;
    }
}
