package com.capturequeue.core;

import java.util.Objects;

/**
 * A question/answer pair as returned by the Q&amp;A generator, before embedding.
 */
public final class QuestionAnswer {
    private final String question;
    private final String answer;

    public QuestionAnswer(String question, String answer) {
        this.question = Objects.requireNonNull(question, "question");
        this.answer = Objects.requireNonNull(answer, "answer");
    }

    public String getQuestion() { return question; }
    public String getAnswer() { return answer; }

    /**
     * Text embedded for the combined vector.
     *
     * @return "Q: question\nA: answer"
     */
    public String toCombinedText() {
        return "Q: " + question + "\nA: " + answer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QuestionAnswer)) {
            return false;
        }
        QuestionAnswer other = (QuestionAnswer) o;
        return question.equals(other.question) && answer.equals(other.answer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(question, answer);
    }

    @Override
    public String toString() {
        return "QuestionAnswer{question='" + question + "'}";
    }
}
