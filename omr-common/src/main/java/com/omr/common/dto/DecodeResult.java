package com.omr.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * 整张答题卡的解码结果：按题号 1..N 排列的单题结果，以及扫描质量提示。
 */
@Value
public class DecodeResult {

    @JsonIgnore
    List<QuestionVerdict> verdicts;

    List<ScanAdvisory> advisories;

    public DecodeResult(List<QuestionVerdict> verdicts, List<ScanAdvisory> advisories) {
        this.verdicts = List.copyOf(verdicts);
        this.advisories = List.copyOf(advisories);
    }

    public int totalQuestions() {
        return verdicts.size();
    }

    public QuestionVerdict verdictOf(int questionNumber) {
        return verdicts.get(questionNumber - 1);
    }

    @JsonProperty("rightAnswers")
    public List<Integer> rightAnswers() {
        return questionsWith(Verdict.CORRECT);
    }

    @JsonProperty("wrongAnswers")
    public List<Integer> wrongAnswers() {
        return questionsWith(Verdict.WRONG);
    }

    @JsonProperty("multipleAnswers")
    public List<Integer> multipleAnswers() {
        return questionsWith(Verdict.MULTIPLE);
    }

    @JsonProperty("unAnswered")
    public List<Integer> unanswered() {
        return questionsWith(Verdict.UNANSWERED);
    }

    /** 每题的作答编码（0 表示未作答或多选） */
    @JsonProperty("Useranswers")
    public List<Integer> userAnswers() {
        return verdicts.stream().map(QuestionVerdict::getChosenNumeric).toList();
    }

    @JsonProperty("score")
    public int score() {
        return rightAnswers().size();
    }

    private List<Integer> questionsWith(Verdict verdict) {
        return verdicts.stream()
                .filter(v -> v.getVerdict() == verdict)
                .map(QuestionVerdict::getQuestionNumber)
                .toList();
    }
}
