package com.omr.grading.answer;

import com.omr.common.dto.AnswerOption;
import com.omr.common.dto.FillState;
import com.omr.common.dto.QuestionVerdict;
import com.omr.common.dto.Verdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 判分汇总：把逐个气泡的填涂状态合并为每题一个结论，并与标准答案比对。
 * <p>
 * 规则：未涂 → 未作答；涂 1 个 → 对/错；涂 2 个及以上 → 多选（无论是否包含正确选项）。
 * 超出标准答案长度的题号不参与判分。
 */
@Slf4j
@Component
public class AnswerAggregator {

    public List<QuestionVerdict> aggregate(Collection<FillState> states, AnswerKey key) {
        int total = key.size();
        Map<Integer, Set<AnswerOption>> selected = new HashMap<>();
        for (FillState state : states) {
            int q = state.getSlot().getQuestionNumber();
            if (!state.isFilled() || q < 1 || q > total) {
                continue;
            }
            selected.computeIfAbsent(q, k -> EnumSet.noneOf(AnswerOption.class)).add(state.getSlot().getOption());
        }

        List<QuestionVerdict> verdicts = new ArrayList<>(total);
        int correct = 0;
        for (int q = 1; q <= total; q++) {
            Set<AnswerOption> options = selected.getOrDefault(q, EnumSet.noneOf(AnswerOption.class));
            QuestionVerdict verdict = judge(q, options, key.optionFor(q));
            if (verdict.getVerdict() == Verdict.CORRECT) {
                correct++;
            }
            verdicts.add(verdict);
        }
        log.info("判分完成: 共 {} 题, 答对 {} 题", total, correct);
        return verdicts;
    }

    private QuestionVerdict judge(int questionNumber, Set<AnswerOption> options, AnswerOption expected) {
        Verdict verdict;
        int chosen = 0;
        if (options.isEmpty()) {
            verdict = Verdict.UNANSWERED;
        } else if (options.size() == 1) {
            AnswerOption only = options.iterator().next();
            chosen = only.numeric();
            verdict = only == expected ? Verdict.CORRECT : Verdict.WRONG;
        } else {
            verdict = Verdict.MULTIPLE;
        }
        return QuestionVerdict.builder()
                .questionNumber(questionNumber)
                .selectedOptions(Collections.unmodifiableSet(EnumSet.copyOf(options)))
                .verdict(verdict)
                .chosenNumeric(chosen)
                .build();
    }
}
