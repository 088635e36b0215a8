package com.frontdesk.domain.scenario.service;

import com.frontdesk.domain.scenario.model.valobj.CandidateLookupResult;
import com.frontdesk.domain.scenario.model.valobj.ExactIndex;
import com.frontdesk.domain.scenario.model.valobj.RuntimeSpec;
import com.frontdesk.domain.scenario.model.valobj.ScenarioPool;
import com.frontdesk.domain.scenario.model.valobj.WordIndex;
import com.frontdesk.types.enums.MatchMethodEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 候选检索领域服务：精确 -> 包含 -> 词索引，三级依次尝试，先命中者返回。
 * <p>
 * 只读索引；返回的候选不超过 {@link #MAX_CANDIDATES} 个，用于约束下游打分成本。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
@Service
public class CandidateLookupDomainService {

    public static final int MAX_CANDIDATES = 20;
    static final int MIN_CONTAINS_LENGTH = 5;

    public CandidateLookupResult lookup(String input, ScenarioPool pool) {
        if (pool == null) {
            return emptyResult();
        }
        return lookup(input, pool.exactIndex(), pool.wordIndex());
    }

    public CandidateLookupResult lookup(String input, ExactIndex exactIndex, WordIndex wordIndex) {
        if (input == null || input.isBlank()) {
            return emptyResult();
        }
        ExactIndex exact = exactIndex == null ? ExactIndex.empty() : exactIndex;
        WordIndex words = wordIndex == null ? WordIndex.empty() : wordIndex;
        String normalized = ScenarioCompileDomainService.normalize(input);

        RuntimeSpec exactMatch = exact.get(normalized);
        if (exactMatch != null) {
            return new CandidateLookupResult(exactMatch, List.of(exactMatch), MatchMethodEnum.EXACT);
        }

        for (Map.Entry<String, RuntimeSpec> entry : exact.entries()) {
            String trigger = entry.getKey();
            if (trigger.length() >= MIN_CONTAINS_LENGTH && normalized.contains(trigger)) {
                return new CandidateLookupResult(null, List.of(entry.getValue()), MatchMethodEnum.CONTAINS);
            }
        }

        // 以实例身份计分；首次出现的顺序即同分时的顺序
        Map<RuntimeSpec, int[]> scores = new IdentityHashMap<>();
        List<RuntimeSpec> firstSeen = new ArrayList<>();
        for (String token : ScenarioPoolCompileDomainService.tokenize(normalized)) {
            for (RuntimeSpec spec : words.getByWord(token)) {
                int[] score = scores.get(spec);
                if (score == null) {
                    score = new int[]{0};
                    scores.put(spec, score);
                    firstSeen.add(spec);
                }
                score[0]++;
            }
        }
        // List.sort 是稳定排序
        firstSeen.sort((left, right) -> Integer.compare(scores.get(right)[0], scores.get(left)[0]));
        List<RuntimeSpec> candidates = firstSeen.size() > MAX_CANDIDATES
                ? new ArrayList<>(firstSeen.subList(0, MAX_CANDIDATES))
                : firstSeen;
        return new CandidateLookupResult(null, Collections.unmodifiableList(candidates), MatchMethodEnum.WORD_INDEX);
    }

    private static CandidateLookupResult emptyResult() {
        return new CandidateLookupResult(null, Collections.emptyList(), MatchMethodEnum.WORD_INDEX);
    }
}
